package io.isolation.lab.harness;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import javax.sql.DataSource;
import java.sql.SQLException;
import java.util.List;
import java.util.Objects;

/**
 * Fixture handling goes through JPA in its own short transactions; each actor session gets a
 * dedicated pooled connection, outside Spring's transaction management.
 */
@Repository
public class JdbcTransactionStore implements TransactionStore {

    private static final Logger log = LoggerFactory.getLogger(JdbcTransactionStore.class);

    private final DataSource dataSource;
    private final ItemJpaRepository itemJpaRepository;
    private final StatementBudget budget;

    public JdbcTransactionStore(DataSource dataSource,
                                ItemJpaRepository itemJpaRepository,
                                StatementBudget budget) {
        this.dataSource = Objects.requireNonNull(dataSource, "dataSource cannot be null");
        this.itemJpaRepository = Objects.requireNonNull(itemJpaRepository, "itemJpaRepository cannot be null");
        this.budget = Objects.requireNonNull(budget, "budget cannot be null");
    }

    @Override
    @Transactional
    public void resetFixture(List<Item> rows) {
        itemJpaRepository.deleteAllInBatch();
        itemJpaRepository.saveAll(rows.stream().map(ItemEntity::of).toList());
        log.debug("Fixture reset to {} rows", rows.size());
    }

    @Override
    public StoreSession openSession() {
        try {
            return new JdbcStoreSession(dataSource.getConnection(), budget);
        } catch (SQLException e) {
            throw SqlStateTranslator.translate("OPEN SESSION", e);
        }
    }

    @Override
    @Transactional(readOnly = true)
    public List<Item> committedRows() {
        return itemJpaRepository.findAll(Sort.by("id")).stream()
            .map(ItemEntity::toDomain)
            .toList();
    }
}
