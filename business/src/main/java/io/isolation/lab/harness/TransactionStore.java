package io.isolation.lab.harness;

import java.util.List;

public interface TransactionStore {

    /** Deletes every row of the contention table and seeds the given rows, committed. */
    void resetFixture(List<Item> rows);

    StoreSession openSession();

    /** Rows as currently committed, ordered by id. */
    List<Item> committedRows();
}
