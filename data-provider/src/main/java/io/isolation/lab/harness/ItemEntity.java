package io.isolation.lab.harness;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.PostLoad;
import jakarta.persistence.PostPersist;
import jakarta.persistence.Table;
import org.springframework.data.domain.Persistable;

import java.math.BigDecimal;

@Entity
@Table(name = "items")
public class ItemEntity implements Persistable<Long> {

    @Id
    private Long id;

    @Column(name = "name", nullable = false)
    private String name;

    @Column(name = "price", nullable = false, precision = 12, scale = 2)
    private BigDecimal price;

    @Column(name = "deleted", nullable = false)
    private boolean deleted;

    private transient boolean isNew = true;

    protected ItemEntity() {}

    public static ItemEntity of(final Item item) {
        var entity = new ItemEntity();
        entity.id = item.id();
        entity.name = item.name();
        entity.price = item.price();
        entity.deleted = item.deleted();
        return entity;
    }

    public Item toDomain() {
        return new Item(id, name, price, deleted);
    }

    @Override
    public Long getId() { return id; }

    @Override
    public boolean isNew() { return isNew; }

    @PostLoad
    @PostPersist
    void markNotNew() { this.isNew = false; }

    public String getName() { return name; }
    public BigDecimal getPrice() { return price; }
    public boolean isDeleted() { return deleted; }
}
