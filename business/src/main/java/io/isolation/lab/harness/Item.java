package io.isolation.lab.harness;

import java.math.BigDecimal;
import java.util.Objects;

public record Item(
    long id,
    String name,
    BigDecimal price,
    boolean deleted
) {
    public Item {
        Objects.requireNonNull(name, "name cannot be null");
        Objects.requireNonNull(price, "price cannot be null");
        if (price.signum() < 0) throw new IllegalArgumentException("price cannot be negative");
    }

    public static Item of(long id, String name, String price) {
        return new Item(id, name, new BigDecimal(price), false);
    }

    public Item markDeleted() {
        return new Item(id, name, price, true);
    }
}
