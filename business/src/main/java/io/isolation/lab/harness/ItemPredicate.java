package io.isolation.lab.harness;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * Counting predicate {@code price >= minPrice AND deleted = FALSE}.
 */
public record ItemPredicate(BigDecimal minPrice) {

    public ItemPredicate {
        Objects.requireNonNull(minPrice, "minPrice cannot be null");
    }

    public static ItemPredicate priceAtLeast(String minPrice) {
        return new ItemPredicate(new BigDecimal(minPrice));
    }

    public boolean matches(Item item) {
        return !item.deleted() && item.price().compareTo(minPrice) >= 0;
    }

    @Override
    public String toString() {
        return "price >= " + minPrice.toPlainString() + " and not deleted";
    }
}
