package dev.pekelund.reconciler.items;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * A single line entry recovered from an offer or invoice document.
 *
 * @param itemCode    identifying code, case preserved
 * @param description free text, empty when the source had none
 * @param quantity    ordered or delivered quantity
 * @param unitPrice   price per unit
 * @param totalPrice  line total as printed on the document, or {@code quantity * unitPrice} when absent
 */
public record LineItem(
    String itemCode,
    String description,
    BigDecimal quantity,
    BigDecimal unitPrice,
    BigDecimal totalPrice
) {

    public LineItem {
        Objects.requireNonNull(itemCode, "itemCode must not be null");
        if (itemCode.isBlank()) {
            throw new IllegalArgumentException("itemCode must not be blank");
        }
        description = description == null ? "" : description;
        quantity = quantity == null ? BigDecimal.ZERO : quantity;
        unitPrice = unitPrice == null ? BigDecimal.ZERO : unitPrice;
        totalPrice = totalPrice == null ? quantity.multiply(unitPrice) : totalPrice;
    }

    /**
     * Creates an item whose total is derived from quantity and unit price.
     */
    public static LineItem withDerivedTotal(String itemCode, String description, BigDecimal quantity,
        BigDecimal unitPrice) {
        return new LineItem(itemCode, description, quantity, unitPrice, null);
    }

    /**
     * Quantity times unit price, independent of the stored {@link #totalPrice()}.
     */
    public BigDecimal lineTotal() {
        return quantity.multiply(unitPrice);
    }

    /**
     * Folds a later occurrence of the same item code into this one. Quantity and total are
     * summed; code, description and unit price of this item are kept.
     */
    public LineItem mergedWith(LineItem other) {
        Objects.requireNonNull(other, "other must not be null");
        return new LineItem(itemCode, description, quantity.add(other.quantity()), unitPrice,
            totalPrice.add(other.totalPrice()));
    }
}
