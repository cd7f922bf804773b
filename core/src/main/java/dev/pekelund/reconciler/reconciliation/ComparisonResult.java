package dev.pekelund.reconciler.reconciliation;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * One row of reconciliation output.
 *
 * @param itemCode           item code shared by the offer and invoice lines
 * @param description        description from the offer, or from the first invoice line for extra items
 * @param offerQuantity      quantity in the offer, zero for extra items
 * @param deliveredQuantity  quantity summed over all invoices, zero for missing items
 * @param offerPrice         unit price in the offer, zero for extra items
 * @param invoicedPrice      unit price of the first invoice line, zero for missing items
 * @param quantityDifference {@code offerQuantity - deliveredQuantity}
 * @param priceDifference    {@code offerPrice - invoicedPrice}, zero for missing items
 * @param status             classification
 */
public record ComparisonResult(
    String itemCode,
    String description,
    BigDecimal offerQuantity,
    BigDecimal deliveredQuantity,
    BigDecimal offerPrice,
    BigDecimal invoicedPrice,
    BigDecimal quantityDifference,
    BigDecimal priceDifference,
    ComparisonStatus status
) {

    public ComparisonResult {
        Objects.requireNonNull(itemCode, "itemCode must not be null");
        Objects.requireNonNull(status, "status must not be null");
        description = description == null ? "" : description;
        offerQuantity = zeroIfNull(offerQuantity);
        deliveredQuantity = zeroIfNull(deliveredQuantity);
        offerPrice = zeroIfNull(offerPrice);
        invoicedPrice = zeroIfNull(invoicedPrice);
        quantityDifference = zeroIfNull(quantityDifference);
        priceDifference = zeroIfNull(priceDifference);
    }

    private static BigDecimal zeroIfNull(BigDecimal value) {
        return value == null ? BigDecimal.ZERO : value;
    }
}
