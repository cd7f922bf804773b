package dev.pekelund.reconciler.reconciliation;

import java.math.BigDecimal;

/**
 * Count and magnitude statistics over a list of {@link ComparisonResult}s.
 *
 * @param totalItems              number of results
 * @param matches                 results with status {@code match}
 * @param quantityMismatches      results with status {@code quantity_mismatch}
 * @param priceMismatches         results with status {@code price_mismatch}
 * @param missingItems            results with status {@code missing}
 * @param extraItems              results with status {@code extra_item}
 * @param totalQuantityDifference sum of absolute quantity differences over all results
 * @param totalPriceDifference    sum of absolute unit price differences over all results
 */
public record ReconciliationSummary(
    int totalItems,
    int matches,
    int quantityMismatches,
    int priceMismatches,
    int missingItems,
    int extraItems,
    BigDecimal totalQuantityDifference,
    BigDecimal totalPriceDifference
) {

    public static final ReconciliationSummary EMPTY =
        new ReconciliationSummary(0, 0, 0, 0, 0, 0, BigDecimal.ZERO, BigDecimal.ZERO);

    public ReconciliationSummary {
        totalQuantityDifference = totalQuantityDifference == null ? BigDecimal.ZERO : totalQuantityDifference;
        totalPriceDifference = totalPriceDifference == null ? BigDecimal.ZERO : totalPriceDifference;
    }

    public int count(ComparisonStatus status) {
        return switch (status) {
            case MATCH -> matches;
            case QUANTITY_MISMATCH -> quantityMismatches;
            case PRICE_MISMATCH -> priceMismatches;
            case MISSING -> missingItems;
            case EXTRA_ITEM -> extraItems;
        };
    }

    public boolean hasDiscrepancies() {
        return matches < totalItems;
    }
}
