package dev.pekelund.reconciler.reconciliation;

import java.math.BigDecimal;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Reduces reconciliation results into a {@link ReconciliationSummary}.
 */
public class SummaryAggregator {

    public ReconciliationSummary summarize(List<ComparisonResult> results) {
        if (results == null || results.isEmpty()) {
            return ReconciliationSummary.EMPTY;
        }

        Map<ComparisonStatus, Integer> counts = new EnumMap<>(ComparisonStatus.class);
        BigDecimal quantityDifference = BigDecimal.ZERO;
        BigDecimal priceDifference = BigDecimal.ZERO;
        int total = 0;

        for (ComparisonResult result : results) {
            if (result == null) {
                continue;
            }
            total++;
            counts.merge(result.status(), 1, Integer::sum);
            quantityDifference = quantityDifference.add(result.quantityDifference().abs());
            priceDifference = priceDifference.add(result.priceDifference().abs());
        }

        return new ReconciliationSummary(
            total,
            counts.getOrDefault(ComparisonStatus.MATCH, 0),
            counts.getOrDefault(ComparisonStatus.QUANTITY_MISMATCH, 0),
            counts.getOrDefault(ComparisonStatus.PRICE_MISMATCH, 0),
            counts.getOrDefault(ComparisonStatus.MISSING, 0),
            counts.getOrDefault(ComparisonStatus.EXTRA_ITEM, 0),
            quantityDifference,
            priceDifference);
    }
}
