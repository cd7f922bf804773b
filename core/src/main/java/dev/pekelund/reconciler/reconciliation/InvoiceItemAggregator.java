package dev.pekelund.reconciler.reconciliation;

import dev.pekelund.reconciler.items.LineItem;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Folds line items sharing an item code into one item, so that partial deliveries spread over
 * several invoices count as a single delivery.
 */
public class InvoiceItemAggregator {

    /**
     * Aggregates the given invoice item lists in order. Quantities and totals of repeated codes
     * are summed; description and unit price come from the first occurrence. The returned map
     * iterates in order of first appearance.
     */
    public Map<String, LineItem> aggregate(Collection<? extends List<LineItem>> invoiceItemLists) {
        Map<String, LineItem> aggregated = new LinkedHashMap<>();
        if (invoiceItemLists == null) {
            return Collections.unmodifiableMap(aggregated);
        }
        for (List<LineItem> items : invoiceItemLists) {
            if (items == null) {
                continue;
            }
            fold(aggregated, items);
        }
        return Collections.unmodifiableMap(aggregated);
    }

    /**
     * Folds repeated codes within a single list using the same rules as {@link #aggregate(Collection)}.
     */
    public Map<String, LineItem> foldByCode(List<LineItem> items) {
        Map<String, LineItem> aggregated = new LinkedHashMap<>();
        if (items != null) {
            fold(aggregated, items);
        }
        return Collections.unmodifiableMap(aggregated);
    }

    private void fold(Map<String, LineItem> target, List<LineItem> items) {
        for (LineItem item : items) {
            if (item != null) {
                target.merge(item.itemCode(), item, LineItem::mergedWith);
            }
        }
    }
}
