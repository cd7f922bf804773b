package dev.pekelund.reconciler.reconciliation;

import dev.pekelund.reconciler.items.LineItem;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Compares the items of an offer against the items delivered on one or more invoices.
 *
 * <p>Results are ordered offer items first, in offer order, followed by invoice-only items in
 * order of first appearance on the invoices. Every distinct item code appears exactly once.
 * Instances hold no mutable state and may be shared between threads.
 */
public class OfferReconciler {

    private static final Logger LOGGER = LoggerFactory.getLogger(OfferReconciler.class);

    private final InvoiceItemAggregator aggregator;
    private final BigDecimal defaultTolerance;

    public OfferReconciler() {
        this(new InvoiceItemAggregator(), ReconciliationDefaults.PRICE_TOLERANCE);
    }

    public OfferReconciler(InvoiceItemAggregator aggregator, BigDecimal defaultTolerance) {
        this.aggregator = aggregator;
        this.defaultTolerance = requireValidTolerance(defaultTolerance);
    }

    public BigDecimal defaultTolerance() {
        return defaultTolerance;
    }

    public List<ComparisonResult> reconcile(List<LineItem> offerItems,
        Collection<? extends List<LineItem>> invoiceItemLists) {
        return reconcile(offerItems, invoiceItemLists, defaultTolerance);
    }

    /**
     * Reconciles the offer against the aggregated invoices.
     *
     * @param offerItems       items of the offer, in document order
     * @param invoiceItemLists one item list per invoice, in invoice order
     * @param tolerance        maximum accepted relative unit price deviation, e.g. {@code 0.02}
     * @return one result per distinct item code
     * @throws IllegalArgumentException when the tolerance is null or negative
     */
    public List<ComparisonResult> reconcile(List<LineItem> offerItems,
        Collection<? extends List<LineItem>> invoiceItemLists, BigDecimal tolerance) {

        BigDecimal resolvedTolerance = requireValidTolerance(tolerance);
        Map<String, LineItem> delivered = aggregator.aggregate(invoiceItemLists);
        Map<String, LineItem> offered = aggregator.foldByCode(offerItems);

        List<ComparisonResult> results = new ArrayList<>(offered.size() + delivered.size());
        for (LineItem offerItem : offered.values()) {
            LineItem invoiceItem = delivered.get(offerItem.itemCode());
            if (invoiceItem == null) {
                results.add(missing(offerItem));
            } else {
                results.add(compare(offerItem, invoiceItem, resolvedTolerance));
            }
        }

        for (LineItem invoiceItem : delivered.values()) {
            if (!offered.containsKey(invoiceItem.itemCode())) {
                results.add(extra(invoiceItem));
            }
        }

        LOGGER.debug("Reconciled {} offer codes against {} delivered codes into {} results (tolerance {})",
            offered.size(), delivered.size(), results.size(), resolvedTolerance.toPlainString());
        return List.copyOf(results);
    }

    private ComparisonResult missing(LineItem offerItem) {
        return new ComparisonResult(
            offerItem.itemCode(),
            offerItem.description(),
            offerItem.quantity(),
            BigDecimal.ZERO,
            offerItem.unitPrice(),
            BigDecimal.ZERO,
            offerItem.quantity(),
            BigDecimal.ZERO,
            ComparisonStatus.MISSING);
    }

    private ComparisonResult extra(LineItem invoiceItem) {
        return new ComparisonResult(
            invoiceItem.itemCode(),
            invoiceItem.description(),
            BigDecimal.ZERO,
            invoiceItem.quantity(),
            BigDecimal.ZERO,
            invoiceItem.unitPrice(),
            invoiceItem.quantity().negate(),
            invoiceItem.unitPrice().negate(),
            ComparisonStatus.EXTRA_ITEM);
    }

    private ComparisonResult compare(LineItem offerItem, LineItem invoiceItem, BigDecimal tolerance) {
        BigDecimal quantityDifference = offerItem.quantity().subtract(invoiceItem.quantity());
        BigDecimal priceDifference = offerItem.unitPrice().subtract(invoiceItem.unitPrice());

        ComparisonStatus status;
        if (quantityDifference.signum() != 0) {
            status = ComparisonStatus.QUANTITY_MISMATCH;
        } else if (exceedsTolerance(priceDifference, offerItem.unitPrice(), tolerance)) {
            status = ComparisonStatus.PRICE_MISMATCH;
        } else {
            status = ComparisonStatus.MATCH;
        }

        return new ComparisonResult(
            offerItem.itemCode(),
            offerItem.description(),
            offerItem.quantity(),
            invoiceItem.quantity(),
            offerItem.unitPrice(),
            invoiceItem.unitPrice(),
            quantityDifference,
            priceDifference,
            status);
    }

    /**
     * {@code |difference / offerPrice| > tolerance}, evaluated as
     * {@code |difference| > tolerance * |offerPrice|} to stay exact. A zero offer price never
     * exceeds the tolerance.
     */
    static boolean exceedsTolerance(BigDecimal priceDifference, BigDecimal offerPrice, BigDecimal tolerance) {
        if (offerPrice.signum() == 0) {
            return false;
        }
        BigDecimal allowed = tolerance.multiply(offerPrice.abs());
        return priceDifference.abs().compareTo(allowed) > 0;
    }

    private static BigDecimal requireValidTolerance(BigDecimal tolerance) {
        if (tolerance == null) {
            throw new IllegalArgumentException("Price tolerance must not be null");
        }
        if (tolerance.signum() < 0) {
            throw new IllegalArgumentException("Price tolerance must not be negative: " + tolerance.toPlainString());
        }
        return tolerance;
    }
}
