package dev.pekelund.reconciler.reconciliation;

/**
 * Classification of a reconciled item.
 */
public enum ComparisonStatus {

    MATCH("match"),
    QUANTITY_MISMATCH("quantity_mismatch"),
    PRICE_MISMATCH("price_mismatch"),
    MISSING("missing"),
    EXTRA_ITEM("extra_item");

    private final String code;

    ComparisonStatus(String code) {
        this.code = code;
    }

    /**
     * Stable lowercase code used in reports and serialised payloads.
     */
    public String code() {
        return code;
    }
}
