package dev.pekelund.reconciler.reconciliation;

import java.math.BigDecimal;

/**
 * Defaults shared by the engine and the service configuration.
 */
public final class ReconciliationDefaults {

    /**
     * Maximum relative deviation of the invoiced unit price from the offer unit price that is
     * still accepted as a match (2%).
     */
    public static final BigDecimal PRICE_TOLERANCE = new BigDecimal("0.02");

    private ReconciliationDefaults() {
    }
}
