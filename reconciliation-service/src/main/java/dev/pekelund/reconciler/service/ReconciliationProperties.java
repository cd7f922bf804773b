package dev.pekelund.reconciler.service;

import dev.pekelund.reconciler.extraction.ExtractionMethod;
import dev.pekelund.reconciler.reconciliation.ReconciliationDefaults;
import java.math.BigDecimal;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Engine settings bound from {@code reconciliation.*}.
 *
 * @param priceTolerance   accepted relative unit price deviation, {@code 0.02} when unset
 * @param extractionMethod strategies run over each document, {@code both} when unset
 */
@ConfigurationProperties(prefix = "reconciliation")
public record ReconciliationProperties(
    BigDecimal priceTolerance,
    ExtractionMethod extractionMethod
) {

    public ReconciliationProperties {
        if (priceTolerance == null) {
            priceTolerance = ReconciliationDefaults.PRICE_TOLERANCE;
        }
        if (priceTolerance.signum() < 0) {
            throw new IllegalStateException(String.format(
                "reconciliation.price-tolerance must not be negative but was %s", priceTolerance.toPlainString()));
        }
        if (extractionMethod == null) {
            extractionMethod = ExtractionMethod.DEFAULT;
        }
    }

    public static ReconciliationProperties defaults() {
        return new ReconciliationProperties(null, null);
    }
}
