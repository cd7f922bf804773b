package dev.pekelund.reconciler.service;

import java.util.Arrays;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;

/**
 * Emits diagnostic logging when the service boots so we can verify the effective configuration.
 */
@Component
public class ReconciliationDiagnostics implements ApplicationRunner {

    private static final Logger LOGGER = LoggerFactory.getLogger(ReconciliationDiagnostics.class);

    private final Environment environment;
    private final ReconciliationProperties properties;

    public ReconciliationDiagnostics(Environment environment, ReconciliationProperties properties) {
        this.environment = environment;
        this.properties = properties;
    }

    @Override
    public void run(ApplicationArguments args) {
        LOGGER.info("Delivery reconciler diagnostics starting");
        LOGGER.info("Active Spring profiles: {}", Arrays.toString(environment.getActiveProfiles()));
        LOGGER.info("Resolved price tolerance: {} (property reconciliation.price-tolerance={})",
            properties.priceTolerance().toPlainString(),
            environment.getProperty("reconciliation.price-tolerance", "(unset)"));
        LOGGER.info("Resolved extraction method: {} (property reconciliation.extraction-method={})",
            properties.extractionMethod().settingValue(),
            environment.getProperty("reconciliation.extraction-method", "(unset)"));
        LOGGER.info("Environment override RECONCILIATION_PRICE_TOLERANCE={} (System.getenv)",
            System.getenv().getOrDefault("RECONCILIATION_PRICE_TOLERANCE", "(unset)"));
    }
}
