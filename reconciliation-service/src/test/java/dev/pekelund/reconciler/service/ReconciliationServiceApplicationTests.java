package dev.pekelund.reconciler.service;

import static org.assertj.core.api.Assertions.assertThat;

import dev.pekelund.reconciler.extraction.ExtractionMethod;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

@SpringBootTest(properties = "reconciliation.extraction-method=text-only")
class ReconciliationServiceApplicationTests {

    @Autowired
    private ReconciliationService reconciliationService;

    @Autowired
    private ReconciliationApiController reconciliationApiController;

    @Test
    void contextLoadsWithConfiguredEngine() {
        assertThat(reconciliationApiController).isNotNull();
        assertThat(reconciliationService.properties().extractionMethod()).isEqualTo(ExtractionMethod.TEXT_ONLY);
        assertThat(reconciliationService.properties().priceTolerance()).isEqualByComparingTo("0.02");
    }
}
