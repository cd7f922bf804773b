package dev.pekelund.reconciler.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import dev.pekelund.reconciler.extraction.LineItemExtractor;
import dev.pekelund.reconciler.reconciliation.InvoiceItemAggregator;
import dev.pekelund.reconciler.reconciliation.OfferReconciler;
import dev.pekelund.reconciler.reconciliation.SummaryAggregator;
import dev.pekelund.reconciler.service.pdf.PdfDocumentReader;
import java.time.Clock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the reconciliation engine into the service.
 */
@Configuration
@EnableConfigurationProperties(ReconciliationProperties.class)
public class ReconciliationConfiguration {

    private static final Logger LOGGER = LoggerFactory.getLogger(ReconciliationConfiguration.class);

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.findAndRegisterModules();
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return mapper;
    }

    @Bean
    public Clock reconciliationClock() {
        return Clock.systemUTC();
    }

    @Bean
    public PdfDocumentReader pdfDocumentReader() {
        return new PdfDocumentReader();
    }

    @Bean
    public LineItemExtractor lineItemExtractor() {
        return new LineItemExtractor();
    }

    @Bean
    public OfferReconciler offerReconciler(ReconciliationProperties properties) {
        return new OfferReconciler(new InvoiceItemAggregator(), properties.priceTolerance());
    }

    @Bean
    public SummaryAggregator summaryAggregator() {
        return new SummaryAggregator();
    }

    @Bean
    public ReconciliationService reconciliationService(PdfDocumentReader pdfDocumentReader,
        LineItemExtractor lineItemExtractor, OfferReconciler offerReconciler, SummaryAggregator summaryAggregator,
        ApplicationEventPublisher eventPublisher, ReconciliationProperties properties, Clock reconciliationClock) {
        LOGGER.info("Configured reconciliation engine - price tolerance: {}, extraction method: {}",
            properties.priceTolerance().toPlainString(), properties.extractionMethod().settingValue());
        return new ReconciliationService(pdfDocumentReader, lineItemExtractor, offerReconciler, summaryAggregator,
            eventPublisher, properties, reconciliationClock);
    }
}
