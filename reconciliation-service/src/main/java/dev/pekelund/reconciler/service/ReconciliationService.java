package dev.pekelund.reconciler.service;

import dev.pekelund.reconciler.extraction.ExtractionMethod;
import dev.pekelund.reconciler.extraction.LineItemExtractor;
import dev.pekelund.reconciler.extraction.SourceDocument;
import dev.pekelund.reconciler.items.LineItem;
import dev.pekelund.reconciler.messaging.ReconciliationCompletedMessage;
import dev.pekelund.reconciler.reconciliation.ComparisonResult;
import dev.pekelund.reconciler.reconciliation.OfferReconciler;
import dev.pekelund.reconciler.reconciliation.ReconciliationSummary;
import dev.pekelund.reconciler.reconciliation.SummaryAggregator;
import dev.pekelund.reconciler.service.pdf.PdfDocumentReader;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;

/**
 * Runs one offer against its invoices: reads every PDF, extracts line items with the configured
 * strategies, reconciles them and publishes the completed report as an application event.
 */
public class ReconciliationService {

    private static final Logger LOGGER = LoggerFactory.getLogger(ReconciliationService.class);

    private final PdfDocumentReader documentReader;
    private final LineItemExtractor lineItemExtractor;
    private final OfferReconciler offerReconciler;
    private final SummaryAggregator summaryAggregator;
    private final ApplicationEventPublisher eventPublisher;
    private final ReconciliationProperties properties;
    private final Clock clock;

    public ReconciliationService(PdfDocumentReader documentReader, LineItemExtractor lineItemExtractor,
        OfferReconciler offerReconciler, SummaryAggregator summaryAggregator,
        ApplicationEventPublisher eventPublisher, ReconciliationProperties properties, Clock clock) {
        this.documentReader = documentReader;
        this.lineItemExtractor = lineItemExtractor;
        this.offerReconciler = offerReconciler;
        this.summaryAggregator = summaryAggregator;
        this.eventPublisher = eventPublisher;
        this.properties = properties;
        this.clock = clock;
    }

    public ReconciliationCompletedMessage reconcile(DocumentUpload offer, List<DocumentUpload> invoices) {
        Objects.requireNonNull(offer, "offer must not be null");
        List<DocumentUpload> invoiceUploads = invoices == null ? List.of() : invoices;
        ExtractionMethod method = properties.extractionMethod();
        String runId = UUID.randomUUID().toString();

        try (ReconciliationMdc.Context ignored = ReconciliationMdc.open(runId, offer.fileName())) {
            try {
                LOGGER.info("Starting reconciliation of offer {} against {} invoices (method {}, tolerance {})",
                    offer.fileName(), invoiceUploads.size(), method.settingValue(),
                    properties.priceTolerance().toPlainString());

                ReconciliationMdc.setStage("extract-offer");
                List<LineItem> offerItems = extractItems(offer, method);

                ReconciliationMdc.setStage("extract-invoices");
                List<List<LineItem>> invoiceItems = new ArrayList<>(invoiceUploads.size());
                List<String> invoiceNames = new ArrayList<>(invoiceUploads.size());
                for (DocumentUpload invoice : invoiceUploads) {
                    invoiceItems.add(extractItems(invoice, method));
                    invoiceNames.add(invoice.fileName());
                }

                ReconciliationMdc.setStage("reconcile");
                List<ComparisonResult> results = offerReconciler.reconcile(offerItems, invoiceItems,
                    properties.priceTolerance());
                ReconciliationSummary summary = summaryAggregator.summarize(results);

                ReconciliationCompletedMessage message = ReconciliationCompletedMessage.fromReconciliation(runId,
                    clock.instant(), offer.fileName(), invoiceNames, properties.priceTolerance(),
                    method.settingValue(), summary, results);

                ReconciliationMdc.setStage("publish");
                eventPublisher.publishEvent(message);
                LOGGER.info("Reconciliation completed: {} items, {} matches, {} quantity mismatches, "
                        + "{} price mismatches, {} missing, {} extra", summary.totalItems(), summary.matches(),
                    summary.quantityMismatches(), summary.priceMismatches(), summary.missingItems(),
                    summary.extraItems());
                return message;
            } catch (RuntimeException ex) {
                LOGGER.error("Reconciliation run {} failed", runId, ex);
                throw ex;
            }
        }
    }

    public List<LineItem> extractItems(DocumentUpload upload, ExtractionMethod method) {
        Objects.requireNonNull(upload, "upload must not be null");
        ExtractionMethod effectiveMethod = method == null ? properties.extractionMethod() : method;
        SourceDocument document = documentReader.read(upload.content(), upload.fileName());
        return lineItemExtractor.extract(document, effectiveMethod);
    }

    public ReconciliationProperties properties() {
        return properties;
    }
}
