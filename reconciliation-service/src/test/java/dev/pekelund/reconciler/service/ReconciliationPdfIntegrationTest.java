package dev.pekelund.reconciler.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

import dev.pekelund.reconciler.extraction.ExtractionMethod;
import dev.pekelund.reconciler.extraction.LineItemExtractor;
import dev.pekelund.reconciler.items.LineItem;
import dev.pekelund.reconciler.messaging.ReconciliationCompletedMessage;
import dev.pekelund.reconciler.messaging.ReconciliationCompletedMessage.ResultPayload;
import dev.pekelund.reconciler.reconciliation.OfferReconciler;
import dev.pekelund.reconciler.reconciliation.SummaryAggregator;
import dev.pekelund.reconciler.service.pdf.PdfDocumentReader;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.springframework.context.ApplicationEventPublisher;

class ReconciliationPdfIntegrationTest {

    private final List<Object> publishedEvents = new ArrayList<>();

    private final ApplicationEventPublisher eventPublisher = publishedEvents::add;

    @Test
    void reconcilesGeneratedPdfsEndToEnd() {
        ReconciliationService service = newService(ExtractionMethod.TEXT_ONLY);
        byte[] offer = TestPdfs.createPdf("""
            A123 Widget 10 15.50
            B456 Gadget 5 25.00
            C789 Gizmo 2 9.99
            """);
        byte[] firstInvoice = TestPdfs.createPdf("""
            A123 Widget 8 15.50
            B456 Gadget 5 26.00
            """);
        byte[] secondInvoice = TestPdfs.createPdf("""
            A123 Widget 2 15.50
            D000 Bracket 1 3.00
            """);

        ReconciliationCompletedMessage message = service.reconcile(new DocumentUpload("offer.pdf", offer),
            List.of(new DocumentUpload("invoice-1.pdf", firstInvoice),
                new DocumentUpload("invoice-2.pdf", secondInvoice)));

        assertThat(message.results()).extracting(ResultPayload::itemCode, ResultPayload::status)
            .containsExactly(
                tuple("A123", "match"),
                tuple("B456", "price_mismatch"),
                tuple("C789", "missing"),
                tuple("D000", "extra_item"));
        ResultPayload widget = message.results().get(0);
        assertThat(widget.deliveredQuantity()).isEqualByComparingTo("10");
        assertThat(message.results().get(1).priceDifference()).isEqualByComparingTo("-1.00");
        assertThat(message.summary().totalItems()).isEqualTo(4);
        assertThat(publishedEvents).containsExactly(message);
    }

    @Test
    void reconcilesRuledTablePdfsWithTableStrategy() {
        ReconciliationService service = newService(ExtractionMethod.TABLE_ONLY);
        List<String> header = List.of("Item Code", "Description", "Quantity", "Unit Price", "Total");
        byte[] offer = TestPdfs.createRuledTablePdf(List.of(header,
            List.of("A123", "Widget", "10", "EUR 15.50", "EUR 155.00"),
            List.of("B456", "Gadget", "5", "EUR 25.00", "EUR 125.00")));
        byte[] invoice = TestPdfs.createRuledTablePdf(List.of(header,
            List.of("A123", "Widget", "7", "EUR 15.50", "EUR 108.50"),
            List.of("B456", "Gadget", "5", "EUR 25.00", "EUR 125.00")));

        ReconciliationCompletedMessage message = service.reconcile(new DocumentUpload("offer.pdf", offer),
            List.of(new DocumentUpload("invoice.pdf", invoice)));

        assertThat(message.extractionMethod()).isEqualTo("table-only");
        assertThat(message.results()).extracting(ResultPayload::itemCode, ResultPayload::status)
            .containsExactly(
                tuple("A123", "quantity_mismatch"),
                tuple("B456", "match"));
        assertThat(message.results().get(0).quantityDifference()).isEqualByComparingTo("3");
        assertThat(message.summary().quantityMismatches()).isEqualTo(1);
    }

    @Test
    void itemsOnLaterPagesAreExtracted() {
        ReconciliationService service = newService(ExtractionMethod.BOTH);
        byte[] offer = TestPdfs.createPdf("A123 Widget 10 15.50", "B456 Gadget 5 25.00");

        List<LineItem> items = service.extractItems(new DocumentUpload("offer.pdf", offer), null);

        assertThat(items).extracting(LineItem::itemCode).containsExactly("A123", "B456");
        assertThat(items.get(1).totalPrice()).isEqualByComparingTo("125.00");
    }

    @Test
    void corruptInvoiceMarksEveryOfferItemMissing() {
        ReconciliationService service = newService(ExtractionMethod.BOTH);
        byte[] offer = TestPdfs.createPdf("A123 Widget 10 15.50");
        byte[] corrupt = "garbage".getBytes(StandardCharsets.UTF_8);

        ReconciliationCompletedMessage message = service.reconcile(new DocumentUpload("offer.pdf", offer),
            List.of(new DocumentUpload("broken.pdf", corrupt)));

        assertThat(message.results()).extracting(ResultPayload::status).containsExactly("missing");
        assertThat(message.summary().missingItems()).isEqualTo(1);
        assertThat(message.summary().totalQuantityDifference()).isEqualByComparingTo("10");
    }

    private ReconciliationService newService(ExtractionMethod method) {
        return new ReconciliationService(new PdfDocumentReader(), new LineItemExtractor(), new OfferReconciler(),
            new SummaryAggregator(), eventPublisher, new ReconciliationProperties(new BigDecimal("0.02"), method),
            Clock.systemUTC());
    }
}
