package dev.pekelund.reconciler.messaging;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import dev.pekelund.reconciler.reconciliation.ComparisonResult;
import dev.pekelund.reconciler.reconciliation.ReconciliationSummary;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Payload handed to storage and notification collaborators when a reconciliation run has
 * finished. Decimal values are written as JSON strings so that consumers never read them
 * through binary floating point.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ReconciliationCompletedMessage(
    @JsonProperty("runId") String runId,
    @JsonProperty("completedAt") Instant completedAt,
    @JsonProperty("offerDocument") String offerDocument,
    @JsonProperty("invoiceDocuments") List<String> invoiceDocuments,
    @JsonProperty("priceTolerance") @JsonFormat(shape = JsonFormat.Shape.STRING) BigDecimal priceTolerance,
    @JsonProperty("extractionMethod") String extractionMethod,
    @JsonProperty("summary") SummaryPayload summary,
    @JsonProperty("results") List<ResultPayload> results
) {

    public ReconciliationCompletedMessage {
        invoiceDocuments = invoiceDocuments == null ? List.of() : List.copyOf(invoiceDocuments);
        results = results == null ? List.of() : List.copyOf(results);
    }

    /**
     * Builds the message for a finished run.
     */
    public static ReconciliationCompletedMessage fromReconciliation(
        String runId,
        Instant completedAt,
        String offerDocument,
        List<String> invoiceDocuments,
        BigDecimal priceTolerance,
        String extractionMethod,
        ReconciliationSummary summary,
        List<ComparisonResult> results) {

        Objects.requireNonNull(runId, "runId must not be null");
        Objects.requireNonNull(summary, "summary must not be null");
        List<ResultPayload> resultPayloads = results == null
            ? List.of()
            : results.stream().map(ResultPayload::fromResult).toList();
        return new ReconciliationCompletedMessage(runId, completedAt, offerDocument, invoiceDocuments,
            priceTolerance, extractionMethod, SummaryPayload.fromSummary(summary), resultPayloads);
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record SummaryPayload(
        @JsonProperty("totalItems") int totalItems,
        @JsonProperty("matches") int matches,
        @JsonProperty("quantityMismatches") int quantityMismatches,
        @JsonProperty("priceMismatches") int priceMismatches,
        @JsonProperty("missingItems") int missingItems,
        @JsonProperty("extraItems") int extraItems,
        @JsonProperty("totalQuantityDifference") @JsonFormat(shape = JsonFormat.Shape.STRING)
        BigDecimal totalQuantityDifference,
        @JsonProperty("totalPriceDifference") @JsonFormat(shape = JsonFormat.Shape.STRING)
        BigDecimal totalPriceDifference
    ) {

        static SummaryPayload fromSummary(ReconciliationSummary summary) {
            return new SummaryPayload(summary.totalItems(), summary.matches(), summary.quantityMismatches(),
                summary.priceMismatches(), summary.missingItems(), summary.extraItems(),
                summary.totalQuantityDifference(), summary.totalPriceDifference());
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ResultPayload(
        @JsonProperty("itemCode") String itemCode,
        @JsonProperty("description") String description,
        @JsonProperty("offerQuantity") @JsonFormat(shape = JsonFormat.Shape.STRING) BigDecimal offerQuantity,
        @JsonProperty("deliveredQuantity") @JsonFormat(shape = JsonFormat.Shape.STRING) BigDecimal deliveredQuantity,
        @JsonProperty("offerPrice") @JsonFormat(shape = JsonFormat.Shape.STRING) BigDecimal offerPrice,
        @JsonProperty("invoicedPrice") @JsonFormat(shape = JsonFormat.Shape.STRING) BigDecimal invoicedPrice,
        @JsonProperty("quantityDifference") @JsonFormat(shape = JsonFormat.Shape.STRING) BigDecimal quantityDifference,
        @JsonProperty("priceDifference") @JsonFormat(shape = JsonFormat.Shape.STRING) BigDecimal priceDifference,
        @JsonProperty("status") String status
    ) {

        static ResultPayload fromResult(ComparisonResult result) {
            return new ResultPayload(result.itemCode(), result.description(), result.offerQuantity(),
                result.deliveredQuantity(), result.offerPrice(), result.invoicedPrice(), result.quantityDifference(),
                result.priceDifference(), result.status().code());
        }
    }
}
