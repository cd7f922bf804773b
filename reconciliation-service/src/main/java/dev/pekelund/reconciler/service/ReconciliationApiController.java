package dev.pekelund.reconciler.service;

import dev.pekelund.reconciler.extraction.ExtractionMethod;
import dev.pekelund.reconciler.items.LineItem;
import dev.pekelund.reconciler.messaging.ReconciliationCompletedMessage;
import java.io.IOException;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.util.StringUtils;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RequestPart;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;
import org.springframework.web.server.ResponseStatusException;

/**
 * REST API for reconciling an offer PDF against one or more invoice PDFs and for inspecting
 * the line items extracted from a single document. Nothing is persisted.
 */
@RestController
@RequestMapping(path = "/api")
public class ReconciliationApiController {

    private static final Logger LOGGER = LoggerFactory.getLogger(ReconciliationApiController.class);

    private static final String PDF_MIME_TYPE = "application/pdf";

    private final ReconciliationService reconciliationService;

    public ReconciliationApiController(ReconciliationService reconciliationService) {
        this.reconciliationService = reconciliationService;
    }

    @PostMapping(path = "/reconciliations", consumes = MediaType.MULTIPART_FORM_DATA_VALUE,
        produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<ReconciliationCompletedMessage> reconcile(
        @RequestPart(name = "offer", required = false) MultipartFile offer,
        @RequestPart(name = "invoices", required = false) List<MultipartFile> invoices) throws IOException {

        DocumentUpload offerUpload = toUpload(offer, "offer", "offer.pdf");
        if (invoices == null || invoices.isEmpty()) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST,
                "At least one invoice PDF must be provided as an 'invoices' part");
        }
        List<DocumentUpload> invoiceUploads = new ArrayList<>(invoices.size());
        for (int index = 0; index < invoices.size(); index++) {
            invoiceUploads.add(toUpload(invoices.get(index), "invoices", "invoice-" + (index + 1) + ".pdf"));
        }

        LOGGER.info("Reconciling offer '{}' against {} invoices", offerUpload.fileName(), invoiceUploads.size());
        return ResponseEntity.ok(reconciliationService.reconcile(offerUpload, invoiceUploads));
    }

    @PostMapping(path = "/documents/items", consumes = MediaType.MULTIPART_FORM_DATA_VALUE,
        produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<ExtractedItemsResponse> extractItems(
        @RequestPart(name = "file", required = false) MultipartFile file,
        @RequestParam(name = "method", required = false) String method) throws IOException {

        ExtractionMethod extractionMethod = resolveMethod(method);
        DocumentUpload upload = toUpload(file, "file", "document.pdf");
        List<LineItem> items = reconciliationService.extractItems(upload, extractionMethod);
        LOGGER.info("Extracted {} line items from '{}' using method {}", items.size(), upload.fileName(),
            extractionMethod.settingValue());
        return ResponseEntity.ok(new ExtractedItemsResponse(upload.fileName(), extractionMethod.settingValue(), items));
    }

    @GetMapping(path = "/settings", produces = MediaType.APPLICATION_JSON_VALUE)
    public SettingsResponse settings() {
        ReconciliationProperties properties = reconciliationService.properties();
        return new SettingsResponse(properties.priceTolerance(), properties.extractionMethod().settingValue());
    }

    @ExceptionHandler(IllegalArgumentException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Map<String, Object> handleIllegalArgument(IllegalArgumentException exception) {
        LOGGER.warn("Rejected reconciliation request: {}", exception.getMessage());
        return Map.of("error", String.valueOf(exception.getMessage()));
    }

    private ExtractionMethod resolveMethod(String method) {
        if (!StringUtils.hasText(method)) {
            return reconciliationService.properties().extractionMethod();
        }
        return ExtractionMethod.fromSetting(method)
            .orElseThrow(() -> new ResponseStatusException(HttpStatus.BAD_REQUEST,
                "Unknown extraction method: " + method));
    }

    private DocumentUpload toUpload(MultipartFile file, String partName, String fallbackName) throws IOException {
        if (file == null || file.isEmpty()) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST,
                "A non-empty PDF must be provided as the '" + partName + "' part");
        }
        if (!isPdf(file)) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST,
                "Only PDF uploads are supported");
        }
        return new DocumentUpload(determineFileName(file, fallbackName), file.getBytes());
    }

    private boolean isPdf(MultipartFile file) {
        String contentType = file.getContentType();
        if (StringUtils.hasText(contentType)) {
            String normalised = contentType.toLowerCase();
            if (normalised.startsWith(PDF_MIME_TYPE)) {
                return true;
            }
        }
        String name = file.getOriginalFilename();
        return name != null && name.toLowerCase().endsWith(".pdf");
    }

    private String determineFileName(MultipartFile file, String fallbackName) {
        String fileName = file.getOriginalFilename();
        if (StringUtils.hasText(fileName)) {
            return fileName;
        }
        return fallbackName;
    }

    public record ExtractedItemsResponse(String document, String method, List<LineItem> items) { }

    public record SettingsResponse(BigDecimal priceTolerance, String extractionMethod) { }
}
