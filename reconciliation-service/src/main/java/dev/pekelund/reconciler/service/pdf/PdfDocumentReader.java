package dev.pekelund.reconciler.service.pdf;

import dev.pekelund.reconciler.extraction.DocumentPage;
import dev.pekelund.reconciler.extraction.SourceDocument;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.text.PDFTextStripper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import technology.tabula.ObjectExtractor;
import technology.tabula.Page;
import technology.tabula.RectangularTextContainer;
import technology.tabula.Table;
import technology.tabula.extractors.SpreadsheetExtractionAlgorithm;

/**
 * Reads a PDF into the page model consumed by the line item extractor: the raw text of every
 * page (PDFBox) and the ruled tables detected on it (Tabula lattice mode).
 *
 * <p>A document that cannot be opened is reported as an empty document rather than an error,
 * so that a broken upload turns into missing or extra items instead of a failed run.
 */
public class PdfDocumentReader {

    private static final Logger LOGGER = LoggerFactory.getLogger(PdfDocumentReader.class);

    private final SpreadsheetExtractionAlgorithm tableAlgorithm;

    public PdfDocumentReader() {
        this(new SpreadsheetExtractionAlgorithm());
    }

    PdfDocumentReader(SpreadsheetExtractionAlgorithm tableAlgorithm) {
        this.tableAlgorithm = tableAlgorithm;
    }

    public SourceDocument read(byte[] pdfBytes, String fileName) {
        LOGGER.info("PdfDocumentReader invoked for file {} with payload size {}", fileName,
            pdfBytes != null ? pdfBytes.length : null);
        if (pdfBytes == null || pdfBytes.length == 0) {
            LOGGER.warn("Document {} is empty; treating it as having no pages", fileName);
            return SourceDocument.empty(fileName);
        }

        try (PDDocument document = PDDocument.load(new ByteArrayInputStream(pdfBytes))) {
            int pageCount = document.getNumberOfPages();
            PDFTextStripper stripper = new PDFTextStripper();
            ObjectExtractor objectExtractor = new ObjectExtractor(document);

            List<DocumentPage> pages = new ArrayList<>(pageCount);
            for (int pageNumber = 1; pageNumber <= pageCount; pageNumber++) {
                String text = readText(stripper, document, pageNumber, fileName);
                List<List<List<String>>> tables = readTables(objectExtractor, pageNumber, fileName);
                pages.add(new DocumentPage(pageNumber, tables, text));
            }
            LOGGER.info("Read {} pages from {}", pages.size(), fileName);
            return new SourceDocument(fileName, pages);
        } catch (IOException | RuntimeException ex) {
            LOGGER.warn("Unable to read PDF document {}; treating it as having no pages", fileName, ex);
            return SourceDocument.empty(fileName);
        }
    }

    private String readText(PDFTextStripper stripper, PDDocument document, int pageNumber, String fileName) {
        try {
            stripper.setStartPage(pageNumber);
            stripper.setEndPage(pageNumber);
            return stripper.getText(document);
        } catch (IOException | RuntimeException ex) {
            LOGGER.warn("Text extraction failed on page {} of {}; continuing with its tables only", pageNumber,
                fileName, ex);
            return "";
        }
    }

    private List<List<List<String>>> readTables(ObjectExtractor objectExtractor, int pageNumber, String fileName) {
        try {
            Page page = objectExtractor.extract(pageNumber);
            List<? extends Table> detected = tableAlgorithm.extract(page);
            List<List<List<String>>> tables = new ArrayList<>(detected.size());
            for (Table table : detected) {
                tables.add(toRows(table));
            }
            LOGGER.debug("Detected {} ruled tables on page {} of {}", tables.size(), pageNumber, fileName);
            return tables;
        } catch (RuntimeException ex) {
            LOGGER.warn("Table detection failed on page {} of {}; continuing with page text only", pageNumber,
                fileName, ex);
            return List.of();
        }
    }

    @SuppressWarnings("rawtypes")
    private List<List<String>> toRows(Table table) {
        List<List<String>> rows = new ArrayList<>();
        for (List<RectangularTextContainer> row : table.getRows()) {
            List<String> cells = new ArrayList<>(row.size());
            for (RectangularTextContainer cell : row) {
                String text = cell.getText();
                cells.add(text == null ? "" : text.replace('\r', ' ').replace('\n', ' ').trim());
            }
            rows.add(cells);
        }
        return rows;
    }
}
