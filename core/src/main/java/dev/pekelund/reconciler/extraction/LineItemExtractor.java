package dev.pekelund.reconciler.extraction;

import dev.pekelund.reconciler.items.LineItem;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Recovers line items from a document by running the table and text strategies page by page.
 *
 * <p>Both strategies see the same page, so an item printed in a table usually shows up twice.
 * Those duplicates are left in place; the reconciler folds repeated item codes together.
 * Extraction never fails for a whole document: a page that cannot be processed contributes
 * no items.
 */
public class LineItemExtractor {

    private static final Logger LOGGER = LoggerFactory.getLogger(LineItemExtractor.class);

    private final TableItemExtractor tableItemExtractor;
    private final TextPatternItemExtractor textPatternItemExtractor;

    public LineItemExtractor() {
        this(new TableItemExtractor(), new TextPatternItemExtractor());
    }

    public LineItemExtractor(TableItemExtractor tableItemExtractor, TextPatternItemExtractor textPatternItemExtractor) {
        this.tableItemExtractor = Objects.requireNonNull(tableItemExtractor, "tableItemExtractor");
        this.textPatternItemExtractor = Objects.requireNonNull(textPatternItemExtractor, "textPatternItemExtractor");
    }

    public List<LineItem> extract(SourceDocument document) {
        return extract(document, ExtractionMethod.DEFAULT);
    }

    public List<LineItem> extract(SourceDocument document, ExtractionMethod method) {
        List<LineItem> items = new ArrayList<>();
        if (document == null || document.isEmpty()) {
            LOGGER.info("Document {} has no readable pages; no items extracted",
                document != null ? document.name() : null);
            return items;
        }
        ExtractionMethod resolvedMethod = method != null ? method : ExtractionMethod.DEFAULT;

        for (DocumentPage page : document.pages()) {
            try {
                items.addAll(extractPage(page, resolvedMethod));
            } catch (RuntimeException ex) {
                LOGGER.warn("Skipping page {} of {} after extraction failure", page.number(), document.name(), ex);
            }
        }

        LOGGER.info("Extracted {} items from {} ({} pages, method {})", items.size(), document.name(),
            document.pages().size(), resolvedMethod.settingValue());
        return items;
    }

    private List<LineItem> extractPage(DocumentPage page, ExtractionMethod method) {
        List<LineItem> pageItems = new ArrayList<>();
        if (method.usesTables()) {
            for (List<List<String>> table : page.tables()) {
                pageItems.addAll(tableItemExtractor.extract(table));
            }
        }
        if (method.usesText()) {
            pageItems.addAll(textPatternItemExtractor.extract(page.text()));
        }
        LOGGER.debug("Page {} yielded {} items", page.number(), pageItems.size());
        return pageItems;
    }
}
