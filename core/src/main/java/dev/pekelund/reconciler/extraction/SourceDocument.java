package dev.pekelund.reconciler.extraction;

import java.util.List;

/**
 * Page-wise content of an offer or invoice document as handed to the extractor.
 *
 * @param name  display name of the document, usually the file name
 * @param pages pages in document order
 */
public record SourceDocument(String name, List<DocumentPage> pages) {

    public SourceDocument {
        pages = pages == null ? List.of() : List.copyOf(pages);
    }

    /**
     * Document that could not be opened or paged. Extracting it yields no items.
     */
    public static SourceDocument empty(String name) {
        return new SourceDocument(name, List.of());
    }

    public boolean isEmpty() {
        return pages.isEmpty();
    }
}
