package dev.pekelund.reconciler.extraction;

import java.util.List;
import java.util.Locale;

/**
 * Semantic role of a table column, with the header keywords that identify it and the column
 * position assumed when no header cell matches.
 *
 * <p>Declaration order is the matching priority: a header cell takes the first role whose
 * keywords it contains.
 */
public enum ColumnRole {

    ITEM_CODE(0, "item", "code", "article"),
    DESCRIPTION(1, "desc", "description", "product"),
    QUANTITY(2, "qty", "quantity", "amount"),
    UNIT_PRICE(3, "price", "unit"),
    TOTAL_PRICE(4, "total", "sum");

    private final int defaultPosition;
    private final List<String> keywords;

    ColumnRole(int defaultPosition, String... keywords) {
        this.defaultPosition = defaultPosition;
        this.keywords = List.of(keywords);
    }

    public int defaultPosition() {
        return defaultPosition;
    }

    /**
     * Case-insensitive substring match of a header cell against this role's keywords.
     */
    public boolean matchesHeader(String headerCell) {
        if (headerCell == null) {
            return false;
        }
        String lower = headerCell.toLowerCase(Locale.ROOT);
        for (String keyword : keywords) {
            if (lower.contains(keyword)) {
                return true;
            }
        }
        return false;
    }
}
