package dev.pekelund.reconciler.extraction;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Column positions resolved from a table header row.
 */
public final class HeaderColumnMapping {

    private final Map<ColumnRole, Integer> matchedColumns;

    private HeaderColumnMapping(Map<ColumnRole, Integer> matchedColumns) {
        this.matchedColumns = Collections.unmodifiableMap(matchedColumns);
    }

    /**
     * Assigns roles to header cells. Each cell takes the first role (in {@link ColumnRole}
     * order) whose keywords it contains; a role that is already taken keeps its earlier column.
     */
    public static HeaderColumnMapping fromHeader(List<String> headerRow) {
        Map<ColumnRole, Integer> matched = new EnumMap<>(ColumnRole.class);
        if (headerRow != null) {
            for (int column = 0; column < headerRow.size(); column++) {
                String cell = headerRow.get(column);
                for (ColumnRole role : ColumnRole.values()) {
                    if (role.matchesHeader(cell)) {
                        matched.putIfAbsent(role, column);
                        break;
                    }
                }
            }
        }
        return new HeaderColumnMapping(matched);
    }

    /**
     * {@code true} when no header cell matched any role, i.e. the table is not an item table.
     */
    public boolean isEmpty() {
        return matchedColumns.isEmpty();
    }

    public boolean isMatched(ColumnRole role) {
        return matchedColumns.containsKey(role);
    }

    /**
     * Column of the given role, falling back to the role's positional default.
     */
    public int columnOf(ColumnRole role) {
        return matchedColumns.getOrDefault(role, role.defaultPosition());
    }

    public Map<ColumnRole, Integer> matchedColumns() {
        return matchedColumns;
    }

    @Override
    public String toString() {
        return "HeaderColumnMapping" + matchedColumns;
    }
}
