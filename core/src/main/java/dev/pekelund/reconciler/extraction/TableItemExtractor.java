package dev.pekelund.reconciler.extraction;

import dev.pekelund.reconciler.items.LineItem;
import dev.pekelund.reconciler.items.NormalizedNumber;
import dev.pekelund.reconciler.items.NumericNormalizer;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.StringUtils;

/**
 * Maps the rows of a detected table to line items using the header row to locate columns.
 */
public class TableItemExtractor {

    private static final Logger LOGGER = LoggerFactory.getLogger(TableItemExtractor.class);

    public List<LineItem> extract(List<List<String>> table) {
        List<LineItem> items = new ArrayList<>();
        if (table == null || table.isEmpty()) {
            return items;
        }

        HeaderColumnMapping mapping = HeaderColumnMapping.fromHeader(table.get(0));
        if (mapping.isEmpty()) {
            LOGGER.debug("Skipping table without recognisable header: {}", table.get(0));
            return items;
        }
        LOGGER.debug("Resolved table columns {}", mapping);

        for (int index = 1; index < table.size(); index++) {
            List<String> row = table.get(index);
            Optional<LineItem> item = parseRow(row, mapping);
            if (item.isPresent()) {
                items.add(item.get());
            } else {
                LOGGER.debug("Skipping table row {}: {}", index, row);
            }
        }
        return items;
    }

    /**
     * Parses a single data row. Returns empty when the row has no item code or when its quantity
     * or unit price cell is missing or unreadable. A printed zero is kept.
     */
    Optional<LineItem> parseRow(List<String> row, HeaderColumnMapping mapping) {
        if (row == null || row.isEmpty()) {
            return Optional.empty();
        }

        String itemCode = cell(row, mapping.columnOf(ColumnRole.ITEM_CODE));
        if (!StringUtils.hasText(itemCode)) {
            return Optional.empty();
        }

        NormalizedNumber quantity = NumericNormalizer.normalize(cell(row, mapping.columnOf(ColumnRole.QUANTITY)));
        NormalizedNumber unitPrice = NumericNormalizer.normalize(cell(row, mapping.columnOf(ColumnRole.UNIT_PRICE)));
        if (quantity.lossy() || unitPrice.lossy()) {
            return Optional.empty();
        }

        NormalizedNumber total = NumericNormalizer.normalize(cell(row, mapping.columnOf(ColumnRole.TOTAL_PRICE)));
        String description = cell(row, mapping.columnOf(ColumnRole.DESCRIPTION));

        return Optional.of(new LineItem(
            itemCode,
            description,
            quantity.value(),
            unitPrice.value(),
            total.lossy() ? null : total.value()));
    }

    private static String cell(List<String> row, int column) {
        if (column < 0 || column >= row.size()) {
            return "";
        }
        String value = row.get(column);
        return value == null ? "" : value.replace('\u00A0', ' ').trim();
    }
}
