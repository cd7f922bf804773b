package dev.pekelund.reconciler.extraction;

import dev.pekelund.reconciler.items.LineItem;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Fallback that scans raw page text for lines shaped like
 * {@code <CODE> <DESCRIPTION> <QUANTITY> <UNIT_PRICE>}.
 *
 * <p>This is a single pattern tuned to one document layout, not a general parser. Vendor
 * layouts that print the total before the unit price, use decimal commas or wrap descriptions
 * over several lines are not recognised.
 */
public class TextPatternItemExtractor {

    private static final Logger LOGGER = LoggerFactory.getLogger(TextPatternItemExtractor.class);

    static final Pattern ITEM_LINE_PATTERN = Pattern.compile(
        "(?<code>[A-Z0-9-]+)[ \\t]+"
            + "(?<description>[^0-9\\r\\n]+)[ \\t]+"
            + "(?<quantity>\\d+(?:\\.\\d+)?)[ \\t]+"
            + "(?<unitPrice>\\d+(?:\\.\\d+)?)"
    );

    public List<LineItem> extract(String text) {
        List<LineItem> items = new ArrayList<>();
        if (text == null || text.isBlank()) {
            return items;
        }

        Matcher matcher = ITEM_LINE_PATTERN.matcher(text.replace('\u00A0', ' '));
        while (matcher.find()) {
            String description = matcher.group("description").trim();
            BigDecimal quantity = new BigDecimal(matcher.group("quantity"));
            BigDecimal unitPrice = new BigDecimal(matcher.group("unitPrice"));
            LineItem item = LineItem.withDerivedTotal(matcher.group("code"), description, quantity, unitPrice);
            LOGGER.debug("Matched item line '{}'", matcher.group());
            items.add(item);
        }
        return items;
    }
}
