package dev.pekelund.reconciler.items;

import java.math.BigDecimal;
import java.util.regex.Pattern;
import org.springframework.util.StringUtils;

/**
 * Parses free-form numeric text found in documents (currency symbols, thousands and decimal
 * separators in either European or English convention) into exact decimals.
 *
 * <p>Parsing never fails: anything that cannot be read becomes zero. Callers that need to tell
 * a printed zero apart from a missing value use {@link #normalize(String)} and check
 * {@link NormalizedNumber#lossy()}.
 */
public final class NumericNormalizer {

    private static final Pattern NON_NUMERIC = Pattern.compile("[^0-9.,\\-]");

    private NumericNormalizer() {
        // Utility class
    }

    public static BigDecimal parse(String text) {
        return normalize(text).value();
    }

    public static NormalizedNumber normalize(String text) {
        if (!StringUtils.hasText(text)) {
            return NormalizedNumber.ABSENT;
        }

        String cleaned = NON_NUMERIC.matcher(text).replaceAll("");
        if (cleaned.isEmpty()) {
            return NormalizedNumber.ABSENT;
        }

        int lastDot = cleaned.lastIndexOf('.');
        int lastComma = cleaned.lastIndexOf(',');
        if (lastDot >= 0 && lastComma >= 0) {
            // Whichever separator comes last is the decimal point
            if (lastComma > lastDot) {
                cleaned = cleaned.replace(".", "").replace(',', '.');
            } else {
                cleaned = cleaned.replace(",", "");
            }
        } else if (lastComma >= 0) {
            cleaned = cleaned.replace(',', '.');
        }

        try {
            return NormalizedNumber.of(new BigDecimal(cleaned));
        } catch (NumberFormatException ex) {
            return NormalizedNumber.ABSENT;
        }
    }
}
