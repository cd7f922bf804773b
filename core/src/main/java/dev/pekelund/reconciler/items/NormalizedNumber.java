package dev.pekelund.reconciler.items;

import java.math.BigDecimal;

/**
 * Outcome of normalising a numeric token.
 *
 * @param value the parsed value, zero when the token could not be read
 * @param lossy {@code true} when the token was absent or unparsable and {@code value} is a
 *              substituted zero rather than a zero read from the document
 */
public record NormalizedNumber(BigDecimal value, boolean lossy) {

    static final NormalizedNumber ABSENT = new NormalizedNumber(BigDecimal.ZERO, true);

    public static NormalizedNumber of(BigDecimal value) {
        return new NormalizedNumber(value, false);
    }
}
