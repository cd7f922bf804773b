package dev.pekelund.reconciler.extraction;

import java.util.Locale;
import java.util.Optional;

/**
 * Which extraction strategies run over a document.
 */
public enum ExtractionMethod {

    TABLE_ONLY(true, false),
    TEXT_ONLY(false, true),
    BOTH(true, true);

    public static final ExtractionMethod DEFAULT = BOTH;

    private final boolean tables;
    private final boolean text;

    ExtractionMethod(boolean tables, boolean text) {
        this.tables = tables;
        this.text = text;
    }

    public boolean usesTables() {
        return tables;
    }

    public boolean usesText() {
        return text;
    }

    /**
     * Resolves a configured value such as {@code table-only}, {@code TEXT_ONLY} or {@code both}.
     */
    public static Optional<ExtractionMethod> fromSetting(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        String normalised = value.trim().replace('-', '_').toUpperCase(Locale.ROOT);
        for (ExtractionMethod method : values()) {
            if (method.name().equals(normalised)) {
                return Optional.of(method);
            }
        }
        return Optional.empty();
    }

    public String settingValue() {
        return name().toLowerCase(Locale.ROOT).replace('_', '-');
    }
}
