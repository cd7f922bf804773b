package dev.pekelund.reconciler.extraction;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class ExtractionMethodTest {

    @Test
    void resolvesSettingValuesLeniently() {
        assertThat(ExtractionMethod.fromSetting("table-only")).contains(ExtractionMethod.TABLE_ONLY);
        assertThat(ExtractionMethod.fromSetting("TEXT_ONLY")).contains(ExtractionMethod.TEXT_ONLY);
        assertThat(ExtractionMethod.fromSetting(" Both ")).contains(ExtractionMethod.BOTH);
    }

    @Test
    void rejectsUnknownOrBlankValues() {
        assertThat(ExtractionMethod.fromSetting("ocr")).isEmpty();
        assertThat(ExtractionMethod.fromSetting("")).isEmpty();
        assertThat(ExtractionMethod.fromSetting(null)).isEmpty();
    }

    @Test
    void exposesStrategiesAndSettingValue() {
        assertThat(ExtractionMethod.TABLE_ONLY.usesTables()).isTrue();
        assertThat(ExtractionMethod.TABLE_ONLY.usesText()).isFalse();
        assertThat(ExtractionMethod.BOTH.usesText()).isTrue();
        assertThat(ExtractionMethod.TEXT_ONLY.settingValue()).isEqualTo("text-only");
        assertThat(ExtractionMethod.DEFAULT).isEqualTo(ExtractionMethod.BOTH);
    }
}
