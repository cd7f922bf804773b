package dev.pekelund.reconciler.extraction;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.Arrays;
import java.util.List;
import org.junit.jupiter.api.Test;

class HeaderColumnMappingTest {

    @Test
    void mapsConventionalHeader() {
        HeaderColumnMapping mapping = HeaderColumnMapping.fromHeader(
            List.of("Item Code", "Description", "Qty", "Unit Price", "Total"));

        assertThat(mapping.columnOf(ColumnRole.ITEM_CODE)).isEqualTo(0);
        assertThat(mapping.columnOf(ColumnRole.DESCRIPTION)).isEqualTo(1);
        assertThat(mapping.columnOf(ColumnRole.QUANTITY)).isEqualTo(2);
        assertThat(mapping.columnOf(ColumnRole.UNIT_PRICE)).isEqualTo(3);
        assertThat(mapping.columnOf(ColumnRole.TOTAL_PRICE)).isEqualTo(4);
    }

    @Test
    void mapsReorderedHeaderCaseInsensitively() {
        HeaderColumnMapping mapping = HeaderColumnMapping.fromHeader(
            List.of("QUANTITY", "Article No.", "product", "Price", "Sum"));

        assertThat(mapping.columnOf(ColumnRole.QUANTITY)).isEqualTo(0);
        assertThat(mapping.columnOf(ColumnRole.ITEM_CODE)).isEqualTo(1);
        assertThat(mapping.columnOf(ColumnRole.DESCRIPTION)).isEqualTo(2);
        assertThat(mapping.columnOf(ColumnRole.UNIT_PRICE)).isEqualTo(3);
        assertThat(mapping.columnOf(ColumnRole.TOTAL_PRICE)).isEqualTo(4);
    }

    @Test
    void firstColumnKeepsRoleWhenLaterHeaderMatchesSameRole() {
        HeaderColumnMapping mapping = HeaderColumnMapping.fromHeader(
            List.of("Item No", "Item Description", "Qty", "Price"));

        assertThat(mapping.columnOf(ColumnRole.ITEM_CODE)).isEqualTo(0);
        assertThat(mapping.isMatched(ColumnRole.DESCRIPTION)).isFalse();
        assertThat(mapping.columnOf(ColumnRole.DESCRIPTION)).isEqualTo(1);
    }

    @Test
    void headerCellTakesOnlyItsFirstMatchingRole() {
        HeaderColumnMapping mapping = HeaderColumnMapping.fromHeader(
            List.of("Code", "Desc", "Qty", "Unit Price", "Total Price"));

        assertThat(mapping.columnOf(ColumnRole.UNIT_PRICE)).isEqualTo(3);
        assertThat(mapping.isMatched(ColumnRole.TOTAL_PRICE)).isFalse();
        assertThat(mapping.columnOf(ColumnRole.TOTAL_PRICE)).isEqualTo(ColumnRole.TOTAL_PRICE.defaultPosition());
    }

    @Test
    void usesPositionalDefaultsForUnmatchedRoles() {
        HeaderColumnMapping mapping = HeaderColumnMapping.fromHeader(List.of("Article", "", "", ""));

        assertThat(mapping.isEmpty()).isFalse();
        assertThat(mapping.columnOf(ColumnRole.QUANTITY)).isEqualTo(2);
        assertThat(mapping.columnOf(ColumnRole.UNIT_PRICE)).isEqualTo(3);
    }

    @Test
    void headerWithoutKeywordsIsEmpty() {
        HeaderColumnMapping mapping = HeaderColumnMapping.fromHeader(List.of("Date", "Reference", "Notes"));

        assertThat(mapping.isEmpty()).isTrue();
    }

    @Test
    void toleratesNullCells() {
        HeaderColumnMapping mapping = HeaderColumnMapping.fromHeader(Arrays.asList(null, "Qty"));

        assertThat(mapping.matchedColumns()).containsOnlyKeys(ColumnRole.QUANTITY);
    }
}
