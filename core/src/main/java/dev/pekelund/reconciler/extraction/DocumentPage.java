package dev.pekelund.reconciler.extraction;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * One page of a document: the tables detected on it and its raw text.
 *
 * @param number 1-based page number
 * @param tables tables in reading order; each table is a list of rows, each row a list of cells
 * @param text   raw page text, empty when none could be read
 */
public record DocumentPage(int number, List<List<List<String>>> tables, String text) {

    public DocumentPage {
        if (tables == null) {
            tables = List.of();
        } else {
            List<List<List<String>>> copy = new ArrayList<>(tables.size());
            for (List<List<String>> table : tables) {
                copy.add(copyRows(table));
            }
            tables = List.copyOf(copy);
        }
        text = text == null ? "" : text;
    }

    public static DocumentPage textOnly(int number, String text) {
        return new DocumentPage(number, List.of(), text);
    }

    private static List<List<String>> copyRows(List<List<String>> table) {
        if (table == null) {
            return List.of();
        }
        List<List<String>> rows = new ArrayList<>(table.size());
        for (List<String> row : table) {
            // cells may be null for merged or blank cells
            rows.add(row == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(row)));
        }
        return Collections.unmodifiableList(rows);
    }
}
