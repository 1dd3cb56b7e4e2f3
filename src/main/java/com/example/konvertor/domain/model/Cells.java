package com.example.konvertor.domain.model;

import java.util.List;

/**
 * Helpers for reading cells out of ragged rows.
 */
public final class Cells {

    public static final char NBSP = '\u00a0';

    private Cells() {
    }

    /**
     * Replaces non-breaking spaces with ordinary spaces and trims the result.
     *
     * @param value raw cell, may be {@code null}
     * @return cleaned value, empty when the input is {@code null}
     */
    public static String clean(String value) {
        if (value == null) {
            return "";
        }
        return value.replace(NBSP, ' ').strip();
    }

    /**
     * Reads a cell by index, treating missing positions as empty.
     *
     * @param row   source row
     * @param index column index
     * @return raw cell value or an empty string
     */
    public static String get(List<String> row, int index) {
        if (row == null || index < 0 || index >= row.size() || row.get(index) == null) {
            return "";
        }
        return row.get(index);
    }

    public static boolean isBlank(List<String> row) {
        for (String cell : row) {
            if (!clean(cell).isEmpty()) {
                return false;
            }
        }
        return true;
    }
}
