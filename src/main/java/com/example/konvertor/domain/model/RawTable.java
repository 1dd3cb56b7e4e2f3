package com.example.konvertor.domain.model;

import java.nio.charset.Charset;
import java.util.List;

/**
 * Rows read from a delimited text file before any cleaning. Rows may have different lengths.
 */
public record RawTable(
        List<List<String>> rows,
        Charset charset,
        char delimiter
) {

    public RawTable {
        rows = rows == null ? List.of() : List.copyOf(rows);
    }
}
