package com.example.konvertor.domain.model;

import java.util.ArrayList;
import java.util.List;

/**
 * Domain value holding a cleaned accounting table: the original header labels of the kept columns
 * followed by the data rows in their source order.
 */
public record NormalizedTable(
        List<String> header,
        List<List<String>> rows
) {

    public NormalizedTable {
        header = header == null ? List.of() : List.copyOf(header);
        List<List<String>> copies = new ArrayList<>();
        if (rows != null) {
            for (List<String> row : rows) {
                copies.add(List.copyOf(row));
            }
        }
        rows = List.copyOf(copies);
    }

	/**
	 * Splits a table whose first row is the header.
	 *
	 * @param table header row followed by data rows
	 * @return normalized table, empty when the input is empty
	 */
    public static NormalizedTable fromRows(List<List<String>> table) {
        if (table == null || table.isEmpty()) {
            return new NormalizedTable(List.of(), List.of());
        }
        return new NormalizedTable(table.get(0), table.subList(1, table.size()));
    }

	/**
	 * @return header followed by the data rows, as one list
	 */
    public List<List<String>> toRows() {
        if (header.isEmpty() && rows.isEmpty()) {
            return List.of();
        }
        List<List<String>> all = new ArrayList<>(rows.size() + 1);
        all.add(header);
        all.addAll(rows);
        return all;
    }

    public boolean isEmpty() {
        return rows.isEmpty();
    }
}
