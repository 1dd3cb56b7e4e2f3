package com.example.konvertor.application.service;

import com.example.konvertor.domain.model.NormalizedTable;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Application-layer service that turns a normalized table back into semicolon-delimited CSV content.
 */
@Service
public class CsvExportService {

    static final char DELIMITER = ';';
    private static final String LINE_END = "\r\n";

	/**
	 * Builds the CSV output: the header row followed by every data row.
	 *
	 * @param table normalized table
	 * @return CSV document as a string, empty when the table has no header
	 */
    public String export(NormalizedTable table) {
        StringBuilder builder = new StringBuilder();
        for (List<String> row : table.toRows()) {
            for (int i = 0; i < row.size(); i++) {
                if (i > 0) {
                    builder.append(DELIMITER);
                }
                builder.append(escape(row.get(i)));
            }
            builder.append(LINE_END);
        }
        return builder.toString();
    }

	/**
	 * Escapes CSV values by quoting entries containing the delimiter, quotes, or line breaks.
	 *
	 * @param value raw column value
	 * @return sanitized CSV-safe token
	 */
    private String escape(String value) {
        if (value == null) {
            return "";
        }
        if (value.indexOf(DELIMITER) >= 0 || value.contains("\"") || value.contains("\n") || value.contains("\r")) {
            return "\"" + value.replace("\"", "\"\"") + "\"";
        }
        return value;
    }
}
