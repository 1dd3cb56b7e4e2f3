package com.example.konvertor.domain.exception;

import java.util.List;

/**
 * Raised by document assembly when the normalized table lacks one or more accounting columns.
 */
public class MissingRequiredColumnsException extends DomainException {

    private final List<String> missingColumns;

	/**
	 * Creates the exception listing the absent columns and the headers that were present.
	 *
	 * @param missingColumns canonical labels of the missing columns
	 * @param presentHeaders folded header labels found in the table
	 */
    public MissingRequiredColumnsException(List<String> missingColumns, List<String> presentHeaders) {
        super("Missing columns in CSV: " + String.join(", ", missingColumns)
                + ". Present (normalized) headers: " + String.join(", ", presentHeaders));
        this.missingColumns = List.copyOf(missingColumns);
    }

    public List<String> missingColumns() {
        return missingColumns;
    }
}
