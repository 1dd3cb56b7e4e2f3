package com.example.konvertor.domain.exception;

/**
 * Raised when the client attempts to run a conversion without providing a CSV file.
 */
public class CsvFileRequiredException extends DomainException {

	/**
	 * Creates the exception with a user-friendly explanation.
	 */
    public CsvFileRequiredException() {
        super("Please choose a CSV file to convert.");
    }
}
