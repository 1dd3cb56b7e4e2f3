package com.example.konvertor.domain.exception;

/**
 * Raised when a CSV path handed to the converter does not exist on disk.
 */
public class CsvNotFoundException extends DomainException {

	/**
	 * Creates the exception and records the missing path as part of the message.
	 *
	 * @param path absolute or relative path that could not be resolved
	 */
    public CsvNotFoundException(String path) {
        super("CSV not found: " + path);
    }
}
