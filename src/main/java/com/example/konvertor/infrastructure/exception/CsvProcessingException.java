package com.example.konvertor.infrastructure.exception;

/**
 * Infrastructure-layer exception that signals issues while reading or writing CSV content.
 */
public class CsvProcessingException extends InfrastructureException {
	/**
	 * Creates the exception with a contextual message and the root cause.
	 *
	 * @param message description shared with the application layer
	 * @param cause   low-level I/O or Commons CSV exception
	 */
    public CsvProcessingException(String message, Throwable cause) {
        super(message, cause);
    }
}
