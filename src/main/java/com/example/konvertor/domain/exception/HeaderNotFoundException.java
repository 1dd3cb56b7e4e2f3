package com.example.konvertor.domain.exception;

/**
 * Raised when no row of the input table looks like the accounting header
 * (a row naming the item, debit account and credit account columns).
 */
public class HeaderNotFoundException extends DomainException {

	/**
	 * Creates the exception with a message naming the labels that were searched for.
	 *
	 * @param expectedLabels header labels the locator required
	 */
    public HeaderNotFoundException(String expectedLabels) {
        super("Header row not found. Expected a row containing: " + expectedLabels);
    }
}
