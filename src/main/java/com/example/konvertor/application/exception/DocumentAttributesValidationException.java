package com.example.konvertor.application.exception;

import java.util.List;

/**
 * Thrown when a conversion that requires every document attribute is started with some of them blank.
 */
public class DocumentAttributesValidationException extends UseCaseValidationException {

	/**
	 * Creates a new exception naming the blank attributes.
	 *
	 * @param missingAttributes XML names of the attributes without a value
	 */
    public DocumentAttributesValidationException(List<String> missingAttributes) {
        super("Missing required document attributes: " + String.join(", ", missingAttributes));
    }
}
