package com.example.konvertor.infrastructure.exception;

import java.util.List;

/**
 * Raised when none of the candidate charsets can decode the input bytes.
 */
public class EncodingUndetectableException extends InfrastructureException {

    /**
     * @param candidates charset names that were tried, in order
     */
    public EncodingUndetectableException(List<String> candidates) {
        super("Unable to detect the file encoding (tried " + String.join(", ", candidates) + ").");
    }
}
