package com.example.konvertor.domain.model;

/**
 * Caller-supplied switches for a conversion run.
 *
 * @param delimiter            delimiter to force instead of sniffing, or {@code null}
 * @param keepEmptyAttributes  whether empty XML attributes are written; {@code null} uses the configured default
 * @param requireAllAttributes whether every document attribute must have a value
 */
public record ConversionOptions(
        Character delimiter,
        Boolean keepEmptyAttributes,
        boolean requireAllAttributes
) {

    public static ConversionOptions defaults() {
        return new ConversionOptions(null, null, false);
    }

    /**
     * Parses a delimiter supplied as text. {@code \t} and {@code tab} stand for a tab character.
     *
     * @param rawValue delimiter text, may be {@code null}
     * @return delimiter, or {@code null} when none was given
     */
    public static Character parseDelimiter(String rawValue) {
        if (rawValue == null || rawValue.isEmpty()) {
            return null;
        }
        if ("\\t".equals(rawValue) || "tab".equalsIgnoreCase(rawValue)) {
            return '\t';
        }
        return rawValue.charAt(0);
    }
}
