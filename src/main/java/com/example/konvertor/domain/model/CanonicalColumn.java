package com.example.konvertor.domain.model;

import java.text.Normalizer;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * The six accounting columns the converter understands, in matching priority order.
 * Each column carries its canonical header label and the substrings recognized in folded header text.
 */
public enum CanonicalColumn {
    NAME("Názov", List.of("nazov"), List.of()),
    DEBIT_ACCOUNT("Účet MD", List.of("ucet md"), List.of("md")),
    CREDIT_ACCOUNT("Účet Dal", List.of("ucet dal"), List.of("dal")),
    COST_CENTER("Stred.", List.of("stred"), List.of()),
    ORDER("Zák.", List.of("zak"), List.of()),
    ACTIVITY("Činn.", List.of("cinn"), List.of());

    private static final Pattern COMBINING_MARKS = Pattern.compile("\\p{M}+");

    private final String label;
    private final List<String> patterns;
    private final List<String> abbreviations;

    CanonicalColumn(String label, List<String> patterns, List<String> abbreviations) {
        this.label = label;
        this.patterns = patterns;
        this.abbreviations = abbreviations;
    }

	/**
	 * @return header label as it appears in a well-formed export
	 */
    public String label() {
        return label;
    }

	/**
	 * Checks the folded header text against the full patterns of this column.
	 *
	 * @param headerCell raw header cell
	 * @return {@code true} when any pattern occurs in the folded text
	 */
    public boolean matches(String headerCell) {
        return containsAny(fold(headerCell), patterns);
    }

	/**
	 * Same as {@link #matches(String)} but also accepts the short abbreviations some exports use
	 * (for example a bare "MD" column). Only column projection is this tolerant.
	 *
	 * @param headerCell raw header cell
	 * @return {@code true} when any pattern or abbreviation occurs in the folded text
	 */
    public boolean matchesLoosely(String headerCell) {
        String folded = fold(headerCell);
        return containsAny(folded, patterns) || containsAny(folded, abbreviations);
    }

	/**
	 * @return whether spaces inside values of this column are thousands separators rather than text
	 */
    public boolean isNumeric() {
        return this != NAME;
    }

	/**
	 * Normalizes a header cell for matching: NBSP to space, trimmed, lower-cased, diacritics removed.
	 *
	 * @param value raw cell, may be {@code null}
	 * @return folded text, never {@code null}
	 */
    public static String fold(String value) {
        String cleaned = Cells.clean(value).toLowerCase(Locale.ROOT);
        return COMBINING_MARKS.matcher(Normalizer.normalize(cleaned, Normalizer.Form.NFD)).replaceAll("");
    }

    private static boolean containsAny(String folded, List<String> candidates) {
        for (String candidate : candidates) {
            if (folded.contains(candidate)) {
                return true;
            }
        }
        return false;
    }
}
