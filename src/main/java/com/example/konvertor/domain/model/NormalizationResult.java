package com.example.konvertor.domain.model;

/**
 * Normalized table together with the report describing how it was produced.
 */
public record NormalizationResult(
        NormalizedTable table,
        NormalizationReport report
) {
}
