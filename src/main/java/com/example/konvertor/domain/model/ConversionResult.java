package com.example.konvertor.domain.model;

/**
 * Domain DTO returned by a full conversion run: the normalization outcome, the assembled document and its XML.
 */
public record ConversionResult(
        String fileName,
        NormalizationResult normalization,
        AccountingDocument document,
        String xml
) {
}
