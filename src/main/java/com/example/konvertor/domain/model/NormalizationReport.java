package com.example.konvertor.domain.model;

import java.util.List;

/**
 * Informational counts collected while normalizing a table. Never used to fail a run.
 *
 * @param charset              name of the charset the input was decoded with
 * @param delimiter            field delimiter used to split the input
 * @param rowsBeforeHeader     preamble rows dropped in front of the header
 * @param keptColumns          header labels of the projected columns
 * @param trailerRow           1-based row number of the trailer marker after blank-row removal, or {@code null}
 * @param filledNames          data rows whose blank name was filled from a group-total row
 * @param removedSummaries     summary rows removed, including a trailing one
 * @param trailingSummaryRemoved whether the last row was removed as a leftover summary row
 * @param excludedRows         rows dropped because of the excluded item name
 * @param rowCount             rows in the result, header included
 */
public record NormalizationReport(
        String charset,
        char delimiter,
        int rowsBeforeHeader,
        List<String> keptColumns,
        Integer trailerRow,
        int filledNames,
        int removedSummaries,
        boolean trailingSummaryRemoved,
        int excludedRows,
        int rowCount
) {
}
