package com.example.konvertor.application.service;

import com.example.konvertor.domain.exception.HeaderNotFoundException;
import com.example.konvertor.domain.model.CanonicalColumn;
import com.example.konvertor.domain.model.Cells;
import com.example.konvertor.domain.model.NormalizationReport;
import com.example.konvertor.domain.model.NormalizationResult;
import com.example.konvertor.domain.model.NormalizedTable;
import com.example.konvertor.domain.model.RawTable;
import com.example.konvertor.domain.model.SummaryFoldState;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;

/**
 * Application-layer service that turns a raw accounting export into a {@link NormalizedTable}.
 * <p>
 * Stages run in a fixed order and each returns a new list of rows:
 * locate header, project columns, strip spaces from numeric columns, drop blank rows,
 * cut the trailer, fold summary rows and finally drop rows with the excluded item name.
 */
@Service
public class TableNormalizationService {

    public static final String DEFAULT_TRAILER_MARKER = "Vypracoval:";
    public static final String DEFAULT_EXCLUDED_ITEM_NAME = "výplata v hotovosti";

    private static final Logger log = LoggerFactory.getLogger(TableNormalizationService.class);
    private static final String JOIN_DELIMITER = ";";
    private static final List<CanonicalColumn> NUMERIC_COLUMNS = Arrays.stream(CanonicalColumn.values())
            .filter(CanonicalColumn::isNumeric)
            .toList();

    private final SummaryFolder summaryFolder;
    private final String trailerMarker;
    private final String excludedItemName;

    /**
     * Creates the service.
     *
     * @param summaryFolder    folds summary rows into group names
     * @param trailerMarker    prefix of the first cell that starts the free-text trailer
     * @param excludedItemName item name (compared case-insensitively) whose rows are dropped
     */
    public TableNormalizationService(SummaryFolder summaryFolder,
                                     @Value("${konvertor.normalization.trailer-marker:" + DEFAULT_TRAILER_MARKER + "}") String trailerMarker,
                                     @Value("${konvertor.normalization.excluded-item-name:" + DEFAULT_EXCLUDED_ITEM_NAME + "}") String excludedItemName) {
        this.summaryFolder = summaryFolder;
        this.trailerMarker = trailerMarker;
        this.excludedItemName = Cells.clean(excludedItemName).toLowerCase(Locale.ROOT);
    }

    /**
     * Runs every normalization stage over the raw rows.
     *
     * @param raw rows read from the CSV file
     * @return normalized table and the counts collected on the way
     * @throws HeaderNotFoundException when no header row can be located
     */
    public NormalizationResult normalize(RawTable raw) {
        String charset = raw.charset() != null ? raw.charset().name() : null;

        int headerIndex = locateHeader(raw.rows());
        List<List<String>> rows = raw.rows().subList(headerIndex, raw.rows().size());
        rows = projectColumns(rows);
        List<String> keptColumns = List.copyOf(rows.get(0));
        rows = stripNumericSpaces(rows);
        rows = dropBlankRows(rows);

        int trailerIndex = findTrailer(rows);
        Integer trailerRow = null;
        if (trailerIndex >= 0) {
            rows = rows.subList(0, trailerIndex);
            trailerRow = trailerIndex + 1;
        }
        log.debug("Header at row {}, {} rows left before folding", headerIndex, rows.size());

        if (rows.isEmpty()) {
            log.info("No rows left after cleaning.");
            NormalizationReport report = new NormalizationReport(charset, raw.delimiter(), headerIndex, keptColumns,
                    trailerRow, 0, 0, false, 0, 0);
            return new NormalizationResult(NormalizedTable.fromRows(rows), report);
        }

        int activityColumn = summaryFolder.activityColumn(rows.get(0));
        SummaryFoldState state = new SummaryFoldState();
        rows = summaryFolder.fold(rows, activityColumn, state);

        boolean trailingRemoved = false;
        int removedSummaries = state.removedSummaries();
        if (rows.size() > 1 && summaryFolder.isSummary(rows.get(rows.size() - 1), activityColumn)) {
            rows = rows.subList(0, rows.size() - 1);
            trailingRemoved = true;
            removedSummaries++;
        }

        int beforeExclusion = rows.size();
        rows = excludeNamedRows(rows);
        int excluded = beforeExclusion - rows.size();
        if (excluded > 0) {
            log.info("Removed {} row(s) named '{}'", excluded, excludedItemName);
        }

        NormalizationReport report = new NormalizationReport(charset, raw.delimiter(), headerIndex, keptColumns,
                trailerRow, state.filledNames(), removedSummaries, trailingRemoved, excluded, rows.size());
        log.info("Normalized table: encoding={}, rows before header={}, filled names={}, removed summaries={}, rows={}",
                charset, headerIndex, state.filledNames(), removedSummaries, rows.size());
        return new NormalizationResult(NormalizedTable.fromRows(rows), report);
    }

    /**
     * Finds the header row. A row whose first cell is exactly the name label and which mentions both
     * account labels wins; only when no such row exists is any row mentioning all three labels accepted.
     *
     * @param rows raw rows
     * @return index of the header row
     * @throws HeaderNotFoundException when neither rule matches any row
     */
    public int locateHeader(List<List<String>> rows) {
        String name = CanonicalColumn.NAME.label();
        String debit = CanonicalColumn.DEBIT_ACCOUNT.label();
        String credit = CanonicalColumn.CREDIT_ACCOUNT.label();

        for (int i = 0; i < rows.size(); i++) {
            List<String> row = rows.get(i);
            String joined = String.join(JOIN_DELIMITER, row);
            if (!row.isEmpty() && Cells.clean(row.get(0)).equals(name)
                    && joined.contains(debit) && joined.contains(credit)) {
                return i;
            }
        }
        for (int i = 0; i < rows.size(); i++) {
            String joined = String.join(JOIN_DELIMITER, rows.get(i));
            if (joined.contains(name) && joined.contains(debit) && joined.contains(credit)) {
                log.warn("Header row {} matched only by the loose rule.", i);
                return i;
            }
        }
        throw new HeaderNotFoundException(String.join(", ", name, debit, credit));
    }

    /**
     * Keeps only the columns whose header names one of the six accounting columns, in source order.
     * When no header cell matches, the rows are returned untouched.
     *
     * @param rows header row followed by data rows
     * @return projected rows
     */
    public List<List<String>> projectColumns(List<List<String>> rows) {
        if (rows.isEmpty()) {
            return rows;
        }
        List<Integer> kept = new ArrayList<>();
        List<String> header = rows.get(0);
        for (int i = 0; i < header.size(); i++) {
            for (CanonicalColumn column : CanonicalColumn.values()) {
                if (column.matchesLoosely(header.get(i))) {
                    kept.add(i);
                    break;
                }
            }
        }
        if (kept.isEmpty()) {
            log.warn("No accounting columns recognized in header {}; keeping all columns.", header);
            return rows;
        }

        List<List<String>> projected = new ArrayList<>(rows.size());
        for (List<String> row : rows) {
            List<String> cells = new ArrayList<>(kept.size());
            for (int index : kept) {
                cells.add(Cells.get(row, index));
            }
            projected.add(cells);
        }
        return projected;
    }

    /**
     * Removes every space and non-breaking space from account, cost center, order and activity cells.
     *
     * @param rows header row followed by data rows; the header is not modified
     * @return cleaned rows
     */
    public List<List<String>> stripNumericSpaces(List<List<String>> rows) {
        if (rows.isEmpty()) {
            return rows;
        }
        List<String> header = rows.get(0);
        List<Integer> numeric = new ArrayList<>();
        for (int i = 0; i < header.size(); i++) {
            String cell = header.get(i);
            if (NUMERIC_COLUMNS.stream().anyMatch(column -> column.matches(cell))) {
                numeric.add(i);
            }
        }

        List<List<String>> cleaned = new ArrayList<>(rows.size());
        cleaned.add(header);
        for (List<String> row : rows.subList(1, rows.size())) {
            List<String> copy = new ArrayList<>(row);
            for (int index : numeric) {
                if (index < copy.size()) {
                    copy.set(index, copy.get(index).replace(Cells.NBSP, ' ').replace(" ", ""));
                }
            }
            cleaned.add(copy);
        }
        return cleaned;
    }

    public List<List<String>> dropBlankRows(List<List<String>> rows) {
        return rows.stream().filter(row -> !Cells.isBlank(row)).toList();
    }

    /**
     * @param rows rows to scan
     * @return index of the first row whose first cell starts with the trailer marker, or {@code -1}
     */
    public int findTrailer(List<List<String>> rows) {
        for (int i = 0; i < rows.size(); i++) {
            if (Cells.clean(Cells.get(rows.get(i), 0)).startsWith(trailerMarker)) {
                return i;
            }
        }
        return -1;
    }

    /**
     * Drops rows whose name cell equals the excluded item name, ignoring case.
     *
     * @param rows rows to filter
     * @return rows without the excluded items
     */
    public List<List<String>> excludeNamedRows(List<List<String>> rows) {
        return rows.stream()
                .filter(row -> !Cells.clean(Cells.get(row, 0)).toLowerCase(Locale.ROOT).equals(excludedItemName))
                .toList();
    }
}
