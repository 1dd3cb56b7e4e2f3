package com.example.konvertor.application.service;

import com.example.konvertor.domain.model.CanonicalColumn;
import com.example.konvertor.domain.model.Cells;
import com.example.konvertor.domain.model.SummaryFoldState;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Removes subtotal rows from an accounting table and copies group names into the item rows that follow them.
 * <p>
 * Two row shapes are treated as summaries, both keyed on the activity column:
 * <ul>
 *   <li>group total: only the name cell and the activity cell are filled. The name is remembered.</li>
 *   <li>subtotal: only the activity cell is filled.</li>
 * </ul>
 * Every other row with an empty name receives the remembered group name; a row with its own name
 * forgets it.
 */
@Component
public class SummaryFolder {

    private static final Logger log = LoggerFactory.getLogger(SummaryFolder.class);

    /**
     * Finds the activity column, defaulting to the last header column.
     *
     * @param header header row
     * @return activity column index
     */
    public int activityColumn(List<String> header) {
        for (int i = 0; i < header.size(); i++) {
            if (CanonicalColumn.ACTIVITY.matches(header.get(i))) {
                return i;
            }
        }
        int fallback = header.isEmpty() ? 0 : header.size() - 1;
        log.warn("No activity column in header {}; using column {}.", header, fallback);
        return fallback;
    }

    /**
     * Folds the data rows of a table whose first row is the header.
     *
     * @param table          header row followed by data rows
     * @param activityColumn index of the activity column
     * @param state          fold state, updated in place
     * @return header followed by the surviving, possibly name-filled rows
     */
    public List<List<String>> fold(List<List<String>> table, int activityColumn, SummaryFoldState state) {
        if (table.isEmpty()) {
            return table;
        }
        List<List<String>> out = new ArrayList<>(table.size());
        out.add(table.get(0));

        for (List<String> row : table.subList(1, table.size())) {
            if (isGroupTotal(row, activityColumn)) {
                state.rememberGroupName(Cells.clean(Cells.get(row, 0)));
                state.recordRemoved();
                continue;
            }
            if (isSubtotal(row, activityColumn)) {
                state.recordRemoved();
                continue;
            }

            boolean named = !Cells.clean(Cells.get(row, 0)).isEmpty();
            List<String> emitted = row;
            if (!named && state.pendingGroupName().isPresent() && !row.isEmpty()) {
                emitted = new ArrayList<>(row);
                emitted.set(0, state.pendingGroupName().get());
                state.recordFilled();
            }
            if (named) {
                state.clearGroupName();
            }
            out.add(emitted);
        }
        return out;
    }

    /**
     * @return whether the row is either kind of summary row
     */
    public boolean isSummary(List<String> row, int activityColumn) {
        return isGroupTotal(row, activityColumn) || isSubtotal(row, activityColumn);
    }

    boolean isGroupTotal(List<String> row, int activityColumn) {
        Set<Integer> filled = filledColumns(row);
        return !filled.isEmpty() && filled.equals(new HashSet<>(List.of(0, activityColumn)));
    }

    boolean isSubtotal(List<String> row, int activityColumn) {
        Set<Integer> filled = filledColumns(row);
        return !filled.isEmpty() && filled.equals(Set.of(activityColumn));
    }

    private Set<Integer> filledColumns(List<String> row) {
        Set<Integer> filled = new HashSet<>();
        for (int i = 0; i < row.size(); i++) {
            if (!Cells.clean(row.get(i)).isEmpty()) {
                filled.add(i);
            }
        }
        return filled;
    }
}
