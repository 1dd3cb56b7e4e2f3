package com.example.konvertor.application.service;

import com.example.konvertor.domain.model.SummaryFoldState;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.example.konvertor.testing.Fixtures.HEADER;
import static com.example.konvertor.testing.Fixtures.row;
import static org.assertj.core.api.Assertions.assertThat;

class SummaryFolderTest {

    private static final List<String> SHORT_HEADER = row("Názov", "Účet MD", "Účet Dal", "Činn.");

    private final SummaryFolder folder = new SummaryFolder();

    @Test
    void groupTotalNameFillsFollowingBlankName() {
        SummaryFoldState state = new SummaryFoldState();
        List<List<String>> table = List.of(SHORT_HEADER, row("TOTAL_A", "", "", "500"), row("", "1", "2", "3"));

        List<List<String>> folded = folder.fold(table, 3, state);

        assertThat(folded).containsExactly(SHORT_HEADER, row("TOTAL_A", "1", "2", "3"));
        assertThat(state.filledNames()).isEqualTo(1);
        assertThat(state.removedSummaries()).isEqualTo(1);
    }

    /**
     * A row with only a name and an empty activity cell is an ordinary item row, not a group total.
     */
    @Test
    void nameWithoutActivityValueIsKeptUnfolded() {
        SummaryFoldState state = new SummaryFoldState();
        List<List<String>> table = List.of(SHORT_HEADER, row("TOTAL_A", "", "", ""), row("", "1", "2", "3"));

        List<List<String>> folded = folder.fold(table, 3, state);

        assertThat(folded).containsExactly(SHORT_HEADER, row("TOTAL_A", "", "", ""), row("", "1", "2", "3"));
        assertThat(state.filledNames()).isZero();
        assertThat(state.removedSummaries()).isZero();
        assertThat(state.pendingGroupName()).isEmpty();
    }

    @Test
    void groupTotalWithActivityValueIsRecognized() {
        SummaryFoldState state = new SummaryFoldState();
        List<List<String>> table = List.of(SHORT_HEADER, row("Mzdy", "", "", "500"), row("", "521", "331", "500"));

        assertThat(folder.fold(table, 3, state)).containsExactly(SHORT_HEADER, row("Mzdy", "521", "331", "500"));
        assertThat(state.pendingGroupName()).contains("Mzdy");
    }

    @Test
    void pendingNameFillsSeveralRowsAndSurvivesSubtotals() {
        SummaryFoldState state = new SummaryFoldState();
        List<List<String>> table = List.of(
                SHORT_HEADER,
                row("Mzdy", "", "", "300"),
                row("", "521", "331", "100"),
                row("", "", "", "100"),
                row("", "522", "331", "200"));

        List<List<String>> folded = folder.fold(table, 3, state);

        assertThat(folded).containsExactly(
                SHORT_HEADER,
                row("Mzdy", "521", "331", "100"),
                row("Mzdy", "522", "331", "200"));
        assertThat(state.filledNames()).isEqualTo(2);
        assertThat(state.removedSummaries()).isEqualTo(2);
    }

    @Test
    void namedRowClearsPendingName() {
        SummaryFoldState state = new SummaryFoldState();
        List<List<String>> table = List.of(
                SHORT_HEADER,
                row("Mzdy", "", "", "300"),
                row("Odvody", "524", "336", "50"),
                row("", "521", "331", "10"));

        List<List<String>> folded = folder.fold(table, 3, state);

        assertThat(folded.get(2)).containsExactly("", "521", "331", "10");
        assertThat(state.pendingGroupName()).isEmpty();
        assertThat(state.filledNames()).isZero();
    }

    @Test
    void trailingSubtotalIsDropped() {
        SummaryFoldState state = new SummaryFoldState();
        List<List<String>> table = List.of(
                SHORT_HEADER,
                row("Mzdy", "521", "331", "100"),
                row("", "", "", "100"));

        List<List<String>> folded = folder.fold(table, 3, state);

        assertThat(folded).hasSize(table.size() - 1);
        assertThat(folded).containsExactly(SHORT_HEADER, row("Mzdy", "521", "331", "100"));
    }

    @Test
    void rowsWithOtherShapesAreKept() {
        SummaryFoldState state = new SummaryFoldState();
        List<List<String>> table = List.of(SHORT_HEADER, row("Mzdy", "", "", ""), row("", "521", "", "100"));

        assertThat(folder.fold(table, 3, state)).isEqualTo(table);
        assertThat(state.removedSummaries()).isZero();
    }

    @Test
    void activityColumnIsFoundByHeaderOrDefaultsToLastColumn() {
        assertThat(folder.activityColumn(HEADER)).isEqualTo(5);
        assertThat(folder.activityColumn(row("Cinnost", "Názov"))).isZero();
        assertThat(folder.activityColumn(row("Názov", "Účet MD", "Suma"))).isEqualTo(2);
        assertThat(folder.activityColumn(List.of())).isZero();
    }

    /**
     * With the activity column at index 0 a row holding only a name counts as a group total.
     */
    @Test
    void activityAtFirstColumnTreatsLoneNameAsGroupTotal() {
        SummaryFoldState state = new SummaryFoldState();
        List<List<String>> table = List.of(row("Činn."), row("Skupina"), row(""));

        assertThat(folder.isSummary(row("Skupina"), 0)).isTrue();
        assertThat(folder.fold(table, 0, state)).containsExactly(row("Činn."), row("Skupina"));
        assertThat(state.removedSummaries()).isEqualTo(1);
        assertThat(state.filledNames()).isEqualTo(1);
    }

    @Test
    void isSummaryIgnoresNonBreakingSpaces() {
        assertThat(folder.isSummary(row("\u00a0", " ", "", "100"), 3)).isTrue();
        assertThat(folder.isSummary(row("", "", "", ""), 3)).isFalse();
    }
}
