package com.example.konvertor.domain.model;

import java.util.Optional;

/**
 * Mutable state threaded through a single summary-folding pass. Holds the group name remembered from the
 * last group-total row together with the counters reported after the pass.
 */
public final class SummaryFoldState {

    private String pendingGroupName;
    private int filledNames;
    private int removedSummaries;

    public Optional<String> pendingGroupName() {
        return Optional.ofNullable(pendingGroupName);
    }

    public void rememberGroupName(String groupName) {
        this.pendingGroupName = groupName;
    }

    public void clearGroupName() {
        this.pendingGroupName = null;
    }

    public void recordFilled() {
        filledNames++;
    }

    public void recordRemoved() {
        removedSummaries++;
    }

    public int filledNames() {
        return filledNames;
    }

    public int removedSummaries() {
        return removedSummaries;
    }
}
