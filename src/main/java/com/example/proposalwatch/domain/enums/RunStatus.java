package com.example.proposalwatch.domain.enums;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Outcome of a single fetch run.
 */
@Getter
@RequiredArgsConstructor
public enum RunStatus {

    /**
     * Refresh succeeded and at least one new proposal was found.
     */
    COMPLETED("completed", "Completed"),

    /**
     * Refresh succeeded, nothing new. Counts as a success.
     */
    NO_CHANGES("no-changes", "No Changes"),

    /**
     * Another run held the execution guard. No side effects.
     */
    SKIPPED_BUSY("skipped-busy", "Skipped (Busy)"),

    /**
     * The run window rejected the execution time.
     */
    OUTSIDE_WINDOW("outside-window", "Outside Window"),

    /**
     * The daily run budget was already used up.
     */
    BUDGET_EXHAUSTED("budget-exhausted", "Budget Exhausted"),

    /**
     * The bound schedule was deleted or disabled before the run started.
     */
    ABORTED("aborted", "Aborted"),

    /**
     * Refresh or last-check persistence failed.
     */
    FAILED("failed", "Failed");

    private final String code;
    private final String displayName;

    public static RunStatus fromCode(String code) {
        for (var status : values()) {
            if (status.getCode().equals(code)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown run status code: " + code);
    }

    /**
     * Whether the run actually executed the fetch and succeeded
     */
    public boolean isSuccess() {
        return this == COMPLETED || this == NO_CHANGES;
    }

    public boolean isFailure() {
        return this == FAILED;
    }

    /**
     * Whether the run reached the fetch at all. Only executed runs touch the budget and retry state.
     */
    public boolean isExecuted() {
        return isSuccess() || isFailure();
    }
}
