package com.meteoharvest.core.model;

public enum RunOutcome {
    SUCCESS,
    PARTIAL_FAILURE,
    TOTAL_FAILURE;

    public static RunOutcome fromCounts(int succeeded, int failed) {
        if (failed == 0 && succeeded > 0) {
            return SUCCESS;
        }
        if (succeeded > 0) {
            return PARTIAL_FAILURE;
        }
        return TOTAL_FAILURE;
    }
}
