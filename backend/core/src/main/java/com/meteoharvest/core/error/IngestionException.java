package com.meteoharvest.core.error;

import com.meteoharvest.core.model.RunStage;

/**
 * Base of every failure an ingestion run can report. {@code scope} is a location id, or
 * {@link #BATCH_SCOPE} when the failure covers the whole run.
 */
public class IngestionException extends RuntimeException {
    public static final String BATCH_SCOPE = "batch";

    private final String scope;
    private final RunStage stage;

    public IngestionException(String scope, RunStage stage, String message, Throwable cause) {
        super(message, cause);
        this.scope = scope == null ? BATCH_SCOPE : scope;
        this.stage = stage;
    }

    public String scope() {
        return scope;
    }

    public RunStage stage() {
        return stage;
    }

    /**
     * Innermost message of the cause chain, falling back to the exception type name.
     */
    public String rootMessage() {
        Throwable root = this;
        while (root.getCause() != null) {
            root = root.getCause();
        }
        if (root == this) {
            return getMessage();
        }
        String rootMessage = root.getMessage() == null ? root.getClass().getSimpleName() : root.getMessage();
        return getMessage() + ": " + rootMessage;
    }
}
