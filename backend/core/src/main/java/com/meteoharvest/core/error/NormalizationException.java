package com.meteoharvest.core.error;

import com.meteoharvest.core.model.RunStage;

public class NormalizationException extends IngestionException {
    public NormalizationException(String scope, String message) {
        super(scope, RunStage.NORMALIZING, message, null);
    }

    public NormalizationException(String scope, String message, Throwable cause) {
        super(scope, RunStage.NORMALIZING, message, cause);
    }
}
