package com.meteoharvest.core.error;

import com.meteoharvest.core.model.RunStage;

public class SecretResolutionException extends IngestionException {
    public SecretResolutionException(String message) {
        super(BATCH_SCOPE, RunStage.SETUP, message, null);
    }

    public SecretResolutionException(String message, Throwable cause) {
        super(BATCH_SCOPE, RunStage.SETUP, message, cause);
    }
}
