package com.meteoharvest.core.error;

import com.meteoharvest.core.model.RunStage;

public class FetchException extends IngestionException {
    public FetchException(String scope, String message) {
        super(scope, RunStage.FETCHING, message, null);
    }

    public FetchException(String scope, String message, Throwable cause) {
        super(scope, RunStage.FETCHING, message, cause);
    }
}
