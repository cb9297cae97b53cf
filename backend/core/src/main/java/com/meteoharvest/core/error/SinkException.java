package com.meteoharvest.core.error;

import com.meteoharvest.core.model.RunStage;

public class SinkException extends IngestionException {
    public SinkException(String scope, String message, Throwable cause) {
        super(scope, RunStage.WRITING, message, cause);
    }
}
