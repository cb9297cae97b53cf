package com.meteoharvest.core.model;

public enum RunStage {
    SETUP,
    FETCHING,
    NORMALIZING,
    WRITING
}
