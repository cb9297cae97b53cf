package com.meteoharvest.core.model;

public record StoredArtifact(String scope, String container, String path, long bytes) {
}
