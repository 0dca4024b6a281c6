package com.sldce.backend.enums;

public enum ExperimentStatus {
    RUNNING("Running"),
    COMPLETED("Completed");

    private final String displayName;

    ExperimentStatus(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }
}
