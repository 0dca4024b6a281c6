package com.sldce.backend.enums;

public enum SuggestionStatus {
    PENDING("Pending review"),
    ACCEPTED("Accepted"),
    REJECTED("Rejected"),
    MODIFIED("Modified");

    private final String displayName;

    SuggestionStatus(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }

    public boolean isTerminal() {
        return this != PENDING;
    }
}
