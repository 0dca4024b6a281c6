package com.sldce.backend.enums;

public enum FeedbackAction {
    ACCEPT(SuggestionStatus.ACCEPTED),
    REJECT(SuggestionStatus.REJECTED),
    MODIFY(SuggestionStatus.MODIFIED);

    private final SuggestionStatus resultingStatus;

    FeedbackAction(SuggestionStatus resultingStatus) {
        this.resultingStatus = resultingStatus;
    }

    public SuggestionStatus getResultingStatus() {
        return resultingStatus;
    }

    /**
     * Accept and modify carry a label change; reject is kept only for analytics.
     */
    public boolean isCorrection() {
        return this != REJECT;
    }
}
