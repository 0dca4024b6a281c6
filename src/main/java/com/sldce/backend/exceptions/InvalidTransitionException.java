package com.sldce.backend.exceptions;

import com.sldce.backend.enums.SuggestionStatus;

/**
 * A suggestion may leave {@link SuggestionStatus#PENDING} exactly once.
 */
public class InvalidTransitionException extends BusinessException {

    private final Long suggestionId;
    private final SuggestionStatus currentStatus;

    public InvalidTransitionException(Long suggestionId, SuggestionStatus currentStatus) {
        super("Suggestion " + suggestionId + " has already been reviewed (status: " + currentStatus + ")");
        this.suggestionId = suggestionId;
        this.currentStatus = currentStatus;
    }

    public Long getSuggestionId() {
        return suggestionId;
    }

    public SuggestionStatus getCurrentStatus() {
        return currentStatus;
    }
}
