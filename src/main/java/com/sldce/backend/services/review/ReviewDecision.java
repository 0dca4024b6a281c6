package com.sldce.backend.services.review;

import com.sldce.backend.entities.Sample;
import com.sldce.backend.entities.Suggestion;
import com.sldce.backend.enums.FeedbackAction;
import com.sldce.backend.exceptions.BadRequestException;

/**
 * A reviewer's verdict on a pending suggestion. A {@link Modify} always carries the label to apply.
 */
public interface ReviewDecision {

    FeedbackAction action();

    /**
     * Label recorded on the feedback row.
     */
    int finalLabel(Suggestion suggestion, Sample sample);

    default Integer customLabel() {
        return null;
    }

    static ReviewDecision of(FeedbackAction action, Integer customLabel) {
        if (action == null) {
            throw new BadRequestException("Review action is required");
        }
        switch (action) {
            case ACCEPT:
                return new Accept();
            case REJECT:
                return new Reject();
            case MODIFY:
                if (customLabel == null) {
                    throw new BadRequestException("customLabel is required when action is MODIFY");
                }
                return new Modify(customLabel);
            default:
                throw new BadRequestException("Unsupported review action " + action);
        }
    }

    record Accept() implements ReviewDecision {
        @Override
        public FeedbackAction action() {
            return FeedbackAction.ACCEPT;
        }

        @Override
        public int finalLabel(Suggestion suggestion, Sample sample) {
            return suggestion.getSuggestedLabel();
        }
    }

    record Reject() implements ReviewDecision {
        @Override
        public FeedbackAction action() {
            return FeedbackAction.REJECT;
        }

        // the label stays as it is
        @Override
        public int finalLabel(Suggestion suggestion, Sample sample) {
            return sample.getCurrentLabel();
        }
    }

    record Modify(Integer customLabel) implements ReviewDecision {
        public Modify {
            if (customLabel == null) {
                throw new BadRequestException("customLabel is required when action is MODIFY");
            }
        }

        @Override
        public FeedbackAction action() {
            return FeedbackAction.MODIFY;
        }

        @Override
        public int finalLabel(Suggestion suggestion, Sample sample) {
            return customLabel;
        }
    }
}
