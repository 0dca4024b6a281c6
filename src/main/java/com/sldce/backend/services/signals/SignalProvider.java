package com.sldce.backend.services.signals;

import com.sldce.backend.entities.Sample;
import com.sldce.backend.exceptions.UpstreamSignalException;

/**
 * Source of the two per-sample signals the detection engine fuses: a classifier that may disagree with the current
 * label and an anomaly detector.
 * <p>
 * Implementations report failures as {@link UpstreamSignalException}. Score range checks are left to the caller.
 */
public interface SignalProvider {

    /**
     * @return the classifier's label for the sample and its confidence that the current label is wrong
     */
    SignalPrediction predict(Sample sample);

    /**
     * @return how atypical the sample is, expected in [0, 1]
     */
    double anomalyScore(Sample sample);
}
