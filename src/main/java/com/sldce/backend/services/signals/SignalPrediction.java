package com.sldce.backend.services.signals;

public record SignalPrediction(int predictedLabel, double confidence) {
}
