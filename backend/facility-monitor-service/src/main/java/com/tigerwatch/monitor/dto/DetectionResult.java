package com.tigerwatch.monitor.dto;

import java.util.Comparator;
import java.util.List;

/**
 * Per-image tiger detection outcome. Failures are represented as a negative
 * result carrying an error string, never as an exception.
 */
public record DetectionResult(
        boolean detected,
        List<Detection> detections,
        double confidence,
        String error
) {

    public DetectionResult {
        detections = detections != null ? List.copyOf(detections) : List.of();
    }

    public static DetectionResult of(List<Detection> detections) {
        if (detections == null || detections.isEmpty()) {
            return none();
        }
        double best = detections.stream()
                .max(Comparator.comparingDouble(Detection::confidence))
                .map(Detection::confidence)
                .orElse(0.0);
        return new DetectionResult(true, detections, best, null);
    }

    public static DetectionResult none() {
        return new DetectionResult(false, List.of(), 0.0, null);
    }

    public static DetectionResult failed(String error) {
        return new DetectionResult(false, List.of(), 0.0, error);
    }

    public boolean hasError() {
        return error != null;
    }
}
