package com.tigerwatch.monitor.dto;

import java.util.Comparator;
import java.util.List;

/**
 * Re-identification outcome. {@code matches} is ranked by similarity, best first.
 */
public record IdentificationResult(
        boolean identified,
        List<TigerMatch> matches,
        TigerMatch bestMatch,
        String model,
        String error
) {

    public IdentificationResult {
        matches = matches != null ? List.copyOf(matches) : List.of();
    }

    public static IdentificationResult of(List<TigerMatch> matches, String model) {
        if (matches == null || matches.isEmpty()) {
            return new IdentificationResult(false, List.of(), null, model, null);
        }
        List<TigerMatch> ranked = matches.stream()
                .sorted(Comparator.comparingDouble(TigerMatch::similarity).reversed())
                .toList();
        return new IdentificationResult(true, ranked, ranked.get(0), model, null);
    }

    public static IdentificationResult failed(String model, String error) {
        return new IdentificationResult(false, List.of(), null, model, error);
    }

    public boolean hasError() {
        return error != null;
    }
}
