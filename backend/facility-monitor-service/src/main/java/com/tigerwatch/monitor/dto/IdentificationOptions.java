package com.tigerwatch.monitor.dto;

/**
 * Per-call identification settings. Passed explicitly on every call instead of
 * being set on the shared stage instance.
 *
 * @param modelName           re-identification model used to embed the image
 * @param similarityThreshold minimum cosine similarity for a gallery match
 * @param maxMatches          maximum number of ranked matches returned
 */
public record IdentificationOptions(String modelName, double similarityThreshold, int maxMatches) {

    public static final double DEFAULT_SIMILARITY_THRESHOLD = 0.8;
    public static final int DEFAULT_MAX_MATCHES = 5;

    public IdentificationOptions {
        if (similarityThreshold < 0 || similarityThreshold > 1) {
            throw new IllegalArgumentException("similarityThreshold must be within [0, 1]: " + similarityThreshold);
        }
        if (maxMatches < 1) {
            throw new IllegalArgumentException("maxMatches must be positive: " + maxMatches);
        }
    }

    public static IdentificationOptions defaults(String modelName) {
        return new IdentificationOptions(modelName, DEFAULT_SIMILARITY_THRESHOLD, DEFAULT_MAX_MATCHES);
    }

    public IdentificationOptions withModel(String otherModel) {
        return new IdentificationOptions(otherModel, similarityThreshold, maxMatches);
    }
}
