package com.tigerwatch.monitor.exception;

public class IdentificationException extends MonitorException {

    public IdentificationException(String message) {
        super("IDENTIFICATION_ERROR", message);
    }

    public IdentificationException(String message, Throwable cause) {
        super("IDENTIFICATION_ERROR", message, null, cause);
    }

    public static IdentificationException embeddingFailed(Throwable cause) {
        return new IdentificationException("Embedding generation failed: " + DetectionException.describe(cause), cause);
    }

    public static IdentificationException gallerySearchFailed(Throwable cause) {
        return new IdentificationException("Gallery search failed: " + DetectionException.describe(cause), cause);
    }

    public static IdentificationException emptyEmbedding() {
        return new IdentificationException("Re-identification model returned an empty embedding");
    }
}
