package com.tigerwatch.monitor.exception;

public class DetectionException extends MonitorException {

    public DetectionException(String message) {
        super("DETECTION_ERROR", message);
    }

    public DetectionException(String message, Throwable cause) {
        super("DETECTION_ERROR", message, null, cause);
    }

    public static DetectionException modelFailed(Throwable cause) {
        return new DetectionException("Detection model call failed: " + describe(cause), cause);
    }

    public static DetectionException emptyImage() {
        return new DetectionException("Image payload is empty");
    }

    static String describe(Throwable cause) {
        return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
    }
}
