package com.tigerwatch.monitor.exception;

public class ImageFetchException extends MonitorException {

    public ImageFetchException(String imageUrl, Throwable cause) {
        super("IMAGE_FETCH_ERROR", "Failed to fetch image " + imageUrl + ": "
                + DetectionException.describe(cause), null, cause);
    }

    public ImageFetchException(String imageUrl, String reason) {
        super("IMAGE_FETCH_ERROR", "Failed to fetch image " + imageUrl + ": " + reason);
    }
}
