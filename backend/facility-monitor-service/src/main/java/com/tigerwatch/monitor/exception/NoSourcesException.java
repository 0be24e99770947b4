package com.tigerwatch.monitor.exception;

/**
 * Facility has neither a website nor any social-media link, so there is nothing to crawl.
 */
public class NoSourcesException extends MonitorException {

    public NoSourcesException(String facilityId) {
        super("NO_SOURCES", "Facility has no social media links or website to crawl", facilityId);
    }
}
