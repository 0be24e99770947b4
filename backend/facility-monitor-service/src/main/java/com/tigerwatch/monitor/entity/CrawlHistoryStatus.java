package com.tigerwatch.monitor.entity;

/**
 * Terminal status of a facility crawl run
 */
public enum CrawlHistoryStatus {
    /**
     * Run finished; individual sources may still have failed (see error log)
     */
    COMPLETED("completed"),

    /**
     * Run aborted on a precondition such as a missing facility record
     */
    FAILED("failed");

    private final String value;

    CrawlHistoryStatus(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }
}
