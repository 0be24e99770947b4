package com.tigerwatch.monitor.service.crawl;

/**
 * Lifecycle of one facility crawl: PENDING → RUNNING → COMPLETED | FAILED
 */
public enum CrawlJobState {
    PENDING,
    RUNNING,
    COMPLETED,
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }

    boolean canTransitionTo(CrawlJobState next) {
        return switch (this) {
            case PENDING -> next == RUNNING || next == FAILED;
            case RUNNING -> next == COMPLETED || next == FAILED;
            case COMPLETED, FAILED -> false;
        };
    }
}
