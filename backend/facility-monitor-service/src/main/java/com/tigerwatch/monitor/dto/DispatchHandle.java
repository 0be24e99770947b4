package com.tigerwatch.monitor.dto;

import java.time.LocalDateTime;

/**
 * Returned immediately by dispatch; the crawl itself runs asynchronously.
 */
public record DispatchHandle(
        String facilityId,
        String taskId,
        String status,
        LocalDateTime dispatchedAt
) {

    public static DispatchHandle scheduled(String facilityId, String taskId) {
        return new DispatchHandle(facilityId, taskId, "scheduled", LocalDateTime.now());
    }
}
