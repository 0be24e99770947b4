package com.tigerwatch.monitor.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * Facility ranked for crawling. Computed per cycle, never persisted.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FacilityPriority {
    private String facilityId;
    private String facilityName;
    private int priority;
    private LocalDateTime lastCrawledAt;
    private boolean reference;
    private boolean hasSocialMedia;
    private int tigerCount;
}
