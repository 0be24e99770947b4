package com.tigerwatch.monitor.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Summary returned by one facility crawl run.
 * {@code errors} is null when every source succeeded.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonInclude(JsonInclude.Include.ALWAYS)
public class CrawlJobReport {
    private String facilityId;
    private int imagesFound;
    private int tigersDetected;
    private int tigersIdentified;
    private int evidenceCreated;
    private int pagesCrawled;
    private long durationMs;
    private String status;
    private List<String> errors;

    public boolean isCompleted() {
        return "completed".equals(status);
    }

    public boolean hasErrors() {
        return errors != null && !errors.isEmpty();
    }
}
