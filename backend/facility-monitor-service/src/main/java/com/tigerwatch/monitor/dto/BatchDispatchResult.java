package com.tigerwatch.monitor.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BatchDispatchResult {

    @Builder.Default
    private List<ScheduledCrawl> scheduled = new ArrayList<>();

    @Builder.Default
    private List<FailedDispatch> failed = new ArrayList<>();

    public int getScheduledCount() {
        return scheduled.size();
    }

    public int getFailedCount() {
        return failed.size();
    }

    public List<String> failedFacilityIds() {
        return failed.stream().map(FailedDispatch::facilityId).toList();
    }

    public record ScheduledCrawl(String facilityId, String facilityName, String taskId) {
    }

    public record FailedDispatch(String facilityId, String error) {
    }
}
