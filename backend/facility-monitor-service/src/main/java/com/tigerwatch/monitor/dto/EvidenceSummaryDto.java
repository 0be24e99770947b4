package com.tigerwatch.monitor.dto;

import java.util.Map;

public record EvidenceSummaryDto(
        int totalEvidence,
        Map<String, Long> sourcesByType,
        double averageRelevance
) {
}
