package com.tigerwatch.monitor.service.evidence;

import com.tigerwatch.monitor.config.MonitorProperties;
import com.tigerwatch.monitor.dto.EvidenceSummaryDto;
import com.tigerwatch.monitor.entity.Evidence;
import com.tigerwatch.monitor.entity.EvidenceSourceType;
import com.tigerwatch.monitor.repository.EvidenceRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.YearMonth;
import java.util.*;
import java.util.stream.Collectors;

/**
 * Read-side views over evidence, used by reporting collaborators.
 */
@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class EvidenceGroupingService {

    static final String UNASSIGNED_FACILITY = "unassigned";

    private final EvidenceRepository evidenceRepository;
    private final MonitorProperties properties;

    public List<Evidence> forInvestigation(String investigationId) {
        return evidenceRepository.findByInvestigationId(investigationId);
    }

    public Map<String, List<Evidence>> groupByFacility(List<Evidence> evidence) {
        return evidence.stream().collect(Collectors.groupingBy(
                e -> e.getFacilityId() != null ? e.getFacilityId() : UNASSIGNED_FACILITY,
                LinkedHashMap::new,
                Collectors.toList()));
    }

    public Map<EvidenceSourceType, List<Evidence>> groupBySourceType(List<Evidence> evidence) {
        return evidence.stream().collect(Collectors.groupingBy(
                Evidence::getSourceType,
                () -> new EnumMap<>(EvidenceSourceType.class),
                Collectors.toList()));
    }

    /**
     * Months in chronological order. Evidence without a creation time is left out.
     */
    public SortedMap<YearMonth, List<Evidence>> groupByMonth(List<Evidence> evidence) {
        return evidence.stream()
                .filter(e -> e.getCreatedAt() != null)
                .collect(Collectors.groupingBy(
                        e -> YearMonth.from(e.getCreatedAt()),
                        TreeMap::new,
                        Collectors.toList()));
    }

    /**
     * Evidence scoring at or above the high-relevance threshold, best first.
     */
    public List<Evidence> highRelevance(List<Evidence> evidence) {
        double threshold = properties.getEvidence().getHighRelevanceThreshold();
        return evidence.stream()
                .filter(e -> relevanceOf(e) >= threshold)
                .sorted(Comparator.comparingDouble(EvidenceGroupingService::relevanceOf).reversed())
                .toList();
    }

    public EvidenceSummaryDto summarize(List<Evidence> evidence) {
        Map<String, Long> byType = new TreeMap<>();
        for (Evidence e : evidence) {
            String type = e.getSourceType() != null ? e.getSourceType().getValue() : "unknown";
            byType.merge(type, 1L, Long::sum);
        }
        double average = evidence.stream()
                .mapToDouble(EvidenceGroupingService::relevanceOf)
                .average()
                .orElse(0.0);
        return new EvidenceSummaryDto(evidence.size(), byType, average);
    }

    public EvidenceSummaryDto summarizeInvestigation(String investigationId) {
        return summarize(forInvestigation(investigationId));
    }

    private static double relevanceOf(Evidence e) {
        return e.getRelevanceScore() != null ? e.getRelevanceScore() : 0.0;
    }
}
