package com.tigerwatch.monitor.service.evidence;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tigerwatch.monitor.config.MonitorProperties;
import com.tigerwatch.monitor.dto.DetectionResult;
import com.tigerwatch.monitor.dto.IdentificationResult;
import com.tigerwatch.monitor.dto.TigerMatch;
import com.tigerwatch.monitor.entity.Evidence;
import com.tigerwatch.monitor.entity.EvidenceSourceType;
import com.tigerwatch.monitor.entity.Facility;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.net.URI;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;

/**
 * Turns a positive detection into a scored {@link Evidence} record.
 *
 * 점수 계산 (기본 0.5, 가산 후 [0, 1] 범위로 제한):
 * - social_media +0.10, web_search +0.05
 * - .gov / .edu / .org 도메인 +0.10
 * - 기준(reference) 시설 +0.20
 * - 탐지 신뢰도 × 0.10, 개체 식별 성공 +0.10
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class EvidenceSynthesizer {

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private final MonitorProperties properties;
    private final ObjectMapper objectMapper;

    /**
     * Source reliability score, always within [0, 1].
     */
    public double score(String sourceUrl, EvidenceSourceType sourceType, boolean referenceFacility) {
        MonitorProperties.EvidenceScoring weights = properties.getEvidence();
        double score = weights.getBaseScore();

        if (sourceType == EvidenceSourceType.SOCIAL_MEDIA) {
            score += nonNegative(weights.getSocialMediaBonus());
        } else if (sourceType == EvidenceSourceType.WEB_SEARCH) {
            score += nonNegative(weights.getWebSearchBonus());
        }
        if (isTrustedDomain(sourceUrl)) {
            score += nonNegative(weights.getTrustedDomainBonus());
        }
        if (referenceFacility) {
            score += nonNegative(weights.getReferenceFacilityBonus());
        }
        return clamp(score);
    }

    /**
     * Builds (but does not persist) evidence for one image with a positive detection.
     *
     * @param pageUrl  page the image was found on; used for source scoring
     * @param imageUrl the image itself; stored as the evidence source URL
     */
    public Evidence createEvidence(Facility facility,
                                   String pageUrl,
                                   EvidenceSourceType sourceType,
                                   String imageUrl,
                                   DetectionResult detection,
                                   IdentificationResult identification) {
        if (imageUrl == null || imageUrl.isBlank()) {
            throw new IllegalArgumentException("Evidence requires a non-empty source url");
        }
        if (sourceType == null) {
            throw new IllegalArgumentException("Evidence requires a source type");
        }

        MonitorProperties.EvidenceScoring weights = properties.getEvidence();
        double relevance = score(pageUrl, sourceType, facility.isReference());
        relevance += nonNegative(weights.getDetectionConfidenceWeight()) * clamp(detection.confidence());
        boolean identified = identification != null && identification.identified();
        if (identified) {
            relevance += nonNegative(weights.getIdentifiedBonus());
        }

        Map<String, Object> content = new LinkedHashMap<>();
        content.put("image_url", imageUrl);
        content.put("source_url", pageUrl);
        content.put("facility_id", facility.getId());
        content.put("detection_result", objectMapper.convertValue(detection, MAP_TYPE));
        content.put("identification_result",
                identification != null ? objectMapper.convertValue(identification, MAP_TYPE) : null);

        return Evidence.builder()
                .id(UUID.randomUUID().toString())
                .facilityId(facility.getId())
                .sourceType(sourceType)
                .sourceUrl(imageUrl)
                .content(content)
                .extractedText(describe(pageUrl, identified ? identification.bestMatch() : null))
                .relevanceScore(clamp(relevance))
                .build();
    }

    private boolean isTrustedDomain(String url) {
        if (url == null || url.isBlank()) {
            return false;
        }
        String host;
        try {
            host = URI.create(url.trim()).getHost();
        } catch (IllegalArgumentException e) {
            return false;
        }
        if (host == null) {
            return false;
        }
        String lowerHost = host.toLowerCase(Locale.ROOT);
        return properties.getEvidence().getTrustedDomainSuffixes().stream()
                .anyMatch(suffix -> lowerHost.endsWith(suffix.toLowerCase(Locale.ROOT)));
    }

    private static String describe(String pageUrl, TigerMatch bestMatch) {
        String text = "Tiger image found on " + pageUrl;
        if (bestMatch == null) {
            return text;
        }
        String tiger = bestMatch.tigerName() != null ? bestMatch.tigerName() : bestMatch.tigerId();
        return String.format(Locale.ROOT, "%s (matched %s, similarity %.2f)", text, tiger, bestMatch.similarity());
    }

    private static double nonNegative(double weight) {
        return Math.max(0.0, weight);
    }

    private static double clamp(double value) {
        if (Double.isNaN(value)) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(1.0, value));
    }
}
