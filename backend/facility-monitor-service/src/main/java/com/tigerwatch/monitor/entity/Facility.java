package com.tigerwatch.monitor.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.annotations.UpdateTimestamp;
import org.hibernate.type.SqlTypes;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Captive-wildlife facility (exhibitor) monitored by the crawl pipeline.
 *
 * Only {@code lastCrawledAt} is written by this service; every other attribute is
 * maintained by facility-management collaborators.
 */
@Entity
@Table(name = "facilities", indexes = {
        @Index(name = "idx_facilities_name", columnList = "exhibitor_name"),
        @Index(name = "idx_facilities_reference", columnList = "is_reference_facility"),
        @Index(name = "idx_facilities_last_crawled", columnList = "last_crawled_at")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Facility {

    @Id
    @Column(name = "facility_id", length = 36)
    private String id;

    @Column(name = "exhibitor_name", nullable = false)
    private String name;

    @Column(length = 50)
    private String state;

    @Column(length = 500)
    private String website;

    /**
     * Platform name to profile URL, in configured crawl order.
     * Stored as {@code json} rather than {@code jsonb} so key order is preserved.
     */
    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "social_media_links", columnDefinition = "json")
    @Builder.Default
    private Map<String, String> socialMediaLinks = new LinkedHashMap<>();

    @Column(name = "tiger_count")
    @Builder.Default
    private Integer tigerCount = 0;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "violation_history", columnDefinition = "jsonb")
    @Builder.Default
    private List<Map<String, Object>> violationHistory = new ArrayList<>();

    @Column(name = "is_reference_facility", nullable = false)
    @Builder.Default
    private Boolean referenceFacility = false;

    @Column(name = "last_crawled_at")
    private LocalDateTime lastCrawledAt;

    @CreationTimestamp
    @Column(name = "created_at", updatable = false)
    private LocalDateTime createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at")
    private LocalDateTime updatedAt;

    // ========================================
    // 유틸리티 메서드
    // ========================================

    public boolean isReference() {
        return Boolean.TRUE.equals(referenceFacility);
    }

    public int knownTigerCount() {
        return tigerCount != null ? Math.max(0, tigerCount) : 0;
    }

    public int violationCount() {
        return violationHistory != null ? violationHistory.size() : 0;
    }

    public int socialMediaSourceCount() {
        if (socialMediaLinks == null) return 0;
        return (int) socialMediaLinks.values().stream()
                .filter(url -> url != null && !url.isBlank())
                .count();
    }

    public boolean hasWebsite() {
        return website != null && !website.isBlank();
    }

    /**
     * A facility is dispatchable only when it has at least one crawl target.
     */
    public boolean hasCrawlSources() {
        return hasWebsite() || socialMediaSourceCount() > 0;
    }
}
