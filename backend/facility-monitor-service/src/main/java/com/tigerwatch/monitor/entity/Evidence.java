package com.tigerwatch.monitor.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.LocalDateTime;
import java.util.Map;

/**
 * Scored evidence produced from a positive tiger detection.
 * Created by the synthesizer; other collaborators may annotate or verify it later.
 */
@Entity
@Table(name = "evidence", indexes = {
        @Index(name = "idx_evidence_investigation", columnList = "investigation_id"),
        @Index(name = "idx_evidence_facility", columnList = "facility_id"),
        @Index(name = "idx_evidence_source_type", columnList = "source_type")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Evidence {

    @Id
    @Column(name = "evidence_id", length = 36)
    private String id;

    @Column(name = "investigation_id", length = 36)
    private String investigationId;

    @Column(name = "facility_id", length = 36)
    private String facilityId;

    @Enumerated(EnumType.STRING)
    @Column(name = "source_type", nullable = false, length = 50)
    private EvidenceSourceType sourceType;

    @Column(name = "source_url", nullable = false, columnDefinition = "TEXT")
    private String sourceUrl;

    /**
     * Detection/identification payload and facility linkage
     */
    @JdbcTypeCode(SqlTypes.JSON)
    @Column(columnDefinition = "jsonb")
    private Map<String, Object> content;

    @Column(name = "extracted_text", columnDefinition = "TEXT")
    private String extractedText;

    /**
     * Relevance in [0, 1]
     */
    @Column(name = "relevance_score")
    private Double relevanceScore;

    @Column(nullable = false)
    @Builder.Default
    private Boolean verified = false;

    @CreationTimestamp
    @Column(name = "created_at", updatable = false)
    private LocalDateTime createdAt;
}
