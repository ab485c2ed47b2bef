package com.supplychain.pipeline.persistence.entity;

import com.supplychain.pipeline.domain.ImpactType;
import com.supplychain.pipeline.domain.RiskCategory;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Persistent risk assessment, looked up by (region, sector, created_at).
 */
@Entity
@Table(name = "risk_assessments", indexes = {
    @Index(name = "idx_assessment_region_sector_created", columnList = "region, sector, created_at"),
    @Index(name = "idx_assessment_event_id", columnList = "event_id"),
    @Index(name = "idx_assessment_created_at", columnList = "created_at"),
    @Index(name = "idx_assessment_category", columnList = "risk_category")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RiskAssessmentEntity {

    @Id
    @Column(name = "assessment_id", nullable = false)
    private String assessmentId;

    @Column(name = "event_id", nullable = false)
    private String eventId;

    @Column(name = "region", nullable = false)
    private String region;

    @Column(name = "sector", nullable = false)
    private String sector;

    @Column(name = "risk_level", nullable = false)
    private double riskLevel;

    @Enumerated(EnumType.STRING)
    @Column(name = "risk_category", nullable = false)
    private RiskCategory riskCategory;

    @Enumerated(EnumType.STRING)
    @Column(name = "impact_type", nullable = false)
    private ImpactType impactType;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "risk_assessment_factors", joinColumns = @JoinColumn(name = "assessment_id"))
    @OrderColumn(name = "position")
    @Builder.Default
    private List<RiskFactorEmbeddable> riskFactors = new ArrayList<>();

    @ElementCollection(fetch = FetchType.LAZY)
    @CollectionTable(name = "risk_assessment_recommendations", joinColumns = @JoinColumn(name = "assessment_id"))
    @OrderColumn(name = "position")
    @Column(name = "recommendation", nullable = false, length = 500)
    @Builder.Default
    private List<String> recommendations = new ArrayList<>();

    @Column(name = "confidence_score", nullable = false)
    private double confidenceScore;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) {
            createdAt = Instant.now();
        }
    }
}
