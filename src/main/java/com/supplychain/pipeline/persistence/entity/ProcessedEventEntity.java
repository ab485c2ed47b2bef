package com.supplychain.pipeline.persistence.entity;

import com.supplychain.pipeline.domain.EventType;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Persistent form of a processed event. {@code processed} is only set through the
 * conditional update in the repository.
 */
@Entity
@Table(name = "processed_events", indexes = {
    @Index(name = "idx_event_timestamp", columnList = "event_timestamp"),
    @Index(name = "idx_event_processed", columnList = "processed"),
    @Index(name = "idx_event_country", columnList = "country")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProcessedEventEntity {

    @Id
    @Column(name = "event_id", nullable = false)
    private String eventId;

    @Column(name = "title", nullable = false, length = 500)
    private String title;

    @Column(name = "description", columnDefinition = "TEXT")
    private String description;

    @Column(name = "source")
    private String source;

    @Column(name = "location_name")
    private String locationName;

    @Column(name = "country")
    private String country;

    @Column(name = "region")
    private String region;

    @Column(name = "latitude")
    private double latitude;

    @Column(name = "longitude")
    private double longitude;

    @Column(name = "location_resolved", nullable = false)
    private boolean locationResolved;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "processed_event_sectors", joinColumns = @JoinColumn(name = "event_id"))
    @OrderColumn(name = "position")
    @Column(name = "sector", nullable = false)
    @Builder.Default
    private List<String> impactSectors = new ArrayList<>();

    @Enumerated(EnumType.STRING)
    @Column(name = "event_type", nullable = false)
    private EventType eventType;

    @Column(name = "severity", nullable = false)
    private double severity;

    @Column(name = "severity_explicit", nullable = false)
    private boolean severityExplicit;

    @Column(name = "sectors_explicit", nullable = false)
    private boolean sectorsExplicit;

    @Column(name = "event_timestamp", nullable = false)
    private Instant eventTimestamp;

    @Column(name = "url", length = 2048)
    private String url;

    @Column(name = "quality_score", nullable = false)
    private double qualityScore;

    @Column(name = "data_quality_score", nullable = false)
    private double dataQualityScore;

    @Column(name = "processed", nullable = false)
    private boolean processed;

    @Column(name = "processed_at")
    private Instant processedAt;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @PrePersist
    protected void onCreate() {
        createdAt = Instant.now();
    }
}
