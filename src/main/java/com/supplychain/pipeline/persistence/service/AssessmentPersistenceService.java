package com.supplychain.pipeline.persistence.service;

import com.supplychain.pipeline.domain.Coordinates;
import com.supplychain.pipeline.domain.ProcessedEvent;
import com.supplychain.pipeline.domain.RiskAssessment;
import com.supplychain.pipeline.domain.RiskFactor;
import com.supplychain.pipeline.domain.StandardizedLocation;
import com.supplychain.pipeline.persistence.entity.ProcessedEventEntity;
import com.supplychain.pipeline.persistence.entity.RiskAssessmentEntity;
import com.supplychain.pipeline.persistence.entity.RiskFactorEmbeddable;
import com.supplychain.pipeline.persistence.repository.ProcessedEventRepository;
import com.supplychain.pipeline.persistence.repository.RiskAssessmentRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Writes processed events and their assessments to PostgreSQL. Failures propagate so
 * the sink writer can retry; the processed flag is only flipped by {@link #markProcessed}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AssessmentPersistenceService {

    private final ProcessedEventRepository eventRepository;
    private final RiskAssessmentRepository assessmentRepository;

    /**
     * Stores the event (unprocessed) and all of its assessments in one transaction.
     * Safe to call again for the same event after a partial failure.
     */
    @Transactional
    public void persist(ProcessedEvent event, List<RiskAssessment> assessments) {
        if (!eventRepository.existsById(event.getId())) {
            eventRepository.save(toEntity(event));
        }
        List<RiskAssessmentEntity> entities = assessments.stream()
                .map(AssessmentPersistenceService::toEntity)
                .collect(Collectors.toList());
        assessmentRepository.saveAll(entities);
        log.debug("Persisted event {} with {} assessments", event.getId(), entities.size());
    }

    /**
     * @return true if this call moved the stored event from unprocessed to processed
     */
    @Transactional
    public boolean markProcessed(String eventId) {
        int updated = eventRepository.markProcessed(eventId, Instant.now());
        if (updated == 0) {
            log.debug("Event {} was already marked processed or is not stored", eventId);
        }
        return updated == 1;
    }

    /**
     * Processed events whose event time is at or after {@code since}, newest first.
     */
    @Transactional(readOnly = true)
    public List<ProcessedEvent> findProcessedSince(Instant since) {
        return eventRepository.findProcessedSince(since).stream()
                .map(AssessmentPersistenceService::toDomain)
                .collect(Collectors.toList());
    }

    /**
     * Assessments created at or after {@code since}, highest risk first.
     */
    @Transactional(readOnly = true)
    public List<RiskAssessment> findRecentAssessments(Instant since) {
        return assessmentRepository.findRecentAssessments(since).stream()
                .map(AssessmentPersistenceService::toDomain)
                .collect(Collectors.toList());
    }

    @Transactional(readOnly = true)
    public Optional<RiskAssessment> findLatestAssessment(String region, String sector) {
        return assessmentRepository.findByRegionAndSectorOrderByCreatedAtDesc(region, sector, PageRequest.of(0, 1))
                .stream()
                .findFirst()
                .map(AssessmentPersistenceService::toDomain);
    }

    @Transactional(readOnly = true)
    public List<RiskAssessment> findAssessmentsForEvent(String eventId) {
        return assessmentRepository.findByEventId(eventId).stream()
                .map(AssessmentPersistenceService::toDomain)
                .collect(Collectors.toList());
    }

    /** Stored events whose sinks have not all completed. */
    @Transactional(readOnly = true)
    public long countUnprocessed() {
        return eventRepository.countByProcessedFalse();
    }

    static ProcessedEventEntity toEntity(ProcessedEvent event) {
        StandardizedLocation location = event.getLocationStandardized();
        Coordinates coordinates = location != null && location.getCoordinates() != null
                ? location.getCoordinates() : Coordinates.UNKNOWN;
        return ProcessedEventEntity.builder()
                .eventId(event.getId())
                .title(event.getTitle())
                .description(event.getDescription())
                .source(event.getSource())
                .locationName(location != null ? location.getStandardName() : null)
                .country(location != null ? location.getCountry() : null)
                .region(location != null ? location.getRegion() : null)
                .latitude(coordinates.getLat())
                .longitude(coordinates.getLon())
                .locationResolved(location != null && location.isResolved())
                .impactSectors(new ArrayList<>(event.getImpactSectors()))
                .eventType(event.getEventType())
                .severity(event.getSeverity())
                .severityExplicit(event.isSeverityExplicit())
                .sectorsExplicit(event.isSectorsExplicit())
                .eventTimestamp(event.getTimestamp())
                .url(event.getUrl())
                .qualityScore(event.getQualityScore())
                .dataQualityScore(event.getDataQualityScore())
                .processed(false)
                .build();
    }

    static RiskAssessmentEntity toEntity(RiskAssessment assessment) {
        List<RiskFactorEmbeddable> factors = assessment.getRiskFactors() == null ? new ArrayList<>()
                : assessment.getRiskFactors().stream()
                        .map(f -> new RiskFactorEmbeddable(f.getType(), f.getDescription(), f.getSeverity()))
                        .collect(Collectors.toCollection(ArrayList::new));
        List<String> recommendations = assessment.getRecommendations() == null
                ? new ArrayList<>() : new ArrayList<>(assessment.getRecommendations());
        return RiskAssessmentEntity.builder()
                .assessmentId(assessment.getId())
                .eventId(assessment.getEventId())
                .region(assessment.getRegion())
                .sector(assessment.getSector())
                .riskLevel(assessment.getRiskLevel())
                .riskCategory(assessment.getRiskCategory())
                .impactType(assessment.getImpactType())
                .riskFactors(factors)
                .recommendations(recommendations)
                .confidenceScore(assessment.getConfidenceScore())
                .createdAt(assessment.getCreatedAt())
                .build();
    }

    static ProcessedEvent toDomain(ProcessedEventEntity entity) {
        StandardizedLocation location = StandardizedLocation.builder()
                .standardName(entity.getLocationName())
                .country(entity.getCountry())
                .region(entity.getRegion())
                .coordinates(new Coordinates(entity.getLatitude(), entity.getLongitude()))
                .resolved(entity.isLocationResolved())
                .build();
        ProcessedEvent event = ProcessedEvent.builder()
                .id(entity.getEventId())
                .title(entity.getTitle())
                .description(entity.getDescription())
                .source(entity.getSource())
                .locationStandardized(location)
                .impactSectors(List.copyOf(entity.getImpactSectors()))
                .eventType(entity.getEventType())
                .severity(entity.getSeverity())
                .severityExplicit(entity.isSeverityExplicit())
                .sectorsExplicit(entity.isSectorsExplicit())
                .timestamp(entity.getEventTimestamp())
                .url(entity.getUrl())
                .qualityScore(entity.getQualityScore())
                .dataQualityScore(entity.getDataQualityScore())
                .warnings(Set.of())
                .processedAt(entity.getProcessedAt())
                .build();
        if (entity.isProcessed()) {
            event.markProcessed();
        }
        return event;
    }

    static RiskAssessment toDomain(RiskAssessmentEntity entity) {
        List<RiskFactor> factors = entity.getRiskFactors().stream()
                .map(f -> RiskFactor.builder()
                        .type(f.getType())
                        .description(f.getDescription())
                        .severity(f.getSeverity())
                        .build())
                .collect(Collectors.toList());
        return RiskAssessment.builder()
                .id(entity.getAssessmentId())
                .eventId(entity.getEventId())
                .region(entity.getRegion())
                .sector(entity.getSector())
                .riskLevel(entity.getRiskLevel())
                .riskCategory(entity.getRiskCategory())
                .impactType(entity.getImpactType())
                .riskFactors(List.copyOf(factors))
                .recommendations(List.copyOf(entity.getRecommendations()))
                .confidenceScore(entity.getConfidenceScore())
                .createdAt(entity.getCreatedAt())
                .build();
    }
}
