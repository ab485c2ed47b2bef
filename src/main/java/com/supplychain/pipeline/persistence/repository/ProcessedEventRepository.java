package com.supplychain.pipeline.persistence.repository;

import com.supplychain.pipeline.persistence.entity.ProcessedEventEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;

@Repository
public interface ProcessedEventRepository extends JpaRepository<ProcessedEventEntity, String> {

    /**
     * Flips the processed flag only if it is still false.
     *
     * @return 1 for the caller that won, 0 otherwise
     */
    @Modifying
    @Query("UPDATE ProcessedEventEntity e SET e.processed = true, e.processedAt = :at WHERE e.eventId = :id AND e.processed = false")
    int markProcessed(@Param("id") String eventId, @Param("at") Instant at);

    @Query("SELECT e FROM ProcessedEventEntity e WHERE e.processed = true AND e.eventTimestamp >= :since ORDER BY e.eventTimestamp DESC")
    List<ProcessedEventEntity> findProcessedSince(@Param("since") Instant since);

    long countByProcessedFalse();
}
