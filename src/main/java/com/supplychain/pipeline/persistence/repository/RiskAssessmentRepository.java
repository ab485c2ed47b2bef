package com.supplychain.pipeline.persistence.repository;

import com.supplychain.pipeline.persistence.entity.RiskAssessmentEntity;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;

@Repository
public interface RiskAssessmentRepository extends JpaRepository<RiskAssessmentEntity, String> {

    List<RiskAssessmentEntity> findByEventId(String eventId);

    Page<RiskAssessmentEntity> findByRegionAndSectorOrderByCreatedAtDesc(String region, String sector, Pageable pageable);

    @Query("SELECT a FROM RiskAssessmentEntity a WHERE a.createdAt >= :since ORDER BY a.riskLevel DESC")
    List<RiskAssessmentEntity> findRecentAssessments(@Param("since") Instant since);
}
