package com.tigerwatch.monitor.repository;

import com.tigerwatch.monitor.entity.Evidence;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface EvidenceRepository extends JpaRepository<Evidence, String> {

    List<Evidence> findByInvestigationId(String investigationId);

    List<Evidence> findByFacilityIdOrderByCreatedAtDesc(String facilityId);

    long countByFacilityId(String facilityId);
}
