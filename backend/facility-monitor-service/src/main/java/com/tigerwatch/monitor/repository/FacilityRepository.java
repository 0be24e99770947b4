package com.tigerwatch.monitor.repository;

import com.tigerwatch.monitor.entity.Facility;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;

/**
 * Facility 저장소 (읽기 위주, lastCrawledAt만 갱신)
 */
@Repository
public interface FacilityRepository extends JpaRepository<Facility, String> {

    /**
     * 마지막 크롤링 이후 기준 시각이 지났거나 한 번도 크롤링되지 않은 시설
     */
    @Query("SELECT f FROM Facility f " +
           "WHERE (f.lastCrawledAt IS NULL OR f.lastCrawledAt < :cutoff) " +
           "AND (:referenceOnly = false OR f.referenceFacility = true)")
    List<Facility> findDueForCrawl(@Param("cutoff") LocalDateTime cutoff,
                                   @Param("referenceOnly") boolean referenceOnly);

    List<Facility> findByIdIn(Collection<String> ids);

    @Modifying
    @Transactional
    @Query("UPDATE Facility f SET f.lastCrawledAt = :crawledAt WHERE f.id = :facilityId")
    int updateLastCrawledAt(@Param("facilityId") String facilityId,
                            @Param("crawledAt") LocalDateTime crawledAt);
}
