package com.tigerwatch.monitor.repository;

import com.tigerwatch.monitor.entity.CrawlHistory;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;

@Repository
public interface CrawlHistoryRepository extends JpaRepository<CrawlHistory, String> {

    /**
     * 시설별 가장 최근 완료 이력 (동일 시각이면 여러 행이 반환될 수 있음)
     */
    @Query("SELECT h FROM CrawlHistory h " +
           "WHERE h.facilityId IN :facilityIds " +
           "AND h.completedAt = (SELECT MAX(h2.completedAt) FROM CrawlHistory h2 WHERE h2.facilityId = h.facilityId)")
    List<CrawlHistory> findLatestByFacilityIdIn(@Param("facilityIds") Collection<String> facilityIds);

    List<CrawlHistory> findByCompletedAtGreaterThanEqual(LocalDateTime since);

    List<CrawlHistory> findByFacilityIdAndCompletedAtGreaterThanEqual(String facilityId, LocalDateTime since);
}
