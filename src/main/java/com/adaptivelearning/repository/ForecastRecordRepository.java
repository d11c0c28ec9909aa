package com.adaptivelearning.repository;

import com.adaptivelearning.entity.ForecastRecord;
import com.adaptivelearning.entity.ForecastStatus;
import com.adaptivelearning.entity.ForecastType;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.UUID;

public interface ForecastRecordRepository extends JpaRepository<ForecastRecord, UUID> {

    List<ForecastRecord> findByStatus(ForecastStatus status);

    long countByStatus(ForecastStatus status);

    @Query("""
        SELECT f FROM ForecastRecord f
        WHERE (:forecastType IS NULL OR f.forecastType = :forecastType)
          AND (:domain IS NULL OR f.domain = :domain)
          AND (:status IS NULL OR f.status = :status)
        ORDER BY f.createdAt DESC
    """)
    List<ForecastRecord> findHistory(
        @Param("forecastType") ForecastType forecastType,
        @Param("domain") String domain,
        @Param("status") ForecastStatus status,
        Pageable pageable);
}
