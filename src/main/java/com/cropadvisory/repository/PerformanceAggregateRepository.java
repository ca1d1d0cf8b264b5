package com.cropadvisory.repository;

import com.cropadvisory.entity.PerformanceAggregate;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.Optional;

public interface PerformanceAggregateRepository extends JpaRepository<PerformanceAggregate, String> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT a FROM PerformanceAggregate a WHERE a.key = :key")
    Optional<PerformanceAggregate> findForUpdate(@Param("key") String key);

    List<PerformanceAggregate> findByLocation(String location);

    List<PerformanceAggregate> findByLocationAndSeason(String location, String season);
}
