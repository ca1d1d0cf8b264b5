package com.cropadvisory.repository;

import com.cropadvisory.entity.RecommendationRecord;
import org.springframework.data.jpa.repository.JpaRepository;

public interface RecommendationRepository extends JpaRepository<RecommendationRecord, String> {
}
