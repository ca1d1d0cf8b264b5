package com.cropadvisory.repository;

import com.cropadvisory.entity.FeedbackRecord;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface FeedbackRepository extends JpaRepository<FeedbackRecord, String> {

    List<FeedbackRecord> findAllByOrderByCreatedAtAsc();
}
