package com.adaptivelearning.repository;

import com.adaptivelearning.entity.FeedbackRecord;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.UUID;

public interface FeedbackRecordRepository extends JpaRepository<FeedbackRecord, UUID> {

    List<FeedbackRecord> findByLegacyMigratedFalse();
}
