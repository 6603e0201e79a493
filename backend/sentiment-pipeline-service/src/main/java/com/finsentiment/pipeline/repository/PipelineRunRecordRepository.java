package com.finsentiment.pipeline.repository;

import com.finsentiment.pipeline.entity.PipelineRunRecord;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface PipelineRunRecordRepository extends JpaRepository<PipelineRunRecord, Long> {

    Optional<PipelineRunRecord> findFirstByOrderByStartedAtDesc();
}
