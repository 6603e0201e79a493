package com.finsentiment.pipeline.repository;

import com.finsentiment.pipeline.dto.UsageSummaryDTO;
import com.finsentiment.pipeline.entity.UsageRecord;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface UsageRecordRepository extends JpaRepository<UsageRecord, Long> {

    Page<UsageRecord> findAllByOrderByCreatedAtDesc(Pageable pageable);

    /**
     * provider/model 별 호출 수, 토큰, 비용 합계
     */
    @Query("""
        SELECT new com.finsentiment.pipeline.dto.UsageSummaryDTO(
            u.provider, u.model, COUNT(u), SUM(u.totalTokens), SUM(u.costUsd))
        FROM UsageRecord u
        GROUP BY u.provider, u.model
        ORDER BY u.provider, u.model
        """)
    List<UsageSummaryDTO> summarizeByProviderAndModel();
}
