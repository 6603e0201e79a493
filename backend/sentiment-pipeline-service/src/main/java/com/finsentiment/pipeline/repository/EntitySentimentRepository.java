package com.finsentiment.pipeline.repository;

import com.finsentiment.pipeline.entity.EntitySentiment;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface EntitySentimentRepository extends JpaRepository<EntitySentiment, Long> {
}
