package com.finsentiment.pipeline.store;

import com.finsentiment.pipeline.entity.Article;
import com.finsentiment.pipeline.entity.EntitySentiment;
import com.finsentiment.pipeline.entity.PipelineRunRecord;
import com.finsentiment.pipeline.entity.UsageRecord;
import com.finsentiment.pipeline.exception.InfrastructureFailureException;
import com.finsentiment.pipeline.repository.ArticleRepository;
import com.finsentiment.pipeline.repository.EntitySentimentRepository;
import com.finsentiment.pipeline.repository.PipelineRunRecordRepository;
import com.finsentiment.pipeline.repository.UsageRecordRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

@Component
@RequiredArgsConstructor
@Slf4j
public class JpaPipelineStore implements PipelineStore {

    private final ArticleRepository articleRepository;
    private final EntitySentimentRepository entitySentimentRepository;
    private final UsageRecordRepository usageRecordRepository;
    private final PipelineRunRecordRepository pipelineRunRecordRepository;

    @Override
    @Transactional(readOnly = true)
    public boolean existsUrl(String url) {
        try {
            return articleRepository.existsByUrl(url);
        } catch (DataAccessException e) {
            throw new InfrastructureFailureException("Article lookup failed: " + e.getMessage(), e);
        }
    }

    @Override
    @Transactional
    public Long saveArticle(Article article) {
        try {
            return articleRepository.saveAndFlush(article).getId();
        } catch (DataAccessException e) {
            throw new InfrastructureFailureException("Failed to store article " + article.getUrl() + ": " + e.getMessage(), e);
        }
    }

    @Override
    @Transactional
    public void saveEntitySentiments(Long articleId, List<EntitySentiment> sentiments) {
        try {
            Article article = articleRepository.findById(articleId)
                    .orElseThrow(() -> new IllegalStateException("Article not found: " + articleId));

            sentiments.forEach(sentiment -> sentiment.setArticleId(articleId));
            entitySentimentRepository.saveAll(sentiments);

            article.markAnalyzed();
            articleRepository.save(article);
            log.debug("Stored {} entity sentiments for article {}", sentiments.size(), articleId);
        } catch (DataAccessException e) {
            throw new InfrastructureFailureException("Failed to store sentiments for article " + articleId + ": " + e.getMessage(), e);
        }
    }

    @Override
    @Transactional
    public void markAnalysisFailed(Long articleId) {
        try {
            articleRepository.findById(articleId).ifPresent(article -> {
                article.markAnalysisFailed();
                articleRepository.save(article);
            });
        } catch (DataAccessException e) {
            throw new InfrastructureFailureException("Failed to update article " + articleId + ": " + e.getMessage(), e);
        }
    }

    @Override
    @Transactional
    public void appendUsage(UsageRecord usageRecord) {
        try {
            usageRecordRepository.save(usageRecord);
        } catch (DataAccessException e) {
            throw new InfrastructureFailureException("Failed to append usage record: " + e.getMessage(), e);
        }
    }

    @Override
    @Transactional
    public void saveRun(PipelineRunRecord runRecord) {
        try {
            pipelineRunRecordRepository.save(runRecord);
        } catch (DataAccessException e) {
            throw new InfrastructureFailureException("Failed to store run record " + runRecord.getRunId() + ": " + e.getMessage(), e);
        }
    }
}
