package com.finsentiment.pipeline.store;

import com.finsentiment.pipeline.entity.Article;
import com.finsentiment.pipeline.entity.EntitySentiment;
import com.finsentiment.pipeline.entity.PipelineRunRecord;
import com.finsentiment.pipeline.entity.UsageRecord;

import java.util.List;

/**
 * Persistence operations the pipeline engine depends on.
 *
 * <p>Every write must be durable (visible to later {@link #existsUrl(String)} calls)
 * when the method returns. Writes are not transactional across articles.
 * Implementations report store failures as
 * {@link com.finsentiment.pipeline.exception.InfrastructureFailureException}.
 */
public interface PipelineStore {

    boolean existsUrl(String url);

    /**
     * @return generated article id
     */
    Long saveArticle(Article article);

    /**
     * Stores the sentiment batch for an article and marks the article analyzed, atomically.
     */
    void saveEntitySentiments(Long articleId, List<EntitySentiment> sentiments);

    void markAnalysisFailed(Long articleId);

    void appendUsage(UsageRecord usageRecord);

    void saveRun(PipelineRunRecord runRecord);
}
