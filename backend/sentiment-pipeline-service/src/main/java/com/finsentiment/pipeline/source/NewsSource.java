package com.finsentiment.pipeline.source;

import java.util.List;

/**
 * A news site the pipeline can discover and fetch articles from.
 *
 * Implementations only do network I/O. Failures may be thrown as any runtime
 * exception; {@link SourceRegistry} wraps them.
 */
public interface NewsSource {

    String getSourceId();

    /**
     * @return article URLs currently listed by the source, in listing order
     */
    List<String> discoverUrls();

    ScrapedArticle fetchArticle(String url);
}
