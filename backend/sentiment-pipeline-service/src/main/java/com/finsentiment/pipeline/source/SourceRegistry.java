package com.finsentiment.pipeline.source;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.finsentiment.pipeline.config.NewsSourcesConfig;
import com.finsentiment.pipeline.exception.ExtractionFailedException;
import com.finsentiment.pipeline.exception.SourceUnavailableException;
import com.finsentiment.pipeline.source.html.HtmlNewsSource;
import com.finsentiment.pipeline.source.html.HtmlPageFetcher;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Registration table of news sources by id.
 *
 * Built once at startup from the enabled {@code pipeline.sources.entries} and
 * every {@link NewsSource} bean. Unexpected failures from a source are wrapped
 * into {@link SourceUnavailableException} / {@link ExtractionFailedException}.
 */
@Component
@Slf4j
public class SourceRegistry {

    private final Map<String, NewsSource> sources;

    @Autowired
    public SourceRegistry(NewsSourcesConfig config,
                          HtmlPageFetcher pageFetcher,
                          ObjectMapper objectMapper,
                          ObjectProvider<NewsSource> sourceBeans) {
        List<NewsSource> all = new ArrayList<>();
        config.getEntries().stream()
                .filter(NewsSourcesConfig.SourceEntry::isEnabled)
                .forEach(entry -> all.add(new HtmlNewsSource(entry, pageFetcher, objectMapper)));
        sourceBeans.orderedStream().forEach(all::add);
        this.sources = buildTable(all);
        log.info("News sources registered: {}", listSources());
    }

    public SourceRegistry(List<NewsSource> sources) {
        this.sources = buildTable(sources);
    }

    private static Map<String, NewsSource> buildTable(List<NewsSource> sources) {
        Map<String, NewsSource> table = new LinkedHashMap<>();
        for (NewsSource source : sources) {
            NewsSource previous = table.putIfAbsent(source.getSourceId(), source);
            if (previous != null) {
                throw new IllegalStateException("Duplicate news source id: " + source.getSourceId());
            }
        }
        return Collections.unmodifiableMap(table);
    }

    public SortedSet<String> listSources() {
        return Collections.unmodifiableSortedSet(new TreeSet<>(sources.keySet()));
    }

    public boolean contains(String sourceId) {
        return sources.containsKey(sourceId);
    }

    /**
     * @return canonical URLs, de-duplicated, in listing order
     * @throws SourceUnavailableException when the listing cannot be read
     */
    public List<String> discoverUrls(String sourceId) {
        NewsSource source = require(sourceId);
        List<String> raw;
        try {
            raw = source.discoverUrls();
        } catch (SourceUnavailableException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new SourceUnavailableException(sourceId, "URL discovery failed for " + sourceId + ": " + e.getMessage(), e);
        }

        Set<String> unique = new LinkedHashSet<>();
        if (raw != null) {
            for (String url : raw) {
                String canonical = canonicalize(url);
                if (canonical != null) {
                    unique.add(canonical);
                }
            }
        }
        return List.copyOf(unique);
    }

    /**
     * @throws ExtractionFailedException when the article cannot be fetched or has no body
     */
    public ScrapedArticle fetchArticle(String sourceId, String url) {
        NewsSource source = require(sourceId);
        ScrapedArticle article;
        try {
            article = source.fetchArticle(url);
        } catch (ExtractionFailedException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new ExtractionFailedException(url, "Fetch failed for " + url + ": " + e.getMessage(), e);
        }
        if (article == null) {
            throw new ExtractionFailedException(url, "Source " + sourceId + " returned no article for " + url);
        }
        return article;
    }

    private NewsSource require(String sourceId) {
        NewsSource source = sources.get(sourceId);
        if (source == null) {
            throw new IllegalArgumentException("Unknown news source: " + sourceId);
        }
        return source;
    }

    /**
     * 공백 제거 및 #fragment 제거. 빈 값은 null
     */
    public static String canonicalize(String url) {
        if (url == null) {
            return null;
        }
        String trimmed = url.trim();
        int hash = trimmed.indexOf('#');
        if (hash >= 0) {
            trimmed = trimmed.substring(0, hash);
        }
        return trimmed.isEmpty() ? null : trimmed;
    }
}
