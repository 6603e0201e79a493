package com.finsentiment.pipeline.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.List;

/**
 * HTML news sources registered at startup.
 *
 * Each entry describes how to find article links on a listing page and how to
 * extract an article from its page with CSS selectors.
 */
@Configuration
@ConfigurationProperties(prefix = "pipeline.sources")
@Data
public class NewsSourcesConfig {

    private List<SourceEntry> entries = new ArrayList<>();

    @Data
    public static class SourceEntry {
        /**
         * Source identifier, e.g. "zawya.com"
         */
        private String id;

        private boolean enabled = true;

        /**
         * Listing page that links to articles
         */
        private String listUrl;

        /**
         * CSS selector for article anchors on the listing page
         */
        private String linkSelector = "a[href]";

        /**
         * Optional regex the raw href must match
         */
        private String linkPattern;

        /**
         * 0 = unlimited
         */
        private int maxUrls = 0;

        private String titleSelector = "h1";

        /**
         * CSS selector for body paragraphs, joined with newlines
         */
        private String bodySelector = "article p";

        private String authorSelector;

        private String publishedSelector;

        /**
         * Attribute holding the date on the published element; text is used when empty
         */
        private String publishedAttribute;

        /**
         * DateTimeFormatter pattern (English locale) for human-readable dates, e.g. "MMMM d, yyyy".
         * Tried before the ISO formats
         */
        private String publishedFormat;

        /**
         * Read datePublished from application/ld+json blocks first
         */
        private boolean jsonLdDates = false;
    }
}
