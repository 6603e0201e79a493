package com.finsentiment.pipeline.source;

import java.time.LocalDateTime;

/**
 * @param author      null when the page does not name one
 * @param publishedAt UTC, null when the page does not report one or it cannot be parsed
 */
public record ScrapedArticle(
        String title,
        String body,
        String author,
        LocalDateTime publishedAt
) {
}
