package com.finsentiment.pipeline.source.html;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;

/**
 * Blocking HTML GET over the shared WebClient.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class HtmlPageFetcher {

    private final WebClient webClient;

    @Value("${pipeline.http.page-timeout-seconds:30}")
    private int pageTimeoutSeconds = 30;

    /**
     * @return page HTML, never null
     * @throws RuntimeException on HTTP error, timeout or connection failure
     */
    public String fetch(String url) {
        log.debug("Fetching page: {}", url);
        String html = webClient.get()
                .uri(url)
                .retrieve()
                .bodyToMono(String.class)
                .timeout(Duration.ofSeconds(pageTimeoutSeconds))
                .block();
        return html == null ? "" : html;
    }
}
