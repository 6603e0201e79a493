package com.finsentiment.pipeline.source.html;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.finsentiment.pipeline.config.NewsSourcesConfig.SourceEntry;
import com.finsentiment.pipeline.exception.ExtractionFailedException;
import com.finsentiment.pipeline.exception.SourceUnavailableException;
import com.finsentiment.pipeline.source.NewsSource;
import com.finsentiment.pipeline.source.ScrapedArticle;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAccessor;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.function.Function;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * News source described entirely by CSS selectors.
 */
@Slf4j
public class HtmlNewsSource implements NewsSource {

    private static final Set<String> ARTICLE_TYPES = Set.of("Article", "NewsArticle", "ReportageNewsArticle");

    private static final List<Function<String, LocalDateTime>> DATE_PARSERS = List.of(
            value -> OffsetDateTime.parse(value).withOffsetSameInstant(ZoneOffset.UTC).toLocalDateTime(),
            value -> LocalDateTime.ofInstant(Instant.parse(value), ZoneOffset.UTC),
            LocalDateTime::parse,
            value -> LocalDate.parse(value).atStartOfDay()
    );

    private final SourceEntry entry;
    private final HtmlPageFetcher pageFetcher;
    private final ObjectMapper objectMapper;
    private final Pattern linkPattern;
    private final DateTimeFormatter publishedFormat;

    public HtmlNewsSource(SourceEntry entry, HtmlPageFetcher pageFetcher, ObjectMapper objectMapper) {
        if (entry.getId() == null || entry.getId().isBlank()) {
            throw new IllegalArgumentException("News source entry without id");
        }
        if (entry.getListUrl() == null || entry.getListUrl().isBlank()) {
            throw new IllegalArgumentException("News source " + entry.getId() + " has no list-url");
        }
        this.entry = entry;
        this.pageFetcher = pageFetcher;
        this.objectMapper = objectMapper;
        this.linkPattern = isBlank(entry.getLinkPattern()) ? null : Pattern.compile(entry.getLinkPattern());
        this.publishedFormat = isBlank(entry.getPublishedFormat()) ? null : new DateTimeFormatterBuilder()
                .parseCaseInsensitive()
                .appendPattern(entry.getPublishedFormat())
                .toFormatter(Locale.ENGLISH);
    }

    @Override
    public String getSourceId() {
        return entry.getId();
    }

    @Override
    public List<String> discoverUrls() {
        String html;
        try {
            html = pageFetcher.fetch(entry.getListUrl());
        } catch (RuntimeException e) {
            throw new SourceUnavailableException(entry.getId(),
                    "Cannot load listing " + entry.getListUrl() + ": " + e.getMessage(), e);
        }

        Document doc = Jsoup.parse(html, entry.getListUrl());
        Set<String> urls = new LinkedHashSet<>();
        for (Element link : doc.select(entry.getLinkSelector())) {
            String href = link.attr("href");
            if (href.isBlank()) {
                continue;
            }
            if (linkPattern != null && !linkPattern.matcher(href).find()) {
                continue;
            }
            String absolute = link.absUrl("href");
            if (absolute.isBlank()) {
                continue;
            }
            urls.add(absolute);
            if (entry.getMaxUrls() > 0 && urls.size() >= entry.getMaxUrls()) {
                break;
            }
        }

        log.debug("{}: {} article links found on {}", entry.getId(), urls.size(), entry.getListUrl());
        return new ArrayList<>(urls);
    }

    @Override
    public ScrapedArticle fetchArticle(String url) {
        String html;
        try {
            html = pageFetcher.fetch(url);
        } catch (RuntimeException e) {
            throw new ExtractionFailedException(url, "Cannot load article " + url + ": " + e.getMessage(), e);
        }

        Document doc = Jsoup.parse(html, url);

        String body = doc.select(entry.getBodySelector()).stream()
                .map(Element::text)
                .map(HtmlNewsSource::normalizeText)
                .filter(text -> !text.isEmpty())
                .collect(Collectors.joining("\n"));
        if (body.isBlank()) {
            throw new ExtractionFailedException(url, "No article body matched '" + entry.getBodySelector() + "' on " + url);
        }

        String title = selectText(doc, entry.getTitleSelector());
        if (title == null) {
            title = normalizeText(doc.title());
        }

        return new ScrapedArticle(
                title,
                body,
                selectText(doc, entry.getAuthorSelector()),
                extractPublishedAt(doc)
        );
    }

    private LocalDateTime extractPublishedAt(Document doc) {
        if (entry.isJsonLdDates()) {
            LocalDateTime fromJsonLd = parseDate(findJsonLdDatePublished(doc));
            if (fromJsonLd != null) {
                return fromJsonLd;
            }
        }
        if (isBlank(entry.getPublishedSelector())) {
            return null;
        }
        Element element = doc.selectFirst(entry.getPublishedSelector());
        if (element == null) {
            return null;
        }
        String raw = isBlank(entry.getPublishedAttribute()) || !element.hasAttr(entry.getPublishedAttribute())
                ? element.text()
                : element.attr(entry.getPublishedAttribute());
        return parseDate(raw, publishedFormat);
    }

    /**
     * application/ld+json 블록에서 Article 계열의 datePublished 탐색 (@graph, 배열 포함)
     */
    private String findJsonLdDatePublished(Document doc) {
        for (Element script : doc.select("script[type=application/ld+json]")) {
            JsonNode root;
            try {
                root = objectMapper.readTree(script.data());
            } catch (JsonProcessingException e) {
                log.trace("Skipping unparseable JSON-LD block: {}", e.getOriginalMessage());
                continue;
            }
            String found = findDatePublished(root);
            if (found != null) {
                return found;
            }
        }
        return null;
    }

    private String findDatePublished(JsonNode node) {
        if (node == null) {
            return null;
        }
        if (node.isArray()) {
            for (JsonNode item : node) {
                String found = findDatePublished(item);
                if (found != null) {
                    return found;
                }
            }
            return null;
        }
        if (!node.isObject()) {
            return null;
        }
        if (ARTICLE_TYPES.contains(node.path("@type").asText()) && node.path("datePublished").isTextual()) {
            return node.get("datePublished").asText();
        }
        return findDatePublished(node.get("@graph"));
    }

    /**
     * ISO offset date-time, instant, local date-time, or date. Unparseable → null
     */
    static LocalDateTime parseDate(String raw) {
        return parseDate(raw, null);
    }

    /**
     * 소스별 형식(시각 없으면 자정)을 먼저 시도하고, 실패하면 ISO 형식
     */
    static LocalDateTime parseDate(String raw, DateTimeFormatter format) {
        if (isBlank(raw)) {
            return null;
        }
        String value = normalizeText(raw);
        if (format != null) {
            try {
                TemporalAccessor parsed = format.parseBest(value, LocalDateTime::from, LocalDate::from);
                return parsed instanceof LocalDate date ? date.atStartOfDay() : (LocalDateTime) parsed;
            } catch (DateTimeParseException e) {
                log.trace("Date '{}' does not match source format: {}", value, e.getMessage());
            }
        }
        for (Function<String, LocalDateTime> parser : DATE_PARSERS) {
            try {
                return parser.apply(value);
            } catch (DateTimeParseException e) {
                log.trace("Date '{}' not in this format: {}", value, e.getMessage());
            }
        }
        log.debug("Unparseable published date '{}'", value);
        return null;
    }

    private static String selectText(Document doc, String selector) {
        if (isBlank(selector)) {
            return null;
        }
        Element element = doc.selectFirst(selector);
        if (element == null) {
            return null;
        }
        String text = normalizeText(element.text());
        return text.isEmpty() ? null : text;
    }

    private static String normalizeText(String text) {
        if (text == null || text.isBlank()) {
            return "";
        }
        return text.replaceAll("\\s+", " ").trim();
    }

    private static boolean isBlank(String str) {
        return str == null || str.isBlank();
    }
}
