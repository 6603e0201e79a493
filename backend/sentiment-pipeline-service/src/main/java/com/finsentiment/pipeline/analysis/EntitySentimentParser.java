package com.finsentiment.pipeline.analysis;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.finsentiment.pipeline.entity.EntitySentiment;
import com.finsentiment.pipeline.entity.EntityType;
import com.finsentiment.pipeline.entity.SentimentLabel;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Parses and validates a model's JSON answer into {@link EntitySentiment} rows.
 * Any violation makes the whole answer invalid; nothing is passed through partially.
 */
@Component
@RequiredArgsConstructor
public class EntitySentimentParser {

    private final ObjectMapper objectMapper;

    public ParseResult parse(String content) {
        if (content == null || content.isBlank()) {
            return ParseResult.invalid("empty response");
        }

        JsonNode root;
        try {
            root = objectMapper.readTree(stripCodeFence(content));
        } catch (JsonProcessingException e) {
            return ParseResult.invalid("malformed JSON: " + e.getOriginalMessage());
        }

        if (root == null || !root.isObject()) {
            return ParseResult.invalid("root is not an object");
        }
        JsonNode entities = root.get("entities");
        if (entities == null || !entities.isArray()) {
            return ParseResult.invalid("missing 'entities' array");
        }

        List<EntitySentiment> result = new ArrayList<>();
        for (int i = 0; i < entities.size(); i++) {
            JsonNode node = entities.get(i);
            if (!node.isObject()) {
                return ParseResult.invalid("entities[" + i + "] is not an object");
            }

            String name = text(node, "entity_name");
            if (name == null || name.isBlank()) {
                return ParseResult.invalid("entities[" + i + "].entity_name is missing");
            }
            Optional<EntityType> type = EntityType.fromValue(text(node, "entity_type"));
            if (type.isEmpty()) {
                return ParseResult.invalid("entities[" + i + "].entity_type is invalid: " + text(node, "entity_type"));
            }
            Optional<SentimentLabel> financial = SentimentLabel.fromValue(text(node, "financial_sentiment"));
            if (financial.isEmpty()) {
                return ParseResult.invalid("entities[" + i + "].financial_sentiment is invalid: " + text(node, "financial_sentiment"));
            }
            Optional<SentimentLabel> overall = SentimentLabel.fromValue(text(node, "overall_sentiment"));
            if (overall.isEmpty()) {
                return ParseResult.invalid("entities[" + i + "].overall_sentiment is invalid: " + text(node, "overall_sentiment"));
            }
            String reasoning = text(node, "reasoning");
            if (reasoning == null) {
                return ParseResult.invalid("entities[" + i + "].reasoning is missing");
            }

            result.add(EntitySentiment.builder()
                    .entityName(name.trim())
                    .entityType(type.get())
                    .financialSentiment(financial.get())
                    .overallSentiment(overall.get())
                    .reasoning(reasoning)
                    .build());
        }
        return ParseResult.ok(result);
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value != null && value.isTextual() ? value.asText() : null;
    }

    /**
     * ```json ... ``` 형태로 감싼 응답 허용
     */
    static String stripCodeFence(String content) {
        String trimmed = content.trim();
        if (!trimmed.startsWith("```")) {
            return trimmed;
        }
        int firstNewline = trimmed.indexOf('\n');
        if (firstNewline < 0) {
            return trimmed;
        }
        String inner = trimmed.substring(firstNewline + 1);
        int closing = inner.lastIndexOf("```");
        if (closing >= 0) {
            inner = inner.substring(0, closing);
        }
        return inner.trim();
    }

    /**
     * Either a validated entity list (possibly empty) or the reason it was rejected.
     */
    public record ParseResult(List<EntitySentiment> entities, String error) {

        public static ParseResult ok(List<EntitySentiment> entities) {
            return new ParseResult(List.copyOf(entities), null);
        }

        public static ParseResult invalid(String error) {
            return new ParseResult(List.of(), error);
        }

        public boolean isValid() {
            return error == null;
        }
    }
}
