package com.finsentiment.pipeline.analysis;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.finsentiment.pipeline.analysis.EntitySentimentParser.ParseResult;
import com.finsentiment.pipeline.entity.EntitySentiment;
import com.finsentiment.pipeline.entity.EntityType;
import com.finsentiment.pipeline.entity.SentimentLabel;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class EntitySentimentParserTest {

    private final EntitySentimentParser parser = new EntitySentimentParser(new ObjectMapper());

    private static final String VALID = """
            {"entities": [
              {"entity_name": "International Business Machines", "entity_type": "company",
               "financial_sentiment": "negative", "overall_sentiment": "positive",
               "reasoning": "Shares fell while a new partnership was announced"},
              {"entity_name": "Bitcoin", "entity_type": "crypto",
               "financial_sentiment": "positive", "overall_sentiment": "neutral",
               "reasoning": "Price reached a new high"}
            ]}
            """;

    @Test
    @DisplayName("올바른 응답은 엔티티 목록으로 변환")
    void parsesValidAnswer() {
        ParseResult result = parser.parse(VALID);

        assertThat(result.isValid()).isTrue();
        assertThat(result.entities()).hasSize(2);
        EntitySentiment ibm = result.entities().get(0);
        assertThat(ibm.getEntityName()).isEqualTo("International Business Machines");
        assertThat(ibm.getEntityType()).isEqualTo(EntityType.COMPANY);
        assertThat(ibm.getFinancialSentiment()).isEqualTo(SentimentLabel.NEGATIVE);
        assertThat(ibm.getOverallSentiment()).isEqualTo(SentimentLabel.POSITIVE);
        assertThat(ibm.getArticleId()).isNull();
        assertThat(result.entities().get(1).getEntityType()).isEqualTo(EntityType.CRYPTO);
    }

    @Test
    @DisplayName("마크다운 코드 블록으로 감싼 응답 허용")
    void toleratesCodeFence() {
        ParseResult result = parser.parse("```json\n" + VALID + "\n```");

        assertThat(result.isValid()).isTrue();
        assertThat(result.entities()).hasSize(2);
    }

    @Test
    @DisplayName("빈 entities 목록은 유효한 결과")
    void emptyListIsValid() {
        ParseResult result = parser.parse("{\"entities\": []}");

        assertThat(result.isValid()).isTrue();
        assertThat(result.entities()).isEmpty();
    }

    @Test
    @DisplayName("대소문자와 공백은 정규화")
    void normalizesLabels() {
        ParseResult result = parser.parse("""
                {"entities": [{"entity_name": " Aramco ", "entity_type": "Company",
                  "financial_sentiment": " POSITIVE", "overall_sentiment": "Neutral", "reasoning": ""}]}
                """);

        assertThat(result.isValid()).isTrue();
        assertThat(result.entities().get(0).getEntityName()).isEqualTo("Aramco");
        assertThat(result.entities().get(0).getFinancialSentiment()).isEqualTo(SentimentLabel.POSITIVE);
    }

    @Test
    @DisplayName("허용되지 않은 entity_type은 전체 응답을 거부")
    void rejectsUnknownEntityType() {
        ParseResult result = parser.parse("""
                {"entities": [{"entity_name": "Dubai", "entity_type": "location",
                  "financial_sentiment": "neutral", "overall_sentiment": "neutral", "reasoning": "city"}]}
                """);

        assertThat(result.isValid()).isFalse();
        assertThat(result.error()).contains("entity_type");
        assertThat(result.entities()).isEmpty();
    }

    @Test
    @DisplayName("필수 필드 누락 거부")
    void rejectsMissingFields() {
        assertThat(parser.parse("""
                {"entities": [{"entity_name": "Careem", "entity_type": "company",
                  "financial_sentiment": "neutral", "reasoning": "acquired"}]}
                """).error()).contains("overall_sentiment");
        assertThat(parser.parse("""
                {"entities": [{"entity_name": "  ", "entity_type": "company",
                  "financial_sentiment": "neutral", "overall_sentiment": "neutral", "reasoning": "x"}]}
                """).error()).contains("entity_name");
        assertThat(parser.parse("""
                {"entities": [{"entity_name": "Careem", "entity_type": "company",
                  "financial_sentiment": "neutral", "overall_sentiment": "neutral"}]}
                """).error()).contains("reasoning");
    }

    @Test
    @DisplayName("JSON 아님, entities 누락, 빈 응답은 모두 실패")
    void rejectsMalformedDocuments() {
        assertThat(parser.parse("Sure! Here are the entities").isValid()).isFalse();
        assertThat(parser.parse("{\"items\": []}").error()).contains("entities");
        assertThat(parser.parse("[]").error()).contains("root");
        assertThat(parser.parse("").isValid()).isFalse();
        assertThat(parser.parse(null).isValid()).isFalse();
    }
}
