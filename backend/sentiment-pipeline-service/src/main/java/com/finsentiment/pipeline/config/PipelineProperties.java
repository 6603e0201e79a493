package com.finsentiment.pipeline.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Pipeline run, analysis retry and schedule settings.
 */
@Configuration
@ConfigurationProperties(prefix = "pipeline")
@Data
public class PipelineProperties {

    private Analysis analysis = new Analysis();

    private Schedule schedule = new Schedule();

    @Data
    public static class Analysis {
        /**
         * Provider used when a start request does not name one (and for scheduled runs)
         */
        private String defaultProvider = "openai";

        /**
         * Model used when a start request does not name one. Falls back to the provider's default model.
         */
        private String defaultModel;

        /**
         * Attempts per article, including the first one
         */
        private int maxRetries = 3;

        private Duration initialBackoff = Duration.ofSeconds(1);

        private double backoffMultiplier = 2.0;

        private Duration maxBackoff = Duration.ofSeconds(30);

        /**
         * Article text is truncated to this many characters before it is sent to the model
         */
        private int maxTextLength = 20_000;
    }

    @Data
    public static class Schedule {
        /**
         * Daily trigger time in UTC (HH:mm), used until an administrator stores another one
         */
        private String time = "01:00";

        private boolean enabled = true;
    }
}
