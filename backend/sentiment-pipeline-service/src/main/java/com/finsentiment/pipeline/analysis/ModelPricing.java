package com.finsentiment.pipeline.analysis;

import com.finsentiment.pipeline.config.LlmProvidersConfig;
import com.finsentiment.pipeline.config.LlmProvidersConfig.ModelPrice;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * USD cost of a call from the configured per-model price table.
 * Models without an entry cost 0.
 */
@Component
@RequiredArgsConstructor
public class ModelPricing {

    private static final double PER_MILLION = 1_000_000d;

    private final LlmProvidersConfig config;

    public double cost(String model, int inputTokens, int outputTokens) {
        ModelPrice price = model == null ? null : config.getPricing().get(model);
        if (price == null) {
            return 0.0;
        }
        return inputTokens * price.getInputPerMillion() / PER_MILLION
                + outputTokens * price.getOutputPerMillion() / PER_MILLION;
    }
}
