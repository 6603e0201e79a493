package com.finsentiment.pipeline.pipeline;

import com.finsentiment.pipeline.entity.RunTrigger;

import java.util.List;
import java.util.Objects;

/**
 * @param provider  null → configured default provider
 * @param model     null → configured default model for the provider
 * @param sourceIds null or empty → every registered source
 */
public record StartCommand(
        String provider,
        String model,
        List<String> sourceIds,
        RunTrigger trigger
) {

    public StartCommand {
        sourceIds = sourceIds == null ? List.of() : sourceIds.stream()
                .filter(Objects::nonNull)
                .map(String::trim)
                .filter(id -> !id.isEmpty())
                .toList();
        trigger = trigger == null ? RunTrigger.MANUAL : trigger;
    }

    public static StartCommand manual(String provider, String model, List<String> sourceIds) {
        return new StartCommand(provider, model, sourceIds, RunTrigger.MANUAL);
    }

    public static StartCommand scheduled() {
        return new StartCommand(null, null, List.of(), RunTrigger.SCHEDULED);
    }

    public static StartCommand commandLine(String provider, String model, List<String> sourceIds) {
        return new StartCommand(provider, model, sourceIds, RunTrigger.COMMAND_LINE);
    }
}
