package com.finsentiment.pipeline.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;

public record ScheduleRequest(
        @NotBlank(message = "Time is required")
        @Pattern(regexp = "^([01]\\d|2[0-3]):([0-5]\\d)$", message = "Time must be HH:MM (00:00-23:59, UTC)")
        String time,
        Boolean enabled
) {
}
