package com.yerin.notifyq.dto.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

import java.time.Instant;

public record ScheduleRequest(
        @NotBlank String entityId,
        String fundId,
        @NotNull Instant anchor
) {}
