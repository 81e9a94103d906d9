package com.yerin.notifyq.dto.request;

import jakarta.validation.constraints.NotBlank;

public record TransitionRequest(
        @NotBlank String entityId,
        @NotBlank String newState,
        String previousState
) {}
