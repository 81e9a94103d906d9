package com.yerin.notifyq.dto.response;

public record TransitionResponse(
        String family,
        String entityId,
        int cancelled
) {}
