package com.yerin.notifyq.dto.response;

import java.time.Instant;

public record QueueStatsResponse(
        boolean available,
        long pending,
        Instant ts
) {}
