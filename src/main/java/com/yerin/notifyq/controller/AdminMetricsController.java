package com.yerin.notifyq.controller;

import com.yerin.notifyq.domain.DelayedJobQueue;
import com.yerin.notifyq.dto.response.QueueStatsResponse;
import com.yerin.notifyq.global.dto.DataResponse;
import io.swagger.v3.oas.annotations.Parameter;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;

@RestController
@RequestMapping("/admin/metrics")
@RequiredArgsConstructor
public class AdminMetricsController {

    private final DelayedJobQueue queue;
    private final Clock clock;

    @GetMapping("/queue")
    public ResponseEntity<DataResponse<QueueStatsResponse>> queue(@RequestHeader(value = "X-Admin-Token", required = false)
                                                                  @Parameter(description = "관리자 토큰", example = "test-admin-token")
                                                                  String adminToken) {
        boolean available = queue.isAvailable();
        long pending = available ? queue.pendingCount() : 0;
        return ResponseEntity.ok(DataResponse.from(new QueueStatsResponse(available, pending, clock.instant())));
    }
}
