package com.yerin.notifyq.controller;

import com.yerin.notifyq.domain.JobCategory;
import com.yerin.notifyq.domain.JobKey;
import com.yerin.notifyq.dto.response.JobEventResponse;
import com.yerin.notifyq.dto.response.JobResponse;
import com.yerin.notifyq.global.dto.DataResponse;
import com.yerin.notifyq.global.exception.AppException;
import com.yerin.notifyq.global.exception.code.JobErrorCode;
import com.yerin.notifyq.service.AdminJobService;
import com.yerin.notifyq.service.NotificationScheduler;
import io.swagger.v3.oas.annotations.Parameter;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@RestController
@RequiredArgsConstructor
@RequestMapping("/admin/jobs")
public class AdminJobController {
    private final AdminJobService adminJobService;
    private final NotificationScheduler scheduler;

    @GetMapping("/{key}")
    public ResponseEntity<DataResponse<JobResponse>> get(@PathVariable String key,
                                                         @RequestHeader(value = "X-Admin-Token", required = false)
                                                         @Parameter(description = "관리자 토큰", example = "test-admin-token")
                                                         String adminToken) {
        return ResponseEntity.ok(DataResponse.from(JobResponse.from(adminJobService.find(key))));
    }

    @GetMapping("/{key}/events")
    public ResponseEntity<DataResponse<List<JobEventResponse>>> events(@PathVariable String key,
                                                                       @RequestHeader(value = "X-Admin-Token", required = false)
                                                                       @Parameter(description = "관리자 토큰", example = "test-admin-token")
                                                                       String adminToken) {
        List<JobEventResponse> events = adminJobService.events(key).stream().map(JobEventResponse::from).toList();
        return ResponseEntity.ok(DataResponse.from(events));
    }

    @PostMapping("/{key}/replay")
    public ResponseEntity<DataResponse<JobResponse>> replay(@PathVariable String key,
                                                            @RequestHeader(value = "X-Admin-Token", required = false)
                                                            @Parameter(description = "관리자 토큰", example = "test-admin-token")
                                                            String adminToken) {
        return ResponseEntity.ok(DataResponse.from(JobResponse.from(adminJobService.replay(key))));
    }

    @DeleteMapping("/{category}/{entityId}")
    public ResponseEntity<DataResponse<Map<String, Object>>> cancel(@PathVariable String category,
                                                                    @PathVariable String entityId,
                                                                    @RequestHeader(value = "X-Admin-Token", required = false)
                                                                    @Parameter(description = "관리자 토큰", example = "test-admin-token")
                                                                    String adminToken) {
        JobCategory c = JobCategory.fromWireName(category)
                .orElseThrow(() -> new AppException(JobErrorCode.UNKNOWN_CATEGORY));
        boolean cancelled = scheduler.cancel(c, entityId);
        return ResponseEntity.ok(DataResponse.from(Map.of(
                "key", JobKey.of(c, entityId),
                "cancelled", cancelled
        )));
    }
}
