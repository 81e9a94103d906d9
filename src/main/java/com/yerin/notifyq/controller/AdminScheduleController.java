package com.yerin.notifyq.controller;

import com.yerin.notifyq.domain.EntityFamily;
import com.yerin.notifyq.dto.request.ScheduleRequest;
import com.yerin.notifyq.dto.request.TransitionRequest;
import com.yerin.notifyq.dto.response.ScheduleResponse;
import com.yerin.notifyq.dto.response.TransitionResponse;
import com.yerin.notifyq.global.dto.DataResponse;
import com.yerin.notifyq.policy.EventGroup;
import com.yerin.notifyq.service.NotificationScheduler;
import com.yerin.notifyq.service.SuppressionEngine;
import io.swagger.v3.oas.annotations.Parameter;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * 비즈니스 모듈이 부르는 진입점을 운영자가 직접 호출할 수 있게 노출한다.
 */
@RestController
@RequiredArgsConstructor
@RequestMapping("/admin")
public class AdminScheduleController {
    private final NotificationScheduler scheduler;
    private final SuppressionEngine suppressionEngine;

    @PostMapping("/schedules/{eventGroup}")
    public ResponseEntity<DataResponse<ScheduleResponse>> schedule(@PathVariable String eventGroup,
                                                                   @Valid @RequestBody ScheduleRequest request,
                                                                   @RequestHeader(value = "X-Admin-Token", required = false)
                                                                   @Parameter(description = "관리자 토큰", example = "test-admin-token")
                                                                   String adminToken) {
        EventGroup group = EventGroup.from(eventGroup);
        var result = scheduler.schedule(group, request.entityId(), request.fundId(), request.anchor());
        return ResponseEntity.ok(DataResponse.from(ScheduleResponse.from(result)));
    }

    @PostMapping("/transitions/{family}")
    public ResponseEntity<DataResponse<TransitionResponse>> transition(@PathVariable String family,
                                                                       @Valid @RequestBody TransitionRequest request,
                                                                       @RequestHeader(value = "X-Admin-Token", required = false)
                                                                       @Parameter(description = "관리자 토큰", example = "test-admin-token")
                                                                       String adminToken) {
        EntityFamily f = EntityFamily.from(family);
        int cancelled = suppressionEngine.onTransition(f, request.entityId(), request.newState(), request.previousState());
        return ResponseEntity.ok(DataResponse.from(new TransitionResponse(f.getValue(), request.entityId(), cancelled)));
    }
}
