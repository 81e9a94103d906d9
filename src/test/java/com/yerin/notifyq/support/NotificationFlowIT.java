package com.yerin.notifyq.support;

import com.yerin.notifyq.application.HandlerOutcome;
import com.yerin.notifyq.domain.JobCategory;
import com.yerin.notifyq.domain.JobEventLog;
import com.yerin.notifyq.domain.JobKey;
import com.yerin.notifyq.repository.JobEventLogRepository;
import com.yerin.notifyq.service.NotificationScheduler;
import com.yerin.notifyq.service.ScheduleResult;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.client.TestRestTemplate;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.jdbc.Sql;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.InstanceOfAssertFactories.LIST;
import static org.awaitility.Awaitility.await;

@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
@ActiveProfiles("test")
@Sql("/sql/platform-fixture.sql")
@DisplayName("E2E: 예약 → 워커 발송 / 상태 검사 / 억제")
class NotificationFlowIT extends IntegrationTestBase {

    static final String FUND = "00000000-0000-0000-0000-0000000000f1";
    static final String PENDING_INVITE = "00000000-0000-0000-0000-0000000000a1";
    static final String ACCEPTED_INVITE = "00000000-0000-0000-0000-0000000000a2";
    static final String OPEN_ITEM = "00000000-0000-0000-0000-0000000000d1";

    @Autowired
    TestRestTemplate rest;

    @Autowired
    NotificationScheduler scheduler;

    @Autowired
    JobEventLogRepository eventLogRepository;

    private HttpHeaders adminHeaders() {
        HttpHeaders h = new HttpHeaders();
        h.set("X-Admin-Token", "test-admin-token"); // application-test.yml
        h.setContentType(MediaType.APPLICATION_JSON);
        return h;
    }

    private List<String> eventTypes(String key) {
        return eventLogRepository.findTop100ByJobKeyOrderByTsDesc(key).stream()
                .map(JobEventLog::getEventType).toList();
    }

    @Test
    @DisplayName("pending 초대 리마인더는 워커가 발송하고 completed 로 남는다")
    void due_job_is_sent() {
        ScheduleResult r = scheduler.enqueueNow(JobCategory.TEAM_INVITE_REMINDER_3D, PENDING_INVITE, FUND,
                Map.of("daysRemaining", "4"));
        String key = JobKey.of(JobCategory.TEAM_INVITE_REMINDER_3D, PENDING_INVITE);
        assertThat(r.enqueuedKeys()).containsExactly(key);

        await().atMost(Duration.ofSeconds(20))
                .pollInterval(Duration.ofMillis(300))
                .untilAsserted(() -> assertThat(eventTypes(key)).contains("started", "completed"));

        ResponseEntity<Map> job = rest.exchange("/admin/jobs/{key}", HttpMethod.GET,
                new HttpEntity<>(adminHeaders()), Map.class, key);
        assertThat(job.getStatusCode().is2xxSuccessful()).isTrue();
        assertThat(((Map<?, ?>) job.getBody().get("data")).get("status")).isEqualTo("COMPLETED");
    }

    @Test
    @DisplayName("이미 수락된 초대는 stale state 로 건너뛴다")
    void stale_job_is_skipped() {
        scheduler.enqueueNow(JobCategory.TEAM_INVITE_REMINDER_5D, ACCEPTED_INVITE, FUND, Map.of());
        String key = JobKey.of(JobCategory.TEAM_INVITE_REMINDER_5D, ACCEPTED_INVITE);

        await().atMost(Duration.ofSeconds(20))
                .pollInterval(Duration.ofMillis(300))
                .untilAsserted(() -> assertThat(eventLogRepository.findTop100ByJobKeyOrderByTsDesc(key))
                        .anySatisfy(e -> {
                            assertThat(e.getEventType()).isEqualTo("skipped");
                            assertThat(e.getMessage()).isEqualTo(HandlerOutcome.STALE_STATE);
                        }));
    }

    @Test
    @DisplayName("마감 2일 전 예약은 1d 리마인더만 남고 paid 전환이 그것을 취소한다")
    void paid_transition_cancels_reminders() {
        Instant deadline = Instant.now().plus(Duration.ofDays(2));
        String body = "{\"entityId\":\"" + OPEN_ITEM + "\",\"fundId\":\"" + FUND + "\",\"anchor\":\"" + deadline + "\"}";

        ResponseEntity<Map> scheduled = rest.exchange("/admin/schedules/capital-call-reminders", HttpMethod.POST,
                new HttpEntity<>(body, adminHeaders()), Map.class);
        assertThat(scheduled.getStatusCode().is2xxSuccessful()).isTrue();
        Map<?, ?> data = (Map<?, ?>) scheduled.getBody().get("data");
        assertThat(data.get("skippedPast")).asInstanceOf(LIST)
                .containsExactlyInAnyOrder("capital_call_reminder_7d", "capital_call_reminder_3d");
        assertThat(data.get("enqueued")).asInstanceOf(LIST)
                .containsExactly(JobKey.of(JobCategory.CAPITAL_CALL_REMINDER_1D, OPEN_ITEM));

        String transition = "{\"entityId\":\"" + OPEN_ITEM + "\",\"newState\":\"paid\",\"previousState\":\"pending\"}";
        ResponseEntity<Map> cancelled = rest.exchange("/admin/transitions/capital_call", HttpMethod.POST,
                new HttpEntity<>(transition, adminHeaders()), Map.class);
        assertThat(((Map<?, ?>) cancelled.getBody().get("data")).get("cancelled")).isEqualTo(1);

        String key = JobKey.of(JobCategory.CAPITAL_CALL_REMINDER_1D, OPEN_ITEM);
        ResponseEntity<Map> job = rest.exchange("/admin/jobs/{key}", HttpMethod.GET,
                new HttpEntity<>(adminHeaders()), Map.class, key);
        assertThat(((Map<?, ?>) job.getBody().get("data")).get("status")).isEqualTo("CANCELLED");
    }
}
