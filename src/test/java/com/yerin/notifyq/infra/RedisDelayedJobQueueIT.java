package com.yerin.notifyq.infra;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.yerin.notifyq.domain.*;
import com.yerin.notifyq.support.MutableClock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.data.redis.connection.RedisStandaloneConfiguration;
import org.springframework.data.redis.connection.lettuce.LettuceConnectionFactory;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.testcontainers.containers.GenericContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import org.testcontainers.utility.DockerImageName;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.UUID;

import static org.assertj.core.api.Assertions.*;

@Testcontainers
@DisplayName("Redis 브로커 통합 테스트")
class RedisDelayedJobQueueIT {

    @Container
    static final GenericContainer<?> REDIS =
            new GenericContainer<>(DockerImageName.parse("redis:7.2-alpine"))
                    .withExposedPorts(6379);

    MutableClock clock = new MutableClock(Instant.parse("2026-01-01T10:00:00Z"));
    LettuceConnectionFactory factory;
    RedisDelayedJobQueue sut;

    @BeforeEach
    void setUp() {
        factory = new LettuceConnectionFactory(new RedisStandaloneConfiguration(REDIS.getHost(), REDIS.getMappedPort(6379)));
        factory.afterPropertiesSet();
        factory.start();
        StringRedisTemplate redis = new StringRedisTemplate(factory);
        // 테스트마다 다른 prefix 로 격리
        String prefix = "it-" + UUID.randomUUID().toString().substring(0, 8);
        sut = new RedisDelayedJobQueue(redis, new ObjectMapper().findAndRegisterModules(), clock,
                RetryPolicy.DEFAULT, Duration.ofMinutes(5), prefix);
    }

    @AfterEach
    void tearDown() {
        factory.destroy();
    }

    private static JobPayload payload(JobCategory category, String entityId) {
        Instant anchor = Instant.parse("2026-01-08T10:00:00Z");
        return JobPayload.of(category, entityId, "F1", anchor, anchor, Map.of("daysRemaining", "4"));
    }

    @Test
    @DisplayName("due 시각 전에는 가져가지 않고, 지나면 lease 와 함께 가져간다")
    void delayed_delivery() {
        String key = JobKey.of(JobCategory.TEAM_INVITE_REMINDER_3D, "T1");
        sut.enqueue(key, payload(JobCategory.TEAM_INVITE_REMINDER_3D, "T1"), 60_000);

        assertThat(sut.pollDue(10, "c")).isEmpty();
        clock.advance(Duration.ofMinutes(1));

        var claimed = sut.pollDue(10, "c");
        assertThat(claimed).singleElement().satisfies(j -> {
            assertThat(j.getKey()).isEqualTo(key);
            assertThat(j.getStatus()).isEqualTo(JobStatus.EXECUTING);
            assertThat(j.getAttempts()).isEqualTo(1);
            assertThat(j.getPayload().metadata("daysRemaining")).isEqualTo("4");
            assertThat(j.getPayload().anchorAt()).isEqualTo(Instant.parse("2026-01-08T10:00:00Z"));
        });
    }

    @Test
    @DisplayName("같은 키 재예약은 pending 하나로 교체된다")
    void upsert() {
        String key = JobKey.of(JobCategory.KYC_REMINDER_1, "P1");
        sut.enqueue(key, payload(JobCategory.KYC_REMINDER_1, "P1"), 60_000);
        sut.enqueue(key, payload(JobCategory.KYC_REMINDER_1, "P1"), 120_000);

        assertThat(sut.pendingCount()).isEqualTo(1);
        assertThat(sut.find(key)).get().extracting(ScheduledJob::getDueAt)
                .isEqualTo(clock.instant().plusMillis(120_000));
    }

    @Test
    @DisplayName("cancel 은 pending 작업만 지우고 두 번째 호출은 false")
    void cancel() {
        String key = JobKey.of(JobCategory.CAPITAL_CALL_REMINDER_1D, "I1");
        sut.enqueue(key, payload(JobCategory.CAPITAL_CALL_REMINDER_1D, "I1"), 60_000);

        assertThat(sut.cancel(key)).isTrue();
        assertThat(sut.cancel(key)).isFalse();
        assertThat(sut.cancel("capital_call_reminder_7d:capital_call:missing")).isFalse();
        assertThat(sut.find(key)).get().extracting(ScheduledJob::getStatus).isEqualTo(JobStatus.CANCELLED);
    }

    @Test
    @DisplayName("실패는 60초, 120초 백오프 후 세 번째에 FAILED 로 끝난다")
    void retry_then_exhaust() {
        String key = JobKey.of(JobCategory.CAPITAL_CALL_PAST_DUE, "I1");
        sut.enqueue(key, payload(JobCategory.CAPITAL_CALL_PAST_DUE, "I1"), 0);

        ScheduledJob first = sut.pollDue(1, "c").get(0);
        assertThat(sut.fail(first, new IllegalStateException("smtp"))).isEqualTo(RetryDecision.RETRY_SCHEDULED);
        assertThat(sut.find(key)).get().extracting(ScheduledJob::getDueAt).isEqualTo(clock.instant().plusSeconds(60));

        clock.advance(Duration.ofSeconds(60));
        ScheduledJob second = sut.pollDue(1, "c").get(0);
        assertThat(second.getAttempts()).isEqualTo(2);
        assertThat(sut.fail(second, new IllegalStateException("smtp"))).isEqualTo(RetryDecision.RETRY_SCHEDULED);

        clock.advance(Duration.ofSeconds(120));
        ScheduledJob third = sut.pollDue(1, "c").get(0);
        assertThat(sut.fail(third, new IllegalStateException("smtp"))).isEqualTo(RetryDecision.EXHAUSTED);

        ScheduledJob failed = sut.find(key).orElseThrow();
        assertThat(failed.getStatus()).isEqualTo(JobStatus.FAILED);
        assertThat(failed.getLastError()).contains("smtp");
        assertThat(sut.pendingCount()).isZero();
    }

    @Test
    @DisplayName("실행 중 재예약되면 complete 가 새 pending 작업을 건드리지 않는다")
    void reschedule_during_execution() {
        String key = JobKey.of(JobCategory.MEETING_REMINDER_24HR, "P1");
        sut.enqueue(key, payload(JobCategory.MEETING_REMINDER_24HR, "P1"), 0);
        ScheduledJob running = sut.pollDue(1, "c").get(0);

        sut.enqueue(key, payload(JobCategory.MEETING_REMINDER_24HR, "P1"), 3_600_000);
        sut.complete(running);

        assertThat(sut.find(key)).get().extracting(ScheduledJob::getStatus).isEqualTo(JobStatus.PENDING);
        assertThat(sut.pendingCount()).isEqualTo(1);
    }

    @Test
    @DisplayName("재예약된 작업을 다른 워커가 가져간 뒤 이전 전달이 끝나도 새 lease 는 유지된다")
    void stale_delivery_keeps_new_lease() {
        String key = JobKey.of(JobCategory.MEETING_REMINDER_24HR, "P2");
        sut.enqueue(key, payload(JobCategory.MEETING_REMINDER_24HR, "P2"), 0);
        ScheduledJob first = sut.pollDue(1, "c1").get(0);

        sut.enqueue(key, payload(JobCategory.MEETING_REMINDER_24HR, "P2"), 0);
        ScheduledJob second = sut.pollDue(1, "c2").get(0);
        assertThat(second.getClaim()).isGreaterThan(first.getClaim());

        sut.complete(first);
        assertThat(sut.fail(first, new IllegalStateException("late"))).isEqualTo(RetryDecision.SUPERSEDED);

        assertThat(sut.find(key)).get().extracting(ScheduledJob::getStatus).isEqualTo(JobStatus.EXECUTING);
        clock.advance(Duration.ofMinutes(6));
        assertThat(sut.requeueExpiredLeases()).isEmpty();
        assertThat(sut.pendingCount()).isEqualTo(1);

        ScheduledJob third = sut.pollDue(1, "c3").get(0);
        sut.complete(third);
        assertThat(sut.find(key)).get().extracting(ScheduledJob::getStatus).isEqualTo(JobStatus.COMPLETED);
    }

    @Test
    @DisplayName("lease 가 만료되면 다시 due 가 된다")
    void lease_expiry() {
        String key = JobKey.of(JobCategory.NURTURE_DAY15, "P1");
        sut.enqueue(key, payload(JobCategory.NURTURE_DAY15, "P1"), 0);
        sut.pollDue(1, "dead");

        clock.advance(Duration.ofMinutes(6));
        assertThat(sut.requeueExpiredLeases()).isEmpty();

        assertThat(sut.pollDue(1, "c")).singleElement()
                .extracting(ScheduledJob::getAttempts).isEqualTo(2);
    }

    @Test
    @DisplayName("보관 기간이 지난 완료 기록을 지운다")
    void purge_completed() {
        String key = JobKey.of(JobCategory.DORMANT_CLOSEOUT, "P1");
        sut.enqueue(key, payload(JobCategory.DORMANT_CLOSEOUT, "P1"), 0);
        sut.complete(sut.pollDue(1, "c").get(0));

        clock.advance(Duration.ofDays(8));
        Instant now = clock.instant();
        int purged = sut.purgeFinished(now.minus(Duration.ofDays(7)), 1000, now.minus(Duration.ofDays(30)));

        assertThat(purged).isEqualTo(1);
        assertThat(sut.find(key)).isEmpty();
    }
}
