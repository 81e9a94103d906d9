package com.yerin.notifyq.infra;

import com.yerin.notifyq.domain.*;
import com.yerin.notifyq.support.MutableClock;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

@DisplayName("메모리 브로커 테스트")
public class InMemoryDelayedJobQueueTest {

    MutableClock clock = new MutableClock(Instant.parse("2026-01-01T10:00:00Z"));
    InMemoryDelayedJobQueue sut = new InMemoryDelayedJobQueue(clock, RetryPolicy.DEFAULT, Duration.ofMinutes(5));

    private static JobPayload payload(String entityId) {
        return JobPayload.of(JobCategory.KYC_REMINDER_1, entityId, "F1", null, null, Map.of());
    }

    @Test
    @DisplayName("due 전에는 가져가지 않는다")
    void not_polled_before_due() {
        sut.enqueue("k1", payload("P1"), 60_000);

        assertThat(sut.pollDue(10, "c")).isEmpty();
        clock.advance(Duration.ofMinutes(1));
        assertThat(sut.pollDue(10, "c")).extracting(ScheduledJob::getKey).containsExactly("k1");
    }

    @Test
    @DisplayName("같은 키로 다시 넣으면 due 시각이 교체되고 pending 은 하나")
    void enqueue_replaces_pending() {
        sut.enqueue("k1", payload("P1"), 60_000);
        sut.enqueue("k1", payload("P1"), 120_000);

        assertThat(sut.pendingCount()).isEqualTo(1);
        assertThat(sut.find("k1")).get()
                .extracting(ScheduledJob::getDueAt)
                .isEqualTo(clock.instant().plusMillis(120_000));
    }

    @Test
    @DisplayName("cancel 은 pending 일 때만 true, 두 번째는 false")
    void cancel_idempotent() {
        sut.enqueue("k1", payload("P1"), 60_000);

        assertThat(sut.cancel("k1")).isTrue();
        assertThat(sut.cancel("k1")).isFalse();
        assertThat(sut.cancel("missing")).isFalse();
        assertThat(sut.find("k1")).get().extracting(ScheduledJob::getStatus).isEqualTo(JobStatus.CANCELLED);
    }

    @Test
    @DisplayName("실행 중인 작업은 취소할 수 없다")
    void executing_job_cannot_be_cancelled() {
        sut.enqueue("k1", payload("P1"), 1);
        clock.advance(Duration.ofSeconds(1));
        sut.pollDue(1, "c");

        assertThat(sut.cancel("k1")).isFalse();
    }

    @Test
    @DisplayName("실패하면 백오프 후 재시도, 세 번째 실패에서 소진")
    void retry_then_exhaust() {
        sut.enqueue("k1", payload("P1"), 1);
        clock.advance(Duration.ofSeconds(1));

        ScheduledJob first = sut.pollDue(1, "c").get(0);
        assertThat(first.getAttempts()).isEqualTo(1);
        assertThat(sut.fail(first, new RuntimeException("smtp down"))).isEqualTo(RetryDecision.RETRY_SCHEDULED);

        clock.advance(Duration.ofSeconds(59));
        assertThat(sut.pollDue(1, "c")).isEmpty();
        clock.advance(Duration.ofSeconds(1));
        ScheduledJob second = sut.pollDue(1, "c").get(0);
        assertThat(second.getAttempts()).isEqualTo(2);
        assertThat(sut.fail(second, new RuntimeException("smtp down"))).isEqualTo(RetryDecision.RETRY_SCHEDULED);

        clock.advance(Duration.ofSeconds(120));
        ScheduledJob third = sut.pollDue(1, "c").get(0);
        assertThat(sut.fail(third, new RuntimeException("smtp down"))).isEqualTo(RetryDecision.EXHAUSTED);

        assertThat(sut.find("k1")).get().extracting(ScheduledJob::getStatus).isEqualTo(JobStatus.FAILED);
        assertThat(sut.pendingCount()).isZero();
    }

    @Test
    @DisplayName("실행 중 다시 예약되면 완료 처리가 새 작업을 지우지 않는다")
    void complete_does_not_clobber_reschedule() {
        sut.enqueue("k1", payload("P1"), 1);
        clock.advance(Duration.ofSeconds(1));
        ScheduledJob running = sut.pollDue(1, "c").get(0);

        sut.enqueue("k1", payload("P1"), 60_000);
        sut.complete(running);

        assertThat(sut.find("k1")).get().extracting(ScheduledJob::getStatus).isEqualTo(JobStatus.PENDING);
        assertThat(sut.fail(running, new RuntimeException("x"))).isEqualTo(RetryDecision.SUPERSEDED);
    }

    @Test
    @DisplayName("재예약된 작업이 다시 실행 중이면 이전 전달의 완료/실패가 새 lease 를 지우지 않는다")
    void stale_delivery_does_not_release_new_lease() {
        sut.enqueue("k1", payload("P1"), 0);
        ScheduledJob first = sut.pollDue(1, "c").get(0);

        sut.enqueue("k1", payload("P1"), 0);
        ScheduledJob second = sut.pollDue(1, "c").get(0);
        assertThat(second.getClaim()).isNotEqualTo(first.getClaim());

        sut.complete(first);
        assertThat(sut.fail(first, new RuntimeException("late"))).isEqualTo(RetryDecision.SUPERSEDED);

        assertThat(sut.find("k1")).get().extracting(ScheduledJob::getStatus).isEqualTo(JobStatus.EXECUTING);
        // 두 번째 전달은 여전히 reaper 의 보호를 받는다
        clock.advance(Duration.ofMinutes(6));
        assertThat(sut.requeueExpiredLeases()).isEmpty();
        assertThat(sut.pendingCount()).isEqualTo(1);
    }

    @Test
    @DisplayName("lease 가 만료되면 다시 due 로 돌아가고 마지막 시도면 소진으로 반환")
    void lease_reaper() {
        sut.enqueue("k1", payload("P1"), 1);
        clock.advance(Duration.ofSeconds(1));
        sut.pollDue(1, "c");

        clock.advance(Duration.ofMinutes(6));
        assertThat(sut.requeueExpiredLeases()).isEmpty();
        assertThat(sut.pendingCount()).isEqualTo(1);

        // 2, 3번째 시도도 lease 만료
        sut.pollDue(1, "c");
        clock.advance(Duration.ofMinutes(6));
        sut.requeueExpiredLeases();
        sut.pollDue(1, "c");
        clock.advance(Duration.ofMinutes(6));

        List<ScheduledJob> exhausted = sut.requeueExpiredLeases();
        assertThat(exhausted).extracting(ScheduledJob::getKey).containsExactly("k1");
        assertThat(sut.find("k1")).get().extracting(ScheduledJob::getStatus).isEqualTo(JobStatus.FAILED);
    }

    @Test
    @DisplayName("보관 기간이 지난 완료/실패 기록은 지워진다")
    void purge_finished() {
        for (int i = 0; i < 3; i++) {
            sut.enqueue("done" + i, payload("P" + i), 1);
        }
        clock.advance(Duration.ofSeconds(1));
        sut.pollDue(10, "c").forEach(sut::complete);

        clock.advance(Duration.ofDays(8));
        sut.enqueue("fresh", payload("PX"), 1);
        clock.advance(Duration.ofSeconds(1));
        sut.pollDue(10, "c").forEach(sut::complete);

        Instant now = clock.instant();
        int purged = sut.purgeFinished(now.minus(Duration.ofDays(7)), 1000, now.minus(Duration.ofDays(30)));

        assertThat(purged).isEqualTo(3);
        assertThat(sut.find("done0")).isEmpty();
        assertThat(sut.find("fresh")).isPresent();
    }

    @Test
    @DisplayName("완료 기록은 최대 개수를 넘으면 오래된 것부터 지운다")
    void purge_completed_over_max() {
        for (int i = 0; i < 3; i++) {
            sut.enqueue("done" + i, payload("P" + i), 1);
            clock.advance(Duration.ofSeconds(1));
            sut.pollDue(10, "c").forEach(sut::complete);
        }
        Instant now = clock.instant();

        int purged = sut.purgeFinished(now.minus(Duration.ofDays(7)), 2, now.minus(Duration.ofDays(30)));

        assertThat(purged).isEqualTo(1);
        assertThat(sut.find("done0")).isEmpty();
        assertThat(sut.find("done2")).isPresent();
    }
}
