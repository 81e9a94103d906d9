package com.yerin.notifyq.infra;

import com.yerin.notifyq.domain.*;
import com.yerin.notifyq.repository.JobEventLogRepository;
import com.yerin.notifyq.support.MutableClock;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DataAccessResourceFailureException;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@DisplayName("감사 보관 정리 테스트")
public class AuditRetentionWorkerTest {

    static final Instant START = Instant.parse("2026-01-01T00:00:00Z");

    MutableClock clock = new MutableClock(START);
    InMemoryDelayedJobQueue queue = new InMemoryDelayedJobQueue(clock, new RetryPolicy(1, 1000, 1000, 0.0), Duration.ofMinutes(5));
    JobEventLogRepository repository = mock(JobEventLogRepository.class);
    AuditRetentionWorker sut = new AuditRetentionWorker(queue, repository, clock, 7, 1000, 30);

    private void runToCompletion(String key) {
        queue.enqueue(key, JobPayload.of(JobCategory.KYC_REMINDER_1, "P1", "F1", null, null, Map.of()), 0);
        queue.complete(queue.pollDue(1, "c").get(0));
    }

    private void runToFailure(String key) {
        queue.enqueue(key, JobPayload.of(JobCategory.KYC_REMINDER_1, "P2", "F1", null, null, Map.of()), 0);
        queue.fail(queue.pollDue(1, "c").get(0), new IllegalStateException("x"));
    }

    @Test
    @DisplayName("완료 기록은 7일, 실패 기록은 30일 뒤 지워진다")
    void retention_windows() {
        runToCompletion("done");
        runToFailure("failed");

        clock.advance(Duration.ofDays(8));
        sut.run();
        assertThat(queue.find("done")).isEmpty();
        assertThat(queue.find("failed")).isPresent();

        clock.advance(Duration.ofDays(23));
        sut.run();
        assertThat(queue.find("failed")).isEmpty();
        verify(repository).deleteOlderThan(START.plus(Duration.ofDays(31)).minus(Duration.ofDays(30)));
    }

    @Test
    @DisplayName("이벤트 로그 정리 실패는 워커를 멈추지 않는다")
    void event_purge_failure_contained() {
        when(repository.deleteOlderThan(any())).thenThrow(new DataAccessResourceFailureException("db down"));

        assertThatCode(sut::run).doesNotThrowAnyException();
    }
}
