package com.yerin.notifyq.application;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.yerin.notifyq.domain.*;
import com.yerin.notifyq.repository.JobEventLogRepository;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.transaction.CannotCreateTransactionException;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@DisplayName("수명주기 이벤트 로거 테스트")
public class JobLifecycleLoggerTest {

    static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");

    JobEventLogRepository repository = mock(JobEventLogRepository.class);
    JobLifecycleLogger sut = new JobLifecycleLogger(new ObjectMapper(), repository, Clock.fixed(NOW, ZoneOffset.UTC));

    private static ScheduledJob job() {
        JobPayload p = JobPayload.of(JobCategory.CAPITAL_CALL_PAST_DUE, "I1", "F1", NOW, NOW, Map.of());
        return ScheduledJob.builder().key("capital_call_past_due:capital_call:I1").payload(p)
                .attempts(3).status(JobStatus.FAILED).lastError("smtp down").build();
    }

    @Test
    @DisplayName("exhausted 이벤트는 마지막 오류와 함께 적재된다")
    void exhausted_persisted() {
        sut.exhausted(job(), null);

        ArgumentCaptor<JobEventLog> saved = ArgumentCaptor.forClass(JobEventLog.class);
        verify(repository).save(saved.capture());
        JobEventLog e = saved.getValue();
        assertThat(e.getEventType()).isEqualTo(JobLifecycleLogger.EXHAUSTED_EVENT);
        assertThat(e.getJobKey()).isEqualTo("capital_call_past_due:capital_call:I1");
        assertThat(e.getMessage()).isEqualTo("smtp down");
        assertThat(e.getTs()).isEqualTo(NOW);
    }

    @Test
    @DisplayName("skipped 이벤트는 사유와 소요시간을 남긴다")
    void skipped_persisted() {
        sut.skipped(job(), HandlerOutcome.STALE_STATE, 12);

        ArgumentCaptor<JobEventLog> saved = ArgumentCaptor.forClass(JobEventLog.class);
        verify(repository).save(saved.capture());
        assertThat(saved.getValue().getEventType()).isEqualTo("skipped");
        assertThat(saved.getValue().getMessage()).isEqualTo(HandlerOutcome.STALE_STATE);
        assertThat(saved.getValue().getDurationMs()).isEqualTo(12L);
    }

    @Test
    @DisplayName("감사 테이블 적재 실패는 호출자에게 전파되지 않는다")
    void persist_failure_contained() {
        when(repository.save(any())).thenThrow(new DataAccessResourceFailureException("db down"));

        assertThatCode(() -> sut.completed(job(), 5)).doesNotThrowAnyException();
    }

    @Test
    @DisplayName("DB 연결 실패로 트랜잭션을 못 열어도 started/skipped 는 예외 없이 끝난다")
    void transaction_failure_contained() {
        when(repository.save(any())).thenThrow(new CannotCreateTransactionException("db down"));

        assertThatCode(() -> {
            sut.started(job());
            sut.skipped(job(), HandlerOutcome.UNKNOWN_CATEGORY, 0);
            sut.exhausted(job(), null);
        }).doesNotThrowAnyException();
    }
}
