package com.yerin.notifyq.application;

import com.yerin.notifyq.domain.NotifyqMetrics;
import com.yerin.notifyq.domain.ScheduledJob;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Optional;

/**
 * 전달된 작업 한 건을 카테고리 핸들러로 보내고 수명주기 이벤트를 남긴다.
 * 핸들러 예외는 기록 후 그대로 다시 던져서 브로커 재시도가 적용되게 한다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class JobDispatcher {

    private final JobHandlerRegistry registry;
    private final JobLifecycleLogger lifecycle;
    private final NotifyqMetrics metrics;

    public HandlerOutcome process(ScheduledJob job) {
        lifecycle.started(job);

        Optional<JobHandler> handler = job.getPayload() == null ? Optional.empty() : registry.find(job.category());
        if (handler.isEmpty()) {
            log.warn("[Dispatcher] unknown category={}, key={}", job.category(), job.getKey());
            lifecycle.skipped(job, HandlerOutcome.UNKNOWN_CATEGORY, 0);
            metrics.incSkipped();
            return HandlerOutcome.skipped(HandlerOutcome.UNKNOWN_CATEGORY);
        }

        long start = System.nanoTime();
        try {
            HandlerOutcome outcome = handler.get().handle(job);
            long ms = elapsedMillis(start);
            if (outcome.sent()) {
                lifecycle.completed(job, ms);
                metrics.incCompleted();
            } else {
                lifecycle.skipped(job, outcome.skipReason(), ms);
                metrics.incSkipped();
            }
            return outcome;
        } catch (RuntimeException e) {
            lifecycle.failed(job, elapsedMillis(start), e);
            metrics.incFailed();
            throw e;
        } finally {
            metrics.handlerTimer(job.category()).record(Duration.ofNanos(System.nanoTime() - start));
        }
    }

    public void onExhausted(ScheduledJob job, Throwable lastError) {
        lifecycle.exhausted(job, lastError);
        metrics.incExhausted();
    }

    private static long elapsedMillis(long startNanos) {
        return Duration.ofNanos(System.nanoTime() - startNanos).toMillis();
    }
}
