package com.yerin.notifyq.domain;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

@Component
public class NotifyqMetrics {

    private final MeterRegistry registry;

    private final Counter jobScheduled;
    private final Counter jobSkippedPast;
    private final Counter enqueueFailed;
    private final Counter jobCancelled;
    private final Counter jobCompleted;
    private final Counter jobSkipped;
    private final Counter jobFailed;
    private final Counter jobRetried;
    private final Counter jobExhausted;

    public NotifyqMetrics(MeterRegistry registry) {
        this.registry = registry;
        this.jobScheduled   = Counter.builder("notifyq_jobs_scheduled_total")
                .description("jobs enqueued with a future due time").register(registry);
        this.jobSkippedPast = Counter.builder("notifyq_jobs_skipped_past_total")
                .description("policy offsets already elapsed at schedule time").register(registry);
        this.enqueueFailed  = Counter.builder("notifyq_enqueue_failed_total")
                .description("enqueue calls rejected by the broker").register(registry);
        this.jobCancelled   = Counter.builder("notifyq_jobs_cancelled_total")
                .description("pending jobs removed by suppression or direct cancel").register(registry);
        this.jobCompleted   = Counter.builder("notifyq_jobs_completed_total")
                .description("jobs whose handler sent the notification").register(registry);
        this.jobSkipped     = Counter.builder("notifyq_jobs_skipped_total")
                .description("jobs skipped at dispatch (stale state, unknown category, not found)").register(registry);
        this.jobFailed      = Counter.builder("notifyq_jobs_failed_total")
                .description("handler attempts that threw").register(registry);
        this.jobRetried     = Counter.builder("notifyq_jobs_retried_total")
                .description("jobs rescheduled with backoff").register(registry);
        this.jobExhausted   = Counter.builder("notifyq_jobs_exhausted_total")
                .description("jobs that used every attempt").register(registry);
    }

    public void incScheduled()          { jobScheduled.increment(); }
    public void incSkippedPast()        { jobSkippedPast.increment(); }
    public void incEnqueueFailed()      { enqueueFailed.increment(); }
    public void incCancelled(int count) { jobCancelled.increment(count); }
    public void incCompleted()          { jobCompleted.increment(); }
    public void incSkipped()            { jobSkipped.increment(); }
    public void incFailed()             { jobFailed.increment(); }
    public void incRetried()            { jobRetried.increment(); }
    public void incExhausted()          { jobExhausted.increment(); }

    // 카테고리 태그가 붙은 핸들러 타이머
    public Timer handlerTimer(String category) {
        return Timer.builder("notifyq_handler_duration_seconds")
                .description("handler duration by category")
                .tag("category", category == null ? "unknown" : category)
                .publishPercentiles(0.5, 0.9, 0.95, 0.99)
                .register(registry);
    }
}
