package com.yerin.notifyq.infra;

import com.yerin.notifyq.application.JobDispatcher;
import com.yerin.notifyq.domain.DelayedJobQueue;
import com.yerin.notifyq.domain.NotifyqMetrics;
import com.yerin.notifyq.domain.RetryDecision;
import com.yerin.notifyq.domain.ScheduledJob;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * 고정 크기 스레드 풀로 due 작업을 가져와 디스패처에 넘긴다.
 * 수명주기는 open()/close() 로 명시한다.
 */
@Slf4j
public class WorkerRunner {

    private final DelayedJobQueue queue;
    private final JobDispatcher dispatcher;
    private final NotifyqMetrics metrics;
    private final int concurrency;
    private final int batchSize;
    private final long pollMillis;

    private ExecutorService workers;
    private volatile boolean running = false;

    public WorkerRunner(DelayedJobQueue queue, JobDispatcher dispatcher, NotifyqMetrics metrics,
                        int concurrency, int batchSize, long pollMillis) {
        if (concurrency < 1) throw new IllegalArgumentException("concurrency must be >= 1");
        this.queue = queue;
        this.dispatcher = dispatcher;
        this.metrics = metrics;
        this.concurrency = concurrency;
        this.batchSize = Math.max(1, batchSize);
        this.pollMillis = pollMillis;
    }

    public synchronized void open() {
        if (running) return;
        if (!queue.isAvailable()) {
            log.warn("[Worker] broker not configured, worker not started");
            return;
        }
        running = true;
        workers = Executors.newFixedThreadPool(concurrency);
        for (int i = 0; i < concurrency; i++) {
            final String consumer = WorkerId.consumerName("notifyq", i);
            workers.submit(() -> loop(consumer));
        }
        log.info("[Worker] started {} consumers, batchSize={}", concurrency, batchSize);
    }

    public synchronized void close() {
        if (!running) return;
        running = false;
        workers.shutdownNow();
        try {
            if (!workers.awaitTermination(10, TimeUnit.SECONDS)) {
                log.warn("[Worker] consumers did not stop within 10s");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        log.info("[Worker] stopped");
    }

    public boolean isRunning() {
        return running;
    }

    private void loop(String consumer) {
        while (running && !Thread.currentThread().isInterrupted()) {
            try {
                if (pollOnce(consumer) == 0) Thread.sleep(pollMillis);
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
            } catch (Exception e) {
                log.warn("[Worker] poll loop error: {}", e.toString());
                try {
                    Thread.sleep(pollMillis);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                }
            }
        }
    }

    public int pollOnce(String consumer) {
        List<ScheduledJob> jobs = queue.pollDue(batchSize, consumer);
        for (ScheduledJob job : jobs) {
            runOne(job);
        }
        return jobs.size();
    }

    void runOne(ScheduledJob job) {
        try {
            dispatcher.process(job);
        } catch (Exception e) {
            onFailure(job, e);
            return;
        }
        try {
            queue.complete(job);
        } catch (Exception e) {
            // lease 만료 후 재전달되고 핸들러 상태 검사가 중복 발송을 막는다
            log.error("[Worker] complete failed key={}, err={}", job.getKey(), e.toString());
        }
    }

    private void onFailure(ScheduledJob job, Exception error) {
        try {
            RetryDecision decision = queue.fail(job, error);
            switch (decision) {
                case EXHAUSTED -> {
                    log.warn("[Worker] exhausted key={}, attempts={}", job.getKey(), job.getAttempts());
                    dispatcher.onExhausted(job, error);
                }
                case RETRY_SCHEDULED -> {
                    metrics.incRetried();
                    log.info("[Worker] reserved retry key={}, attempt={}", job.getKey(), job.getAttempts());
                }
                case SUPERSEDED -> log.debug("[Worker] failed job superseded by re-schedule key={}", job.getKey());
            }
        } catch (Exception nested) {
            log.error("[Worker] retry-flow error key={}, err={}", job.getKey(), nested.toString());
        }
    }
}
