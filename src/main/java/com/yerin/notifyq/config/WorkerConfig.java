package com.yerin.notifyq.config;

import com.yerin.notifyq.application.JobDispatcher;
import com.yerin.notifyq.domain.DelayedJobQueue;
import com.yerin.notifyq.domain.NotifyqMetrics;
import com.yerin.notifyq.infra.WorkerRunner;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

@Configuration
public class WorkerConfig {

    @Bean(initMethod = "open", destroyMethod = "close")
    public WorkerRunner workerRunner(DelayedJobQueue queue,
                                     JobDispatcher dispatcher,
                                     NotifyqMetrics metrics,
                                     @Value("${notifyq.worker.concurrency:5}") int concurrency,
                                     @Value("${notifyq.worker.batch-size:1}") int batchSize,
                                     @Value("${notifyq.worker.poll-millis:1000}") long pollMillis) {
        return new WorkerRunner(queue, dispatcher, metrics, concurrency, batchSize, pollMillis);
    }

    // schedule() 한 번의 enqueue 들을 병렬로 보내는 작은 풀
    @Bean(name = "enqueueExecutor")
    public ThreadPoolTaskExecutor enqueueExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(4);
        executor.setMaxPoolSize(8);
        executor.setQueueCapacity(200);
        executor.setThreadNamePrefix("notifyq-enqueue-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(10);
        return executor;
    }
}
