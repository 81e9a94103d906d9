package com.yerin.notifyq.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.yerin.notifyq.domain.DelayedJobQueue;
import com.yerin.notifyq.infra.InMemoryDelayedJobQueue;
import com.yerin.notifyq.infra.NoopDelayedJobQueue;
import com.yerin.notifyq.infra.RedisDelayedJobQueue;
import com.yerin.notifyq.infra.RetryPolicy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnExpression;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Profile;
import org.springframework.data.redis.connection.lettuce.LettuceClientConfiguration;
import org.springframework.data.redis.connection.lettuce.LettuceConnectionFactory;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.time.Clock;
import java.time.Duration;

/**
 * 브로커 선택: local-inmem 프로필이면 메모리, 연결 문자열이 있으면 Redis, 없으면 no-op.
 * 연결 문자열은 시작 시 한 번만 읽는다. Redis 자동 구성은 꺼 두었으므로 연결과 템플릿은 여기서만 만든다.
 */
@Slf4j
@Configuration
public class QueueConfig {

    private static final String REDIS_URL_PRESENT = "!'${notifyq.queue.redis-url:}'.isBlank()";

    @Bean
    public RetryPolicy retryPolicy(@Value("${notifyq.retry.max-attempts:3}") int maxAttempts,
                                   @Value("${notifyq.retry.base-backoff-millis:60000}") long baseBackoffMillis,
                                   @Value("${notifyq.retry.backoff-cap-millis:3600000}") long backoffCapMillis,
                                   @Value("${notifyq.retry.jitter-ratio:0.0}") double jitterRatio) {
        return new RetryPolicy(maxAttempts, baseBackoffMillis, backoffCapMillis, jitterRatio);
    }

    @Bean
    @ConditionalOnExpression(REDIS_URL_PRESENT)
    public LettuceConnectionFactory notifyqRedisConnectionFactory(
            @Value("${notifyq.queue.redis-url}") String redisUrl,
            @Value("${notifyq.queue.command-timeout-millis:2000}") long commandTimeoutMillis) {
        LettuceClientConfiguration.LettuceClientConfigurationBuilder client = LettuceClientConfiguration.builder()
                .commandTimeout(Duration.ofMillis(commandTimeoutMillis));
        if (redisUrl.startsWith("rediss://")) {
            client.useSsl();
        }
        return new LettuceConnectionFactory(LettuceConnectionFactory.createRedisConfiguration(redisUrl), client.build());
    }

    @Bean
    @ConditionalOnExpression(REDIS_URL_PRESENT)
    public StringRedisTemplate notifyqRedisTemplate(LettuceConnectionFactory notifyqRedisConnectionFactory) {
        return new StringRedisTemplate(notifyqRedisConnectionFactory);
    }

    @Bean
    @Profile("local-inmem")
    public DelayedJobQueue inMemoryDelayedJobQueue(Clock clock, RetryPolicy retryPolicy,
                                                   @Value("${notifyq.worker.lease-seconds:300}") long leaseSeconds) {
        log.info("[QueueConfig] using in-memory broker");
        return new InMemoryDelayedJobQueue(clock, retryPolicy, Duration.ofSeconds(leaseSeconds));
    }

    @Bean
    @Profile("!local-inmem")
    public DelayedJobQueue delayedJobQueue(@Value("${notifyq.queue.redis-url:}") String redisUrl,
                                           @Value("${notifyq.queue.key-prefix:notifyq}") String keyPrefix,
                                           @Value("${notifyq.worker.lease-seconds:300}") long leaseSeconds,
                                           ObjectProvider<StringRedisTemplate> redis,
                                           ObjectMapper objectMapper,
                                           Clock clock,
                                           RetryPolicy retryPolicy) {
        if (redisUrl == null || redisUrl.isBlank()) {
            log.warn("[QueueConfig] notifyq.queue.redis-url not set, scheduling and cancellation are disabled");
            return new NoopDelayedJobQueue();
        }
        log.info("[QueueConfig] using redis broker prefix={}", keyPrefix);
        return new RedisDelayedJobQueue(redis.getObject(), objectMapper, clock, retryPolicy,
                Duration.ofSeconds(leaseSeconds), keyPrefix);
    }
}
