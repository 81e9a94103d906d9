package com.yerin.notifyq.infra;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.yerin.notifyq.domain.*;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;
import org.springframework.data.redis.core.script.RedisScript;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.*;

/**
 * Redis 기반 지연 작업 브로커.
 * <pre>
 * {prefix}:due        ZSET key -> dueAt(ms)
 * {prefix}:leased     ZSET key -> leaseUntil(ms)
 * {prefix}:completed  ZSET key -> finishedAt(ms)  (완료/취소 감사 기록)
 * {prefix}:failed     ZSET key -> finishedAt(ms)
 * {prefix}:claims     STRING 전달마다 증가하는 claim 토큰
 * {prefix}:job:{key}  HASH payload, status, attempts, claim, dueAt, leaseUntil, lastError, finishedAt
 * </pre>
 * 상태 전이는 모두 Lua 스크립트 한 번으로 원자 처리한다.
 */
@Slf4j
public class RedisDelayedJobQueue implements DelayedJobQueue {

    private static final RedisScript<Long> ENQUEUE = new DefaultRedisScript<>("""
            redis.call('ZADD', KEYS[1], ARGV[3], ARGV[1])
            redis.call('HSET', KEYS[2], 'payload', ARGV[2], 'status', 'PENDING', 'attempts', '0', 'dueAt', ARGV[3], 'updatedAt', ARGV[4])
            redis.call('HDEL', KEYS[2], 'lastError', 'leaseUntil', 'finishedAt')
            redis.call('ZREM', KEYS[3], ARGV[1])
            redis.call('ZREM', KEYS[4], ARGV[1])
            return 1
            """, Long.class);

    // 반환값: "key\tclaim" 줄을 개행으로 이은 문자열
    private static final RedisScript<String> CLAIM = new DefaultRedisScript<>("""
            local keys = redis.call('ZRANGEBYSCORE', KEYS[1], '-inf', ARGV[1], 'LIMIT', 0, tonumber(ARGV[2]))
            local out = {}
            for _, k in ipairs(keys) do
              if redis.call('ZREM', KEYS[1], k) == 1 then
                redis.call('ZADD', KEYS[2], ARGV[3], k)
                local h = ARGV[4] .. k
                local c = redis.call('INCR', KEYS[3])
                redis.call('HINCRBY', h, 'attempts', 1)
                redis.call('HSET', h, 'status', 'EXECUTING', 'leaseUntil', ARGV[3], 'claim', c)
                table.insert(out, k .. '\\t' .. c)
              end
            end
            return table.concat(out, '\\n')
            """, String.class);

    private static final RedisScript<Long> CANCEL = new DefaultRedisScript<>("""
            if redis.call('ZREM', KEYS[1], ARGV[1]) == 0 then return 0 end
            redis.call('HSET', KEYS[2], 'status', 'CANCELLED', 'finishedAt', ARGV[2], 'updatedAt', ARGV[2])
            redis.call('ZADD', KEYS[3], ARGV[2], ARGV[1])
            return 1
            """, Long.class);

    // 다른 전달이 이미 가져갔거나 실행 중에 같은 키가 다시 예약되었으면 새 작업을 건드리지 않는다
    private static final RedisScript<Long> COMPLETE = new DefaultRedisScript<>("""
            if redis.call('HGET', KEYS[3], 'claim') ~= ARGV[3] then return 0 end
            redis.call('ZREM', KEYS[1], ARGV[1])
            if redis.call('ZSCORE', KEYS[2], ARGV[1]) then return 0 end
            redis.call('HSET', KEYS[3], 'status', 'COMPLETED', 'finishedAt', ARGV[2], 'updatedAt', ARGV[2])
            redis.call('HDEL', KEYS[3], 'leaseUntil')
            redis.call('ZADD', KEYS[4], ARGV[2], ARGV[1])
            return 1
            """, Long.class);

    private static final RedisScript<String> FAIL = new DefaultRedisScript<>("""
            if redis.call('HGET', KEYS[3], 'claim') ~= ARGV[7] then return 'SUPERSEDED' end
            redis.call('ZREM', KEYS[1], ARGV[1])
            if redis.call('ZSCORE', KEYS[2], ARGV[1]) then return 'SUPERSEDED' end
            if tonumber(ARGV[6]) >= tonumber(ARGV[3]) then
              redis.call('HSET', KEYS[3], 'status', 'FAILED', 'lastError', ARGV[5], 'finishedAt', ARGV[2], 'updatedAt', ARGV[2])
              redis.call('HDEL', KEYS[3], 'leaseUntil')
              redis.call('ZADD', KEYS[4], ARGV[2], ARGV[1])
              return 'EXHAUSTED'
            end
            redis.call('HSET', KEYS[3], 'status', 'PENDING', 'lastError', ARGV[5], 'dueAt', ARGV[4], 'updatedAt', ARGV[2])
            redis.call('HDEL', KEYS[3], 'leaseUntil')
            redis.call('ZADD', KEYS[2], ARGV[4], ARGV[1])
            return 'RETRY_SCHEDULED'
            """, String.class);

    // 반환값: 소진된 키를 개행으로 이은 문자열
    private static final RedisScript<String> REAP = new DefaultRedisScript<>("""
            local expired = redis.call('ZRANGEBYSCORE', KEYS[1], '-inf', ARGV[1])
            local exhausted = {}
            for _, k in ipairs(expired) do
              redis.call('ZREM', KEYS[1], k)
              if not redis.call('ZSCORE', KEYS[2], k) then
                local h = ARGV[3] .. k
                local attempts = tonumber(redis.call('HGET', h, 'attempts') or '0')
                if attempts >= tonumber(ARGV[2]) then
                  redis.call('HSET', h, 'status', 'FAILED', 'lastError', 'lease expired', 'finishedAt', ARGV[1], 'updatedAt', ARGV[1])
                  redis.call('HDEL', h, 'leaseUntil')
                  redis.call('ZADD', KEYS[3], ARGV[1], k)
                  table.insert(exhausted, k)
                else
                  redis.call('HSET', h, 'status', 'PENDING', 'dueAt', ARGV[1], 'updatedAt', ARGV[1])
                  redis.call('HDEL', h, 'leaseUntil')
                  redis.call('ZADD', KEYS[2], ARGV[1], k)
                end
              end
            end
            return table.concat(exhausted, '\\n')
            """, String.class);

    private static final RedisScript<Long> PURGE = new DefaultRedisScript<>("""
            local n = 0
            for i = 2, #ARGV do
              local k = ARGV[i]
              if redis.call('ZREM', KEYS[1], k) == 1 then
                local h = ARGV[1] .. k
                local s = redis.call('HGET', h, 'status')
                if s ~= 'PENDING' and s ~= 'EXECUTING' then redis.call('DEL', h) end
                n = n + 1
              end
            end
            return n
            """, Long.class);

    private final StringRedisTemplate redis;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final RetryPolicy retryPolicy;
    private final Duration leaseDuration;

    private final String dueKey;
    private final String leasedKey;
    private final String completedKey;
    private final String failedKey;
    private final String claimSeqKey;
    private final String jobKeyPrefix;

    public RedisDelayedJobQueue(StringRedisTemplate redis, ObjectMapper objectMapper, Clock clock,
                                RetryPolicy retryPolicy, Duration leaseDuration, String keyPrefix) {
        this.redis = redis;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.retryPolicy = retryPolicy;
        this.leaseDuration = leaseDuration;
        this.dueKey = keyPrefix + ":due";
        this.leasedKey = keyPrefix + ":leased";
        this.completedKey = keyPrefix + ":completed";
        this.failedKey = keyPrefix + ":failed";
        this.claimSeqKey = keyPrefix + ":claims";
        this.jobKeyPrefix = keyPrefix + ":job:";
    }

    @Override
    public boolean isAvailable() {
        return true;
    }

    @Override
    public String enqueue(String key, JobPayload payload, long delayMillis) {
        long now = clock.millis();
        long dueAt = now + Math.max(0, delayMillis);
        redis.execute(ENQUEUE, List.of(dueKey, hashKey(key), completedKey, failedKey),
                key, toJson(payload), String.valueOf(dueAt), String.valueOf(now));
        log.debug("[RedisQueue] enqueue key={}, dueAt={}", key, Instant.ofEpochMilli(dueAt));
        return key;
    }

    @Override
    public boolean cancel(String key) {
        Long removed = redis.execute(CANCEL, List.of(dueKey, hashKey(key), completedKey),
                key, String.valueOf(clock.millis()));
        return removed != null && removed == 1L;
    }

    @Override
    public List<ScheduledJob> pollDue(int max, String consumer) {
        long now = clock.millis();
        long leaseUntil = now + leaseDuration.toMillis();
        String claimed = redis.execute(CLAIM, List.of(dueKey, leasedKey, claimSeqKey),
                String.valueOf(now), String.valueOf(max), String.valueOf(leaseUntil), jobKeyPrefix);

        List<ScheduledJob> jobs = new ArrayList<>();
        for (String line : lines(claimed)) {
            int tab = line.lastIndexOf('\t');
            long claim = Long.parseLong(line.substring(tab + 1));
            read(line.substring(0, tab)).ifPresent(j -> jobs.add(j.toBuilder().claim(claim).build()));
        }
        if (jobs.isEmpty()) return List.of();
        log.debug("[RedisQueue] claimed {} jobs consumer={}", jobs.size(), consumer);
        return jobs;
    }

    @Override
    public void complete(ScheduledJob job) {
        Long done = redis.execute(COMPLETE, List.of(leasedKey, dueKey, hashKey(job.getKey()), completedKey),
                job.getKey(), String.valueOf(clock.millis()), String.valueOf(job.getClaim()));
        if (done != null && done == 0L) {
            log.debug("[RedisQueue] complete superseded key={}, claim={}", job.getKey(), job.getClaim());
        }
    }

    @Override
    public RetryDecision fail(ScheduledJob job, Throwable error) {
        long now = clock.millis();
        long retryAt = now + retryPolicy.backoffAfter(job.getAttempts()).toMillis();
        String decision = redis.execute(FAIL, List.of(leasedKey, dueKey, hashKey(job.getKey()), failedKey),
                job.getKey(),
                String.valueOf(now),
                String.valueOf(retryPolicy.maxAttempts()),
                String.valueOf(retryAt),
                error == null ? "" : error.toString(),
                String.valueOf(job.getAttempts()),
                String.valueOf(job.getClaim()));
        return RetryDecision.valueOf(decision);
    }

    @Override
    public List<ScheduledJob> requeueExpiredLeases() {
        String exhausted = redis.execute(REAP, List.of(leasedKey, dueKey, failedKey),
                String.valueOf(clock.millis()), String.valueOf(retryPolicy.maxAttempts()), jobKeyPrefix);

        List<ScheduledJob> jobs = new ArrayList<>();
        for (String key : lines(exhausted)) {
            read(key).ifPresent(jobs::add);
        }
        return jobs;
    }

    @Override
    public int purgeFinished(Instant completedBefore, int completedMax, Instant failedBefore) {
        int purged = 0;

        Set<String> oldCompleted = redis.opsForZSet()
                .rangeByScore(completedKey, Double.NEGATIVE_INFINITY, completedBefore.toEpochMilli() - 1);
        purged += purge(completedKey, oldCompleted);

        Long size = redis.opsForZSet().zCard(completedKey);
        if (size != null && size > completedMax) {
            Set<String> overflow = redis.opsForZSet().range(completedKey, 0, size - completedMax - 1);
            purged += purge(completedKey, overflow);
        }

        Set<String> oldFailed = redis.opsForZSet()
                .rangeByScore(failedKey, Double.NEGATIVE_INFINITY, failedBefore.toEpochMilli() - 1);
        purged += purge(failedKey, oldFailed);
        return purged;
    }

    @Override
    public Optional<ScheduledJob> find(String key) {
        return read(key);
    }

    @Override
    public long pendingCount() {
        Long n = redis.opsForZSet().zCard(dueKey);
        return n == null ? 0 : n;
    }

    private int purge(String setKey, Set<String> keys) {
        if (keys == null || keys.isEmpty()) return 0;
        List<String> args = new ArrayList<>(keys.size() + 1);
        args.add(jobKeyPrefix);
        args.addAll(keys);
        Long n = redis.execute(PURGE, List.of(setKey), args.toArray());
        return n == null ? 0 : n.intValue();
    }

    private Optional<ScheduledJob> read(String key) {
        Map<Object, Object> h = redis.opsForHash().entries(hashKey(key));
        if (h == null || h.isEmpty()) return Optional.empty();

        return Optional.of(ScheduledJob.builder()
                .key(key)
                .payload(fromJson(key, (String) h.get("payload")))
                .status(JobStatus.valueOf((String) h.get("status")))
                .attempts(Integer.parseInt((String) h.getOrDefault("attempts", "0")))
                .dueAt(millis(h.get("dueAt")))
                .leaseUntil(millis(h.get("leaseUntil")))
                .lastError((String) h.get("lastError"))
                .claim(Long.parseLong((String) h.getOrDefault("claim", "0")))
                .build());
    }

    private static List<String> lines(String joined) {
        if (joined == null || joined.isEmpty()) return List.of();
        return Arrays.asList(joined.split("\n"));
    }

    private String hashKey(String key) {
        return jobKeyPrefix + key;
    }

    private static Instant millis(Object v) {
        return v == null ? null : Instant.ofEpochMilli(Long.parseLong((String) v));
    }

    private String toJson(JobPayload payload) {
        try {
            return objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("payload serialization failed", e);
        }
    }

    // 역직렬화할 수 없는 페이로드는 null 로 두고 디스패처가 unknown category 로 건너뛰게 한다
    private JobPayload fromJson(String key, String json) {
        if (json == null) return null;
        try {
            return objectMapper.readValue(json, JobPayload.class);
        } catch (JsonProcessingException e) {
            log.warn("[RedisQueue] unreadable payload key={}, err={}", key, e.getOriginalMessage());
            return null;
        }
    }
}
