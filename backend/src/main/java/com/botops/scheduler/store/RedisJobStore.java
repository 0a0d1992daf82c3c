package com.botops.scheduler.store;

import com.botops.config.AppProperties;
import com.botops.scheduler.model.Job;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.RedisScript;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.Set;

@Component
@ConditionalOnProperty(value = "app.scheduler.store", havingValue = "redis", matchIfMissing = true)
public class RedisJobStore implements JobStore {

    private static final RedisScript<Long> RELEASE_LEASE = RedisScript.of(
            "if redis.call('get', KEYS[1]) == ARGV[1] then return redis.call('del', KEYS[1]) else return 0 end",
            Long.class);

    private final StringRedisTemplate redisTemplate;
    private final ObjectMapper objectMapper;
    private final String keyPrefix;

    public RedisJobStore(StringRedisTemplate redisTemplate, ObjectMapper objectMapper, AppProperties appProperties) {
        this.redisTemplate = redisTemplate;
        this.objectMapper = objectMapper;
        this.keyPrefix = appProperties.scheduler().keyPrefix();
    }

    @Override
    public void put(Job job) {
        try {
            String payload = objectMapper.writeValueAsString(job);
            redisTemplate.opsForHash().put(jobsKey(job.tenantId()), job.id(), payload);
            redisTemplate.opsForSet().add(tenantsKey(), job.tenantId());
        } catch (Exception exception) {
            throw new IllegalStateException("Unable to store job " + job.id(), exception);
        }
    }

    @Override
    public Optional<Job> get(String tenantId, String jobId) {
        Object payload = redisTemplate.opsForHash().get(jobsKey(tenantId), jobId);
        if (payload == null) {
            return Optional.empty();
        }
        return Optional.of(read(payload.toString()));
    }

    @Override
    public boolean delete(String tenantId, String jobId) {
        Long removed = redisTemplate.opsForHash().delete(jobsKey(tenantId), jobId);
        return removed != null && removed > 0;
    }

    @Override
    public List<Job> list(String tenantId) {
        Map<Object, Object> entries = redisTemplate.opsForHash().entries(jobsKey(tenantId));
        List<Job> jobs = new ArrayList<>(entries.size());
        for (Object payload : entries.values()) {
            jobs.add(read(payload.toString()));
        }
        return jobs;
    }

    @Override
    public OptionalLong getAlarm(String tenantId) {
        Double score = redisTemplate.opsForZSet().score(alarmsKey(), tenantId);
        return score == null ? OptionalLong.empty() : OptionalLong.of(score.longValue());
    }

    @Override
    public void setAlarm(String tenantId, long wakeAtMillis) {
        redisTemplate.opsForZSet().add(alarmsKey(), tenantId, wakeAtMillis);
    }

    @Override
    public void clearAlarm(String tenantId) {
        redisTemplate.opsForZSet().remove(alarmsKey(), tenantId);
    }

    @Override
    public List<String> claimDueAlarms(long nowMillis, int limit) {
        Set<String> due = redisTemplate.opsForZSet()
                .rangeByScore(alarmsKey(), Double.NEGATIVE_INFINITY, nowMillis, 0, limit);
        if (due == null || due.isEmpty()) {
            return List.of();
        }

        List<String> claimed = new ArrayList<>(due.size());
        for (String tenantId : due) {
            Long removed = redisTemplate.opsForZSet().remove(alarmsKey(), tenantId);
            if (removed != null && removed > 0) {
                claimed.add(tenantId);
            }
        }
        return claimed;
    }

    @Override
    public boolean tryAcquireLease(String tenantId, String owner, long ttlMillis) {
        Boolean acquired = redisTemplate.opsForValue()
                .setIfAbsent(leaseKey(tenantId), owner, Duration.ofMillis(ttlMillis));
        return Boolean.TRUE.equals(acquired);
    }

    @Override
    public void releaseLease(String tenantId, String owner) {
        redisTemplate.execute(RELEASE_LEASE, List.of(leaseKey(tenantId)), owner);
    }

    @Override
    public Set<String> tenants() {
        Set<String> members = redisTemplate.opsForSet().members(tenantsKey());
        return members == null ? Set.of() : members;
    }

    private Job read(String payload) {
        try {
            return objectMapper.readValue(payload, Job.class);
        } catch (Exception exception) {
            throw new IllegalStateException("Unable to read stored job", exception);
        }
    }

    private String jobsKey(String tenantId) {
        return keyPrefix + ":tenant:" + tenantId + ":jobs";
    }

    private String leaseKey(String tenantId) {
        return keyPrefix + ":tenant:" + tenantId + ":lease";
    }

    private String alarmsKey() {
        return keyPrefix + ":alarms";
    }

    private String tenantsKey() {
        return keyPrefix + ":tenants";
    }
}
