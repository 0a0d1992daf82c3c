package com.botops.scheduler.store;

import com.botops.scheduler.model.Job;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local store for single-node runs and tests. Nothing survives a restart.
 */
@Component
@ConditionalOnProperty(value = "app.scheduler.store", havingValue = "memory")
public class InMemoryJobStore implements JobStore {

    private final Map<String, Map<String, Job>> jobs = new ConcurrentHashMap<>();
    private final Map<String, Long> alarms = new ConcurrentHashMap<>();
    private final Map<String, String> leases = new ConcurrentHashMap<>();

    @Override
    public void put(Job job) {
        jobs.computeIfAbsent(job.tenantId(), ignored -> new ConcurrentHashMap<>()).put(job.id(), job);
    }

    @Override
    public Optional<Job> get(String tenantId, String jobId) {
        return Optional.ofNullable(jobs.getOrDefault(tenantId, Map.of()).get(jobId));
    }

    @Override
    public boolean delete(String tenantId, String jobId) {
        Map<String, Job> tenantJobs = jobs.get(tenantId);
        return tenantJobs != null && tenantJobs.remove(jobId) != null;
    }

    @Override
    public List<Job> list(String tenantId) {
        return new ArrayList<>(jobs.getOrDefault(tenantId, Map.of()).values());
    }

    @Override
    public OptionalLong getAlarm(String tenantId) {
        Long alarm = alarms.get(tenantId);
        return alarm == null ? OptionalLong.empty() : OptionalLong.of(alarm);
    }

    @Override
    public void setAlarm(String tenantId, long wakeAtMillis) {
        alarms.put(tenantId, wakeAtMillis);
    }

    @Override
    public void clearAlarm(String tenantId) {
        alarms.remove(tenantId);
    }

    @Override
    public List<String> claimDueAlarms(long nowMillis, int limit) {
        List<Map.Entry<String, Long>> due = alarms.entrySet()
                .stream()
                .filter(entry -> entry.getValue() <= nowMillis)
                .sorted(Map.Entry.comparingByValue(Comparator.naturalOrder()))
                .limit(limit)
                .map(entry -> Map.entry(entry.getKey(), entry.getValue()))
                .toList();

        List<String> claimed = new ArrayList<>(due.size());
        for (Map.Entry<String, Long> entry : due) {
            if (alarms.remove(entry.getKey(), entry.getValue())) {
                claimed.add(entry.getKey());
            }
        }
        return claimed;
    }

    // no expiry: a lease cannot outlive the process that holds it
    @Override
    public boolean tryAcquireLease(String tenantId, String owner, long ttlMillis) {
        return leases.putIfAbsent(tenantId, owner) == null;
    }

    @Override
    public void releaseLease(String tenantId, String owner) {
        leases.remove(tenantId, owner);
    }

    @Override
    public Set<String> tenants() {
        return Set.copyOf(jobs.keySet());
    }
}
