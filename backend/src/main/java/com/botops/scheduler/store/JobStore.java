package com.botops.scheduler.store;

import com.botops.scheduler.model.Job;

import java.util.List;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.Set;

/**
 * Durable per-tenant storage for scheduled jobs plus the tenant's single wake-up alarm.
 */
public interface JobStore {

    void put(Job job);

    Optional<Job> get(String tenantId, String jobId);

    boolean delete(String tenantId, String jobId);

    List<Job> list(String tenantId);

    OptionalLong getAlarm(String tenantId);

    void setAlarm(String tenantId, long wakeAtMillis);

    void clearAlarm(String tenantId);

    /**
     * Removes and returns up to {@code limit} tenants whose alarm is at or before {@code nowMillis}.
     * A tenant is returned by at most one caller.
     */
    List<String> claimDueAlarms(long nowMillis, int limit);

    /**
     * Takes the tenant's run lease for {@code owner} if no one holds it. Alarm runs happen only
     * under the lease, so a tenant is never run by two nodes at once.
     */
    boolean tryAcquireLease(String tenantId, String owner, long ttlMillis);

    /**
     * Releases the lease only if {@code owner} still holds it.
     */
    void releaseLease(String tenantId, String owner);

    Set<String> tenants();
}
