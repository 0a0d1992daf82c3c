package com.botops.scheduler.service;

import com.botops.config.AppProperties;
import com.botops.delivery.error.BlockedRecipientException;
import com.botops.delivery.error.InvalidRequestException;
import com.botops.delivery.error.RateLimitException;
import com.botops.delivery.error.SenderConfigurationException;
import com.botops.delivery.service.MessageSender;
import com.botops.delivery.service.MessageSenderRegistry;
import com.botops.executionlog.service.ExecutionLogService;
import com.botops.scheduler.model.Job;
import com.botops.scheduler.model.SendResult;
import com.botops.scheduler.store.JobStore;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Comparator;
import java.util.List;
import java.util.OptionalLong;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Scheduling actor for a single tenant. Owns the tenant's job set and its one alarm.
 *
 * <p>Every read-modify-write of the job set and the alarm happens under {@code stateLock};
 * sender calls run outside it so submissions never wait on provider I/O. Timer callbacks for
 * one tenant never overlap: a fire arriving while another is running is folded into a rerun
 * of the running one. Across nodes a run holds the tenant's lease in the job store; a node
 * that cannot take it pushes the alarm back by {@code lease.retryMs} and returns.
 */
public class TenantScheduler {

    private static final Logger log = LoggerFactory.getLogger(TenantScheduler.class);

    private final String tenantId;
    private final String nodeId;
    private final JobStore store;
    private final MessageSenderRegistry registry;
    private final ExecutionLogService executionLogService;
    private final RecurrenceCalculator recurrenceCalculator;
    private final AppProperties.Retry retry;
    private final AppProperties.Lease lease;
    private final Clock clock;
    private final MeterRegistry meterRegistry;

    private final ReentrantLock stateLock = new ReentrantLock();
    private final ReentrantLock timerLock = new ReentrantLock();
    private final AtomicBoolean wakeRequested = new AtomicBoolean(false);

    public TenantScheduler(String tenantId,
                           String nodeId,
                           JobStore store,
                           MessageSenderRegistry registry,
                           ExecutionLogService executionLogService,
                           RecurrenceCalculator recurrenceCalculator,
                           AppProperties.Scheduler settings,
                           Clock clock,
                           MeterRegistry meterRegistry) {
        this.tenantId = tenantId;
        this.nodeId = nodeId;
        this.store = store;
        this.registry = registry;
        this.executionLogService = executionLogService;
        this.recurrenceCalculator = recurrenceCalculator;
        this.retry = settings.retry();
        this.lease = settings.lease();
        this.clock = clock;
        this.meterRegistry = meterRegistry;
    }

    public String tenantId() {
        return tenantId;
    }

    public String schedule(Job job) {
        if (!tenantId.equals(job.tenantId())) {
            throw new IllegalArgumentException("Job " + job.id() + " belongs to tenant " + job.tenantId());
        }

        stateLock.lock();
        try {
            store.put(job);
            lowerAlarmTo(job.scheduledFor());
        } finally {
            stateLock.unlock();
        }
        log.info("Scheduled job {} ({}) for tenant {} at {}", job.id(), job.channel().id(), tenantId, job.scheduledFor());
        return job.id();
    }

    /**
     * Best-effort delete. An execution already in flight finishes, but is not rescheduled.
     */
    public boolean cancel(String jobId) {
        stateLock.lock();
        try {
            boolean removed = store.delete(tenantId, jobId);
            rearm();
            if (removed) {
                log.info("Cancelled job {} for tenant {}", jobId, tenantId);
            }
            return removed;
        } finally {
            stateLock.unlock();
        }
    }

    public List<Job> pendingJobs() {
        return store.list(tenantId)
                .stream()
                .sorted(Comparator.comparingLong(Job::scheduledFor))
                .toList();
    }

    public void onTimer() {
        wakeRequested.set(true);
        while (wakeRequested.get() && timerLock.tryLock()) {
            try {
                wakeRequested.set(false);
                if (!store.tryAcquireLease(tenantId, nodeId, lease.ttlMs())) {
                    deferToLeaseHolder();
                    continue;
                }
                runLeased();
            } catch (RuntimeException exception) {
                log.error("Unable to run alarm for tenant {}", tenantId, exception);
            } finally {
                timerLock.unlock();
            }
        }
    }

    /**
     * Sets the alarm to the earliest stored job, or clears it when nothing is stored.
     */
    public void rearmFromStorage() {
        stateLock.lock();
        try {
            rearm();
        } finally {
            stateLock.unlock();
        }
    }

    private void runLeased() {
        try {
            runDueJobs();
        } catch (RuntimeException exception) {
            log.error("Alarm handler failed for tenant {}", tenantId, exception);
        } finally {
            try {
                rearmFromStorage();
            } catch (RuntimeException exception) {
                log.error("Unable to re-arm alarm for tenant {}", tenantId, exception);
            } finally {
                store.releaseLease(tenantId, nodeId);
            }
        }
    }

    // the holder re-arms from storage when it finishes; this wake only covers a holder that died
    private void deferToLeaseHolder() {
        long wakeAt = clock.millis() + lease.retryMs();
        log.debug("Tenant {} is running on another node; retrying at {}", tenantId, wakeAt);
        stateLock.lock();
        try {
            lowerAlarmTo(wakeAt);
        } finally {
            stateLock.unlock();
        }
    }

    private void runDueJobs() {
        long now = clock.millis();
        List<Job> due;

        stateLock.lock();
        try {
            List<Job> jobs = store.list(tenantId);
            due = jobs.stream()
                    .filter(job -> job.scheduledFor() <= now)
                    .sorted(Comparator.comparingLong(Job::scheduledFor))
                    .toList();
            OptionalLong nextWake = jobs.stream()
                    .filter(job -> job.scheduledFor() > now)
                    .mapToLong(Job::scheduledFor)
                    .min();
            if (nextWake.isPresent()) {
                store.setAlarm(tenantId, nextWake.getAsLong());
            } else {
                store.clearAlarm(tenantId);
            }
        } finally {
            stateLock.unlock();
        }

        if (!due.isEmpty()) {
            log.info("Alarm fired for tenant {}: {} due job(s)", tenantId, due.size());
        }

        for (Job job : due) {
            try {
                execute(job);
            } catch (RuntimeException exception) {
                log.error("Job {} for tenant {} could not be settled", job.id(), tenantId, exception);
            }
        }
    }

    private void execute(Job job) {
        String channel = job.channel() == null ? "unknown" : job.channel().id();
        Timer.Sample sample = Timer.start(meterRegistry);
        try {
            MessageSender sender = registry.getSender(job.channel());
            SendResult result = sender.send(job);

            if (result.isContinuation()) {
                long nextTime = clock.millis() + result.continuationDelay().orElseThrow().toMillis();
                rewrite(job.rescheduled(nextTime, job.attempts()));
                meterRegistry.counter("remarketing.jobs.rescheduled.total", "channel", channel, "reason", "continuation").increment();
                return;
            }

            recordSuccess(job, result.response().orElse(null));
            meterRegistry.counter("remarketing.jobs.succeeded.total", "channel", channel).increment();

            OptionalLong nextRun = recurrenceCalculator.nextRun(job.recurrence(), job.scheduledFor());
            if (nextRun.isPresent()) {
                rewrite(job.rescheduled(nextRun.getAsLong(), 0));
                return;
            }
            remove(job);
        } catch (RateLimitException exception) {
            long retryAfter = exception.getRetryAfter() == null
                    ? retry.defaultRateLimitRetryMs()
                    : exception.getRetryAfter().toMillis();
            log.warn("Rate limit hit for job {} (tenant {}). Rescheduling in {}ms", job.id(), tenantId, retryAfter);
            rewrite(job.rescheduled(clock.millis() + retryAfter, job.attempts()));
            meterRegistry.counter("remarketing.jobs.rescheduled.total", "channel", channel, "reason", "rate_limit").increment();
        } catch (BlockedRecipientException | InvalidRequestException | SenderConfigurationException exception) {
            log.warn("Job {} for tenant {} failed: {}", job.id(), tenantId, exception.getMessage());
            fail(job, exception, channel);
        } catch (Exception exception) {
            int attempts = job.attempts() + 1;
            int maxAttempts = job.maxAttempts() > 0 ? job.maxAttempts() : retry.maxAttempts();
            if (attempts < maxAttempts) {
                long delay = backoff(attempts);
                log.warn("Job {} for tenant {} failed (attempt {}/{}), retrying in {}ms: {}",
                        job.id(), tenantId, attempts, maxAttempts, delay, exception.getMessage());
                rewrite(job.rescheduled(clock.millis() + delay, attempts));
                meterRegistry.counter("remarketing.jobs.rescheduled.total", "channel", channel, "reason", "error").increment();
                return;
            }
            log.error("Unexpected failure for job {} (tenant {}) after {} attempt(s)", job.id(), tenantId, attempts, exception);
            fail(job, exception, channel);
        } finally {
            sample.stop(meterRegistry.timer("remarketing.send.latency", "channel", channel));
        }
    }

    private void fail(Job job, Exception exception, String channel) {
        recordFailure(job, exception.getMessage() == null ? exception.getClass().getSimpleName() : exception.getMessage());
        meterRegistry.counter("remarketing.jobs.failed.total", "channel", channel).increment();
        remove(job);
    }

    private long backoff(int attempts) {
        long delay = retry.baseBackoffMs() << Math.min(attempts - 1, 20);
        return Math.min(delay, retry.maxBackoffMs());
    }

    private void rewrite(Job next) {
        stateLock.lock();
        try {
            if (store.get(tenantId, next.id()).isEmpty()) {
                log.info("Job {} was cancelled while running; not rescheduling", next.id());
                return;
            }
            store.put(next);
            lowerAlarmTo(next.scheduledFor());
        } finally {
            stateLock.unlock();
        }
    }

    private void remove(Job job) {
        stateLock.lock();
        try {
            store.delete(tenantId, job.id());
        } finally {
            stateLock.unlock();
        }
    }

    private void lowerAlarmTo(long wakeAt) {
        OptionalLong current = store.getAlarm(tenantId);
        if (current.isEmpty() || wakeAt < current.getAsLong()) {
            store.setAlarm(tenantId, wakeAt);
        }
    }

    private void rearm() {
        OptionalLong earliest = store.list(tenantId)
                .stream()
                .mapToLong(Job::scheduledFor)
                .min();
        if (earliest.isPresent()) {
            store.setAlarm(tenantId, earliest.getAsLong());
        } else {
            store.clearAlarm(tenantId);
        }
    }

    private void recordSuccess(Job job, Object response) {
        try {
            executionLogService.recordSuccess(job, response);
        } catch (RuntimeException exception) {
            log.error("Failed to save success log for job {}", job.id(), exception);
        }
    }

    private void recordFailure(Job job, String error) {
        try {
            executionLogService.recordFailure(job, error);
        } catch (RuntimeException exception) {
            log.error("Failed to save failure log for job {}", job.id(), exception);
        }
    }
}
