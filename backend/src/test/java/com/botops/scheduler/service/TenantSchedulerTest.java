package com.botops.scheduler.service;

import com.botops.config.AppProperties;
import com.botops.delivery.error.BlockedRecipientException;
import com.botops.delivery.error.DeliveryException;
import com.botops.delivery.error.RateLimitException;
import com.botops.delivery.error.SenderConfigurationException;
import com.botops.delivery.service.MessageSender;
import com.botops.delivery.service.MessageSenderRegistry;
import com.botops.executionlog.service.ExecutionLogService;
import com.botops.scheduler.model.Channel;
import com.botops.scheduler.model.Job;
import com.botops.scheduler.model.JobStatus;
import com.botops.scheduler.model.Recurrence;
import com.botops.scheduler.model.RecurrenceType;
import com.botops.scheduler.model.SendResult;
import com.botops.scheduler.store.InMemoryJobStore;
import com.botops.support.MutableClock;
import com.botops.support.TestProperties;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class TenantSchedulerTest {

    private static final String TENANT = "tenant-a";
    private static final Instant START = Instant.parse("2024-01-01T08:00:00Z");

    @Mock
    private MessageSenderRegistry registry;

    @Mock
    private MessageSender sender;

    @Mock
    private ExecutionLogService executionLogService;

    private InMemoryJobStore store;
    private MutableClock clock;
    private SimpleMeterRegistry meterRegistry;
    private TenantScheduler scheduler;

    @BeforeEach
    void setUp() {
        store = new InMemoryJobStore();
        clock = new MutableClock(START);
        meterRegistry = new SimpleMeterRegistry();
        scheduler = schedulerOnNode("node-a");
    }

    private TenantScheduler schedulerOnNode(String nodeId) {
        AppProperties properties = TestProperties.defaults();
        return new TenantScheduler(
                TENANT,
                nodeId,
                store,
                registry,
                executionLogService,
                new RecurrenceCalculator(clock, properties),
                properties.scheduler(),
                clock,
                meterRegistry
        );
    }

    @Test
    void alarmTracksEarliestScheduledJob() {
        scheduler.schedule(job("late", 5_000, null));
        scheduler.schedule(job("early", 1_000, null));
        scheduler.schedule(job("later", 9_000, null));

        assertThat(store.getAlarm(TENANT)).hasValue(START.toEpochMilli() + 1_000);
        assertThat(scheduler.pendingJobs()).extracting(Job::id).containsExactly("early", "late", "later");
    }

    @Test
    void rejectsJobOfAnotherTenant() {
        Job foreign = new Job("x", "tenant-b", START.toEpochMilli(), Channel.TELEGRAM, Map.of(),
                JobStatus.PENDING, 0, 3, null, null, null);

        assertThatThrownBy(() -> scheduler.schedule(foreign))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void successfulSendLogsOnceAndRemovesJob() {
        when(registry.getSender(Channel.TELEGRAM)).thenReturn(sender);
        when(sender.send(any())).thenReturn(SendResult.completed(Map.of("ok", true)));
        scheduler.schedule(job("job-1", 0, null));

        scheduler.onTimer();

        verify(executionLogService, times(1)).recordSuccess(any(Job.class), eq(Map.of("ok", true)));
        verify(executionLogService, never()).recordFailure(any(), any());
        assertThat(store.list(TENANT)).isEmpty();
        assertThat(store.getAlarm(TENANT)).isEmpty();
        assertThat(meterRegistry.counter("remarketing.jobs.succeeded.total", "channel", "telegram").count()).isEqualTo(1.0);
    }

    @Test
    void futureJobsAreNotExecutedAndKeepTheAlarm() {
        scheduler.schedule(job("job-1", 5_000, null));

        scheduler.onTimer();

        verify(registry, never()).getSender(any());
        assertThat(store.getAlarm(TENANT)).hasValue(START.toEpochMilli() + 5_000);
    }

    @Test
    void rateLimitReschedulesWithoutLoggingOrCountingAnAttempt() {
        when(registry.getSender(Channel.TELEGRAM)).thenReturn(sender);
        when(sender.send(any())).thenThrow(new RateLimitException(Duration.ofSeconds(3)));
        scheduler.schedule(job("job-1", 0, null));

        scheduler.onTimer();

        Job stored = store.get(TENANT, "job-1").orElseThrow();
        assertThat(stored.scheduledFor()).isEqualTo(START.toEpochMilli() + 3_000);
        assertThat(stored.attempts()).isZero();
        assertThat(store.getAlarm(TENANT)).hasValue(START.toEpochMilli() + 3_000);
        verify(executionLogService, never()).recordFailure(any(), any());
        verify(executionLogService, never()).recordSuccess(any(), any());
    }

    @Test
    void rateLimitWithoutProviderDelayUsesConfiguredDefault() {
        when(registry.getSender(Channel.TELEGRAM)).thenReturn(sender);
        when(sender.send(any())).thenThrow(new RateLimitException(null));
        scheduler.schedule(job("job-1", 0, null));

        scheduler.onTimer();

        assertThat(store.get(TENANT, "job-1").orElseThrow().scheduledFor())
                .isEqualTo(START.toEpochMilli() + 5_000);
        verify(executionLogService, never()).recordFailure(any(), any());
    }

    @Test
    void unclassifiedErrorsBackOffThenFail() {
        when(registry.getSender(Channel.TELEGRAM)).thenReturn(sender);
        when(sender.send(any())).thenThrow(new DeliveryException("boom"));
        scheduler.schedule(job("job-1", 0, null));

        scheduler.onTimer();
        Job first = store.get(TENANT, "job-1").orElseThrow();
        assertThat(first.attempts()).isEqualTo(1);
        assertThat(first.scheduledFor()).isEqualTo(START.toEpochMilli() + 1_000);

        clock.advance(Duration.ofSeconds(1));
        scheduler.onTimer();
        Job second = store.get(TENANT, "job-1").orElseThrow();
        assertThat(second.attempts()).isEqualTo(2);
        assertThat(second.scheduledFor()).isEqualTo(START.toEpochMilli() + 1_000 + 2_000);

        clock.advance(Duration.ofSeconds(2));
        scheduler.onTimer();

        assertThat(store.list(TENANT)).isEmpty();
        assertThat(store.getAlarm(TENANT)).isEmpty();
        verify(executionLogService, times(1)).recordFailure(any(Job.class), eq("boom"));
    }

    @Test
    void blockedRecipientIsTerminal() {
        when(registry.getSender(Channel.TELEGRAM)).thenReturn(sender);
        when(sender.send(any())).thenThrow(new BlockedRecipientException("Forbidden: bot was blocked by the user"));
        scheduler.schedule(job("job-1", 0, null));

        scheduler.onTimer();

        assertThat(store.list(TENANT)).isEmpty();
        verify(executionLogService).recordFailure(any(Job.class), eq("Forbidden: bot was blocked by the user"));
    }

    @Test
    void missingSenderIsRecordedAsFailure() {
        when(registry.getSender(Channel.TELEGRAM))
                .thenThrow(new SenderConfigurationException("No sender registered for channel: telegram"));
        scheduler.schedule(job("job-1", 0, null));

        scheduler.onTimer();

        assertThat(store.list(TENANT)).isEmpty();
        verify(executionLogService).recordFailure(any(Job.class), eq("No sender registered for channel: telegram"));
    }

    @Test
    void cancelIsIdempotentAndClearsAlarm() {
        scheduler.schedule(job("job-1", 5_000, null));

        assertThat(scheduler.cancel("job-1")).isTrue();
        assertThat(scheduler.cancel("job-1")).isFalse();
        assertThat(store.getAlarm(TENANT)).isEmpty();
    }

    @Test
    void cancelMovesAlarmToNextRemainingJob() {
        scheduler.schedule(job("job-1", 1_000, null));
        scheduler.schedule(job("job-2", 4_000, null));

        scheduler.cancel("job-1");

        assertThat(store.getAlarm(TENANT)).hasValue(START.toEpochMilli() + 4_000);
    }

    @Test
    void jobCancelledWhileRunningIsNotRescheduled() {
        when(registry.getSender(Channel.TELEGRAM)).thenReturn(sender);
        when(sender.send(any())).thenAnswer(invocation -> {
            scheduler.cancel("job-1");
            throw new RateLimitException(Duration.ofSeconds(1));
        });
        scheduler.schedule(job("job-1", 0, null));

        scheduler.onTimer();

        assertThat(store.list(TENANT)).isEmpty();
        assertThat(store.getAlarm(TENANT)).isEmpty();
    }

    @Test
    void dailyJobIsRewrittenForNextDayAtConfiguredTime() {
        when(registry.getSender(Channel.TELEGRAM)).thenReturn(sender);
        when(sender.send(any())).thenReturn(SendResult.completed());
        scheduler.schedule(job("job-1", 0, new Recurrence(RecurrenceType.DAILY, "09:00", null)));

        scheduler.onTimer();

        long expected = Instant.parse("2024-01-02T09:00:00Z").toEpochMilli();
        Job stored = store.get(TENANT, "job-1").orElseThrow();
        assertThat(stored.scheduledFor()).isEqualTo(expected);
        assertThat(stored.attempts()).isZero();
        assertThat(store.getAlarm(TENANT)).hasValue(expected);
        verify(executionLogService).recordSuccess(any(Job.class), isNull());
    }

    @Test
    void continuationRunsJobAgainWithoutLogging() {
        when(registry.getSender(Channel.TELEGRAM)).thenReturn(sender);
        when(sender.send(any())).thenReturn(SendResult.continueAfter(Duration.ofSeconds(10)));
        scheduler.schedule(job("job-1", 0, null));

        scheduler.onTimer();

        assertThat(store.get(TENANT, "job-1").orElseThrow().scheduledFor())
                .isEqualTo(START.toEpochMilli() + 10_000);
        verify(executionLogService, never()).recordSuccess(any(), any());
        verify(executionLogService, never()).recordFailure(any(), any());
    }

    @Test
    void failingLogWriteDoesNotLoseTheAlarm() {
        when(registry.getSender(Channel.TELEGRAM)).thenReturn(sender);
        when(sender.send(any())).thenReturn(SendResult.completed());
        doThrow(new IllegalStateException("db down"))
                .when(executionLogService).recordSuccess(any(), any());
        scheduler.schedule(job("job-1", 0, null));
        scheduler.schedule(job("job-2", 60_000, null));

        scheduler.onTimer();

        assertThat(store.get(TENANT, "job-1")).isEmpty();
        assertThat(store.getAlarm(TENANT)).hasValue(START.toEpochMilli() + 60_000);
    }

    @Test
    void secondNodeDoesNotRerunJobStillInFlightOnFirst() throws Exception {
        TenantScheduler otherNode = schedulerOnNode("node-b");
        CountDownLatch sending = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        Map<String, AtomicInteger> sends = new ConcurrentHashMap<>();
        when(registry.getSender(Channel.TELEGRAM)).thenReturn(sender);
        when(sender.send(any())).thenAnswer(invocation -> {
            Job running = invocation.getArgument(0);
            sends.computeIfAbsent(running.id(), ignored -> new AtomicInteger()).incrementAndGet();
            if (running.id().equals("x")) {
                sending.countDown();
                release.await(10, TimeUnit.SECONDS);
            }
            return SendResult.completed();
        });
        scheduler.schedule(job("x", 0, null));
        scheduler.schedule(job("y", 5_000, null));

        ExecutorService pool = Executors.newSingleThreadExecutor();
        try {
            Future<?> firstNode = pool.submit(scheduler::onTimer);
            assertThat(sending.await(10, TimeUnit.SECONDS)).isTrue();

            clock.advance(Duration.ofSeconds(6));
            assertThat(store.claimDueAlarms(clock.millis(), 10)).containsExactly(TENANT);
            otherNode.onTimer();

            assertThat(sends.get("x").get()).isEqualTo(1);
            assertThat(sends).doesNotContainKey("y");
            assertThat(store.getAlarm(TENANT)).hasValue(clock.millis() + 1_000);

            release.countDown();
            firstNode.get(10, TimeUnit.SECONDS);
        } finally {
            release.countDown();
            pool.shutdownNow();
        }

        otherNode.onTimer();

        assertThat(sends.get("x").get()).isEqualTo(1);
        assertThat(sends.get("y").get()).isEqualTo(1);
        assertThat(store.list(TENANT)).isEmpty();
    }

    private Job job(String id, long offsetMs, Recurrence recurrence) {
        return new Job(
                id,
                TENANT,
                START.toEpochMilli() + offsetMs,
                Channel.TELEGRAM,
                Map.of("botToken", "t", "chatId", "1", "message", "hi"),
                JobStatus.PENDING,
                0,
                3,
                recurrence,
                null,
                null
        );
    }
}
