package com.botops.scheduler.store;

import com.botops.scheduler.model.Channel;
import com.botops.scheduler.model.Job;
import com.botops.scheduler.model.JobStatus;
import com.botops.scheduler.model.Recurrence;
import com.botops.scheduler.model.RecurrenceType;
import com.botops.support.TestProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.redis.core.HashOperations;
import org.springframework.data.redis.core.SetOperations;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ValueOperations;
import org.springframework.data.redis.core.ZSetOperations;
import org.springframework.data.redis.core.script.RedisScript;

import java.time.Duration;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class RedisJobStoreTest {

    private static final String JOBS_KEY = "test-scheduler:tenant:tenant-a:jobs";
    private static final String ALARMS_KEY = "test-scheduler:alarms";
    private static final String LEASE_KEY = "test-scheduler:tenant:tenant-a:lease";

    @Mock
    private StringRedisTemplate redisTemplate;

    @Mock
    private HashOperations<String, Object, Object> hashOperations;

    @Mock
    private ZSetOperations<String, String> zSetOperations;

    @Mock
    private SetOperations<String, String> setOperations;

    @Mock
    private ValueOperations<String, String> valueOperations;

    @Captor
    private ArgumentCaptor<RedisScript<Long>> releaseScript;

    private ObjectMapper objectMapper;
    private RedisJobStore store;

    @BeforeEach
    void setUp() {
        lenient().when(redisTemplate.<Object, Object>opsForHash()).thenReturn(hashOperations);
        lenient().when(redisTemplate.opsForZSet()).thenReturn(zSetOperations);
        lenient().when(redisTemplate.opsForSet()).thenReturn(setOperations);
        lenient().when(redisTemplate.opsForValue()).thenReturn(valueOperations);
        objectMapper = new ObjectMapper().findAndRegisterModules();
        store = new RedisJobStore(redisTemplate, objectMapper, TestProperties.defaults());
    }

    @Test
    void putWritesJobIntoTenantHashAndRegistersTenant() throws Exception {
        Job job = job("job-1");

        store.put(job);

        ArgumentCaptor<Object> payload = ArgumentCaptor.forClass(Object.class);
        verify(hashOperations).put(eq(JOBS_KEY), eq("job-1"), payload.capture());
        verify(setOperations).add("test-scheduler:tenants", "tenant-a");

        Job decoded = objectMapper.readValue(payload.getValue().toString(), Job.class);
        assertThat(decoded).isEqualTo(job);
    }

    @Test
    void getReadsStoredJob() throws Exception {
        Job job = job("job-1");
        when(hashOperations.get(JOBS_KEY, "job-1")).thenReturn(objectMapper.writeValueAsString(job));

        assertThat(store.get("tenant-a", "job-1")).contains(job);
    }

    @Test
    void getReturnsEmptyForUnknownJob() {
        when(hashOperations.get(JOBS_KEY, "missing")).thenReturn(null);

        assertThat(store.get("tenant-a", "missing")).isEmpty();
    }

    @Test
    void listDecodesEveryEntry() throws Exception {
        when(hashOperations.entries(JOBS_KEY)).thenReturn(Map.of(
                "job-1", objectMapper.writeValueAsString(job("job-1")),
                "job-2", objectMapper.writeValueAsString(job("job-2"))
        ));

        assertThat(store.list("tenant-a")).extracting(Job::id).containsExactlyInAnyOrder("job-1", "job-2");
    }

    @Test
    void deleteReportsWhetherAnythingWasRemoved() {
        when(hashOperations.delete(JOBS_KEY, "job-1")).thenReturn(1L);
        when(hashOperations.delete(JOBS_KEY, "job-2")).thenReturn(0L);

        assertThat(store.delete("tenant-a", "job-1")).isTrue();
        assertThat(store.delete("tenant-a", "job-2")).isFalse();
    }

    @Test
    void alarmIsAScoreInTheSharedSortedSet() {
        store.setAlarm("tenant-a", 1_000L);
        verify(zSetOperations).add(ALARMS_KEY, "tenant-a", 1_000.0);

        when(zSetOperations.score(ALARMS_KEY, "tenant-a")).thenReturn(1_000.0);
        assertThat(store.getAlarm("tenant-a")).hasValue(1_000L);

        store.clearAlarm("tenant-a");
        verify(zSetOperations).remove(ALARMS_KEY, "tenant-a");
    }

    @Test
    void claimReturnsOnlyAlarmsThisCallRemoved() {
        LinkedHashSet<String> due = new LinkedHashSet<>(List.of("tenant-a", "tenant-b"));
        when(zSetOperations.rangeByScore(ALARMS_KEY, Double.NEGATIVE_INFINITY, 5_000.0, 0, 10)).thenReturn(due);
        when(zSetOperations.remove(ALARMS_KEY, "tenant-a")).thenReturn(1L);
        when(zSetOperations.remove(ALARMS_KEY, "tenant-b")).thenReturn(0L);

        assertThat(store.claimDueAlarms(5_000L, 10)).containsExactly("tenant-a");
    }

    @Test
    void claimReturnsEmptyWhenNothingIsDue() {
        when(zSetOperations.rangeByScore(anyString(), eq(Double.NEGATIVE_INFINITY), eq(5_000.0), eq(0L), eq(10L)))
                .thenReturn(new LinkedHashSet<>());

        assertThat(store.claimDueAlarms(5_000L, 10)).isEmpty();
    }

    @Test
    void leaseIsSetIfAbsentWithTtl() {
        when(valueOperations.setIfAbsent(LEASE_KEY, "node-a", Duration.ofMinutes(10))).thenReturn(true);
        when(valueOperations.setIfAbsent(LEASE_KEY, "node-b", Duration.ofMinutes(10))).thenReturn(false);

        assertThat(store.tryAcquireLease("tenant-a", "node-a", 600_000)).isTrue();
        assertThat(store.tryAcquireLease("tenant-a", "node-b", 600_000)).isFalse();
    }

    @Test
    void leaseReleaseComparesOwnerBeforeDeleting() {
        store.releaseLease("tenant-a", "node-a");

        verify(redisTemplate).execute(releaseScript.capture(), eq(List.of(LEASE_KEY)), eq("node-a"));
        assertThat(releaseScript.getValue().getScriptAsString()).contains("redis.call('get', KEYS[1]) == ARGV[1]");
    }

    private Job job(String id) {
        return new Job(
                id,
                "tenant-a",
                1_700_000_000_000L,
                Channel.TELEGRAM,
                Map.of("chatId", "42", "message", "hello"),
                JobStatus.PENDING,
                1,
                3,
                new Recurrence(RecurrenceType.DAILY, "09:00", List.of(1, 3)),
                null,
                Map.of("source", "test")
        );
    }
}
