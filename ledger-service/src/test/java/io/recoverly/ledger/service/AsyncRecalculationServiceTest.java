package io.recoverly.ledger.service;

import io.recoverly.common.dto.recalculation.RecalculationJobDto;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class AsyncRecalculationServiceTest {

    private static final LocalDate AS_OF = LocalDate.of(2025, 6, 30);

    @Mock
    private RecalculationJobRunner jobRunner;

    private AsyncRecalculationService service;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(Instant.parse("2025-06-30T02:30:00Z"), ZoneOffset.UTC);
        service = new AsyncRecalculationService(jobRunner, clock);
    }

    @Test
    void triggerRecalculation_ShouldQueuePendingJob() {
        String jobId = service.triggerRecalculation("scheduler", AS_OF, "c1");

        RecalculationJobDto job = service.getJobStatus(jobId).orElseThrow();
        assertEquals(RecalculationJobDto.JobStatus.PENDING, job.getStatus());
        assertEquals("scheduler", job.getSource());
        assertEquals(AS_OF, job.getAsOf());
        assertEquals("c1", job.getResumeAfterCustomerId());
        verify(jobRunner).run(eq(job), any(AtomicBoolean.class));
    }

    @Test
    void triggerRecalculation_ShouldReuseActiveJob() {
        String first = service.triggerRecalculation("scheduler", AS_OF, null);
        String second = service.triggerRecalculation("event", AS_OF, null);

        assertEquals(first, second);
        verify(jobRunner, times(1)).run(any(), any());
    }

    @Test
    void triggerRecalculation_ShouldStartSingleJobForSimultaneousTriggers() throws Exception {
        int callers = 8;
        ExecutorService pool = Executors.newFixedThreadPool(callers);
        CountDownLatch start = new CountDownLatch(1);
        Set<String> jobIds = ConcurrentHashMap.newKeySet();
        try {
            List<Future<?>> calls = new ArrayList<>();
            for (int i = 0; i < callers; i++) {
                String source = "caller-" + i;
                calls.add(pool.submit(() -> {
                    start.await();
                    jobIds.add(service.triggerRecalculation(source, AS_OF, null));
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> call : calls) {
                call.get(5, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }

        assertEquals(1, jobIds.size());
        verify(jobRunner, times(1)).run(any(), any());
    }

    @Test
    void cancelJob_ShouldRaiseFlagOfActiveJob() {
        String jobId = service.triggerRecalculation("scheduler", AS_OF, null);
        ArgumentCaptor<AtomicBoolean> flag = ArgumentCaptor.forClass(AtomicBoolean.class);
        verify(jobRunner).run(any(), flag.capture());

        assertTrue(service.cancelJob(jobId));
        assertTrue(flag.getValue().get());
        assertFalse(service.cancelJob("unknown"));
    }

    @Test
    void cancelJob_ShouldIgnoreFinishedJob() {
        String jobId = service.triggerRecalculation("scheduler", AS_OF, null);
        service.getJobStatus(jobId).orElseThrow().setStatus(RecalculationJobDto.JobStatus.COMPLETED);

        assertFalse(service.cancelJob(jobId));
    }

    @Test
    void cleanupOldJobs_ShouldDropFinishedJobs() {
        String jobId = service.triggerRecalculation("scheduler", AS_OF, null);
        RecalculationJobDto job = service.getJobStatus(jobId).orElseThrow();
        job.setStatus(RecalculationJobDto.JobStatus.COMPLETED);
        job.setCompletedAt(LocalDateTime.of(2025, 6, 28, 0, 0));

        service.cleanupOldJobs(60);

        assertTrue(service.getJobStatus(jobId).isEmpty());
    }
}
