package com.cropadvisory.service;

import com.cropadvisory.dto.AsyncJobResponse;
import com.cropadvisory.dto.AsyncJobStatus;
import com.cropadvisory.dto.TrainingReport;
import com.cropadvisory.exception.JobNotFoundException;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.Comparator;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.function.Supplier;
import java.util.function.UnaryOperator;

/**
 * Runs retraining requests off the request thread and keeps their latest
 * snapshot in memory. Finished runs beyond {@code max-retained} are evicted
 * oldest first.
 */
@Slf4j
@Service
public class AsyncJobService {

    @Value("${advisory.jobs.pool-size:2}")
    private int poolSize = 2;

    @Value("${advisory.jobs.max-retained:200}")
    private int maxRetained = 200;

    private final Clock clock;
    private final ConcurrentHashMap<UUID, AsyncJobResponse> jobs = new ConcurrentHashMap<>();
    private ExecutorService executor;

    public AsyncJobService(Clock clock) {
        this.clock = clock;
    }

    @PostConstruct
    void init() {
        executor = Executors.newFixedThreadPool(Math.max(1, poolSize));
    }

    @PreDestroy
    void shutdown() {
        if (executor != null) {
            executor.shutdown();
        }
    }

    public UUID submit(String jobType, String requestId, Supplier<TrainingReport> task) {
        UUID jobId = UUID.randomUUID();
        jobs.put(jobId, AsyncJobResponse.builder()
            .jobId(jobId)
            .jobType(jobType)
            .status(AsyncJobStatus.QUEUED)
            .requestId(requestId)
            .submittedAt(clock.instant())
            .build());
        evictFinished();

        CompletableFuture.runAsync(() -> execute(jobId, task), executor);
        log.info("Job submitted | jobId={} | type={} | requestId={}", jobId, jobType, requestId);
        return jobId;
    }

    public AsyncJobResponse getJob(UUID jobId) {
        AsyncJobResponse job = jobs.get(jobId);
        if (job == null) {
            throw new JobNotFoundException(jobId);
        }
        return job;
    }

    private void execute(UUID jobId, Supplier<TrainingReport> task) {
        update(jobId, job -> job.toBuilder().status(AsyncJobStatus.RUNNING).build());
        try {
            TrainingReport report = task.get();
            update(jobId, job -> job.toBuilder()
                .status(AsyncJobStatus.COMPLETED)
                .finishedAt(clock.instant())
                .report(report)
                .build());
            log.info("Job completed | jobId={} | trained={}", jobId, report != null && report.isTrained());
        } catch (RuntimeException ex) {
            String reason = ex.getMessage() != null ? ex.getMessage() : ex.getClass().getSimpleName();
            update(jobId, job -> job.toBuilder()
                .status(AsyncJobStatus.FAILED)
                .finishedAt(clock.instant())
                .failureReason(reason)
                .build());
            log.error("Job failed | jobId={} | reason={}", jobId, reason, ex);
        }
    }

    private void update(UUID jobId, UnaryOperator<AsyncJobResponse> transition) {
        jobs.computeIfPresent(jobId, (id, job) -> transition.apply(job));
    }

    private void evictFinished() {
        if (jobs.size() <= maxRetained) {
            return;
        }
        jobs.values().stream()
            .filter(job -> job.getFinishedAt() != null)
            .sorted(Comparator.comparing(AsyncJobResponse::getSubmittedAt))
            .limit(Math.max(1, jobs.size() - maxRetained))
            .map(AsyncJobResponse::getJobId)
            .toList()
            .forEach(jobs::remove);
    }
}
