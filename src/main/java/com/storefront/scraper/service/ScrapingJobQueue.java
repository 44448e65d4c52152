package com.storefront.scraper.service;

import com.storefront.scraper.enums.FailureKind;
import com.storefront.scraper.enums.JobPriority;
import com.storefront.scraper.enums.JobStatus;
import com.storefront.scraper.exception.JobNotFoundException;
import com.storefront.scraper.interfaces.JobProcessor;
import com.storefront.scraper.model.ScrapingJob;
import com.storefront.scraper.model.ScrapingResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.PriorityQueue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Priority backlog drained by a single worker. Higher priority first, FIFO within a priority.
 * Failed jobs drop one tier and go to the back of it until their retries run out.
 */
@Service
@Slf4j
public class ScrapingJobQueue {

    private static final Comparator<QueuedJob> ORDER =
            Comparator.comparingInt((QueuedJob q) -> q.job().getPriority().getWeight()).reversed()
                    .thenComparingLong(QueuedJob::sequence);

    private final JobProcessor processor;
    private final Executor executor;
    private final Clock clock;

    private final ReentrantLock lock = new ReentrantLock();
    private final PriorityQueue<QueuedJob> queue = new PriorityQueue<>(ORDER);
    private final AtomicLong sequence = new AtomicLong();
    private final AtomicBoolean draining = new AtomicBoolean(false);
    private final AtomicBoolean paused = new AtomicBoolean(false);

    private final Map<String, ScrapingJob> jobs = new ConcurrentHashMap<>();
    private final Map<String, ScrapingResult> results = new ConcurrentHashMap<>();

    @Autowired
    public ScrapingJobQueue(JobProcessor processor,
                            @Qualifier("scrapeExecutor") Executor executor,
                            Clock clock) {
        this.processor = processor;
        this.executor = executor;
        this.clock = clock;
    }

    public ScrapingJob enqueue(ScrapingJob job) {
        if ((job.getUrl() == null || job.getUrl().isBlank()) && (job.getQuery() == null || job.getQuery().isBlank())) {
            throw new IllegalArgumentException("Job needs a url or a query");
        }
        if (job.getPlatform() == null) {
            throw new IllegalArgumentException("Job needs a platform");
        }
        if (job.getId() == null) {
            job.setId(ScrapingJob.newId());
        }
        if (job.getCreatedAt() == null) {
            job.setCreatedAt(clock.instant());
        }
        job.setStatus(JobStatus.PENDING);
        jobs.put(job.getId(), job);
        offer(job);
        log.info("Job queued | id={} | priority={} | platform={}", job.getId(), job.getPriority().code(),
                job.getPlatform().getCode());
        startDrain();
        return job;
    }

    private void offer(ScrapingJob job) {
        lock.lock();
        try {
            queue.add(new QueuedJob(job, sequence.incrementAndGet()));
        } finally {
            lock.unlock();
        }
    }

    private void startDrain() {
        if (paused.get()) {
            return;
        }
        if (draining.compareAndSet(false, true)) {
            executor.execute(this::drain);
        }
    }

    private void drain() {
        while (true) {
            ScrapingJob job = paused.get() ? null : pollNext();
            if (job == null) {
                draining.set(false);
                // an enqueue may have raced the flag reset
                if (!paused.get() && size() > 0 && draining.compareAndSet(false, true)) {
                    continue;
                }
                return;
            }
            process(job);
        }
    }

    private ScrapingJob pollNext() {
        lock.lock();
        try {
            QueuedJob next = queue.poll();
            if (next == null) {
                return null;
            }
            next.job().setStatus(JobStatus.PROCESSING);
            return next.job();
        } finally {
            lock.unlock();
        }
    }

    private void process(ScrapingJob job) {
        log.info("Processing job {} | priority={} | retry={}/{}", job.getId(), job.getPriority().code(),
                job.getRetryCount(), job.getMaxRetries());
        ScrapingResult result;
        try {
            result = processor.process(job);
        } catch (RuntimeException e) {
            log.error("Job {} processor error: {}", job.getId(), e.getMessage(), e);
            result = ScrapingResult.failure(FailureKind.UNKNOWN, e.getMessage(), 0, null, null);
        }
        results.put(job.getId(), result);

        if (result != null && result.isSuccess()) {
            job.setStatus(JobStatus.COMPLETED);
            log.info("Job {} completed | confidence={}", job.getId(), result.getConfidence());
        } else {
            handleFailure(job, result);
        }
    }

    private void handleFailure(ScrapingJob job, ScrapingResult result) {
        int retries = job.getRetryCount() + 1;
        job.setRetryCount(retries);
        String error = result != null ? result.getError() : "no result";
        if (retries >= job.getMaxRetries()) {
            job.setStatus(JobStatus.FAILED);
            log.warn("Job {} failed permanently after {} retries | error={}", job.getId(), retries, error);
            return;
        }
        JobPriority downgraded = job.getPriority().downgrade();
        job.setPriority(downgraded);
        job.setStatus(JobStatus.PENDING);
        offer(job);
        log.info("Job {} requeued | retry={}/{} | priority={} | error={}", job.getId(), retries,
                job.getMaxRetries(), downgraded.code(), error);
    }

    /**
     * Moves a queued job to another priority tier, behind the jobs already there.
     *
     * @return false if the job exists but is no longer queued
     */
    public boolean updatePriority(String jobId, JobPriority priority) {
        ScrapingJob job = jobs.get(jobId);
        if (job == null) {
            throw new JobNotFoundException(jobId);
        }
        lock.lock();
        try {
            boolean removed = queue.removeIf(q -> q.job().getId().equals(jobId));
            if (!removed) {
                return false;
            }
            job.setPriority(priority);
            queue.add(new QueuedJob(job, sequence.incrementAndGet()));
        } finally {
            lock.unlock();
        }
        log.info("Job {} priority changed to {}", jobId, priority.code());
        return true;
    }

    public Optional<ScrapingJob> getJob(String jobId) {
        return Optional.ofNullable(jobs.get(jobId));
    }

    public Optional<ScrapingResult> lastResult(String jobId) {
        return Optional.ofNullable(results.get(jobId));
    }

    /**
     * Removes a job that has not started yet.
     */
    public boolean remove(String jobId) {
        boolean removed;
        lock.lock();
        try {
            removed = queue.removeIf(q -> q.job().getId().equals(jobId));
        } finally {
            lock.unlock();
        }
        if (removed) {
            jobs.remove(jobId);
            results.remove(jobId);
        }
        return removed;
    }

    /**
     * @return number of pending jobs dropped
     */
    public int clear() {
        List<QueuedJob> dropped;
        lock.lock();
        try {
            dropped = new ArrayList<>(queue);
            queue.clear();
        } finally {
            lock.unlock();
        }
        dropped.forEach(q -> jobs.remove(q.job().getId()));
        log.info("Queue cleared | dropped={}", dropped.size());
        return dropped.size();
    }

    public int size() {
        lock.lock();
        try {
            return queue.size();
        } finally {
            lock.unlock();
        }
    }

    public void pause() {
        paused.set(true);
        log.info("Queue paused");
    }

    public void resume() {
        paused.set(false);
        log.info("Queue resumed");
        startDrain();
    }

    public boolean isPaused() {
        return paused.get();
    }

    /**
     * Forgets finished jobs older than the given age.
     */
    public int purgeFinished(Duration olderThan) {
        Instant cutoff = clock.instant().minus(olderThan);
        List<String> stale = jobs.values().stream()
                .filter(j -> j.getStatus().isTerminal() && j.getCreatedAt().isBefore(cutoff))
                .map(ScrapingJob::getId)
                .toList();
        stale.forEach(id -> {
            jobs.remove(id);
            results.remove(id);
        });
        return stale.size();
    }

    public QueueStats stats() {
        Map<JobStatus, Long> byStatus = new EnumMap<>(JobStatus.class);
        Map<JobPriority, Long> byPriority = new EnumMap<>(JobPriority.class);
        for (JobStatus s : JobStatus.values()) byStatus.put(s, 0L);
        for (JobPriority p : JobPriority.values()) byPriority.put(p, 0L);
        for (ScrapingJob job : jobs.values()) {
            byStatus.merge(job.getStatus(), 1L, Long::sum);
            byPriority.merge(job.getPriority(), 1L, Long::sum);
        }
        return new QueueStats(jobs.size(), size(), paused.get(), byStatus, byPriority);
    }

    private record QueuedJob(ScrapingJob job, long sequence) {
    }

    public record QueueStats(int total, int queued, boolean paused,
                             Map<JobStatus, Long> byStatus, Map<JobPriority, Long> byPriority) {
    }
}
