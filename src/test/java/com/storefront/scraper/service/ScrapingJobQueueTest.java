package com.storefront.scraper.service;

import com.storefront.scraper.enums.FailureKind;
import com.storefront.scraper.enums.JobPriority;
import com.storefront.scraper.enums.JobStatus;
import com.storefront.scraper.enums.Platform;
import com.storefront.scraper.exception.JobNotFoundException;
import com.storefront.scraper.interfaces.JobProcessor;
import com.storefront.scraper.model.ScrapingJob;
import com.storefront.scraper.model.ScrapingResult;
import com.storefront.scraper.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("ScrapingJobQueue Tests")
class ScrapingJobQueueTest {

    private MutableClock clock;
    private List<String> processed;
    private Function<ScrapingJob, ScrapingResult> behaviour;
    private ScrapingJobQueue queue;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2025-01-01T00:00:00Z");
        processed = new CopyOnWriteArrayList<>();
        behaviour = job -> ScrapingResult.builder().success(true).confidence(95).build();
        JobProcessor processor = job -> {
            processed.add(job.getId());
            return behaviour.apply(job);
        };
        queue = new ScrapingJobQueue(processor, Runnable::run, clock);
    }

    private ScrapingJob job(String id, JobPriority priority) {
        return ScrapingJob.builder()
                .id(id)
                .url("https://www.alibaba.com/product-detail/" + id + ".html")
                .platform(Platform.ALIBABA)
                .priority(priority)
                .createdAt(clock.instant())
                .build();
    }

    private static ScrapingResult failed(String error) {
        return ScrapingResult.failure(FailureKind.BLOCKED, error, 10, "stealth", null);
    }

    @Nested
    @DisplayName("Enqueue")
    class Enqueue {

        @Test
        @DisplayName("enqueue_successfulJob_completesAndStoresResult")
        void enqueue_successfulJob_completesAndStoresResult() {
            ScrapingJob job = queue.enqueue(job("a", JobPriority.MEDIUM));

            assertThat(job.getStatus()).isEqualTo(JobStatus.COMPLETED);
            assertThat(queue.lastResult("a")).get().extracting(ScrapingResult::getConfidence).isEqualTo(95);
            assertThat(queue.size()).isZero();
        }

        @Test
        @DisplayName("enqueue_noUrlOrQuery_throwsIllegalArgumentException")
        void enqueue_noUrlOrQuery_throwsIllegalArgumentException() {
            ScrapingJob bad = ScrapingJob.builder().platform(Platform.AMAZON).build();

            assertThatThrownBy(() -> queue.enqueue(bad)).isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        @DisplayName("enqueue_noPlatform_throwsIllegalArgumentException")
        void enqueue_noPlatform_throwsIllegalArgumentException() {
            ScrapingJob bad = ScrapingJob.builder().query("usb hub").build();

            assertThatThrownBy(() -> queue.enqueue(bad)).isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        @DisplayName("enqueue_missingId_assignsOne")
        void enqueue_missingId_assignsOne() {
            ScrapingJob job = ScrapingJob.builder().query("usb hub").platform(Platform.AMAZON).build();

            queue.enqueue(job);

            assertThat(job.getId()).matches("job_[0-9a-f]{16}");
        }
    }

    @Nested
    @DisplayName("Ordering")
    class Ordering {

        @Test
        @DisplayName("resume_drainsHighestPriorityFirstThenFifo")
        void resume_drainsHighestPriorityFirstThenFifo() {
            queue.pause();
            queue.enqueue(job("low-1", JobPriority.LOW));
            queue.enqueue(job("med-1", JobPriority.MEDIUM));
            queue.enqueue(job("high-1", JobPriority.HIGH));
            queue.enqueue(job("med-2", JobPriority.MEDIUM));
            queue.enqueue(job("high-2", JobPriority.HIGH));
            assertThat(processed).isEmpty();
            assertThat(queue.size()).isEqualTo(5);

            queue.resume();

            assertThat(processed).containsExactly("high-1", "high-2", "med-1", "med-2", "low-1");
        }

        @Test
        @DisplayName("process_failedHighJob_requeuesBehindEarlierMediumJobs")
        void process_failedHighJob_requeuesBehindEarlierMediumJobs() {
            AtomicInteger flakyRuns = new AtomicInteger();
            behaviour = job -> "high-flaky".equals(job.getId()) && flakyRuns.incrementAndGet() == 1
                    ? failed("Access blocked")
                    : ScrapingResult.builder().success(true).confidence(90).build();
            queue.pause();
            queue.enqueue(job("high-flaky", JobPriority.HIGH));
            queue.enqueue(job("med-1", JobPriority.MEDIUM));
            queue.enqueue(job("med-2", JobPriority.MEDIUM));

            queue.resume();

            assertThat(processed).containsExactly("high-flaky", "med-1", "med-2", "high-flaky");
            ScrapingJob flaky = queue.getJob("high-flaky").orElseThrow();
            assertThat(flaky.getPriority()).isEqualTo(JobPriority.MEDIUM);
            assertThat(flaky.getRetryCount()).isEqualTo(1);
            assertThat(flaky.getStatus()).isEqualTo(JobStatus.COMPLETED);
        }

        @Test
        @DisplayName("updatePriority_queuedJob_movesBehindNewTier")
        void updatePriority_queuedJob_movesBehindNewTier() {
            queue.pause();
            queue.enqueue(job("high-1", JobPriority.HIGH));
            queue.enqueue(job("low-1", JobPriority.LOW));
            queue.enqueue(job("med-1", JobPriority.MEDIUM));

            assertThat(queue.updatePriority("low-1", JobPriority.HIGH)).isTrue();
            queue.resume();

            assertThat(processed).containsExactly("high-1", "low-1", "med-1");
        }

        @Test
        @DisplayName("updatePriority_unknownJob_throwsJobNotFound")
        void updatePriority_unknownJob_throwsJobNotFound() {
            assertThatThrownBy(() -> queue.updatePriority("missing", JobPriority.HIGH))
                    .isInstanceOf(JobNotFoundException.class);
        }

        @Test
        @DisplayName("updatePriority_finishedJob_returnsFalse")
        void updatePriority_finishedJob_returnsFalse() {
            queue.enqueue(job("done", JobPriority.LOW));

            assertThat(queue.updatePriority("done", JobPriority.HIGH)).isFalse();
        }
    }

    @Nested
    @DisplayName("Retries")
    class Retries {

        @Test
        @DisplayName("process_failure_downgradesAndRequeuesUntilMaxRetries")
        void process_failure_downgradesAndRequeuesUntilMaxRetries() {
            behaviour = job -> failed("Access blocked");
            List<JobPriority> prioritiesSeen = new ArrayList<>();
            JobProcessor recording = job -> {
                prioritiesSeen.add(job.getPriority());
                return behaviour.apply(job);
            };
            ScrapingJobQueue retrying = new ScrapingJobQueue(recording, Runnable::run, clock);

            ScrapingJob job = retrying.enqueue(job("flaky", JobPriority.HIGH));

            assertThat(prioritiesSeen).containsExactly(JobPriority.HIGH, JobPriority.MEDIUM, JobPriority.LOW);
            assertThat(job.getRetryCount()).isEqualTo(3);
            assertThat(job.getStatus()).isEqualTo(JobStatus.FAILED);
            assertThat(retrying.lastResult("flaky")).get().extracting(ScrapingResult::getError).isEqualTo("Access blocked");
        }

        @Test
        @DisplayName("process_failsOnceThenSucceeds_completes")
        void process_failsOnceThenSucceeds_completes() {
            AtomicInteger calls = new AtomicInteger();
            behaviour = job -> calls.incrementAndGet() == 1
                    ? failed("timeout")
                    : ScrapingResult.builder().success(true).confidence(80).build();

            ScrapingJob job = queue.enqueue(job("retry-once", JobPriority.MEDIUM));

            assertThat(job.getStatus()).isEqualTo(JobStatus.COMPLETED);
            assertThat(job.getRetryCount()).isEqualTo(1);
            assertThat(job.getPriority()).isEqualTo(JobPriority.LOW);
        }

        @Test
        @DisplayName("process_processorThrows_treatedAsFailure")
        void process_processorThrows_treatedAsFailure() {
            behaviour = job -> {
                throw new IllegalStateException("boom");
            };
            ScrapingJob job = job("throws", JobPriority.LOW);
            job.setMaxRetries(1);

            queue.enqueue(job);

            assertThat(job.getStatus()).isEqualTo(JobStatus.FAILED);
            assertThat(queue.lastResult("throws")).get()
                    .satisfies(r -> {
                        assertThat(r.isSuccess()).isFalse();
                        assertThat(r.getError()).isEqualTo("boom");
                    });
        }
    }

    @Nested
    @DisplayName("Housekeeping")
    class Housekeeping {

        @Test
        @DisplayName("remove_pendingJob_dropsIt")
        void remove_pendingJob_dropsIt() {
            queue.pause();
            queue.enqueue(job("a", JobPriority.MEDIUM));

            assertThat(queue.remove("a")).isTrue();
            assertThat(queue.getJob("a")).isEmpty();
            assertThat(queue.remove("a")).isFalse();
        }

        @Test
        @DisplayName("clear_dropsAllPending")
        void clear_dropsAllPending() {
            queue.pause();
            queue.enqueue(job("a", JobPriority.MEDIUM));
            queue.enqueue(job("b", JobPriority.LOW));

            assertThat(queue.clear()).isEqualTo(2);
            assertThat(queue.stats().total()).isZero();
        }

        @Test
        @DisplayName("purgeFinished_forgetsOldTerminalJobsOnly")
        void purgeFinished_forgetsOldTerminalJobsOnly() {
            queue.enqueue(job("old-done", JobPriority.MEDIUM));
            queue.pause();
            queue.enqueue(job("old-pending", JobPriority.MEDIUM));
            clock.advance(Duration.ofHours(2));

            assertThat(queue.purgeFinished(Duration.ofHours(1))).isEqualTo(1);
            assertThat(queue.getJob("old-done")).isEmpty();
            assertThat(queue.getJob("old-pending")).isPresent();
        }

        @Test
        @DisplayName("stats_countsByStatusAndPriority")
        void stats_countsByStatusAndPriority() {
            queue.enqueue(job("done", JobPriority.HIGH));
            queue.pause();
            queue.enqueue(job("waiting", JobPriority.LOW));

            ScrapingJobQueue.QueueStats stats = queue.stats();

            assertThat(stats.total()).isEqualTo(2);
            assertThat(stats.queued()).isEqualTo(1);
            assertThat(stats.paused()).isTrue();
            assertThat(stats.byStatus()).containsEntry(JobStatus.COMPLETED, 1L).containsEntry(JobStatus.PENDING, 1L);
            assertThat(stats.byPriority()).containsEntry(JobPriority.HIGH, 1L).containsEntry(JobPriority.MEDIUM, 0L);
        }
    }

    @Test
    @Timeout(10)
    @DisplayName("enqueue_fromManyThreads_processesEveryJobOnceOnSingleWorker")
    void enqueue_fromManyThreads_processesEveryJobOnceOnSingleWorker() throws InterruptedException {
        ExecutorService worker = Executors.newSingleThreadExecutor();
        CountDownLatch done = new CountDownLatch(50);
        AtomicInteger concurrent = new AtomicInteger();
        AtomicInteger peak = new AtomicInteger();
        JobProcessor processor = job -> {
            peak.accumulateAndGet(concurrent.incrementAndGet(), Math::max);
            concurrent.decrementAndGet();
            done.countDown();
            return ScrapingResult.builder().success(true).build();
        };
        ScrapingJobQueue threaded = new ScrapingJobQueue(processor, worker, clock);
        ExecutorService producers = Executors.newFixedThreadPool(4);

        for (int i = 0; i < 50; i++) {
            String id = "job-" + i;
            producers.submit(() -> threaded.enqueue(job(id, JobPriority.MEDIUM)));
        }

        assertThat(done.await(5, TimeUnit.SECONDS)).isTrue();
        producers.shutdown();
        assertThat(producers.awaitTermination(5, TimeUnit.SECONDS)).isTrue();
        worker.shutdown();
        assertThat(worker.awaitTermination(5, TimeUnit.SECONDS)).isTrue();
        assertThat(peak.get()).isEqualTo(1);
        assertThat(threaded.stats().byStatus()).containsEntry(JobStatus.COMPLETED, 50L);
    }
}
