package com.agentdeploy.orchestrator.service;

import com.agentdeploy.orchestrator.model.JobRecord;
import com.agentdeploy.orchestrator.model.JobStatus;
import com.agentdeploy.orchestrator.model.StepState;
import com.agentdeploy.orchestrator.pipeline.DeploymentPipeline;
import com.agentdeploy.orchestrator.pipeline.PipelineStep;
import com.agentdeploy.orchestrator.pipeline.StepContext;
import com.agentdeploy.orchestrator.pipeline.StepException;
import com.agentdeploy.orchestrator.pipeline.StepOutput;
import com.agentdeploy.orchestrator.support.DirectExecutorService;
import com.agentdeploy.orchestrator.support.InMemoryJobStore;
import com.agentdeploy.orchestrator.support.MutableClock;
import com.agentdeploy.orchestrator.support.ScriptedStep;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Function;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * End-to-end runs of the processor against the in-memory store.
 *
 * The default executor runs jobs on the ticking thread, so each tick()
 * returns only after its jobs reached a terminal state.
 */
class QueueProcessorTest {

    static final Duration LEASE = Duration.ofMinutes(5);

    final MutableClock        clock   = new MutableClock(Instant.parse("2026-01-01T10:00:00Z"));
    final InMemoryJobStore    store   = new InMemoryJobStore();
    final SimpleMeterRegistry meters  = new SimpleMeterRegistry();
    final StoreRetry          retry   = new StoreRetry(3, Duration.ofMillis(1), Duration.ofMillis(2));
    final StatusPublisher     publisher = new StatusPublisher(store, retry, clock);
    final List<String>        journal = ScriptedStep.journal();

    JobRunner      runner;
    QueueProcessor processor;

    @AfterEach
    void tearDown() throws InterruptedException {
        if (processor != null) {
            processor.shutdown();
        }
        if (runner != null) {
            runner.shutdown();
        }
    }

    // ------------------------------------------------------------------
    // Happy path
    // ------------------------------------------------------------------

    @Test
    void queuedJob_runsAllStepsAndIsDeployed() {
        start(1, new DirectExecutorService(), standardSteps(ctx -> StepOutput.of("imageUri", "img:1")));
        JobRecord job = submit("agent-1");
        List<Long> versions = Collections.synchronizedList(new ArrayList<>());
        List<Integer> progress = Collections.synchronizedList(new ArrayList<>());
        store.subscribe(job.jobId(), r -> {
            versions.add(r.version());
            progress.add(r.progressPercent());
        });

        processor.tick();

        JobRecord done = store.get(job.jobId()).orElseThrow();
        assertThat(done.status()).isEqualTo(JobStatus.DEPLOYED);
        assertThat(done.progressPercent()).isEqualTo(100);
        assertThat(done.resultEndpoint()).isEqualTo("https://agent-1.run.app");
        assertThat(done.steps()).extracting(s -> s.state()).containsOnly(StepState.SUCCEEDED);
        assertThat(done.steps()).hasSize(4);
        assertThat(done.stepAt(2).output()).containsEntry("imageUri", "img:1");
        assertThat(versions).isSorted().doesNotHaveDuplicates();
        assertThat(progress).isSorted().contains(10, 50, 80, 100);
        assertThat(meters.counter("deployer.jobs.finished", "outcome", "deployed").count()).isEqualTo(1.0);
        assertThat(processor.inFlightCount()).isZero();
    }

    // ------------------------------------------------------------------
    // Failures
    // ------------------------------------------------------------------

    @Test
    void buildFailure_failsJobWithBuilderMessage() {
        start(1, new DirectExecutorService(), standardSteps(ctx -> {
            throw new StepException(StepException.Kind.FAILED, "image too large");
        }));
        JobRecord job = submit("agent-1");

        processor.tick();

        JobRecord done = store.get(job.jobId()).orElseThrow();
        assertThat(done.status()).isEqualTo(JobStatus.FAILED);
        assertThat(done.errorMessage()).isEqualTo("image too large");
        assertThat(done.progressPercent()).isEqualTo(10);
        assertThat(done.stepAt(2).state()).isEqualTo(StepState.FAILED);
        assertThat(done.stepAt(2).errorMessage()).isEqualTo("image too large");
        assertThat(journal).containsExactly("run:validate", "run:build");
    }

    @Test
    void transientStoreErrors_areRetried() {
        start(1, new DirectExecutorService(), standardSteps(ctx -> StepOutput.of("imageUri", "img:1")));
        JobRecord job = submit("agent-1");
        store.failNext(2);

        processor.tick();

        assertThat(store.get(job.jobId()).orElseThrow().status()).isEqualTo(JobStatus.DEPLOYED);
    }

    @Test
    void storeOutageMidRun_leavesJobProcessingForTheReaper() {
        start(1, new DirectExecutorService(), standardSteps(ctx -> {
            store.failNext(3);   // every retry of the next write fails, then the store is back
            return StepOutput.of("imageUri", "img:1");
        }));
        JobRecord job = submit("agent-1");

        processor.tick();

        JobRecord stalled = store.get(job.jobId()).orElseThrow();
        assertThat(stalled.status()).isEqualTo(JobStatus.PROCESSING);
        assertThat(stalled.errorMessage()).isNull();
        assertThat(stalled.progressPercent()).isEqualTo(10);
        assertThat(journal).containsExactly("run:validate", "run:build");
        assertThat(meters.counter("deployer.jobs.abandoned").count()).isEqualTo(1.0);
        assertThat(processor.inFlightCount()).isZero();

        clock.advance(LEASE.plusMinutes(1));
        LeaseReaper reaper = new LeaseReaper(store, publisher, retry, meters, clock, 3);
        assertThat(reaper.reapExpired()).isEqualTo(1);
        JobRecord requeued = store.get(job.jobId()).orElseThrow();
        assertThat(requeued.status()).isEqualTo(JobStatus.QUEUED);
        assertThat(requeued.progressPercent()).isEqualTo(10);
    }

    @Test
    void storeOutage_leavesJobQueued() {
        start(1, new DirectExecutorService(), standardSteps(ctx -> StepOutput.of("imageUri", "img:1")));
        JobRecord job = submit("agent-1");
        store.failNext(3);

        processor.tick();

        assertThat(store.get(job.jobId()).orElseThrow().status()).isEqualTo(JobStatus.QUEUED);
        assertThat(journal).isEmpty();
    }

    // ------------------------------------------------------------------
    // Cancellation
    // ------------------------------------------------------------------

    @Test
    void cancelWhileQueued_cancelsWithoutRunningSteps() {
        start(1, new DirectExecutorService(), standardSteps(ctx -> StepOutput.of("imageUri", "img:1")));
        JobRecord job = submit("agent-1");
        store.compareAndSet(job.jobId(), job.version(), r -> r.requestCancel(clock.instant()));

        processor.tick();

        JobRecord done = store.get(job.jobId()).orElseThrow();
        assertThat(done.status()).isEqualTo(JobStatus.CANCELLED);
        assertThat(done.claimCount()).isZero();
        assertThat(journal).isEmpty();
    }

    @Test
    void cancelDuringBuild_stopsAtNextBoundaryAndCompensatesInReverse() {
        start(1, new DirectExecutorService(), standardSteps(ctx -> {
            requestCancel(ctx.jobId());
            return StepOutput.of("imageUri", "img:1");
        }));
        JobRecord job = submit("agent-1");

        processor.tick();

        JobRecord done = store.get(job.jobId()).orElseThrow();
        assertThat(done.status()).isEqualTo(JobStatus.CANCELLED);
        assertThat(done.progressPercent()).isEqualTo(50);
        assertThat(done.resultEndpoint()).isNull();
        assertThat(journal).containsExactly("run:validate", "run:build", "undo:build", "undo:validate");
    }

    @Test
    void cancelDuringLastStep_isTooLate_jobIsDeployed() {
        start(1, new DirectExecutorService(), List.of(
                new ScriptedStep("validate", 10, true, journal, ctx -> StepOutput.empty()),
                new ScriptedStep("build", 50, false, journal, ctx -> StepOutput.of("imageUri", "img:1")),
                new ScriptedStep("deploy", 80, true, journal, ctx -> StepOutput.of("serviceUrl", "https://x")),
                new ScriptedStep("verify", 100, true, journal, ctx -> {
                    requestCancel(ctx.jobId());
                    return StepOutput.of(StepOutput.ENDPOINT, "https://x");
                })));
        JobRecord job = submit("agent-1");

        processor.tick();

        JobRecord done = store.get(job.jobId()).orElseThrow();
        assertThat(done.status()).isEqualTo(JobStatus.DEPLOYED);
        assertThat(done.resultEndpoint()).isEqualTo("https://x");
        assertThat(journal).noneMatch(entry -> entry.startsWith("undo:"));
    }

    @Test
    void cancelWhileWorkersBusy_isSweptWithoutAFreeSlot() throws Exception {
        CountDownLatch building = new CountDownLatch(1);
        CountDownLatch release  = new CountDownLatch(1);
        ExecutorService pool = Executors.newSingleThreadExecutor();
        start(1, pool, standardSteps(ctx -> {
            building.countDown();
            try {
                release.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return StepOutput.of("imageUri", "img:1");
        }));
        JobRecord running = submit("agent-a");
        processor.tick();
        assertThat(building.await(5, TimeUnit.SECONDS)).isTrue();

        JobRecord waiting = submit("agent-b");
        requestCancel(waiting.jobId());
        processor.tick();   // the only slot is taken

        JobRecord cancelled = store.get(waiting.jobId()).orElseThrow();
        assertThat(cancelled.status()).isEqualTo(JobStatus.CANCELLED);
        assertThat(cancelled.claimCount()).isZero();
        assertThat(store.get(running.jobId()).orElseThrow().status()).isEqualTo(JobStatus.PROCESSING);

        release.countDown();
        awaitStatus(running.jobId(), JobStatus.DEPLOYED);
    }

    // ------------------------------------------------------------------
    // Scheduling
    // ------------------------------------------------------------------

    @Test
    void lowerPriorityNumberRunsFirst() {
        start(1, new DirectExecutorService(), standardSteps(ctx -> StepOutput.of("imageUri", "img:1")));
        JobRecord routine = store.create(JobRecord.queued(UUID.randomUUID(), "a", "{}", 5, clock.instant()));
        clock.advance(Duration.ofSeconds(1));
        JobRecord urgent  = store.create(JobRecord.queued(UUID.randomUUID(), "b", "{}", 1, clock.instant()));
        List<UUID> order = Collections.synchronizedList(new ArrayList<>());
        store.bus().subscribeTarget("a", r -> { if (r.claimCount() == 1 && r.steps().isEmpty()) order.add(r.jobId()); });
        store.bus().subscribeTarget("b", r -> { if (r.claimCount() == 1 && r.steps().isEmpty()) order.add(r.jobId()); });

        processor.tick();
        processor.tick();

        assertThat(order).containsExactly(urgent.jobId(), routine.jobId());
    }

    @Test
    void targetWithProcessingJob_isSkipped() {
        start(1, new DirectExecutorService(), standardSteps(ctx -> StepOutput.of("imageUri", "img:1")));
        JobRecord elsewhere = JobRecord.queued(UUID.randomUUID(), "agent-1", "{}", 5, clock.instant())
                .claim("w-other", clock.instant(), LEASE)
                .withVersion(1L);
        clock.advance(Duration.ofSeconds(1));
        JobRecord waiting = JobRecord.queued(UUID.randomUUID(), "agent-1", "{}", 1, clock.instant());
        store.put(elsewhere);
        store.put(waiting);

        processor.tick();

        JobRecord after = store.get(waiting.jobId()).orElseThrow();
        assertThat(after.status()).isEqualTo(JobStatus.QUEUED);
        assertThat(after.claimCount()).isZero();
        assertThat(journal).isEmpty();
    }

    @Test
    void claimRacedByEarlierJobForSameTarget_isReturnedToQueue() {
        start(1, new DirectExecutorService(), standardSteps(ctx -> StepOutput.of("imageUri", "img:1")));
        JobRecord later = submit("agent-1");
        JobRecord earlier = JobRecord.queued(UUID.randomUUID(), "agent-1", "{}", 5,
                        later.createdAt().minusSeconds(60))
                .claim("w-other", clock.instant(), LEASE)
                .withVersion(1L);
        // Another processor claims the earlier job between our claim and the post-claim check.
        AtomicBoolean raced = new AtomicBoolean();
        store.bus().subscribeTarget("agent-1", r -> {
            if (r.jobId().equals(later.jobId()) && r.status() == JobStatus.PROCESSING && raced.compareAndSet(false, true)) {
                store.put(earlier);
            }
        });

        processor.tick();

        JobRecord backoff = store.get(later.jobId()).orElseThrow();
        assertThat(raced).isTrue();
        assertThat(backoff.status()).isEqualTo(JobStatus.QUEUED);
        assertThat(backoff.claimedBy()).isNull();
        assertThat(backoff.claimCount()).isEqualTo(1);
        assertThat(store.get(earlier.jobId()).orElseThrow().status()).isEqualTo(JobStatus.PROCESSING);
        assertThat(journal).isEmpty();
        assertThat(meters.counter("deployer.jobs.claimed").count()).isZero();
    }

    @Test
    void neverRunsMoreThanConcurrencyJobs() throws Exception {
        CountDownLatch running = new CountDownLatch(2);
        CountDownLatch release = new CountDownLatch(1);
        ExecutorService pool = Executors.newFixedThreadPool(2);
        start(2, pool, standardSteps(ctx -> {
            running.countDown();
            try {
                release.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return StepOutput.of("imageUri", "img:1");
        }));
        JobRecord a = submit("agent-a");
        JobRecord b = submit("agent-b");
        JobRecord c = submit("agent-c");

        processor.tick();
        assertThat(running.await(5, TimeUnit.SECONDS)).isTrue();
        processor.tick();   // no free slot

        assertThat(processor.inFlightCount()).isEqualTo(2);
        assertThat(store.get(c.jobId()).orElseThrow().status()).isEqualTo(JobStatus.QUEUED);

        release.countDown();
        awaitStatus(a.jobId(), JobStatus.DEPLOYED);
        awaitStatus(b.jobId(), JobStatus.DEPLOYED);
        awaitIdle();
        processor.tick();
        awaitStatus(c.jobId(), JobStatus.DEPLOYED);
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private void start(int concurrency, ExecutorService workers, List<PipelineStep> steps) {
        DeploymentPipeline pipeline = new DeploymentPipeline(steps, meters);
        runner    = new JobRunner(pipeline, publisher, meters, LEASE);
        processor = new QueueProcessor(store, publisher, runner, retry, meters, concurrency, LEASE, "w-test", workers);
    }

    private List<PipelineStep> standardSteps(Function<StepContext, StepOutput> build) {
        return List.of(
                new ScriptedStep("validate", 10, true, journal, ctx -> StepOutput.of("serviceName", "agent-1")),
                new ScriptedStep("build", 50, false, journal, build),
                new ScriptedStep("deploy", 80, true, journal,
                        ctx -> StepOutput.of("serviceUrl", "https://" + ctx.targetId() + ".run.app")),
                new ScriptedStep("verify", 100, true, journal,
                        ctx -> StepOutput.of(StepOutput.ENDPOINT, "https://" + ctx.targetId() + ".run.app")));
    }

    private JobRecord submit(String target) {
        JobRecord job = store.create(JobRecord.queued(UUID.randomUUID(), target, "{}", 5, clock.instant()));
        clock.advance(Duration.ofMillis(10));
        return job;
    }

    private void requestCancel(UUID jobId) {
        JobRecord current = store.get(jobId).orElseThrow();
        store.compareAndSet(jobId, current.version(), r -> r.requestCancel(clock.instant()));
    }

    private void awaitStatus(UUID jobId, JobStatus expected) throws InterruptedException {
        long deadline = System.currentTimeMillis() + 5_000;
        while (store.get(jobId).orElseThrow().status() != expected && System.currentTimeMillis() < deadline) {
            Thread.sleep(10);
        }
        assertThat(store.get(jobId).orElseThrow().status()).isEqualTo(expected);
    }

    private void awaitIdle() throws InterruptedException {
        long deadline = System.currentTimeMillis() + 5_000;
        while (processor.inFlightCount() > 0 && System.currentTimeMillis() < deadline) {
            Thread.sleep(10);
        }
    }
}
