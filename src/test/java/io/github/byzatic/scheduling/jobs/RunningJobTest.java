package io.github.byzatic.scheduling.jobs;

import io.github.byzatic.scheduling.triggers.Trigger;
import io.github.byzatic.scheduling.workflow.ActivityContext;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class RunningJobTest {

    ExecutorService pool = Executors.newFixedThreadPool(2);

    @AfterEach
    void tearDown() {
        pool.shutdownNow();
    }

    private static RunningJob runningJob(JobInfo job) {
        UUID id = UUID.randomUUID();
        Trigger trigger = Trigger.once();
        CancellationTokenSource source = new CancellationTokenSource();
        ActivityContext ctx = new ActivityContext(job, trigger, id, null, null, source.getToken());
        return new RunningJob(id, job, trigger, source, ctx);
    }

    @Test
    void normalReturn_isCompletedWithValue() throws Exception {
        RunningJob rj = runningJob(JobInfo.fromFunction("ok", token -> "value"));
        JobResult result = rj.getResult();
        assertEquals(JobState.RUNNING, result.getState());
        assertTrue(result.getEndedAt().isEmpty());

        JobResult done = rj.start(null, pool).get(1, TimeUnit.SECONDS);

        assertSame(result, done);
        assertEquals(JobState.COMPLETED, done.getState());
        assertEquals("value", done.getValue());
        assertTrue(done.getException().isEmpty());
        assertFalse(done.getEndedAt().orElseThrow().isBefore(done.getStartedAt()));
        assertEquals(Duration.between(done.getStartedAt(), done.getEndedAt().orElseThrow()), done.getElapsed());
        assertEquals(rj.getId(), done.getRunningJobId());
        assertEquals(rj.getScheduledJob().getId(), done.getScheduledJobId());
        assertEquals(rj.getTrigger().getId(), done.getTriggerId());
    }

    @Test
    void failure_isRecordedWithException() throws Exception {
        RunningJob rj = runningJob(JobInfo.fromFunction("bad", token -> {
            throw new IllegalStateException("broken");
        }));
        JobResult done = rj.start(null, pool).get(1, TimeUnit.SECONDS);

        assertEquals(JobState.FAILED, done.getState());
        assertInstanceOf(IllegalStateException.class, done.getException().orElseThrow());
        assertNull(done.getValue());
    }

    @Test
    void honouredCancellation_isCanceled() throws Exception {
        CountDownLatch started = new CountDownLatch(1);
        RunningJob rj = runningJob(JobInfo.fromFunction("loop", token -> {
            started.countDown();
            while (true) {
                token.throwIfCancellationRequested();
                Thread.sleep(5);
            }
        }));
        CompletableFuture<JobResult> completion = rj.start(null, pool);
        assertTrue(started.await(1, TimeUnit.SECONDS));

        rj.cancel("enough");
        JobResult done = completion.get(1, TimeUnit.SECONDS);

        assertEquals(JobState.CANCELED, done.getState());
        assertTrue(done.isCancellationRequested());
        assertEquals("enough", done.getCancellationReason());
    }

    @Test
    void returnAfterCancellationRequest_isStillCompleted() throws Exception {
        CountDownLatch started = new CountDownLatch(1);
        RunningJob rj = runningJob(JobInfo.fromFunction("polite", token -> {
            started.countDown();
            token.awaitCancellation(Duration.ofSeconds(5));
            return "stopped";
        }));
        CompletableFuture<JobResult> completion = rj.start(null, pool);
        assertTrue(started.await(1, TimeUnit.SECONDS));
        rj.cancel("please");

        JobResult done = completion.get(1, TimeUnit.SECONDS);
        assertEquals(JobState.COMPLETED, done.getState());
        assertTrue(done.isCancellationRequested());
    }

    @Test
    void abandon_finalizesAsCanceled_andDiscardsLateOutcome() throws Exception {
        CountDownLatch release = new CountDownLatch(1);
        RunningJob rj = runningJob(JobInfo.fromFunction("stubborn", token -> {
            release.await();
            return "late";
        }));
        CompletableFuture<JobResult> completion = rj.start(null, pool);

        assertTrue(rj.abandon("grace elapsed"));
        assertFalse(rj.abandon("again"));
        JobResult done = completion.get(1, TimeUnit.SECONDS);
        assertEquals(JobState.CANCELED, done.getState());
        assertTrue(done.getException().orElseThrow().getMessage().contains("Abandoned"));

        release.countDown();
        rj.getExecution().get(1, TimeUnit.SECONDS);
        assertEquals(JobState.CANCELED, done.getState());
        assertNull(done.getValue());
    }

    @Test
    void start_canOnlyBeCalledOnce() {
        RunningJob rj = runningJob(JobInfo.fromRunnable("r", () -> { }));
        rj.start(null, pool);
        assertThrows(IllegalStateException.class, () -> rj.start(null, pool));
    }

    @Test
    void rejectedExecution_isRecordedAsFailure() throws Exception {
        ExecutorService closed = Executors.newSingleThreadExecutor();
        closed.shutdown();
        RunningJob rj = runningJob(JobInfo.fromRunnable("r", () -> { }));

        JobResult done = rj.start(null, closed).get(1, TimeUnit.SECONDS);
        assertEquals(JobState.FAILED, done.getState());
    }
}
