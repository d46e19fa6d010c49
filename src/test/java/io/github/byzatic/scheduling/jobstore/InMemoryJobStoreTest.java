package io.github.byzatic.scheduling.jobstore;

import io.github.byzatic.scheduling.base_exceptions.SchedulingException;
import io.github.byzatic.scheduling.jobs.CancellationTokenSource;
import io.github.byzatic.scheduling.jobs.JobInfo;
import io.github.byzatic.scheduling.jobs.JobResult;
import io.github.byzatic.scheduling.jobs.RunningJob;
import io.github.byzatic.scheduling.triggers.Trigger;
import io.github.byzatic.scheduling.triggers.TriggerState;
import io.github.byzatic.scheduling.workflow.ActivityContext;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.UUID;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryJobStoreTest {

    private static RunningJob runningJob(JobInfo job) {
        UUID id = UUID.randomUUID();
        Trigger trigger = Trigger.once();
        CancellationTokenSource source = new CancellationTokenSource();
        return new RunningJob(id, job, trigger, source, new ActivityContext(job, trigger, id, null, null, source.getToken()));
    }

    @Test
    void scheduledJobs_addGetRemove() {
        InMemoryJobStore store = new InMemoryJobStore();
        JobInfo job = JobInfo.fromRunnable("r", () -> { });

        assertTrue(store.addScheduledJob(job));
        assertFalse(store.addScheduledJob(job));
        assertSame(job, store.getScheduledJob(job.getId()).orElseThrow());
        assertEquals(List.of(job), store.getScheduledJobs());

        assertTrue(store.removeScheduledJob(job.getId()));
        assertFalse(store.removeScheduledJob(job.getId()));
        assertTrue(store.getScheduledJob(job.getId()).isEmpty());
    }

    @Test
    void addTrigger_bindsAndAttaches_andRejectsSecondOwner() throws Exception {
        InMemoryJobStore store = new InMemoryJobStore();
        JobInfo job = JobInfo.fromRunnable("a", () -> { });
        JobInfo other = JobInfo.fromRunnable("b", () -> { });
        Trigger trigger = Trigger.once();

        store.addTrigger(trigger, job);
        assertEquals(List.of(trigger), job.getTriggers());
        assertSame(trigger, store.getTrigger(trigger.getId()).orElseThrow());
        assertSame(job, store.getTriggerOwner(trigger.getId()).orElseThrow());

        assertThrows(SchedulingException.class, () -> store.addTrigger(trigger, other));
        assertTrue(other.getTriggers().isEmpty());

        assertTrue(store.removeTrigger(trigger.getId()));
        assertTrue(job.getTriggers().isEmpty());
        assertTrue(store.getTriggers().isEmpty());
        assertEquals(TriggerState.PENDING, trigger.getState(), "removeTrigger must not cancel the trigger");
    }

    @Test
    void removeScheduledJob_cancelsAndDetachesTriggers() throws Exception {
        InMemoryJobStore store = new InMemoryJobStore();
        JobInfo job = JobInfo.fromRunnable("r", () -> { });
        Trigger trigger = Trigger.once();
        store.addScheduledJob(job);
        store.addTrigger(trigger, job);

        assertTrue(store.removeScheduledJob(job.getId()));
        assertEquals(TriggerState.CANCELLED, trigger.getState());
        assertTrue(store.getTrigger(trigger.getId()).isEmpty());
        assertFalse(job.hasTriggers());
    }

    @Test
    void runningJob_movesToCompletedOnlyWhenFinalized() throws Exception {
        InMemoryJobStore store = new InMemoryJobStore();
        RunningJob rj = runningJob(JobInfo.fromFunction("f", token -> 1));
        JobResult result = rj.getResult();

        store.addRunningJob(result);
        assertThrows(SchedulingException.class, () -> store.addRunningJob(result));
        assertSame(result, store.getRunningJob(rj.getId()).orElseThrow());
        assertThrows(IllegalStateException.class, () -> store.completeRunningJob(result));

        rj.start(null, Runnable::run).get(1, TimeUnit.SECONDS);
        assertTrue(store.completeRunningJob(result));
        assertFalse(store.completeRunningJob(result));
        assertTrue(store.getRunningJobs().isEmpty());
        assertEquals(List.of(result), store.getCompletedJobs());
    }

    @Test
    void completedJobs_evictOldestBeyondCapacity() throws Exception {
        InMemoryJobStore store = InMemoryJobStore.builder().completedJobsCapacity(2).build();
        JobInfo job = JobInfo.fromFunction("f", token -> null);
        JobResult[] results = new JobResult[3];
        for (int i = 0; i < 3; i++) {
            RunningJob rj = runningJob(job);
            store.addRunningJob(rj.getResult());
            results[i] = rj.start(null, Runnable::run).get(1, TimeUnit.SECONDS);
            store.completeRunningJob(results[i]);
        }
        assertEquals(List.of(results[1], results[2]), store.getCompletedJobs());
        assertThrows(IllegalArgumentException.class, () -> InMemoryJobStore.builder().completedJobsCapacity(0));
    }
}
