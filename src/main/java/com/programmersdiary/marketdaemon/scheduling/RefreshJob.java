package com.programmersdiary.marketdaemon.scheduling;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.support.CronTrigger;

import java.time.ZoneId;
import java.util.concurrent.ScheduledFuture;

/**
 * One armed cron trigger bound to a refresh action. Jobs are created already
 * scheduled and never come back once destroyed.
 */
public final class RefreshJob {

    private static final Logger log = LoggerFactory.getLogger(RefreshJob.class);

    private final int id;
    private final long generation;
    private final RefreshSchedule schedule;
    private final RefreshAction action;
    private volatile JobState state = JobState.SCHEDULED;
    private volatile ScheduledFuture<?> future;

    private RefreshJob(int id, long generation, RefreshSchedule schedule, RefreshAction action) {
        this.id = id;
        this.generation = generation;
        this.schedule = schedule;
        this.action = action;
    }

    static RefreshJob arm(int id, long generation, RefreshSchedule schedule, RefreshAction action,
                          TaskScheduler taskScheduler, ZoneId zone) {
        var job = new RefreshJob(id, generation, schedule, action);
        job.future = taskScheduler.schedule(job::fire, new CronTrigger(schedule.triggerExpression(), zone));
        log.info("Scheduled {} refresh job {} with cron '{}' in {}", schedule.name(), id, schedule.cronExpression(), zone);
        return job;
    }

    public int id() {
        return id;
    }

    public long generation() {
        return generation;
    }

    public RefreshSchedule schedule() {
        return schedule;
    }

    public JobState state() {
        return state;
    }

    JobStatus toStatus() {
        var current = state;
        return new JobStatus(id, current == JobState.SCHEDULED, current == JobState.DESTROYED);
    }

    // Does not interrupt a firing that is already running.
    void destroy() {
        state = JobState.DESTROYED;
        var armed = future;
        if (armed != null) {
            armed.cancel(false);
        }
    }

    void fire() {
        if (state == JobState.DESTROYED) {
            log.debug("Skipping {} refresh, job {} of generation {} was destroyed", schedule.name(), id, generation);
            return;
        }
        log.info("Running {} market indicators refresh (job {}, generation {})", schedule.name(), id, generation);
        try {
            var result = action.refresh();
            if (result.success()) {
                log.info("{} refresh finished with status {}", schedule.name(), result.status());
            } else {
                log.error("{} refresh failed: status={}, error={}", schedule.name(), result.status(), result.error());
            }
        } catch (RuntimeException e) {
            log.error("{} refresh threw: {}", schedule.name(), e.getMessage(), e);
        }
    }
}
