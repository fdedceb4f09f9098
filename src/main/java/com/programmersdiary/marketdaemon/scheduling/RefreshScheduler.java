package com.programmersdiary.marketdaemon.scheduling;

import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Service;

import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;

/**
 * Owns the market indicators refresh jobs: a morning and an afternoon cron
 * trigger in a fixed zone, both calling the same {@link RefreshAction}.
 * <p>
 * {@link #start()}, {@link #stop()} and {@link #status()} only touch the job
 * list and are synchronized on this instance. {@link #fireOnce()} runs the
 * action on the caller's thread without holding the lock. Overlapping firings
 * are not serialized.
 */
@Service
public class RefreshScheduler {

    private static final Logger log = LoggerFactory.getLogger(RefreshScheduler.class);

    private final TaskScheduler taskScheduler;
    private final RefreshAction refreshAction;
    private final ZoneId zone;
    private final List<RefreshSchedule> schedules;
    private final List<RefreshJob> jobs = new ArrayList<>();
    private long generation;

    public RefreshScheduler(TaskScheduler taskScheduler,
                            RefreshAction refreshAction,
                            @Value("${marketdaemon.scheduler.timezone:Asia/Seoul}") String timezone,
                            @Value("${marketdaemon.scheduler.morning-cron:0 8 * * *}") String morningCron,
                            @Value("${marketdaemon.scheduler.afternoon-cron:0 15 * * *}") String afternoonCron) {
        this.taskScheduler = taskScheduler;
        this.refreshAction = refreshAction;
        this.zone = ZoneId.of(timezone);
        this.schedules = List.of(
                new RefreshSchedule("morning", morningCron),
                new RefreshSchedule("afternoon", afternoonCron));
    }

    public synchronized StartResult start() {
        destroyAll();
        generation++;
        var armed = new ArrayList<RefreshJob>(schedules.size());
        try {
            for (var schedule : schedules) {
                armed.add(RefreshJob.arm(armed.size(), generation, schedule, refreshAction, taskScheduler, zone));
            }
        } catch (RuntimeException e) {
            armed.forEach(RefreshJob::destroy);
            log.error("Refresh scheduler failed to arm generation {}: {}", generation, e.getMessage());
            throw e;
        }
        jobs.addAll(armed);
        log.info("Refresh scheduler started generation {} with {} jobs", generation, jobs.size());
        return new StartResult(schedules.stream().map(RefreshSchedule::describe).toList(), zone.getId());
    }

    public synchronized void stop() {
        int stopped = destroyAll();
        log.info("Refresh scheduler stopped, {} jobs destroyed", stopped);
    }

    public synchronized SchedulerStatus status() {
        var statuses = jobs.stream().map(RefreshJob::toStatus).toList();
        return new SchedulerStatus(statuses, statuses.size());
    }

    public RefreshResult fireOnce() {
        log.info("Running market indicators refresh on demand");
        return refreshAction.refresh();
    }

    synchronized List<RefreshJob> jobs() {
        return List.copyOf(jobs);
    }

    @PreDestroy
    void shutdown() {
        stop();
    }

    private int destroyAll() {
        int destroyed = 0;
        for (var job : jobs) {
            if (job.state() == JobState.SCHEDULED) {
                job.destroy();
                destroyed++;
            }
        }
        jobs.clear();
        return destroyed;
    }
}
