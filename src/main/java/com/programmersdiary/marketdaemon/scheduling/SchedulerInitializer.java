package com.programmersdiary.marketdaemon.scheduling;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(name = "marketdaemon.scheduler.auto-start", havingValue = "true")
public class SchedulerInitializer {

    private static final Logger log = LoggerFactory.getLogger(SchedulerInitializer.class);

    private final RefreshScheduler refreshScheduler;

    public SchedulerInitializer(RefreshScheduler refreshScheduler) {
        this.refreshScheduler = refreshScheduler;
    }

    @EventListener(ApplicationReadyEvent.class)
    void startOnReady() {
        var result = refreshScheduler.start();
        log.info("Refresh jobs armed on startup: {} ({})", result.schedules(), result.timezone());
    }
}
