package com.programmersdiary.marketdaemon.scheduling;

import java.util.List;

public record SchedulerStatus(List<JobStatus> jobs, int totalJobs) {
}
