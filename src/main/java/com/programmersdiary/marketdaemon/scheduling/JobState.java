package com.programmersdiary.marketdaemon.scheduling;

public enum JobState {
    SCHEDULED,
    DESTROYED
}
