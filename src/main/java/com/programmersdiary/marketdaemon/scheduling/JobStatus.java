package com.programmersdiary.marketdaemon.scheduling;

public record JobStatus(int id, boolean running, boolean destroyed) {
}
