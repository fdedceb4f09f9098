package com.programmersdiary.marketdaemon.scheduling;

/**
 * Work performed by a refresh job on every firing. Implementations report
 * failure through the returned result instead of throwing.
 */
@FunctionalInterface
public interface RefreshAction {

    RefreshResult refresh();
}
