package com.programmersdiary.marketdaemon.scheduling;

import java.util.List;

public record StartResult(List<String> schedules, String timezone) {
}
