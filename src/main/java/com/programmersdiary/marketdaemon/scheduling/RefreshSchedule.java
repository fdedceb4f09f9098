package com.programmersdiary.marketdaemon.scheduling;

import org.springframework.scheduling.support.CronExpression;

public record RefreshSchedule(String name, String cronExpression) {

    public RefreshSchedule {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Schedule name must not be blank");
        }
        if (cronExpression == null || cronExpression.isBlank()) {
            throw new IllegalArgumentException("Cron expression for '" + name + "' must not be blank");
        }
        cronExpression = cronExpression.trim();
        if (!CronExpression.isValidExpression(toTriggerExpression(cronExpression))) {
            throw new IllegalArgumentException("Invalid cron expression for '" + name + "': " + cronExpression);
        }
    }

    // Spring cron has a leading seconds field; five-field expressions fire on second 0.
    public String triggerExpression() {
        return toTriggerExpression(cronExpression);
    }

    public String describe() {
        return name + " (" + cronExpression + ")";
    }

    private static String toTriggerExpression(String expression) {
        return expression.split("\\s+").length == 5 ? "0 " + expression : expression;
    }
}
