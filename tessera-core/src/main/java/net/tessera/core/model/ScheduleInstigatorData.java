package net.tessera.core.model;

public record ScheduleInstigatorData(String cronSchedule, Double startTimestamp, String executionTimezone) {}
