package net.tessera.core.model;

public record SensorInstigatorData(
        Double lastTickTimestamp,
        String lastRunKey,
        Integer minIntervalSeconds,
        String cursor
) {
    public SensorInstigatorData withCursor(String next) {
        return new SensorInstigatorData(lastTickTimestamp, lastRunKey, minIntervalSeconds, next);
    }
}
