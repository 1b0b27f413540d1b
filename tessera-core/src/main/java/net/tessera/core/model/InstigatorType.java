package net.tessera.core.model;

public enum InstigatorType {
    SCHEDULE, SENSOR;

    public static InstigatorType from(String s) {
        if (s == null) return SENSOR;
        return InstigatorType.valueOf(s.toUpperCase());
    }
}
