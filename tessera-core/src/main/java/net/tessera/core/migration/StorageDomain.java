package net.tessera.core.migration;

public enum StorageDomain {
    RUNS("run storage"),
    EVENT_LOGS("event log storage"),
    INSTIGATORS("instigator storage");

    private final String displayName;

    StorageDomain(String displayName) {
        this.displayName = displayName;
    }

    public String displayName() { return displayName; }

    public static StorageDomain from(String s) {
        return StorageDomain.valueOf(s.trim().toUpperCase().replace('-', '_'));
    }
}
