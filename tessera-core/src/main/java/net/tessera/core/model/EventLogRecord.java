package net.tessera.core.model;

public record EventLogRecord(long logId, EventLogEntry entry) {}
