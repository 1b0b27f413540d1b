package net.tessera.core.model;

public enum InstigatorStatus {
    RUNNING, STOPPED
}
