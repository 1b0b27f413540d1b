package net.tessera.core.model;

import java.util.Map;

public enum EventType {
    RUN_ENQUEUED, RUN_STARTING, RUN_START, RUN_SUCCESS, RUN_FAILURE, RUN_CANCELED,
    STEP_START, STEP_OUTPUT, STEP_SUCCESS, STEP_FAILURE, STEP_SKIPPED,
    ASSET_MATERIALIZATION, ENGINE_EVENT;

    /** Names written by releases that still called jobs pipelines. */
    public static final Map<String, String> LEGACY_NAMES = Map.of(
            "PIPELINE_ENQUEUED", "RUN_ENQUEUED",
            "PIPELINE_STARTING", "RUN_STARTING",
            "PIPELINE_START", "RUN_START",
            "PIPELINE_SUCCESS", "RUN_SUCCESS",
            "PIPELINE_FAILURE", "RUN_FAILURE",
            "PIPELINE_CANCELED", "RUN_CANCELED",
            "STEP_MATERIALIZATION", "ASSET_MATERIALIZATION");

    public static EventType fromValue(String value) {
        if (value == null) return null;
        return EventType.valueOf(LEGACY_NAMES.getOrDefault(value, value));
    }

    public boolean isStepEvent() {
        return name().startsWith("STEP_");
    }
}
