package net.tessera.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Metadata of one execution attempt of a job. Lineage ({@code rootRunId}, {@code parentRunId}) is a plain id
 * reference resolved through the run store. Partition membership travels in the reserved
 * {@link RunTags#PARTITION} / {@link RunTags#PARTITION_SET} tags.
 */
public record Run(
        String runId,
        String jobName,
        RunStatus status,
        Map<String, Object> runConfig,
        Map<String, String> tags,
        String rootRunId,
        String parentRunId,
        String jobSnapshotId,
        String executionPlanSnapshotId,
        List<String> opSelection,
        List<String> stepKeysToExecute,
        Set<AssetKey> assetSelection
) {
    public Run {
        Objects.requireNonNull(runId, "runId");
        Objects.requireNonNull(jobName, "jobName");
        Objects.requireNonNull(status, "status");
        runConfig = runConfig == null ? Map.of() : PlainValues.normalizeMap(runConfig);
        tags = tags == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(tags));
        opSelection = opSelection == null ? null : List.copyOf(opSelection);
        stepKeysToExecute = stepKeysToExecute == null ? null : List.copyOf(stepKeysToExecute);
        assetSelection = assetSelection == null ? null : Collections.unmodifiableSet(new LinkedHashSet<>(assetSelection));
    }

    public static Builder builder(String runId, String jobName) {
        return new Builder(runId, jobName);
    }

    public Builder toBuilder() {
        Builder b = new Builder(runId, jobName);
        b.status = status;
        b.runConfig.putAll(runConfig);
        b.tags.putAll(tags);
        b.rootRunId = rootRunId;
        b.parentRunId = parentRunId;
        b.jobSnapshotId = jobSnapshotId;
        b.executionPlanSnapshotId = executionPlanSnapshotId;
        b.opSelection = opSelection;
        b.stepKeysToExecute = stepKeysToExecute;
        b.assetSelection = assetSelection;
        return b;
    }

    public Run withStatus(RunStatus next) {
        return toBuilder().status(next).build();
    }

    public Run withTags(Map<String, String> extra) {
        return toBuilder().tags(extra).build();
    }

    public String partition() { return tags.get(RunTags.PARTITION); }

    public String partitionSet() { return tags.get(RunTags.PARTITION_SET); }

    public boolean isFinished() { return status.isTerminal(); }

    public static final class Builder {
        private final String runId;
        private final String jobName;
        private RunStatus status = RunStatus.NOT_STARTED;
        private final Map<String, Object> runConfig = new LinkedHashMap<>();
        private final Map<String, String> tags = new LinkedHashMap<>();
        private String rootRunId;
        private String parentRunId;
        private String jobSnapshotId;
        private String executionPlanSnapshotId;
        private List<String> opSelection;
        private List<String> stepKeysToExecute;
        private Set<AssetKey> assetSelection;

        private Builder(String runId, String jobName) {
            this.runId = runId;
            this.jobName = jobName;
        }

        public Builder status(RunStatus status) { this.status = status; return this; }

        public Builder runConfig(Map<String, Object> runConfig) { this.runConfig.putAll(runConfig); return this; }

        public Builder tag(String key, String value) { this.tags.put(key, value); return this; }

        public Builder tags(Map<String, String> tags) { this.tags.putAll(tags); return this; }

        public Builder partition(String partitionSet, String partition) {
            if (partitionSet != null) tags.put(RunTags.PARTITION_SET, partitionSet);
            tags.put(RunTags.PARTITION, partition);
            return this;
        }

        /** Retry lineage. The root defaults to the parent when the parent is itself a root run. */
        public Builder parent(String parentRunId, String rootRunId) {
            this.parentRunId = parentRunId;
            this.rootRunId = rootRunId != null ? rootRunId : parentRunId;
            return this;
        }

        public Builder jobSnapshotId(String id) { this.jobSnapshotId = id; return this; }

        public Builder executionPlanSnapshotId(String id) { this.executionPlanSnapshotId = id; return this; }

        public Builder opSelection(List<String> ops) { this.opSelection = ops; return this; }

        public Builder stepKeysToExecute(List<String> keys) { this.stepKeysToExecute = keys; return this; }

        public Builder assetSelection(Set<AssetKey> keys) { this.assetSelection = keys; return this; }

        public Run build() {
            return new Run(runId, jobName, status, runConfig, tags, rootRunId, parentRunId,
                    jobSnapshotId, executionPlanSnapshotId, opSelection, stepKeysToExecute, assetSelection);
        }
    }
}
