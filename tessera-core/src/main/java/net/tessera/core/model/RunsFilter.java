package net.tessera.core.model;

import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/** Conjunctive run query. Null or empty members do not constrain. */
public record RunsFilter(
        List<String> runIds,
        String jobName,
        Set<RunStatus> statuses,
        Map<String, String> tags,
        String partitionSet,
        String partition,
        String snapshotId
) {
    public RunsFilter {
        runIds = runIds == null ? List.of() : List.copyOf(runIds);
        statuses = statuses == null || statuses.isEmpty() ? Set.of() : Collections.unmodifiableSet(EnumSet.copyOf(statuses));
        tags = tags == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(tags));
    }

    public static RunsFilter all() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public boolean hasPartition() { return partition != null; }

    public static final class Builder {
        private List<String> runIds;
        private String jobName;
        private Set<RunStatus> statuses;
        private final Map<String, String> tags = new LinkedHashMap<>();
        private String partitionSet;
        private String partition;
        private String snapshotId;

        public Builder runIds(List<String> runIds) { this.runIds = runIds; return this; }

        public Builder jobName(String jobName) { this.jobName = jobName; return this; }

        public Builder statuses(RunStatus first, RunStatus... rest) {
            this.statuses = EnumSet.of(first, rest);
            return this;
        }

        public Builder tag(String key, String value) { this.tags.put(key, value); return this; }

        public Builder partition(String partitionSet, String partition) {
            this.partitionSet = partitionSet;
            this.partition = partition;
            return this;
        }

        public Builder snapshotId(String snapshotId) { this.snapshotId = snapshotId; return this; }

        public RunsFilter build() {
            return new RunsFilter(runIds, jobName, statuses, tags, partitionSet, partition, snapshotId);
        }
    }
}
