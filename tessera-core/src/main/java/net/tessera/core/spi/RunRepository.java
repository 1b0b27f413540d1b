package net.tessera.core.spi;

import net.tessera.core.model.Run;
import net.tessera.core.model.RunRecord;
import net.tessera.core.model.RunsFilter;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

public interface RunRepository {
    boolean exists(String runId) throws Exception;

    /** Writes the body, tags and partition columns. */
    long insert(Run run, Instant now) throws Exception;

    /** Rewrites status, body, tags and partition columns of an existing run. */
    void update(Run run, Instant now) throws Exception;

    /** {@code withRunTimes} selects the start/end columns, which exist only after the run-times migration. */
    Optional<RunRecord> findRecord(String runId, boolean withRunTimes) throws Exception;

    /**
     * Newest first. {@code cursor} is the run id of the last row of the previous page.
     * {@code indexedPartitions} filters partitions on the indexed columns instead of the tag table.
     */
    List<RunRecord> query(RunsFilter filter, String cursor, int limit,
                          boolean indexedPartitions, boolean withRunTimes) throws Exception;

    void setStartTime(String runId, double startTime) throws Exception;

    void setEndTime(String runId, double endTime) throws Exception;

    List<String> runIds() throws Exception;

    boolean hasSnapshot(String snapshotId) throws Exception;

    void insertSnapshot(String snapshotId, String kind, String body, Instant now) throws Exception;

    Optional<String> findSnapshotBody(String snapshotId) throws Exception;
}
