package net.tessera.core.migration;

/** Revision ids of every storage domain, in chain order. */
public final class SchemaRevisions {
    private SchemaRevisions() {}

    public static final String RUNS_CREATE = "0001_create_runs";
    public static final String RUNS_SNAPSHOTS = "0002_add_snapshots";
    public static final String RUNS_PARTITIONS = "0003_add_run_partitions";
    public static final String RUNS_START_END_TIMES = "0004_add_run_times";

    public static final String EVENTS_CREATE = "0001_create_event_logs";
    public static final String EVENTS_STEP_KEY = "0002_add_step_key";
    public static final String EVENTS_ASSET_KEYS = "0003_add_asset_keys";
    public static final String EVENTS_PARTITION = "0004_add_partition_column";
    public static final String EVENTS_ASSET_INDEX_COLUMNS = "0005_add_asset_index_columns";

    public static final String INSTIGATORS_SCHEDULES = "0001_create_schedules";
    public static final String INSTIGATORS_JOBS = "0002_create_jobs";
    public static final String INSTIGATORS_UNIFIED = "0003_unify_instigators";
}
