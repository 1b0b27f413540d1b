package net.tessera.core.backfill;

/** Names of the data migrations tracked in the secondary-index tables. */
public final class SecondaryIndexes {
    private SecondaryIndexes() {}

    public static final String RUN_PARTITIONS = "run_partitions";
    public static final String EVENT_LOG_COLUMNS = "event_log_columns";
    public static final String ASSET_KEY_TABLE = "asset_key_table";
}
