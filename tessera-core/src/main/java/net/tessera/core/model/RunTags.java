package net.tessera.core.model;

/** Reserved run tag keys. */
public final class RunTags {
    private RunTags() {}

    public static final String PREFIX = "tessera/";
    public static final String PARTITION = PREFIX + "partition";
    public static final String PARTITION_SET = PREFIX + "partition_set";
    public static final String ROOT_RUN_ID = PREFIX + "root_run_id";
    public static final String PARENT_RUN_ID = PREFIX + "parent_run_id";
}
