package net.tessera.integration.spring;

import net.tessera.adapter.jdbc.JdbcStorages;

/** Tuning applied when the storages are wired; a context without this bean gets {@link #defaults()}. */
public record TesseraSettings(int batchSize, int pageSize) {

    public static TesseraSettings defaults() {
        return new TesseraSettings(JdbcStorages.DEFAULT_BATCH_SIZE, JdbcStorages.DEFAULT_PAGE_SIZE);
    }
}
