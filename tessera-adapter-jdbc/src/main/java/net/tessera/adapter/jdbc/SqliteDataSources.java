package net.tessera.adapter.jdbc;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import org.sqlite.SQLiteConfig;
import org.sqlite.SQLiteDataSource;
import org.sqlite.SQLiteOpenMode;

import java.nio.file.Path;

/** Pooled SQLite data sources in WAL mode. */
public final class SqliteDataSources {
    public static final int DEFAULT_BUSY_TIMEOUT_MS = 5_000;
    public static final int DEFAULT_POOL_SIZE = 4;

    private SqliteDataSources() {}

    public static HikariDataSource create(Path file) {
        return create("jdbc:sqlite:" + file.toAbsolutePath(), DEFAULT_POOL_SIZE, DEFAULT_BUSY_TIMEOUT_MS);
    }

    public static HikariDataSource create(String jdbcUrl, int poolSize, int busyTimeoutMs) {
        SQLiteConfig config = new SQLiteConfig();
        config.setOpenMode(SQLiteOpenMode.FULLMUTEX);
        config.setJournalMode(SQLiteConfig.JournalMode.WAL);
        config.setSynchronous(SQLiteConfig.SynchronousMode.NORMAL);
        config.setBusyTimeout(busyTimeoutMs);

        SQLiteDataSource sqlite = new SQLiteDataSource(config);
        sqlite.setUrl(jdbcUrl);

        HikariConfig cfg = new HikariConfig();
        cfg.setDataSource(sqlite);
        cfg.setPoolName("tessera-sqlite");
        cfg.setMaximumPoolSize(poolSize);
        cfg.setMinimumIdle(1);
        cfg.setConnectionTimeout(30_000);
        cfg.setIdleTimeout(60_000);
        return new HikariDataSource(cfg);
    }
}
