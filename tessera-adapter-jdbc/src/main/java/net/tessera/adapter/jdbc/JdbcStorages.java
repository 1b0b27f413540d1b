package net.tessera.adapter.jdbc;

import net.tessera.adapter.jdbc.backfill.AssetKeyBackfill;
import net.tessera.adapter.jdbc.backfill.EventLogColumnsBackfill;
import net.tessera.adapter.jdbc.backfill.RunPartitionBackfill;
import net.tessera.adapter.jdbc.migration.EventLogSchema;
import net.tessera.adapter.jdbc.migration.InstigatorSchema;
import net.tessera.adapter.jdbc.migration.RunSchema;
import net.tessera.adapter.jdbc.repo.JdbcEventLogRepository;
import net.tessera.adapter.jdbc.repo.JdbcInstigatorRepository;
import net.tessera.adapter.jdbc.repo.JdbcRevisionRepository;
import net.tessera.adapter.jdbc.repo.JdbcRunRepository;
import net.tessera.adapter.jdbc.repo.JdbcSecondaryIndexRepository;
import net.tessera.core.backfill.IndexBackfillService;
import net.tessera.core.migration.SchemaMigrator;
import net.tessera.core.migration.StorageDomain;
import net.tessera.core.serdes.CoreTypes;
import net.tessera.core.serdes.Serdes;
import net.tessera.core.service.EventLogStorage;
import net.tessera.core.service.InstanceMigrationService;
import net.tessera.core.service.InstigatorStorage;
import net.tessera.core.service.RunBundleService;
import net.tessera.core.service.RunStorage;
import net.tessera.core.spi.Clock;
import net.tessera.core.spi.TxRunner;

import javax.sql.DataSource;
import java.util.Objects;
import java.util.function.Function;

/**
 * Wires the three storages of one instance over JDBC. Each domain may live in its own database;
 * by default all three share one data source.
 */
public final class JdbcStorages {
    public static final int DEFAULT_BATCH_SIZE = 500;
    public static final int DEFAULT_PAGE_SIZE = 1_000;

    private final RunStorage runStorage;
    private final EventLogStorage eventLogStorage;
    private final InstigatorStorage instigatorStorage;
    private final InstanceMigrationService instanceMigrations;
    private final RunBundleService runBundles;

    private JdbcStorages(Builder b) {
        Serdes serdes = b.serdes;
        Clock clock = b.clock;

        TxRunner runTx = b.txRunners.apply(b.runs);
        runStorage = new RunStorage(
                new JdbcRunRepository(b.runs, serdes),
                new SchemaMigrator(StorageDomain.RUNS, RunSchema.chain(b.runs),
                        new JdbcRevisionRepository(b.runs, RunSchema.REVISION_TABLE), runTx),
                new IndexBackfillService(runTx,
                        new JdbcSecondaryIndexRepository(b.runs, RunSchema.SECONDARY_INDEX_TABLE), clock, b.batchSize),
                new RunPartitionBackfill(b.runs),
                runTx, clock, serdes);

        TxRunner eventTx = b.txRunners.apply(b.eventLogs);
        JdbcEventLogRepository events = new JdbcEventLogRepository(b.eventLogs, serdes);
        eventLogStorage = new EventLogStorage(
                events,
                new SchemaMigrator(StorageDomain.EVENT_LOGS, EventLogSchema.chain(b.eventLogs),
                        new JdbcRevisionRepository(b.eventLogs, EventLogSchema.REVISION_TABLE), eventTx),
                new IndexBackfillService(eventTx,
                        new JdbcSecondaryIndexRepository(b.eventLogs, EventLogSchema.SECONDARY_INDEX_TABLE),
                        clock, b.batchSize),
                new EventLogColumnsBackfill(b.eventLogs, serdes),
                new AssetKeyBackfill(b.eventLogs, events, serdes),
                eventTx, clock, b.pageSize);

        TxRunner instigatorTx = b.txRunners.apply(b.instigators);
        instigatorStorage = new InstigatorStorage(
                new JdbcInstigatorRepository(b.instigators, serdes),
                new SchemaMigrator(StorageDomain.INSTIGATORS, InstigatorSchema.chain(b.instigators, serdes),
                        new JdbcRevisionRepository(b.instigators, InstigatorSchema.REVISION_TABLE), instigatorTx),
                instigatorTx, clock);

        instanceMigrations = new InstanceMigrationService(runStorage, eventLogStorage, instigatorStorage);
        runBundles = new RunBundleService(runStorage, eventLogStorage, serdes);
    }

    public static Builder builder(DataSource ds) {
        return new Builder(ds);
    }

    public RunStorage runStorage() { return runStorage; }

    public EventLogStorage eventLogStorage() { return eventLogStorage; }

    public InstigatorStorage instigatorStorage() { return instigatorStorage; }

    public InstanceMigrationService instanceMigrations() { return instanceMigrations; }

    public RunBundleService runBundles() { return runBundles; }

    public static final class Builder {
        private DataSource runs;
        private DataSource eventLogs;
        private DataSource instigators;
        private Serdes serdes = CoreTypes.serdes();
        private Clock clock = Clock.system();
        private Function<DataSource, TxRunner> txRunners = JdbcTxRunner::new;
        private int batchSize = DEFAULT_BATCH_SIZE;
        private int pageSize = DEFAULT_PAGE_SIZE;

        private Builder(DataSource ds) {
            this.runs = Objects.requireNonNull(ds, "ds");
            this.eventLogs = ds;
            this.instigators = ds;
        }

        public Builder runs(DataSource ds) { this.runs = Objects.requireNonNull(ds); return this; }

        public Builder eventLogs(DataSource ds) { this.eventLogs = Objects.requireNonNull(ds); return this; }

        public Builder instigators(DataSource ds) { this.instigators = Objects.requireNonNull(ds); return this; }

        public Builder serdes(Serdes serdes) { this.serdes = Objects.requireNonNull(serdes); return this; }

        public Builder clock(Clock clock) { this.clock = Objects.requireNonNull(clock); return this; }

        /** Transaction runner per data source, e.g. a Spring-managed one. */
        public Builder txRunners(Function<DataSource, TxRunner> txRunners) {
            this.txRunners = Objects.requireNonNull(txRunners);
            return this;
        }

        public Builder batchSize(int batchSize) {
            if (batchSize <= 0) throw new IllegalArgumentException("batchSize must be positive: " + batchSize);
            this.batchSize = batchSize;
            return this;
        }

        public Builder pageSize(int pageSize) {
            if (pageSize <= 0) throw new IllegalArgumentException("pageSize must be positive: " + pageSize);
            this.pageSize = pageSize;
            return this;
        }

        public JdbcStorages build() {
            return new JdbcStorages(this);
        }
    }
}
