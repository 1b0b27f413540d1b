package net.tessera.core.service;

import net.tessera.core.backfill.BackfillSummary;
import net.tessera.core.migration.MigrationStatus;
import net.tessera.core.migration.SchemaMigrator;
import net.tessera.core.migration.StorageDomain;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/** Instance-wide schema and data migration across the three storage domains. */
public final class InstanceMigrationService {
    private static final Logger log = LoggerFactory.getLogger(InstanceMigrationService.class);

    private final RunStorage runs;
    private final EventLogStorage events;
    private final InstigatorStorage instigators;

    public InstanceMigrationService(RunStorage runs, EventLogStorage events, InstigatorStorage instigators) {
        this.runs = runs;
        this.events = events;
        this.instigators = instigators;
    }

    private List<SchemaMigrator> migrators() {
        return List.of(runs.migrator(), events.migrator(), instigators.migrator());
    }

    private SchemaMigrator migrator(StorageDomain domain) {
        return switch (domain) {
            case RUNS -> runs.migrator();
            case EVENT_LOGS -> events.migrator();
            case INSTIGATORS -> instigators.migrator();
        };
    }

    /** Brings every domain to head, including optional steps. Returns the revisions applied per domain. */
    public Map<StorageDomain, List<String>> upgrade() throws Exception {
        Map<StorageDomain, List<String>> applied = new EnumMap<>(StorageDomain.class);
        for (SchemaMigrator m : migrators()) {
            List<String> revisions = m.upgrade();
            applied.put(m.domain(), revisions);
            if (revisions.isEmpty()) log.info("{} is up to date at {}", m.domain().displayName(), m.headRevision());
        }
        return applied;
    }

    public List<String> downgrade(StorageDomain domain, String targetRevision) throws Exception {
        return migrator(domain).downgrade(targetRevision);
    }

    /** Runs every data migration; {@code force} rebuilds indexes already marked built. */
    public List<BackfillSummary> migrateData(boolean force) throws Exception {
        List<BackfillSummary> summaries = new ArrayList<>();
        summaries.add(runs.migrate(force));
        summaries.add(events.migrateEventLogData(force));
        summaries.add(events.migrateAssetKeyData(force));
        return summaries;
    }

    public List<MigrationStatus> status() throws Exception {
        List<MigrationStatus> status = new ArrayList<>();
        for (SchemaMigrator m : migrators()) status.add(m.status());
        return status;
    }
}
