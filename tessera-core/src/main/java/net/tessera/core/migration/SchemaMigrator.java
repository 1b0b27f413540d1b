package net.tessera.core.migration;

import net.tessera.core.error.SchemaMismatchException;
import net.tessera.core.spi.RevisionRepository;
import net.tessera.core.spi.TxRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Tracks and advances the schema revision of one storage domain. Each step commits together with its
 * revision bump, so a failed upgrade leaves the domain at the last step that succeeded.
 */
public final class SchemaMigrator {
    private static final Logger log = LoggerFactory.getLogger(SchemaMigrator.class);

    public static final String NONE = "none";

    private final StorageDomain domain;
    private final MigrationChain chain;
    private final RevisionRepository revisions;
    private final TxRunner tx;

    public SchemaMigrator(StorageDomain domain, MigrationChain chain, RevisionRepository revisions, TxRunner tx) {
        this.domain = domain;
        this.chain = chain;
        this.revisions = revisions;
        this.tx = tx;
    }

    public StorageDomain domain() { return domain; }

    public MigrationChain chain() { return chain; }

    /** Empty for an uninitialized domain. */
    public Optional<String> currentRevision() throws Exception {
        return tx.required(revisions::currentRevision);
    }

    public String headRevision() { return chain.head(); }

    public List<Migration> pendingMigrations() throws Exception {
        String current = currentRevision().orElse(null);
        if (current != null && !chain.contains(current)) {
            throw new IllegalStateException(domain.displayName() + " is at unknown revision " + current);
        }
        return chain.after(current);
    }

    public boolean isApplied(String revision) throws Exception {
        String current = currentRevision().orElse(null);
        if (current == null || !chain.contains(revision)) return false;
        return chain.after(current).stream().noneMatch(m -> m.revision().equals(revision));
    }

    /** Applies every pending step; returns the revisions applied, empty when already at head. */
    public List<String> upgrade() throws Exception {
        return apply(pendingMigrations());
    }

    /** Applies pending steps up to and including {@code targetRevision}. */
    public List<String> upgrade(String targetRevision) throws Exception {
        if (!chain.contains(targetRevision)) {
            throw new IllegalArgumentException("unknown " + domain.displayName() + " revision " + targetRevision);
        }
        List<Migration> pending = pendingMigrations();
        int end = -1;
        for (int i = 0; i < pending.size(); i++) {
            if (pending.get(i).revision().equals(targetRevision)) end = i;
        }
        if (end < 0) return List.of();
        return apply(pending.subList(0, end + 1));
    }

    private List<String> apply(List<Migration> steps) throws Exception {
        List<String> applied = new ArrayList<>();
        for (Migration m : steps) {
            tx.requiresNew(() -> {
                m.up();
                revisions.setRevision(m.revision());
                return null;
            });
            log.info("Migrated {} to {} ({})", domain.displayName(), m.revision(), m.description());
            applied.add(m.revision());
        }
        return applied;
    }

    /** Reverts steps newest first until {@code targetRevision}; {@link Migration#BASE} reverts all. */
    public List<String> downgrade(String targetRevision) throws Exception {
        List<String> reverted = new ArrayList<>();
        String current = currentRevision().orElse(null);
        for (Migration m : chain.between(targetRevision, current)) {
            tx.requiresNew(() -> {
                m.down();
                revisions.setRevision(m.downRevision());
                return null;
            });
            log.info("Downgraded {} from {} to {}", domain.displayName(), m.revision(), m.downRevision());
            reverted.add(m.revision());
        }
        return reverted;
    }

    /**
     * Passes when the domain is at head or only optional steps are pending.
     *
     * @throws SchemaMismatchException otherwise
     */
    public void requireWritable() throws Exception {
        List<Migration> pending = pendingMigrations();
        if (pending.stream().allMatch(Migration::optional)) return;
        throw new SchemaMismatchException(domain, currentRevision().orElse(NONE), headRevision());
    }

    public MigrationStatus status() throws Exception {
        List<String> pending = pendingMigrations().stream().map(Migration::revision).toList();
        return new MigrationStatus(domain, currentRevision().orElse(NONE), headRevision(), pending);
    }
}
