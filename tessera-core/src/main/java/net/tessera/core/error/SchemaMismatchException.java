package net.tessera.core.error;

import net.tessera.core.migration.StorageDomain;

/**
 * A mutating call hit a storage domain whose schema is behind head and whose pending
 * migrations are not all optional. Raised before any side effect.
 */
public class SchemaMismatchException extends TesseraException {
    public static final String MIGRATE_COMMAND = "tessera instance migrate";

    private final StorageDomain domain;
    private final String currentRevision;
    private final String headRevision;

    public SchemaMismatchException(StorageDomain domain, String currentRevision, String headRevision) {
        super("Storage is out of date and must be migrated (" + domain.displayName() + " requires migration). "
                + "Database is at revision " + currentRevision + ", head is " + headRevision + ". "
                + "Please run `" + MIGRATE_COMMAND + "`.");
        this.domain = domain;
        this.currentRevision = currentRevision;
        this.headRevision = headRevision;
    }

    public StorageDomain domain() { return domain; }

    public String currentRevision() { return currentRevision; }

    public String headRevision() { return headRevision; }
}
