package net.tessera.core.spi;

import net.tessera.core.backfill.SecondaryIndexState;

import java.time.Instant;
import java.util.Optional;

/** Progress rows of named data migrations within one storage domain. */
public interface SecondaryIndexRepository {
    Optional<SecondaryIndexState> find(String name) throws Exception;

    void upsertProgress(String name, long lastRowId, Instant now) throws Exception;

    void markCompleted(String name, Instant now) throws Exception;

    void reset(String name) throws Exception;
}
