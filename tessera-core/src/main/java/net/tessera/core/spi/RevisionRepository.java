package net.tessera.core.spi;

import java.util.Optional;

/** Single-row revision table of one storage domain. */
public interface RevisionRepository {
    /** Empty when the table or its row does not exist yet. */
    Optional<String> currentRevision() throws Exception;

    /** Creates the table when missing and stores {@code revision}, or clears it for base. */
    void setRevision(String revision) throws Exception;
}
