package com.alninja.billing.docstore.api;

import javax.annotation.Nullable;

/**
 * Stores whole JSON documents addressed by path.  Every stored document carries an opaque version token which
 * changes on each successful write, allowing callers to implement optimistic read-modify-write cycles.
 * <p>
 * Implementations report storage failures with {@link DocumentStoreException} and lost races with
 * {@link DocumentConflictException}.
 */
public interface DocumentStore {

    /**
     * Returns the current content and version of a document, or null if the document does not exist.
     */
    @Nullable
    VersionedDocument get(String path);

    /**
     * Writes a document only if its current version equals {@code expectedVersion}.  A null expected version means
     * the document must not exist yet.
     *
     * @return the version token of the newly written content
     * @throws DocumentConflictException if the stored version differs from {@code expectedVersion}
     */
    String put(String path, byte[] content, @Nullable String expectedVersion)
            throws DocumentConflictException;
}
