package com.alninja.billing.docstore.core;

import com.alninja.billing.docstore.api.DocumentConflictException;
import com.alninja.billing.docstore.api.DocumentStore;
import com.alninja.billing.docstore.api.VersionedDocument;
import com.google.common.collect.Maps;

import javax.annotation.Nullable;
import java.util.Objects;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicLong;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * In-memory implementation of {@link DocumentStore}.  Useful for unit testing and for running the billing core
 * without a storage account.
 */
public class InMemoryDocumentStore implements DocumentStore {

    private final ConcurrentMap<String, VersionedDocument> _documents = Maps.newConcurrentMap();
    private final AtomicLong _versionSequence = new AtomicLong();

    @Nullable
    @Override
    public VersionedDocument get(String path) {
        return _documents.get(checkNotNull(path, "path"));
    }

    @Override
    public String put(String path, byte[] content, @Nullable String expectedVersion) {
        checkNotNull(path, "path");
        checkNotNull(content, "content");

        String version = Long.toString(_versionSequence.incrementAndGet());
        VersionedDocument updated = new VersionedDocument(path, content, version);

        boolean written;
        if (expectedVersion == null) {
            written = _documents.putIfAbsent(path, updated) == null;
        } else {
            VersionedDocument current = _documents.get(path);
            written = current != null && Objects.equals(current.getVersion(), expectedVersion)
                    && _documents.replace(path, current, updated);
        }

        if (!written) {
            throw new DocumentConflictException(path, expectedVersion);
        }
        return version;
    }

    /** Unconditionally replaces a document.  Intended for seeding test fixtures. */
    public void set(String path, byte[] content) {
        String version = Long.toString(_versionSequence.incrementAndGet());
        _documents.put(path, new VersionedDocument(path, content, version));
    }

    public void delete(String path) {
        _documents.remove(path);
    }

    public void clear() {
        _documents.clear();
    }
}
