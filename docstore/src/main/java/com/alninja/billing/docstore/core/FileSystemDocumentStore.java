package com.alninja.billing.docstore.core;

import com.alninja.billing.docstore.api.DocumentConflictException;
import com.alninja.billing.docstore.api.DocumentStore;
import com.alninja.billing.docstore.api.DocumentStoreException;
import com.alninja.billing.docstore.api.VersionedDocument;
import com.google.common.hash.Hashing;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nullable;
import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Objects;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * {@link DocumentStore} backed by a local directory, one file per document.  The version token is the SHA-256 of the
 * file content.  Conditional writes are atomic with respect to other writers in the same JVM only, which is
 * sufficient for local development and single-node self-hosted installs.
 */
public class FileSystemDocumentStore implements DocumentStore {
    private static final Logger _log = LoggerFactory.getLogger(FileSystemDocumentStore.class);

    private final Path _root;

    public FileSystemDocumentStore(Path root) {
        _root = checkNotNull(root, "root").toAbsolutePath().normalize();
    }

    @Nullable
    @Override
    public VersionedDocument get(String path) {
        Path file = resolve(path);
        try {
            byte[] content = Files.readAllBytes(file);
            return new VersionedDocument(path, content, versionOf(content));
        } catch (NoSuchFileException e) {
            return null;
        } catch (IOException e) {
            throw new DocumentStoreException(path, "Unable to read document: " + file, e);
        }
    }

    @Override
    public synchronized String put(String path, byte[] content, @Nullable String expectedVersion) {
        checkNotNull(content, "content");
        VersionedDocument current = get(path);
        String currentVersion = current != null ? current.getVersion() : null;
        if (!Objects.equals(currentVersion, expectedVersion)) {
            throw new DocumentConflictException(path, expectedVersion);
        }

        Path file = resolve(path);
        try {
            Files.createDirectories(file.getParent());
            Path temp = Files.createTempFile(file.getParent(), file.getFileName().toString(), ".tmp");
            Files.write(temp, content);
            try {
                Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                _log.debug("Atomic move not supported for {}, falling back to a plain replace", file);
                Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            throw new DocumentStoreException(path, "Unable to write document: " + file, e);
        }
        return versionOf(content);
    }

    private Path resolve(String path) {
        checkNotNull(path, "path");
        Path file = _root.resolve(path).normalize();
        checkArgument(file.startsWith(_root) && !file.equals(_root), "Invalid document path: %s", path);
        return file;
    }

    private static String versionOf(byte[] content) {
        return Hashing.sha256().hashBytes(content).toString();
    }
}
