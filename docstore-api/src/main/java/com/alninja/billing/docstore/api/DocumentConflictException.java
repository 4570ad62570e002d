package com.alninja.billing.docstore.api;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import javax.annotation.Nullable;

/**
 * Thrown when a conditional write loses a race: the document changed since it was read.
 */
@JsonIgnoreProperties ({"cause", "localizedMessage", "stackTrace"})
public class DocumentConflictException extends RuntimeException {
    private final String _path;
    private final String _expectedVersion;

    public DocumentConflictException(String path, @Nullable String expectedVersion) {
        super(String.format("Document %s is no longer at version %s", path, expectedVersion));
        _path = path;
        _expectedVersion = expectedVersion;
    }

    @JsonCreator
    public DocumentConflictException(@JsonProperty("message") String message, @JsonProperty("path") String path,
                                     @JsonProperty("expectedVersion") @Nullable String expectedVersion) {
        super(message);
        _path = path;
        _expectedVersion = expectedVersion;
    }

    public String getPath() {
        return _path;
    }

    @Nullable
    public String getExpectedVersion() {
        return _expectedVersion;
    }
}
