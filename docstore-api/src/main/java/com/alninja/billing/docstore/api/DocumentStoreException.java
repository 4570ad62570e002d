package com.alninja.billing.docstore.api;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Thrown when the underlying storage cannot be reached or returns something unusable.
 */
@JsonIgnoreProperties ({"cause", "localizedMessage", "stackTrace"})
public class DocumentStoreException extends RuntimeException {
    private final String _path;

    public DocumentStoreException(String path, String message) {
        super(message);
        _path = path;
    }

    public DocumentStoreException(String path, String message, Throwable cause) {
        super(message, cause);
        _path = path;
    }

    public String getPath() {
        return _path;
    }
}
