package com.alninja.billing.docstore.api;

import java.util.Arrays;

import static com.google.common.base.Preconditions.checkNotNull;

public class VersionedDocument {
    private final String _path;
    private final byte[] _content;
    private final String _version;

    public VersionedDocument(String path, byte[] content, String version) {
        _path = checkNotNull(path, "path");
        _content = checkNotNull(content, "content").clone();
        _version = checkNotNull(version, "version");
    }

    public String getPath() {
        return _path;
    }

    public byte[] getContent() {
        return _content.clone();
    }

    public String getVersion() {
        return _version;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof VersionedDocument)) {
            return false;
        }
        VersionedDocument that = (VersionedDocument) o;
        return _path.equals(that._path) && _version.equals(that._version) && Arrays.equals(_content, that._content);
    }

    @Override
    public int hashCode() {
        return 31 * _path.hashCode() + _version.hashCode();
    }

    @Override
    public String toString() {
        return _path + "@" + _version;  // for debugging
    }
}
