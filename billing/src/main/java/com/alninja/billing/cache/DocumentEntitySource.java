package com.alninja.billing.cache;

import com.alninja.billing.api.AppInfo;
import com.alninja.billing.api.BlockedOrganizations;
import com.alninja.billing.api.DunningEntry;
import com.alninja.billing.api.Organization;
import com.alninja.billing.api.UserProfile;
import com.alninja.billing.common.json.JsonHelper;
import com.alninja.billing.core.DocumentPaths;
import com.alninja.billing.docstore.api.DocumentStore;
import com.alninja.billing.docstore.api.DocumentStoreException;
import com.alninja.billing.docstore.api.VersionedDocument;
import com.fasterxml.jackson.core.type.TypeReference;
import com.google.common.collect.ImmutableList;
import com.google.inject.Inject;

import java.util.List;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Loads cached collections from their JSON documents.
 */
public class DocumentEntitySource implements EntitySource {

    private static final TypeReference<List<AppInfo>> APPS = new TypeReference<List<AppInfo>>() {};
    private static final TypeReference<List<UserProfile>> USERS = new TypeReference<List<UserProfile>>() {};
    private static final TypeReference<List<Organization>> ORGANIZATIONS = new TypeReference<List<Organization>>() {};
    private static final TypeReference<List<DunningEntry>> DUNNING = new TypeReference<List<DunningEntry>>() {};

    private final DocumentStore _store;

    @Inject
    public DocumentEntitySource(DocumentStore store) {
        _store = checkNotNull(store, "store");
    }

    @Override
    public List<AppInfo> loadApps() {
        return readList(DocumentPaths.APPS, APPS);
    }

    @Override
    public List<UserProfile> loadUsers() {
        return readList(DocumentPaths.USERS, USERS);
    }

    @Override
    public List<Organization> loadOrganizations() {
        return readList(DocumentPaths.ORGANIZATIONS, ORGANIZATIONS);
    }

    @Override
    public BlockedOrganizations loadBlocked() {
        VersionedDocument document = _store.get(DocumentPaths.BLOCKED);
        if (document == null || document.getContent().length == 0) {
            return BlockedOrganizations.EMPTY;
        }
        BlockedOrganizations blocked = parse(document, BlockedOrganizations.class);
        return blocked != null ? blocked : BlockedOrganizations.EMPTY;
    }

    @Override
    public List<DunningEntry> loadDunning() {
        return readList(DocumentPaths.DUNNING, DUNNING);
    }

    private <T> List<T> readList(String path, TypeReference<List<T>> type) {
        VersionedDocument document = _store.get(path);
        if (document == null || document.getContent().length == 0) {
            return ImmutableList.of();
        }
        List<T> values;
        try {
            values = JsonHelper.fromUtf8Bytes(document.getContent(), type);
        } catch (IllegalArgumentException e) {
            throw new DocumentStoreException(path, "Malformed document: " + path, e);
        }
        if (values == null) {
            return ImmutableList.of();
        }
        ImmutableList.Builder<T> builder = ImmutableList.builder();
        for (T value : values) {
            if (value != null) {
                builder.add(value);
            }
        }
        return builder.build();
    }

    private <T> T parse(VersionedDocument document, Class<T> type) {
        try {
            return JsonHelper.fromUtf8Bytes(document.getContent(), type);
        } catch (IllegalArgumentException e) {
            throw new DocumentStoreException(document.getPath(), "Malformed document: " + document.getPath(), e);
        }
    }
}
