package com.alninja.billing.docstore.core;

import com.alninja.billing.common.json.JsonHelper;
import com.alninja.billing.docstore.api.DocumentConflictException;
import com.alninja.billing.docstore.api.DocumentStore;
import com.alninja.billing.docstore.api.DocumentStoreException;
import com.alninja.billing.docstore.api.VersionedDocument;
import com.codahale.metrics.Meter;
import com.codahale.metrics.MetricRegistry;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.Supplier;
import java.util.function.UnaryOperator;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Performs compare-and-swap updates of whole documents in a {@link DocumentStore}.
 * <p>
 * Each attempt reads the current document and its version, hands a private copy to the transform and writes the
 * result conditionally on the version that was read.  When another writer got there first the whole cycle is
 * repeated after a short, jittered, exponentially growing pause.  Transforms are therefore invoked once per attempt
 * and must depend only on the document they are given.
 * <p>
 * A transform that returns a document equal to its input is treated as a no-op and nothing is written.
 */
public class OptimisticDocumentUpdater {
    private static final Logger _log = LoggerFactory.getLogger(OptimisticDocumentUpdater.class);

    private final DocumentStore _store;
    private final int _maxAttempts;
    private final long _minBackoffMillis;
    private final long _maxBackoffMillis;
    private final Meter _conflicts;
    private final Meter _writes;

    public OptimisticDocumentUpdater(DocumentStore store, MetricRegistry metricRegistry) {
        this(store, 0, Duration.ofMillis(5), Duration.ofMillis(250), metricRegistry);
    }

    /**
     * @param maxAttempts maximum number of read-transform-write cycles, or zero to retry until the write succeeds
     */
    public OptimisticDocumentUpdater(DocumentStore store, int maxAttempts, Duration minBackoff, Duration maxBackoff,
                                     MetricRegistry metricRegistry) {
        _store = checkNotNull(store, "store");
        checkArgument(maxAttempts >= 0, "maxAttempts cannot be negative");
        checkArgument(!minBackoff.isNegative() && minBackoff.compareTo(maxBackoff) <= 0,
                "minBackoff must be non-negative and no greater than maxBackoff");
        _maxAttempts = maxAttempts;
        _minBackoffMillis = minBackoff.toMillis();
        _maxBackoffMillis = maxBackoff.toMillis();
        _conflicts = metricRegistry.meter(MetricRegistry.name("alninja.billing.docstore", "OptimisticDocumentUpdater", "conflicts"));
        _writes = metricRegistry.meter(MetricRegistry.name("alninja.billing.docstore", "OptimisticDocumentUpdater", "writes"));
    }

    /**
     * Reads a document as a JSON tree, substituting {@code emptyValue} when it does not exist yet.
     */
    public JsonNode read(String path, JsonNode emptyValue) {
        VersionedDocument current = _store.get(path);
        return parse(path, current, emptyValue);
    }

    /**
     * Applies {@code transform} to the document at {@code path} until a conditional write succeeds.
     *
     * @return the document as committed, or the unchanged current document if the transform made no change
     */
    public JsonNode update(String path, JsonNode emptyValue, UnaryOperator<JsonNode> transform) {
        checkNotNull(path, "path");
        checkNotNull(emptyValue, "emptyValue");
        checkNotNull(transform, "transform");

        for (int attempt = 1; ; attempt++) {
            VersionedDocument current = _store.get(path);
            JsonNode before = parse(path, current, emptyValue);
            JsonNode after = checkNotNull(transform.apply(before.deepCopy()), "transform result");

            if (current != null && after.equals(before)) {
                return before;
            }

            try {
                _store.put(path, JsonHelper.asUtf8Bytes(after), current != null ? current.getVersion() : null);
                _writes.mark();
                return after;
            } catch (DocumentConflictException e) {
                _conflicts.mark();
                if (_maxAttempts != 0 && attempt >= _maxAttempts) {
                    throw e;
                }
                _log.debug("Conflict updating {} on attempt {}, retrying", path, attempt);
                backoff(path, attempt, e);
            }
        }
    }

    /**
     * Typed variant of {@link #update(String, JsonNode, UnaryOperator)}.  The document is deserialized afresh on every
     * attempt, so the transform may mutate the value it is handed.
     */
    public <T> T update(String path, TypeReference<T> type, Supplier<T> emptyValue, UnaryOperator<T> transform) {
        checkNotNull(type, "type");
        checkNotNull(emptyValue, "emptyValue");
        checkNotNull(transform, "transform");

        JsonNode committed = update(path, JsonHelper.toTree(emptyValue.get()), node -> {
            T value = JsonHelper.convert(node, type);
            return JsonHelper.toTree(transform.apply(value));
        });
        return JsonHelper.convert(committed, type);
    }

    /**
     * Appends one entry to an array document, creating the document if necessary.  Entries are never de-duplicated.
     */
    public void append(String path, Object entry) {
        JsonNode entryNode = JsonHelper.toTree(checkNotNull(entry, "entry"));
        update(path, JsonHelper.newArray(), node -> {
            ArrayNode array = node.isArray() ? (ArrayNode) node : JsonHelper.newArray();
            array.add(entryNode.deepCopy());
            return array;
        });
    }

    private JsonNode parse(String path, VersionedDocument document, JsonNode emptyValue) {
        if (document == null) {
            return emptyValue.deepCopy();
        }
        try {
            return JsonHelper.readTree(document.getContent(), emptyValue);
        } catch (IllegalArgumentException e) {
            throw new DocumentStoreException(path, "Malformed document: " + path, e);
        }
    }

    private void backoff(String path, int attempt, DocumentConflictException conflict) {
        if (_maxBackoffMillis == 0) {
            return;
        }
        long ceiling = Math.min(_maxBackoffMillis, _minBackoffMillis << Math.min(attempt - 1, 16));
        long delay = ceiling <= _minBackoffMillis
                ? _minBackoffMillis
                : ThreadLocalRandom.current().nextLong(_minBackoffMillis, ceiling + 1);
        try {
            Thread.sleep(delay);
        } catch (InterruptedException e) {
            // On interrupt don't keep retrying, surface the conflict that got us here.
            Thread.currentThread().interrupt();
            _log.warn("Interrupted while retrying update of {}", path);
            throw conflict;
        }
    }
}
