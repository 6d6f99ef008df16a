// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.sift.index.store;

import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

import sh.sift.core.error.SegmentStoreException;

/**
 * Heap-backed {@link SegmentStore} for tests and short-lived pipelines.
 */
public final class InMemorySegmentStore implements SegmentStore {

    private final ConcurrentMap<String, byte[]> segments = new ConcurrentHashMap<>();

    @Override
    public boolean exists(final SegmentId id) {
        return segments.containsKey(id.fileName());
    }

    @Override
    public void write(final SegmentId id, final byte[] payload) {
        Objects.requireNonNull(payload, "payload");
        if (segments.putIfAbsent(id.fileName(), payload.clone()) != null) {
            throw new SegmentStoreException("Segment " + id + " already exists", false);
        }
    }

    @Override
    public byte[] open(final SegmentId id) {
        final byte[] payload = segments.get(id.fileName());
        if (payload == null) {
            throw new SegmentStoreException("Segment " + id + " does not exist", false);
        }
        return payload.clone();
    }

    /**
     * @return the file names of all published segments, sorted
     */
    public Set<String> fileNames() {
        return new TreeSet<>(segments.keySet());
    }
}
