package io.lendflow.observability;

import java.io.ByteArrayOutputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

public final class InMemorySegmentStore implements SegmentStore {
    private final Map<String, ByteArrayOutputStream> segments = new ConcurrentHashMap<>();

    @Override
    public void append(String segmentKey, byte[] bytes) {
        ByteArrayOutputStream buffer = segments.computeIfAbsent(segmentKey, k -> new ByteArrayOutputStream());
        synchronized (buffer) {
            buffer.writeBytes(bytes);
        }
    }

    @Override
    public byte[] read(String segmentKey) {
        ByteArrayOutputStream buffer = segments.get(segmentKey);
        if (buffer == null) {
            return new byte[0];
        }
        synchronized (buffer) {
            return buffer.toByteArray();
        }
    }

    /**
     * Replaces a segment wholesale. Only meant for tests that simulate tampering.
     */
    public void overwrite(String segmentKey, byte[] bytes) {
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        buffer.writeBytes(bytes);
        segments.put(segmentKey, buffer);
    }

    @Override
    public List<String> listSegments() {
        List<String> keys = new ArrayList<>(segments.keySet());
        keys.sort(String::compareTo);
        return keys;
    }

    @Override
    public boolean delete(String segmentKey) {
        return segments.remove(segmentKey) != null;
    }
}
