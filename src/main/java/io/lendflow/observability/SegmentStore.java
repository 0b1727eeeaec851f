package io.lendflow.observability;

import java.util.List;

/**
 * Byte sink for audit segments. The audit log owns the record format; a store only
 * appends, reads back and enumerates opaque segment keys.
 */
public interface SegmentStore {
    void append(String segmentKey, byte[] bytes);

    /**
     * Full content of the segment, or an empty array when it does not exist.
     */
    byte[] read(String segmentKey);

    List<String> listSegments();

    boolean delete(String segmentKey);
}
