package io.lendflow.recovery;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Keeps records in insertion order so records created within the same instant still
 * list in the order they were raised.
 */
public final class InMemoryErrorRecordStore implements ErrorRecordStore {
    private final Map<String, ErrorRecord> records = new LinkedHashMap<>();

    @Override
    public synchronized void save(ErrorRecord record) {
        records.put(record.errorId(), record);
    }

    @Override
    public synchronized Optional<ErrorRecord> find(String errorId) {
        return Optional.ofNullable(records.get(errorId));
    }

    @Override
    public synchronized List<ErrorRecord> findByApplication(String applicationId) {
        List<ErrorRecord> out = new ArrayList<>();
        for (ErrorRecord record : records.values()) {
            if (record.applicationId().equals(applicationId)) {
                out.add(record);
            }
        }
        out.sort(Comparator.comparing(ErrorRecord::timestamp));
        return out;
    }

    @Override
    public synchronized List<ErrorRecord> findAll() {
        List<ErrorRecord> out = new ArrayList<>(records.values());
        out.sort(Comparator.comparing(ErrorRecord::timestamp));
        return out;
    }
}
