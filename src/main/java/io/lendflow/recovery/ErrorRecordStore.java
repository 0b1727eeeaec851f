package io.lendflow.recovery;

import java.util.List;
import java.util.Optional;

public interface ErrorRecordStore {
    void save(ErrorRecord record);

    Optional<ErrorRecord> find(String errorId);

    List<ErrorRecord> findByApplication(String applicationId);

    List<ErrorRecord> findAll();
}
