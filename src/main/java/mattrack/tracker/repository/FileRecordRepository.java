package mattrack.tracker.repository;

import mattrack.tracker.model.FileRecord;

import java.util.List;

/**
 * Files attached to calculations.
 */
public interface FileRecordRepository {

    /**
     * @return generated file id
     */
    long save(FileRecord record);

    List<FileRecord> findByCalculation(String calcId);

    int count();
}
