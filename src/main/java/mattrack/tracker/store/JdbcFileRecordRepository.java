package mattrack.tracker.store;

import mattrack.tracker.model.FileRecord;
import mattrack.tracker.model.FileType;
import mattrack.tracker.repository.FileRecordRepository;

import java.sql.*;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static mattrack.tracker.store.JdbcSupport.*;

/**
 * JDBC implementation of FileRecordRepository.
 */
public class JdbcFileRecordRepository implements FileRecordRepository {

    private final Database db;

    public JdbcFileRecordRepository(Database db) {
        this.db = db;
    }

    @Override
    public long save(FileRecord record) {
        String sql = """
                    INSERT INTO files (calc_id, file_type, file_name, file_path, file_size, checksum, created_at)
                    VALUES (?, ?, ?, ?, ?, ?, ?)
                """;

        return db.inTransaction("save file record " + record.fileName(), conn -> {
            try (PreparedStatement ps = conn.prepareStatement(sql, Statement.RETURN_GENERATED_KEYS)) {
                ps.setString(1, record.calcId());
                ps.setString(2, record.fileType().dbValue());
                ps.setString(3, record.fileName());
                ps.setString(4, record.filePath());
                ps.setLong(5, record.fileSize());
                ps.setString(6, record.checksum());
                setTimestamp(ps, 7, record.createdAt() != null ? record.createdAt() : Instant.now());
                ps.executeUpdate();
                try (ResultSet keys = ps.getGeneratedKeys()) {
                    return keys.next() ? keys.getLong(1) : -1L;
                }
            }
        });
    }

    @Override
    public List<FileRecord> findByCalculation(String calcId) {
        String sql = "SELECT * FROM files WHERE calc_id = ? ORDER BY created_at DESC, file_id DESC";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, calcId);
            List<FileRecord> results = new ArrayList<>();
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    results.add(new FileRecord(
                            rs.getLong("file_id"),
                            rs.getString("calc_id"),
                            FileType.fromDb(rs.getString("file_type")),
                            rs.getString("file_name"),
                            rs.getString("file_path"),
                            rs.getLong("file_size"),
                            rs.getString("checksum"),
                            toInstant(rs.getTimestamp("created_at"))));
                }
            }
            return results;
        } catch (SQLException e) {
            throw new StoreException("Failed to find files for calculation: " + calcId, e);
        }
    }

    @Override
    public int count() {
        try (Connection conn = db.getConnection();
                Statement st = conn.createStatement();
                ResultSet rs = st.executeQuery("SELECT COUNT(*) FROM files")) {
            return rs.next() ? rs.getInt(1) : 0;
        } catch (SQLException e) {
            throw new StoreException("Failed to count files", e);
        }
    }
}
