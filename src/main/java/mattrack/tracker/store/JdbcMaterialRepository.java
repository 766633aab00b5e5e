package mattrack.tracker.store;

import com.fasterxml.jackson.core.type.TypeReference;
import mattrack.tracker.model.Dimensionality;
import mattrack.tracker.model.Material;
import mattrack.tracker.model.MaterialStatus;
import mattrack.tracker.repository.MaterialRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.*;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static mattrack.tracker.store.JdbcSupport.*;

/**
 * JDBC implementation of MaterialRepository.
 */
public class JdbcMaterialRepository implements MaterialRepository {

    private static final Logger log = LoggerFactory.getLogger(JdbcMaterialRepository.class);

    private final Database db;

    public JdbcMaterialRepository(Database db) {
        this.db = db;
    }

    @Override
    public void save(Material material) {
        String sql = """
                    INSERT INTO materials (material_id, formula, space_group, dimensionality, source_type, source_file,
                                           status, metadata_json, notes, created_at, updated_at)
                    VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
                """;

        db.inTransaction("save material " + material.materialId(), conn -> {
            try (PreparedStatement ps = conn.prepareStatement(sql)) {
                Instant now = Instant.now();
                ps.setString(1, material.materialId());
                ps.setString(2, material.formula());
                setIntOrNull(ps, 3, material.spaceGroup());
                ps.setString(4, material.dimensionality() != null ? material.dimensionality().name() : null);
                ps.setString(5, material.sourceType());
                ps.setString(6, material.sourceFile());
                ps.setString(7, material.status().dbValue());
                ps.setString(8, toJson(material.metadata()));
                ps.setString(9, material.notes());
                setTimestamp(ps, 10, material.createdAt() != null ? material.createdAt() : now);
                setTimestamp(ps, 11, material.updatedAt() != null ? material.updatedAt() : now);
                ps.executeUpdate();
            }
            log.debug("Saved material {}", material.materialId());
            return null;
        });
    }

    @Override
    public Optional<Material> findById(String materialId) {
        String sql = "SELECT * FROM materials WHERE material_id = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, materialId);
            List<Material> found = executeQuery(ps);
            return found.isEmpty() ? Optional.empty() : Optional.of(found.get(0));
        } catch (SQLException e) {
            throw new StoreException("Failed to find material: " + materialId, e);
        }
    }

    @Override
    public List<Material> findAll() {
        String sql = "SELECT * FROM materials ORDER BY created_at DESC";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {
            return executeQuery(ps);
        } catch (SQLException e) {
            throw new StoreException("Failed to list materials", e);
        }
    }

    @Override
    public List<Material> findByStatus(MaterialStatus status) {
        String sql = "SELECT * FROM materials WHERE status = ? ORDER BY created_at DESC";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, status.dbValue());
            return executeQuery(ps);
        } catch (SQLException e) {
            throw new StoreException("Failed to find materials by status: " + status, e);
        }
    }

    @Override
    public boolean updateStatus(String materialId, MaterialStatus status) {
        String sql = "UPDATE materials SET status = ?, updated_at = ? WHERE material_id = ?";

        return db.inTransaction("update material status " + materialId, conn -> {
            try (PreparedStatement ps = conn.prepareStatement(sql)) {
                ps.setString(1, status.dbValue());
                ps.setTimestamp(2, Timestamp.from(Instant.now()));
                ps.setString(3, materialId);
                return ps.executeUpdate() > 0;
            }
        });
    }

    @Override
    public void touch(String materialId) {
        String sql = "UPDATE materials SET updated_at = ? WHERE material_id = ?";

        db.inTransaction("touch material " + materialId, conn -> {
            try (PreparedStatement ps = conn.prepareStatement(sql)) {
                ps.setTimestamp(1, Timestamp.from(Instant.now()));
                ps.setString(2, materialId);
                return ps.executeUpdate();
            }
        });
    }

    @Override
    public int count() {
        try (Connection conn = db.getConnection();
                Statement st = conn.createStatement();
                ResultSet rs = st.executeQuery("SELECT COUNT(*) FROM materials")) {
            return rs.next() ? rs.getInt(1) : 0;
        } catch (SQLException e) {
            throw new StoreException("Failed to count materials", e);
        }
    }

    // Helper methods

    private List<Material> executeQuery(PreparedStatement ps) throws SQLException {
        List<Material> results = new ArrayList<>();
        try (ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                results.add(mapRow(rs));
            }
        }
        return results;
    }

    private Material mapRow(ResultSet rs) throws SQLException {
        String dimensionality = rs.getString("dimensionality");
        int rawSpaceGroup = rs.getInt("space_group");
        Integer spaceGroup = rs.wasNull() ? null : rawSpaceGroup;
        Map<String, Object> metadata = fromJson(rs.getString("metadata_json"), new TypeReference<Map<String, Object>>() {
        });

        return Material.builder()
                .materialId(rs.getString("material_id"))
                .formula(rs.getString("formula"))
                .spaceGroup(spaceGroup)
                .dimensionality(dimensionality != null ? Dimensionality.valueOf(dimensionality) : null)
                .sourceType(rs.getString("source_type"))
                .sourceFile(rs.getString("source_file"))
                .status(MaterialStatus.fromDb(rs.getString("status")))
                .metadata(metadata)
                .notes(rs.getString("notes"))
                .createdAt(toInstant(rs.getTimestamp("created_at")))
                .updatedAt(toInstant(rs.getTimestamp("updated_at")))
                .build();
    }
}
