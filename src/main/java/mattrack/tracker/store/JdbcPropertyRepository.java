package mattrack.tracker.store;

import mattrack.tracker.model.Property;
import mattrack.tracker.repository.PropertyRepository;

import java.sql.*;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static mattrack.tracker.store.JdbcSupport.*;

/**
 * JDBC implementation of PropertyRepository. Rows are never updated or deleted.
 */
public class JdbcPropertyRepository implements PropertyRepository {

    private final Database db;

    public JdbcPropertyRepository(Database db) {
        this.db = db;
    }

    @Override
    public long save(Property p) {
        String sql = """
                    INSERT INTO properties (material_id, calc_id, category, name, num_value, text_value, unit,
                                            extracted_at, extractor)
                    VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?)
                """;

        return db.inTransaction("save property " + p.name() + " for " + p.materialId(), conn -> {
            try (PreparedStatement ps = conn.prepareStatement(sql, Statement.RETURN_GENERATED_KEYS)) {
                ps.setString(1, p.materialId());
                ps.setString(2, p.calcId());
                ps.setString(3, p.category());
                ps.setString(4, p.name());
                setDoubleOrNull(ps, 5, p.value());
                ps.setString(6, p.textValue());
                ps.setString(7, p.unit());
                setTimestamp(ps, 8, p.extractedAt() != null ? p.extractedAt() : Instant.now());
                ps.setString(9, p.extractor());
                ps.executeUpdate();
                try (ResultSet keys = ps.getGeneratedKeys()) {
                    return keys.next() ? keys.getLong(1) : -1L;
                }
            }
        });
    }

    @Override
    public List<Property> findByMaterial(String materialId) {
        return query("SELECT * FROM properties WHERE material_id = ? ORDER BY extracted_at DESC, property_id DESC",
                materialId);
    }

    @Override
    public List<Property> findByCalculation(String calcId) {
        return query("SELECT * FROM properties WHERE calc_id = ? ORDER BY extracted_at DESC, property_id DESC",
                calcId);
    }

    @Override
    public int count() {
        try (Connection conn = db.getConnection();
                Statement st = conn.createStatement();
                ResultSet rs = st.executeQuery("SELECT COUNT(*) FROM properties")) {
            return rs.next() ? rs.getInt(1) : 0;
        } catch (SQLException e) {
            throw new StoreException("Failed to count properties", e);
        }
    }

    private List<Property> query(String sql, String param) {
        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, param);
            List<Property> results = new ArrayList<>();
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    double value = rs.getDouble("num_value");
                    Double numeric = rs.wasNull() ? null : value;
                    results.add(new Property(
                            rs.getLong("property_id"),
                            rs.getString("material_id"),
                            rs.getString("calc_id"),
                            rs.getString("category"),
                            rs.getString("name"),
                            numeric,
                            rs.getString("text_value"),
                            rs.getString("unit"),
                            toInstant(rs.getTimestamp("extracted_at")),
                            rs.getString("extractor")));
                }
            }
            return results;
        } catch (SQLException e) {
            throw new StoreException("Failed to query properties: " + param, e);
        }
    }
}
