package mattrack.tracker.store;

import com.fasterxml.jackson.core.type.TypeReference;
import mattrack.tracker.model.WorkflowInstance;
import mattrack.tracker.model.WorkflowStatus;
import mattrack.tracker.model.WorkflowStep;
import mattrack.tracker.model.WorkflowTemplate;
import mattrack.tracker.repository.WorkflowRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.*;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static mattrack.tracker.store.JdbcSupport.*;

/**
 * JDBC implementation of WorkflowRepository. Template steps are stored as a JSON array.
 */
public class JdbcWorkflowRepository implements WorkflowRepository {

    private static final Logger log = LoggerFactory.getLogger(JdbcWorkflowRepository.class);
    private static final TypeReference<List<WorkflowStep>> STEP_LIST = new TypeReference<>() {
    };

    private final Database db;

    public JdbcWorkflowRepository(Database db) {
        this.db = db;
    }

    @Override
    public void saveTemplate(WorkflowTemplate template) {
        String sql = """
                    MERGE INTO workflow_templates (template_id, name, description, steps_json, created_at)
                    KEY (template_id)
                    VALUES (?, ?, ?, ?, ?)
                """;

        db.inTransaction("save workflow template " + template.templateId(), conn -> {
            try (PreparedStatement ps = conn.prepareStatement(sql)) {
                ps.setString(1, template.templateId());
                ps.setString(2, template.name());
                ps.setString(3, template.description());
                ps.setString(4, toJson(template.steps()));
                setTimestamp(ps, 5, template.createdAt() != null ? template.createdAt() : Instant.now());
                return ps.executeUpdate();
            }
        });
        log.debug("Saved workflow template {}", template.templateId());
    }

    @Override
    public Optional<WorkflowTemplate> findTemplate(String templateId) {
        List<WorkflowTemplate> found = queryTemplates("SELECT * FROM workflow_templates WHERE template_id = ?",
                templateId);
        return found.isEmpty() ? Optional.empty() : Optional.of(found.get(0));
    }

    @Override
    public List<WorkflowTemplate> findAllTemplates() {
        return queryTemplates("SELECT * FROM workflow_templates ORDER BY created_at DESC");
    }

    @Override
    public void createInstance(WorkflowInstance instance) {
        String sql = """
                    INSERT INTO workflow_instances (instance_id, material_id, template_id, status, current_step,
                                                    started_at, completed_at)
                    VALUES (?, ?, ?, ?, ?, ?, ?)
                """;

        db.inTransaction("create workflow instance for " + instance.materialId(), conn -> {
            try (PreparedStatement ps = conn.prepareStatement(sql)) {
                ps.setString(1, instance.instanceId());
                ps.setString(2, instance.materialId());
                ps.setString(3, instance.templateId());
                ps.setString(4, instance.status().dbValue());
                ps.setString(5, instance.currentStep());
                setTimestamp(ps, 6, instance.startedAt() != null ? instance.startedAt() : Instant.now());
                setTimestamp(ps, 7, instance.completedAt());
                return ps.executeUpdate();
            }
        });
    }

    @Override
    public Optional<WorkflowInstance> findOpenInstance(String materialId) {
        List<WorkflowInstance> found = queryInstances("""
                    SELECT * FROM workflow_instances
                    WHERE material_id = ? AND status IN ('active', 'paused')
                    ORDER BY started_at DESC
                """, materialId);
        return found.isEmpty() ? Optional.empty() : Optional.of(found.get(0));
    }

    @Override
    public List<WorkflowInstance> findInstances(String materialId) {
        return queryInstances("SELECT * FROM workflow_instances WHERE material_id = ? ORDER BY started_at DESC",
                materialId);
    }

    @Override
    public boolean updateInstance(String instanceId, WorkflowStatus status, String currentStep) {
        String sql = """
                    UPDATE workflow_instances
                    SET status = ?, current_step = COALESCE(?, current_step), completed_at = ?
                    WHERE instance_id = ?
                """;

        return db.inTransaction("update workflow instance " + instanceId, conn -> {
            try (PreparedStatement ps = conn.prepareStatement(sql)) {
                ps.setString(1, status.dbValue());
                ps.setString(2, currentStep);
                boolean finished = status == WorkflowStatus.COMPLETED || status == WorkflowStatus.FAILED;
                setTimestamp(ps, 3, finished ? Instant.now() : null);
                ps.setString(4, instanceId);
                return ps.executeUpdate() > 0;
            }
        });
    }

    // Helper methods

    private List<WorkflowTemplate> queryTemplates(String sql, String... params) {
        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            for (int i = 0; i < params.length; i++) {
                ps.setString(i + 1, params[i]);
            }
            List<WorkflowTemplate> results = new ArrayList<>();
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    results.add(new WorkflowTemplate(
                            rs.getString("template_id"),
                            rs.getString("name"),
                            rs.getString("description"),
                            fromJson(rs.getString("steps_json"), STEP_LIST),
                            toInstant(rs.getTimestamp("created_at"))));
                }
            }
            return results;
        } catch (SQLException e) {
            throw new StoreException("Failed to query workflow templates", e);
        }
    }

    private List<WorkflowInstance> queryInstances(String sql, String materialId) {
        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, materialId);
            List<WorkflowInstance> results = new ArrayList<>();
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    results.add(new WorkflowInstance(
                            rs.getString("instance_id"),
                            rs.getString("material_id"),
                            rs.getString("template_id"),
                            WorkflowStatus.fromDb(rs.getString("status")),
                            rs.getString("current_step"),
                            toInstant(rs.getTimestamp("started_at")),
                            toInstant(rs.getTimestamp("completed_at"))));
                }
            }
            return results;
        } catch (SQLException e) {
            throw new StoreException("Failed to query workflow instances for " + materialId, e);
        }
    }
}
