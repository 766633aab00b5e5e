package mattrack.tracker.store;

import mattrack.tracker.model.Calculation;
import mattrack.tracker.model.CalculationKind;
import mattrack.tracker.model.CalculationSettings;
import mattrack.tracker.model.CalculationStatus;
import mattrack.tracker.model.IllegalTransitionException;
import mattrack.tracker.model.PrerequisiteNotMetException;
import mattrack.tracker.model.StatusUpdate;
import mattrack.tracker.model.TransitionResult;
import mattrack.tracker.repository.CalculationRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.*;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static mattrack.tracker.store.JdbcSupport.*;

/**
 * JDBC implementation of CalculationRepository.
 * Status transitions lock the row with SELECT ... FOR UPDATE and then apply a conditional
 * UPDATE, so concurrent monitors racing on the same job produce exactly one transition.
 */
public class JdbcCalculationRepository implements CalculationRepository {

    private static final Logger log = LoggerFactory.getLogger(JdbcCalculationRepository.class);

    private final Database db;

    public JdbcCalculationRepository(Database db) {
        this.db = db;
    }

    @Override
    public void save(Calculation calc) {
        String sql = """
                    INSERT INTO calculations (calc_id, material_id, calc_type, status, priority, slurm_job_id, slurm_state,
                                              created_at, submitted_at, started_at, completed_at, input_file, output_file,
                                              job_script, work_dir, settings_json, exit_code, error_type, error_message,
                                              recovery_attempts, completion_type, prerequisite_calc_id)
                    VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
                """;

        db.inTransaction("save calculation " + calc.calcId(), conn -> {
            try (PreparedStatement ps = conn.prepareStatement(sql)) {
                ps.setString(1, calc.calcId());
                ps.setString(2, calc.materialId());
                ps.setString(3, calc.kind().code());
                ps.setString(4, calc.status().dbValue());
                ps.setInt(5, calc.priority());
                ps.setString(6, calc.externalJobId());
                ps.setString(7, calc.externalState());
                setTimestamp(ps, 8, calc.createdAt() != null ? calc.createdAt() : Instant.now());
                setTimestamp(ps, 9, calc.submittedAt());
                setTimestamp(ps, 10, calc.startedAt());
                setTimestamp(ps, 11, calc.completedAt());
                ps.setString(12, calc.inputFile());
                ps.setString(13, calc.outputFile());
                ps.setString(14, calc.jobScript());
                ps.setString(15, calc.workDir());
                ps.setString(16, toJson(calc.settings()));
                setIntOrNull(ps, 17, calc.exitCode());
                ps.setString(18, calc.errorType());
                ps.setString(19, calc.errorMessage());
                ps.setInt(20, calc.recoveryAttempts());
                ps.setString(21, calc.completionType());
                ps.setString(22, calc.prerequisiteCalcId());
                ps.executeUpdate();
            }
            return null;
        });

        log.debug("Saved calculation {} ({}) for {}", calc.calcId(), calc.kind().code(), calc.materialId());
    }

    @Override
    public Optional<Calculation> findById(String calcId) {
        return findOne("SELECT * FROM calculations WHERE calc_id = ?", calcId);
    }

    @Override
    public Optional<Calculation> findByExternalJobId(String externalJobId) {
        return findOne("SELECT * FROM calculations WHERE slurm_job_id = ? ORDER BY created_at DESC", externalJobId);
    }

    @Override
    public List<Calculation> findByStatus(CalculationStatus status) {
        return findMany("SELECT * FROM calculations WHERE status = ? ORDER BY created_at DESC", status.dbValue());
    }

    @Override
    public List<Calculation> findByKind(CalculationKind kind) {
        return findMany("SELECT * FROM calculations WHERE calc_type = ? ORDER BY created_at DESC", kind.code());
    }

    @Override
    public List<Calculation> findByMaterial(String materialId) {
        return findMany("SELECT * FROM calculations WHERE material_id = ? ORDER BY created_at DESC", materialId);
    }

    @Override
    public List<Calculation> findByMaterialAndKind(String materialId, CalculationKind kind) {
        return findMany("SELECT * FROM calculations WHERE material_id = ? AND calc_type = ? ORDER BY created_at DESC",
                materialId, kind.code());
    }

    @Override
    public List<Calculation> findRecent(int limit) {
        String sql = "SELECT * FROM calculations ORDER BY created_at DESC LIMIT ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setInt(1, limit);
            return executeQuery(ps);
        } catch (SQLException e) {
            throw new StoreException("Failed to find recent calculations", e);
        }
    }

    @Override
    public int countByStatus(CalculationStatus status) {
        String sql = "SELECT COUNT(*) FROM calculations WHERE status = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, status.dbValue());
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? rs.getInt(1) : 0;
            }
        } catch (SQLException e) {
            throw new StoreException("Failed to count calculations by status: " + status, e);
        }
    }

    @Override
    public Map<CalculationStatus, Integer> countsByStatus() {
        Map<CalculationStatus, Integer> counts = new EnumMap<>(CalculationStatus.class);
        try (Connection conn = db.getConnection();
                Statement st = conn.createStatement();
                ResultSet rs = st.executeQuery("SELECT status, COUNT(*) FROM calculations GROUP BY status")) {
            while (rs.next()) {
                counts.put(CalculationStatus.fromDb(rs.getString(1)), rs.getInt(2));
            }
            return counts;
        } catch (SQLException e) {
            throw new StoreException("Failed to count calculations by status", e);
        }
    }

    @Override
    public Map<CalculationKind, Integer> countsByKind() {
        Map<CalculationKind, Integer> counts = new EnumMap<>(CalculationKind.class);
        try (Connection conn = db.getConnection();
                Statement st = conn.createStatement();
                ResultSet rs = st.executeQuery("SELECT calc_type, COUNT(*) FROM calculations GROUP BY calc_type")) {
            while (rs.next()) {
                counts.put(CalculationKind.fromCode(rs.getString(1)), rs.getInt(2));
            }
            return counts;
        } catch (SQLException e) {
            throw new StoreException("Failed to count calculations by kind", e);
        }
    }

    @Override
    public TransitionResult updateStatus(StatusUpdate update) {
        String calcId = update.calcId();
        CalculationStatus target = update.newStatus();

        TransitionResult result = db.inTransaction("update status of " + calcId, conn -> {
            LockedRow row = lockRow(conn, calcId);
            if (row == null) {
                return TransitionResult.NOT_FOUND;
            }

            if (row.status == target) {
                return TransitionResult.UNCHANGED;
            }
            if (update.expected() != null && row.status != update.expected()) {
                log.debug("Calculation {} is {} (expected {}), skipping move to {}",
                        calcId, row.status, update.expected(), target);
                return TransitionResult.STALE;
            }
            if (!row.status.canTransitionTo(target)) {
                throw new IllegalTransitionException(calcId, row.status, target);
            }
            if (target == CalculationStatus.SUBMITTED && row.prerequisiteCalcId != null) {
                CalculationStatus prereq = statusOf(conn, row.prerequisiteCalcId);
                if (prereq != CalculationStatus.COMPLETED) {
                    throw new PrerequisiteNotMetException(calcId, row.prerequisiteCalcId, prereq);
                }
            }
            if (update.isRecoveryAttempt() && row.recoveryAttempts >= update.recoveryCeiling()) {
                return TransitionResult.CEILING_REACHED;
            }

            applyTransition(conn, row, update);
            return TransitionResult.APPLIED;
        });

        if (result == TransitionResult.APPLIED) {
            log.info("Calculation {} -> {}", calcId, target.dbValue());
        }
        return result;
    }

    @Override
    public boolean updateArtifacts(String calcId, String workDir, String inputFile, String outputFile,
            String jobScript) {
        String sql = """
                    UPDATE calculations
                    SET work_dir = COALESCE(?, work_dir),
                        input_file = COALESCE(?, input_file),
                        output_file = COALESCE(?, output_file),
                        job_script = COALESCE(?, job_script)
                    WHERE calc_id = ?
                """;

        return db.inTransaction("update artifacts of " + calcId, conn -> {
            try (PreparedStatement ps = conn.prepareStatement(sql)) {
                ps.setString(1, workDir);
                ps.setString(2, inputFile);
                ps.setString(3, outputFile);
                ps.setString(4, jobScript);
                ps.setString(5, calcId);
                return ps.executeUpdate() > 0;
            }
        });
    }

    /**
     * Current row state read under a row lock.
     */
    private static final class LockedRow {
        String calcId;
        CalculationStatus status;
        Instant createdAt;
        Instant submittedAt;
        Instant startedAt;
        Instant completedAt;
        int recoveryAttempts;
        String prerequisiteCalcId;
    }

    private LockedRow lockRow(Connection conn, String calcId) throws SQLException {
        String sql = """
                    SELECT calc_id, status, created_at, submitted_at, started_at, completed_at,
                           recovery_attempts, prerequisite_calc_id
                    FROM calculations
                    WHERE calc_id = ?
                    FOR UPDATE
                """;

        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, calcId);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) {
                    return null;
                }
                LockedRow row = new LockedRow();
                row.calcId = rs.getString("calc_id");
                row.status = CalculationStatus.fromDb(rs.getString("status"));
                row.createdAt = toInstant(rs.getTimestamp("created_at"));
                row.submittedAt = toInstant(rs.getTimestamp("submitted_at"));
                row.startedAt = toInstant(rs.getTimestamp("started_at"));
                row.completedAt = toInstant(rs.getTimestamp("completed_at"));
                row.recoveryAttempts = rs.getInt("recovery_attempts");
                String prereq = rs.getString("prerequisite_calc_id");
                row.prerequisiteCalcId = prereq == null || prereq.isBlank() ? null : prereq;
                return row;
            }
        }
    }

    private CalculationStatus statusOf(Connection conn, String calcId) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement("SELECT status FROM calculations WHERE calc_id = ?")) {
            ps.setString(1, calcId);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? CalculationStatus.fromDb(rs.getString(1)) : null;
            }
        }
    }

    private void applyTransition(Connection conn, LockedRow row, StatusUpdate update) throws SQLException {
        CalculationStatus target = update.newStatus();
        Instant now = Instant.now();

        // Stamps only move forward: clamp against the earlier stamps this transition must follow.
        Instant submittedAt = row.submittedAt;
        Instant startedAt = row.startedAt;
        Instant completedAt = row.completedAt;
        switch (target) {
            case SUBMITTED -> {
                submittedAt = latest(now, row.createdAt, row.submittedAt);
                // A resubmission starts a fresh attempt.
                startedAt = null;
                completedAt = null;
            }
            case RUNNING -> startedAt = latest(now, row.createdAt, row.submittedAt);
            case COMPLETED, FAILED, CANCELLED -> completedAt = latest(now, row.createdAt, row.submittedAt, row.startedAt);
            default -> {
                // PENDING and RESUBMITTED carry no timestamp of their own
            }
        }

        String sql = """
                    UPDATE calculations
                    SET status = ?,
                        submitted_at = ?, started_at = ?, completed_at = ?,
                        slurm_job_id = COALESCE(?, slurm_job_id),
                        slurm_state = COALESCE(?, slurm_state),
                        output_file = COALESCE(?, output_file),
                        exit_code = COALESCE(?, exit_code),
                        error_type = CASE WHEN ? THEN NULL ELSE COALESCE(?, error_type) END,
                        error_message = CASE WHEN ? THEN NULL ELSE COALESCE(?, error_message) END,
                        completion_type = COALESCE(?, completion_type),
                        settings_json = COALESCE(?, settings_json),
                        recovery_attempts = recovery_attempts + ?
                    WHERE calc_id = ? AND status = ?
                """;

        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, target.dbValue());
            setTimestamp(ps, 2, submittedAt);
            setTimestamp(ps, 3, startedAt);
            setTimestamp(ps, 4, completedAt);
            ps.setString(5, update.externalJobId());
            ps.setString(6, update.externalState());
            ps.setString(7, update.outputFile());
            setIntOrNull(ps, 8, update.exitCode());
            // A completed calculation carries no error; recovery history stays.
            boolean clearError = target == CalculationStatus.COMPLETED;
            ps.setBoolean(9, clearError);
            ps.setString(10, update.errorType());
            ps.setBoolean(11, clearError);
            ps.setString(12, truncate(update.errorMessage(), 4096));
            ps.setString(13, update.completionType());
            CalculationSettings settings = update.settings();
            ps.setString(14, toJson(settings));
            ps.setInt(15, update.isRecoveryAttempt() ? 1 : 0);
            ps.setString(16, row.calcId);
            ps.setString(17, row.status.dbValue());

            int updated = ps.executeUpdate();
            if (updated != 1) {
                throw new SQLException("Status update for " + row.calcId + " touched " + updated + " rows");
            }
        }
    }

    private static Instant latest(Instant candidate, Instant... floors) {
        Instant result = candidate;
        for (Instant floor : floors) {
            if (floor != null && floor.isAfter(result)) {
                result = floor;
            }
        }
        return result;
    }

    private static String truncate(String s, int max) {
        return s == null || s.length() <= max ? s : s.substring(0, max);
    }

    // Helper methods

    private Optional<Calculation> findOne(String sql, String param) {
        List<Calculation> found = findMany(sql, param);
        return found.isEmpty() ? Optional.empty() : Optional.of(found.get(0));
    }

    private List<Calculation> findMany(String sql, String... params) {
        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            for (int i = 0; i < params.length; i++) {
                ps.setString(i + 1, params[i]);
            }
            return executeQuery(ps);
        } catch (SQLException e) {
            throw new StoreException("Failed to query calculations: " + String.join(", ", params), e);
        }
    }

    private List<Calculation> executeQuery(PreparedStatement ps) throws SQLException {
        List<Calculation> results = new ArrayList<>();
        try (ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                results.add(mapRow(rs));
            }
        }
        return results;
    }

    private Calculation mapRow(ResultSet rs) throws SQLException {
        int exitCode = rs.getInt("exit_code");
        Integer exit = rs.wasNull() ? null : exitCode;

        return Calculation.builder()
                .calcId(rs.getString("calc_id"))
                .materialId(rs.getString("material_id"))
                .kind(CalculationKind.fromCode(rs.getString("calc_type")))
                .status(CalculationStatus.fromDb(rs.getString("status")))
                .priority(rs.getInt("priority"))
                .externalJobId(rs.getString("slurm_job_id"))
                .externalState(rs.getString("slurm_state"))
                .createdAt(toInstant(rs.getTimestamp("created_at")))
                .submittedAt(toInstant(rs.getTimestamp("submitted_at")))
                .startedAt(toInstant(rs.getTimestamp("started_at")))
                .completedAt(toInstant(rs.getTimestamp("completed_at")))
                .inputFile(rs.getString("input_file"))
                .outputFile(rs.getString("output_file"))
                .jobScript(rs.getString("job_script"))
                .workDir(rs.getString("work_dir"))
                .settings(fromJson(rs.getString("settings_json"), CalculationSettings.class))
                .exitCode(exit)
                .errorType(rs.getString("error_type"))
                .errorMessage(rs.getString("error_message"))
                .recoveryAttempts(rs.getInt("recovery_attempts"))
                .completionType(rs.getString("completion_type"))
                .prerequisiteCalcId(rs.getString("prerequisite_calc_id"))
                .build();
    }
}
