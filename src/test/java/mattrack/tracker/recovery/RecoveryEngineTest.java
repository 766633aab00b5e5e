package mattrack.tracker.recovery;

import mattrack.tracker.classify.Classification;
import mattrack.tracker.classify.ErrorClassifier;
import mattrack.tracker.classify.PatternTable;
import mattrack.tracker.config.TrackerConfig;
import mattrack.tracker.model.Calculation;
import mattrack.tracker.model.CalculationKind;
import mattrack.tracker.model.CalculationSettings;
import mattrack.tracker.model.CalculationStatus;
import mattrack.tracker.model.Material;
import mattrack.tracker.model.StatusUpdate;
import mattrack.tracker.store.Database;
import mattrack.tracker.store.JdbcCalculationRepository;
import mattrack.tracker.store.JdbcMaterialRepository;
import org.junit.jupiter.api.*;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RecoveryEngineTest {

    private static Database db;
    private static JdbcCalculationRepository calculations;
    private static ErrorClassifier classifier;
    private RecoveryEngine engine;

    @BeforeAll
    static void setup() {
        TrackerConfig config = TrackerConfig.defaults()
                .withDatabaseUrl("jdbc:h2:mem:test-recovery;DB_CLOSE_DELAY=-1;MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE");
        db = new Database(config);
        calculations = new JdbcCalculationRepository(db);
        new JdbcMaterialRepository(db).save(Material.builder().materialId("mp-2534").formula("GaAs").build());
        classifier = new ErrorClassifier(PatternTable.loadDefault());
    }

    @AfterAll
    static void teardown() {
        if (db != null)
            db.close();
    }

    @BeforeEach
    void setUp() throws Exception {
        try (var conn = db.getConnection();
                var st = conn.createStatement()) {
            st.execute("DELETE FROM calculations");
            conn.commit();
        }
        engine = RecoveryEngine.withDefaultStrategies(calculations, RecoveryConfig.loadDefault(), 3);
    }

    private String submitted(String calcId) {
        calculations.save(Calculation.builder()
                .calcId(calcId)
                .materialId("mp-2534")
                .kind(CalculationKind.SINGLE_POINT)
                .settings(CalculationSettings.of(24, 8, 4))
                .createdAt(Instant.now())
                .build());
        calculations.updateStatus(StatusUpdate.to(calcId, CalculationStatus.SUBMITTED).externalJobId("1").build());
        return calcId;
    }

    private Calculation fail(String calcId, Classification c) {
        calculations.updateStatus(StatusUpdate.to(calcId, CalculationStatus.FAILED)
                .error(c.kind(), c.summary())
                .build());
        return calculations.findById(calcId).orElseThrow();
    }

    @Test
    @DisplayName("Out-of-memory failure is resubmitted with more memory")
    void memoryErrorIsRecovered() {
        String id = submitted("calc-oom");
        Classification oom = classifier.classify("ERROR **** OUT OF MEMORY ****");

        RecoveryOutcome outcome = engine.attemptRecovery(fail(id, oom), oom);

        assertEquals(RecoveryOutcome.Decision.RESUBMIT, outcome.decision());
        Calculation calc = calculations.findById(id).orElseThrow();
        assertEquals(CalculationStatus.RESUBMITTED, calc.status());
        assertEquals(1, calc.recoveryAttempts());
        assertEquals(12, calc.settings().memoryGb());
        assertEquals(Calculation.RECOVERY_ATTEMPT, calc.completionType());
    }

    @Test
    @DisplayName("Fourth memory failure after three recoveries is terminal")
    void ceilingStopsRecovery() {
        String id = submitted("calc-ceiling");
        Classification oom = classifier.classify("OUT OF MEMORY");

        for (int attempt = 1; attempt <= 3; attempt++) {
            RecoveryOutcome outcome = engine.attemptRecovery(fail(id, oom), oom);
            assertEquals(RecoveryOutcome.Decision.RESUBMIT, outcome.decision(), "attempt " + attempt);
            calculations.updateStatus(StatusUpdate.to(id, CalculationStatus.SUBMITTED).build());
        }

        RecoveryOutcome fourth = engine.attemptRecovery(fail(id, oom), oom);

        assertEquals(RecoveryOutcome.Decision.CEILING_REACHED, fourth.decision());
        Calculation calc = calculations.findById(id).orElseThrow();
        assertEquals(CalculationStatus.FAILED, calc.status());
        assertEquals(3, calc.recoveryAttempts());
        assertEquals(27, calc.settings().memoryGb());
    }

    @Test
    void terminalKindIsNotRecovered() {
        String id = submitted("calc-basis");
        Classification basis = classifier.classify("BASIS SET LINEARLY DEPENDENT");

        RecoveryOutcome outcome = engine.attemptRecovery(fail(id, basis), basis);

        assertEquals(RecoveryOutcome.Decision.NOT_RECOVERABLE, outcome.decision());
        assertEquals(CalculationStatus.FAILED, calculations.findById(id).orElseThrow().status());
        assertEquals(0, calculations.findById(id).orElseThrow().recoveryAttempts());
    }

    @Test
    void unknownFailureIsNotRecovered() {
        String id = submitted("calc-unknown");
        Classification unknown = Classification.unknown("weird error");

        assertFalse(engine.attemptRecovery(fail(id, unknown), unknown).resubmit());
    }

    @Test
    void ioErrorUsesItsOwnLimit() {
        String id = submitted("calc-io");
        Classification io = classifier.classify("I/O ERROR on unit 9");

        assertTrue(engine.attemptRecovery(fail(id, io), io).resubmit());
        calculations.updateStatus(StatusUpdate.to(id, CalculationStatus.SUBMITTED).build());

        RecoveryOutcome second = engine.attemptRecovery(fail(id, io), io);
        assertEquals(RecoveryOutcome.Decision.CEILING_REACHED, second.decision());
    }

    @Test
    void failedTransformLeavesCalculationFailed() {
        // No input file to edit
        String id = submitted("calc-scf");
        Classification scf = classifier.classify("SCF NOT CONVERGED");

        RecoveryOutcome outcome = engine.attemptRecovery(fail(id, scf), scf);

        assertEquals(RecoveryOutcome.Decision.TRANSFORM_FAILED, outcome.decision());
        assertEquals(CalculationStatus.FAILED, calculations.findById(id).orElseThrow().status());
    }

    @Test
    void calculationMovedElsewhereIsStale() {
        String id = submitted("calc-moved");
        Classification oom = classifier.classify("OUT OF MEMORY");
        Calculation snapshot = calculations.findById(id).orElseThrow();

        RecoveryOutcome outcome = engine.attemptRecovery(snapshot, oom);

        assertEquals(RecoveryOutcome.Decision.STALE, outcome.decision());
        assertEquals(CalculationStatus.SUBMITTED, calculations.findById(id).orElseThrow().status());
    }

    @Test
    void missingStrategyFailsClosed() {
        RecoveryEngine bare = new RecoveryEngine(calculations, List.of(), 3);
        String id = submitted("calc-bare");
        Classification oom = classifier.classify("OUT OF MEMORY");

        assertEquals(RecoveryOutcome.Decision.NO_STRATEGY, bare.attemptRecovery(fail(id, oom), oom).decision());
        assertFalse(bare.hasStrategy("memory_error"));
        assertTrue(engine.hasStrategy("memory_error"));
    }
}
