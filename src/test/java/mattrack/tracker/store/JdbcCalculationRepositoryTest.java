package mattrack.tracker.store;

import mattrack.tracker.config.TrackerConfig;
import mattrack.tracker.model.Calculation;
import mattrack.tracker.model.CalculationKind;
import mattrack.tracker.model.CalculationSettings;
import mattrack.tracker.model.CalculationStatus;
import mattrack.tracker.model.IllegalTransitionException;
import mattrack.tracker.model.Material;
import mattrack.tracker.model.PrerequisiteNotMetException;
import mattrack.tracker.model.StatusUpdate;
import mattrack.tracker.model.TransitionResult;
import org.junit.jupiter.api.*;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.junit.jupiter.api.Assertions.*;

class JdbcCalculationRepositoryTest {

    private static Database db;
    private static JdbcCalculationRepository repo;
    private static JdbcMaterialRepository materials;

    @BeforeAll
    static void setup() {
        // Use in-memory H2 for tests
        TrackerConfig config = TrackerConfig.defaults()
                .withDatabaseUrl("jdbc:h2:mem:test-calcs;DB_CLOSE_DELAY=-1;MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE");
        db = new Database(config);
        repo = new JdbcCalculationRepository(db);
        materials = new JdbcMaterialRepository(db);
    }

    @AfterAll
    static void teardown() {
        if (db != null)
            db.close();
    }

    @BeforeEach
    void cleanTables() throws Exception {
        try (var conn = db.getConnection();
                var st = conn.createStatement()) {
            st.execute("DELETE FROM calculations");
            st.execute("DELETE FROM materials");
            conn.commit();
        }
        materials.save(Material.builder().materialId("mp-149").formula("Si").build());
    }

    private static Calculation pending(String calcId) {
        return Calculation.builder()
                .calcId(calcId)
                .materialId("mp-149")
                .kind(CalculationKind.RELAXATION)
                .inputFile("/work/mp-149.d12")
                .settings(CalculationSettings.of(24, 8, 4))
                .createdAt(Instant.now())
                .build();
    }

    private static StatusUpdate move(String calcId, CalculationStatus status) {
        return StatusUpdate.to(calcId, status).build();
    }

    @Test
    void saveAndFindById() {
        repo.save(pending("calc-1"));

        Optional<Calculation> found = repo.findById("calc-1");
        assertTrue(found.isPresent());
        assertEquals("mp-149", found.get().materialId());
        assertEquals(CalculationKind.RELAXATION, found.get().kind());
        assertEquals(CalculationStatus.PENDING, found.get().status());
        assertEquals(8, found.get().settings().memoryGb());
        assertEquals(0, found.get().recoveryAttempts());
    }

    @Test
    void lifecycleStampsTimestampsInOrder() {
        repo.save(pending("calc-life"));

        assertEquals(TransitionResult.APPLIED, repo.updateStatus(StatusUpdate.to("calc-life", CalculationStatus.SUBMITTED)
                .externalJobId("4242")
                .externalState("PENDING")
                .build()));
        assertEquals(TransitionResult.APPLIED, repo.updateStatus(move("calc-life", CalculationStatus.RUNNING)));
        assertEquals(TransitionResult.APPLIED, repo.updateStatus(StatusUpdate.to("calc-life", CalculationStatus.COMPLETED)
                .completionType("optimization_complete")
                .build()));

        Calculation calc = repo.findById("calc-life").orElseThrow();
        assertEquals(CalculationStatus.COMPLETED, calc.status());
        assertEquals("4242", calc.externalJobId());
        assertEquals("optimization_complete", calc.completionType());
        assertNotNull(calc.submittedAt());
        assertNotNull(calc.startedAt());
        assertNotNull(calc.completedAt());
        assertFalse(calc.submittedAt().isBefore(calc.createdAt()));
        assertFalse(calc.startedAt().isBefore(calc.submittedAt()));
        assertFalse(calc.completedAt().isBefore(calc.startedAt()));
    }

    @Test
    void timestampsNeverPrecedeEarlierStamps() {
        // Created "in the future" relative to the transition clock
        repo.save(pending("calc-skew").toBuilder().createdAt(Instant.now().plusSeconds(3600)).build());

        repo.updateStatus(move("calc-skew", CalculationStatus.SUBMITTED));
        repo.updateStatus(move("calc-skew", CalculationStatus.RUNNING));

        Calculation calc = repo.findById("calc-skew").orElseThrow();
        assertFalse(calc.submittedAt().isBefore(calc.createdAt()));
        assertFalse(calc.startedAt().isBefore(calc.submittedAt()));
    }

    @Test
    void illegalTransitionIsRejected() {
        repo.save(pending("calc-bad"));

        assertThrows(IllegalTransitionException.class,
                () -> repo.updateStatus(move("calc-bad", CalculationStatus.COMPLETED)));
        assertEquals(CalculationStatus.PENDING, repo.findById("calc-bad").orElseThrow().status());
    }

    @Test
    void completedIsTerminal() {
        repo.save(pending("calc-done"));
        repo.updateStatus(move("calc-done", CalculationStatus.SUBMITTED));
        repo.updateStatus(move("calc-done", CalculationStatus.COMPLETED));

        assertThrows(IllegalTransitionException.class,
                () -> repo.updateStatus(move("calc-done", CalculationStatus.FAILED)));
    }

    @Test
    void sameStatusIsUnchanged() {
        repo.save(pending("calc-same"));
        repo.updateStatus(move("calc-same", CalculationStatus.SUBMITTED));

        assertEquals(TransitionResult.UNCHANGED, repo.updateStatus(move("calc-same", CalculationStatus.SUBMITTED)));
    }

    @Test
    void expectedStatusMismatchIsStale() {
        repo.save(pending("calc-stale"));

        TransitionResult result = repo.updateStatus(StatusUpdate.to("calc-stale", CalculationStatus.RUNNING)
                .expecting(CalculationStatus.SUBMITTED)
                .build());

        assertEquals(TransitionResult.STALE, result);
        assertEquals(CalculationStatus.PENDING, repo.findById("calc-stale").orElseThrow().status());
    }

    @Test
    void unknownCalculationIsNotFound() {
        assertEquals(TransitionResult.NOT_FOUND, repo.updateStatus(move("nope", CalculationStatus.SUBMITTED)));
    }

    @Test
    void submissionWaitsForPrerequisite() {
        repo.save(pending("calc-opt"));
        repo.save(pending("calc-sp").toBuilder()
                .kind(CalculationKind.SINGLE_POINT)
                .prerequisiteCalcId("calc-opt")
                .build());

        assertThrows(PrerequisiteNotMetException.class,
                () -> repo.updateStatus(move("calc-sp", CalculationStatus.SUBMITTED)));
        assertEquals(CalculationStatus.PENDING, repo.findById("calc-sp").orElseThrow().status());

        repo.updateStatus(move("calc-opt", CalculationStatus.SUBMITTED));
        repo.updateStatus(move("calc-opt", CalculationStatus.COMPLETED));

        assertEquals(TransitionResult.APPLIED, repo.updateStatus(move("calc-sp", CalculationStatus.SUBMITTED)));
    }

    @Test
    void recoveryAttemptsAreBoundedByCeiling() {
        repo.save(pending("calc-rec"));
        repo.updateStatus(move("calc-rec", CalculationStatus.SUBMITTED));

        for (int i = 0; i < 2; i++) {
            repo.updateStatus(move("calc-rec", CalculationStatus.FAILED));
            assertEquals(TransitionResult.APPLIED, repo.updateStatus(
                    StatusUpdate.to("calc-rec", CalculationStatus.RESUBMITTED)
                            .expecting(CalculationStatus.FAILED)
                            .recoveryAttempt(2)
                            .build()));
            repo.updateStatus(move("calc-rec", CalculationStatus.SUBMITTED));
        }
        repo.updateStatus(move("calc-rec", CalculationStatus.FAILED));

        TransitionResult third = repo.updateStatus(StatusUpdate.to("calc-rec", CalculationStatus.RESUBMITTED)
                .expecting(CalculationStatus.FAILED)
                .recoveryAttempt(2)
                .build());

        assertEquals(TransitionResult.CEILING_REACHED, third);
        Calculation calc = repo.findById("calc-rec").orElseThrow();
        assertEquals(CalculationStatus.FAILED, calc.status());
        assertEquals(2, calc.recoveryAttempts());
    }

    @Test
    void resubmissionClearsPreviousRunStamps() {
        repo.save(pending("calc-again"));
        repo.updateStatus(move("calc-again", CalculationStatus.SUBMITTED));
        repo.updateStatus(move("calc-again", CalculationStatus.RUNNING));
        repo.updateStatus(move("calc-again", CalculationStatus.FAILED));
        repo.updateStatus(StatusUpdate.to("calc-again", CalculationStatus.RESUBMITTED).recoveryAttempt(3).build());
        repo.updateStatus(move("calc-again", CalculationStatus.SUBMITTED));

        Calculation calc = repo.findById("calc-again").orElseThrow();
        assertEquals(CalculationStatus.SUBMITTED, calc.status());
        assertNull(calc.startedAt());
        assertNull(calc.completedAt());
        assertEquals(1, calc.recoveryAttempts());
    }

    @Test
    void failureRecordsKindAndMessage() {
        repo.save(pending("calc-err"));
        repo.updateStatus(move("calc-err", CalculationStatus.SUBMITTED));
        repo.updateStatus(StatusUpdate.to("calc-err", CalculationStatus.FAILED)
                .error("memory_error", "Memory allocation failure: OUT OF MEMORY")
                .exitCode(137)
                .build());

        Calculation calc = repo.findById("calc-err").orElseThrow();
        assertEquals("memory_error", calc.errorType());
        assertEquals(137, calc.exitCode());
        assertTrue(calc.errorMessage().contains("OUT OF MEMORY"));
    }

    @Test
    void completionAfterRecoveryClearsError() {
        repo.save(pending("calc-healed"));
        repo.updateStatus(move("calc-healed", CalculationStatus.SUBMITTED));
        repo.updateStatus(StatusUpdate.to("calc-healed", CalculationStatus.FAILED)
                .error("memory_error", "Memory allocation failure: OUT OF MEMORY")
                .build());
        repo.updateStatus(StatusUpdate.to("calc-healed", CalculationStatus.RESUBMITTED).recoveryAttempt(3).build());
        repo.updateStatus(move("calc-healed", CalculationStatus.SUBMITTED));
        repo.updateStatus(move("calc-healed", CalculationStatus.RUNNING));
        assertEquals("memory_error", repo.findById("calc-healed").orElseThrow().errorType());

        repo.updateStatus(move("calc-healed", CalculationStatus.COMPLETED));

        Calculation calc = repo.findById("calc-healed").orElseThrow();
        assertEquals(CalculationStatus.COMPLETED, calc.status());
        assertNull(calc.errorType());
        assertNull(calc.errorMessage());
        assertEquals(1, calc.recoveryAttempts());
    }

    @Test
    void concurrentCompletionAppliesOnce() throws Exception {
        repo.save(pending("calc-race"));
        repo.updateStatus(move("calc-race", CalculationStatus.SUBMITTED));
        repo.updateStatus(move("calc-race", CalculationStatus.RUNNING));

        int threads = 4;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<TransitionResult>> results = new ArrayList<>();
        for (int i = 0; i < threads; i++) {
            results.add(pool.submit(() -> {
                start.await();
                return repo.updateStatus(StatusUpdate.to("calc-race", CalculationStatus.COMPLETED)
                        .expecting(CalculationStatus.RUNNING)
                        .build());
            }));
        }
        start.countDown();

        int applied = 0;
        for (Future<TransitionResult> f : results) {
            if (f.get() == TransitionResult.APPLIED) {
                applied++;
            }
        }
        pool.shutdown();

        assertEquals(1, applied);
        assertEquals(CalculationStatus.COMPLETED, repo.findById("calc-race").orElseThrow().status());
    }

    @Test
    void updateArtifactsKeepsExistingValues() {
        repo.save(pending("calc-art"));

        assertTrue(repo.updateArtifacts("calc-art", "/work/OPT/mp-149", null, "/work/OPT/mp-149/mp-149.out", null));

        Calculation calc = repo.findById("calc-art").orElseThrow();
        assertEquals("/work/OPT/mp-149", calc.workDir());
        assertEquals("/work/mp-149.d12", calc.inputFile());
        assertEquals("/work/OPT/mp-149/mp-149.out", calc.outputFile());
    }

    @Test
    void queriesAndCounts() {
        repo.save(pending("c1"));
        repo.save(pending("c2").toBuilder().kind(CalculationKind.SINGLE_POINT).build());
        repo.save(pending("c3"));
        repo.updateStatus(StatusUpdate.to("c3", CalculationStatus.SUBMITTED).externalJobId("777").build());

        assertEquals(2, repo.countByStatus(CalculationStatus.PENDING));
        assertEquals(2, repo.findByKind(CalculationKind.RELAXATION).size());
        assertEquals(1, repo.findByMaterialAndKind("mp-149", CalculationKind.SINGLE_POINT).size());
        assertEquals("c3", repo.findByExternalJobId("777").orElseThrow().calcId());
        assertEquals(2, repo.findRecent(2).size());

        Map<CalculationStatus, Integer> byStatus = repo.countsByStatus();
        assertEquals(2, byStatus.get(CalculationStatus.PENDING));
        assertEquals(1, byStatus.get(CalculationStatus.SUBMITTED));
        assertEquals(1, repo.countsByKind().get(CalculationKind.SINGLE_POINT));
    }
}
