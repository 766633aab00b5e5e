package mattrack.tracker.batch;

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
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class JobSubmitterTest {

    private static Database db;
    private static JdbcCalculationRepository calculations;

    @TempDir
    Path dir;

    private static final String TEMPLATE = """
            #!/bin/bash
            #SBATCH --mem=4G
            #SBATCH --time=1:00:00
            srun crystal < "$1"
            """;

    private FakeBatchScheduler scheduler;
    private LegacyStatusMirror mirror;
    private JobSubmitter submitter;

    @BeforeAll
    static void setup() {
        TrackerConfig config = TrackerConfig.defaults()
                .withDatabaseUrl("jdbc:h2:mem:test-submit;DB_CLOSE_DELAY=-1;MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE");
        db = new Database(config);
        calculations = new JdbcCalculationRepository(db);
        new JdbcMaterialRepository(db).save(Material.builder().materialId("mp-149").formula("Si").build());
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
        Path scripts = Files.createDirectories(dir.resolve("scripts"));
        Files.writeString(scripts.resolve("submitcrystal23.sh"), TEMPLATE);
        Files.writeString(scripts.resolve("submit_prop.sh"), TEMPLATE);
        scheduler = new FakeBatchScheduler();
        mirror = new LegacyStatusMirror(dir.resolve("crystal_job_status.json"));
        submitter = new JobSubmitter(calculations, scheduler, mirror,
                TrackerConfig.defaults().withBaseWorkDir(dir.resolve("work")).withScriptsDir(scripts));
    }

    private Calculation pending(String calcId, CalculationKind kind, String prerequisite) throws Exception {
        Path input = dir.resolve("inputs").resolve(calcId + ".d12");
        Files.createDirectories(input.getParent());
        Files.writeString(input, "Si\nCRYSTAL\nEND\n");
        Calculation calc = Calculation.builder()
                .calcId(calcId)
                .materialId("mp-149")
                .kind(kind)
                .inputFile(input.toString())
                .settings(CalculationSettings.of(0, 12, 0))
                .prerequisiteCalcId(prerequisite)
                .build();
        calculations.save(calc);
        return calculations.findById(calcId).orElseThrow();
    }

    @Test
    void submitsAndRecordsJob() throws Exception {
        Calculation calc = pending("opt-1", CalculationKind.RELAXATION, null);

        Optional<String> jobId = submitter.submit(calc);

        assertTrue(jobId.isPresent());
        Calculation stored = calculations.findById("opt-1").orElseThrow();
        assertEquals(CalculationStatus.SUBMITTED, stored.status());
        assertEquals(jobId.get(), stored.externalJobId());
        assertEquals("PENDING", stored.externalState());
        assertNotNull(stored.submittedAt());

        Path workDir = dir.resolve("work/OPT/mp-149");
        assertEquals(workDir.toString(), stored.workDir());
        assertTrue(Files.exists(workDir.resolve("opt-1.d12")));
        assertEquals(workDir.resolve("opt-1.out").toString(), stored.outputFile());

        // explicit memory kept, the rest filled from the kind defaults
        SubmitRequest request = scheduler.submissions.get(0);
        assertEquals(12, request.settings().memoryGb());
        assertEquals(168, request.settings().walltimeHours());
        assertEquals(32, request.settings().cores());
        assertEquals("submitcrystal23.sh", request.settings().submitScript());
        assertEquals(12, stored.settings().memoryGb());

        assertTrue(mirror.snapshot().containsKey(jobId.get()));
    }

    @Test
    void waitsForPrerequisite() throws Exception {
        pending("opt-1", CalculationKind.RELAXATION, null);
        Calculation sp = pending("sp-1", CalculationKind.SINGLE_POINT, "opt-1");

        assertFalse(submitter.prerequisiteMet(sp));
        assertTrue(submitter.submit(sp).isEmpty());
        assertTrue(scheduler.submissions.isEmpty());
        assertEquals(CalculationStatus.PENDING, calculations.findById("sp-1").orElseThrow().status());
    }

    @Test
    void submitsOncePrerequisiteCompleted() throws Exception {
        pending("opt-1", CalculationKind.RELAXATION, null);
        calculations.updateStatus(StatusUpdate.to("opt-1", CalculationStatus.SUBMITTED).externalJobId("1").build());
        calculations.updateStatus(StatusUpdate.to("opt-1", CalculationStatus.COMPLETED).build());
        Calculation sp = pending("sp-1", CalculationKind.SINGLE_POINT, "opt-1");

        assertTrue(submitter.submit(sp).isPresent());
        assertEquals(CalculationStatus.SUBMITTED, calculations.findById("sp-1").orElseThrow().status());
    }

    @Test
    void schedulerRejectionFailsCalculation() throws Exception {
        Calculation calc = pending("opt-1", CalculationKind.RELAXATION, null);
        scheduler.rejectSubmissions = true;

        assertTrue(submitter.submit(calc).isEmpty());

        Calculation stored = calculations.findById("opt-1").orElseThrow();
        assertEquals(CalculationStatus.FAILED, stored.status());
        assertEquals(JobSubmitter.SUBMISSION_ERROR, stored.errorType());
        assertTrue(stored.errorMessage().contains("invalid partition"));
        assertTrue(mirror.snapshot().isEmpty());
    }

    @Test
    void missingInputFailsCalculation() throws Exception {
        Calculation calc = pending("opt-1", CalculationKind.RELAXATION, null);
        Files.delete(Path.of(calc.inputFile()));

        assertTrue(submitter.submit(calc).isEmpty());

        Calculation stored = calculations.findById("opt-1").orElseThrow();
        assertEquals(CalculationStatus.FAILED, stored.status());
        assertEquals(JobSubmitter.SUBMISSION_ERROR, stored.errorType());
        assertTrue(scheduler.submissions.isEmpty());
    }

    @Test
    void staleSnapshotCancelsOrphanJob() throws Exception {
        Calculation calc = pending("opt-1", CalculationKind.RELAXATION, null);
        calculations.updateStatus(StatusUpdate.to("opt-1", CalculationStatus.CANCELLED).build());

        // calc still carries PENDING; the store has moved on
        assertTrue(submitter.submit(calc).isEmpty());

        assertEquals(1, scheduler.submissions.size());
        assertEquals(1, scheduler.cancellations.size());
        assertEquals(CalculationStatus.CANCELLED, calculations.findById("opt-1").orElseThrow().status());
    }

    @Test
    void onlyPendingOrResubmittedAreSubmitted() throws Exception {
        Calculation calc = pending("opt-1", CalculationKind.RELAXATION, null);
        submitter.submit(calc);
        Calculation submitted = calculations.findById("opt-1").orElseThrow();

        assertTrue(submitter.submit(submitted).isEmpty());
        assertEquals(1, scheduler.submissions.size());
    }

    @Test
    void stagesJobScriptFromTemplate() throws Exception {
        Calculation calc = pending("opt-1", CalculationKind.RELAXATION, null);

        submitter.submit(calc);

        Path script = dir.resolve("work/OPT/mp-149/opt-1.sh");
        Calculation stored = calculations.findById("opt-1").orElseThrow();
        assertEquals(script.toString(), stored.jobScript());
        assertEquals(script, scheduler.submissions.get(0).jobScript());

        String text = Files.readString(script);
        assertTrue(text.startsWith("#!/bin/bash\n"));
        assertTrue(text.contains("#SBATCH --job-name=opt-1\n"));
        assertTrue(text.contains("#SBATCH --mem=12G\n"));
        assertTrue(text.contains("#SBATCH --time=168:00:00\n"));
        assertTrue(text.contains("#SBATCH --ntasks=32\n"));
        assertFalse(text.contains("--mem=4G"));
        assertTrue(text.contains("srun crystal"));
    }

    @Test
    void missingTemplateFailsCalculation() throws Exception {
        Files.delete(dir.resolve("scripts/submitcrystal23.sh"));
        Calculation calc = pending("opt-1", CalculationKind.RELAXATION, null);

        assertTrue(submitter.submit(calc).isEmpty());

        Calculation stored = calculations.findById("opt-1").orElseThrow();
        assertEquals(CalculationStatus.FAILED, stored.status());
        assertTrue(stored.errorMessage().contains("submit script not found"));
        assertTrue(scheduler.submissions.isEmpty());
    }

    @Test
    void resubmissionKeepsRecordedScript() throws Exception {
        submitter.submit(pending("opt-1", CalculationKind.RELAXATION, null));
        Calculation first = calculations.findById("opt-1").orElseThrow();
        assertTrue(JobScripts.replaceDirective(first.jobScript(), "mem", "18G"));
        calculations.updateStatus(StatusUpdate.to("opt-1", CalculationStatus.FAILED).build());
        calculations.updateStatus(StatusUpdate.to("opt-1", CalculationStatus.RESUBMITTED).build());

        assertTrue(submitter.submit(calculations.findById("opt-1").orElseThrow()).isPresent());

        assertEquals(2, scheduler.submissions.size());
        assertEquals(Path.of(first.jobScript()), scheduler.submissions.get(1).jobScript());
        assertTrue(Files.readString(Path.of(first.jobScript())).contains("#SBATCH --mem=18G"));
    }
}
