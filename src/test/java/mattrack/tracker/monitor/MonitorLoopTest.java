package mattrack.tracker.monitor;

import mattrack.tracker.batch.ExternalJobState;
import mattrack.tracker.batch.FakeBatchScheduler;
import mattrack.tracker.batch.JobSubmitter;
import mattrack.tracker.batch.LegacyStatusMirror;
import mattrack.tracker.classify.ErrorClassifier;
import mattrack.tracker.classify.OutputAnalyzer;
import mattrack.tracker.classify.PatternTable;
import mattrack.tracker.config.TrackerConfig;
import mattrack.tracker.model.Calculation;
import mattrack.tracker.model.CalculationKind;
import mattrack.tracker.model.CalculationSettings;
import mattrack.tracker.model.CalculationStatus;
import mattrack.tracker.model.FileRecord;
import mattrack.tracker.model.FileType;
import mattrack.tracker.model.Material;
import mattrack.tracker.recovery.RecoveryConfig;
import mattrack.tracker.recovery.RecoveryEngine;
import mattrack.tracker.service.FileRecordService;
import mattrack.tracker.service.MaterialService;
import mattrack.tracker.store.Database;
import mattrack.tracker.store.JdbcCalculationRepository;
import mattrack.tracker.store.JdbcFileRecordRepository;
import mattrack.tracker.store.JdbcMaterialRepository;
import mattrack.tracker.store.JdbcPropertyRepository;
import mattrack.tracker.store.JdbcWorkflowRepository;
import mattrack.tracker.workflow.InputGenerationException;
import mattrack.tracker.workflow.InputGenerator;
import mattrack.tracker.workflow.TemplateLoader;
import mattrack.tracker.workflow.WorkflowEngine;
import org.junit.jupiter.api.*;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class MonitorLoopTest {

    private static final String MATERIAL = "mp-149";

    private static final String COMPLETED_OUTPUT = """
             CRYSTAL23 CALCULATION
             SCF CYCLE 14
             OPT END - CONVERGED * E(AU): -5.781234567890E+02  POINTS    9
             TOTAL CPU TIME =  2048.50
            """;

    private static Database db;
    private static JdbcCalculationRepository calculations;
    private static JdbcMaterialRepository materials;
    private static JdbcPropertyRepository properties;
    private static JdbcFileRecordRepository fileRecords;
    private static JdbcWorkflowRepository workflows;

    @TempDir
    Path dir;

    private FakeBatchScheduler scheduler;
    private LegacyStatusMirror mirror;
    private JobSubmitter submitter;
    private MonitorLoop loop;
    private TrackerConfig config;

    @BeforeAll
    static void setup() {
        TrackerConfig config = TrackerConfig.defaults()
                .withDatabaseUrl("jdbc:h2:mem:test-monitor;DB_CLOSE_DELAY=-1;MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE");
        db = new Database(config);
        calculations = new JdbcCalculationRepository(db);
        materials = new JdbcMaterialRepository(db);
        properties = new JdbcPropertyRepository(db);
        fileRecords = new JdbcFileRecordRepository(db);
        workflows = new JdbcWorkflowRepository(db);
        materials.save(Material.builder().materialId(MATERIAL).formula("Si").build());
        TemplateLoader.seed(workflows);
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
            st.execute("DELETE FROM files");
            st.execute("DELETE FROM properties");
            st.execute("DELETE FROM workflow_instances");
            st.execute("DELETE FROM calculations");
            conn.commit();
        }
        Path scripts = Files.createDirectories(dir.resolve("scripts"));
        Files.writeString(scripts.resolve("submitcrystal23.sh"), "#!/bin/bash\n#SBATCH --mem=1G\nsrun crystal\n");
        Files.writeString(scripts.resolve("submit_prop.sh"), "#!/bin/bash\n#SBATCH --mem=1G\nsrun properties\n");
        config = TrackerConfig.defaults()
                .withBaseWorkDir(dir.resolve("work"))
                .withScriptsDir(scripts)
                .withSubmitLimits(2, 250, 30);
        scheduler = new FakeBatchScheduler();
        loop = buildLoop(config);
    }

    private MonitorLoop buildLoop(TrackerConfig config) {
        mirror = new LegacyStatusMirror(dir.resolve("crystal_job_status.json"));
        submitter = new JobSubmitter(calculations, scheduler, mirror, config);
        OutputAnalyzer analyzer = new OutputAnalyzer(new ErrorClassifier(PatternTable.loadDefault()));
        RecoveryEngine recovery = RecoveryEngine.withDefaultStrategies(calculations, RecoveryConfig.loadDefault(), 3);
        InputGenerator generator = (completed, target, targetDir) -> {
            Path input = targetDir.resolve(completed.materialId() + "_" + target.code().toLowerCase() + ".d12");
            try {
                Files.writeString(input, target.code() + "\nEND\n");
            } catch (IOException e) {
                throw new InputGenerationException(e.getMessage(), e);
            }
            return input;
        };
        WorkflowEngine workflow = new WorkflowEngine(calculations, materials, workflows, generator,
                config.baseWorkDir(), "full_characterization");
        EarlyFailureDetector earlyFailures = new EarlyFailureDetector(calculations, scheduler, analyzer, mirror, config);
        return new MonitorLoop(calculations, scheduler, submitter, analyzer, recovery, workflow,
                new FileRecordService(fileRecords), new MaterialService(materials, properties), earlyFailures,
                mirror, config);
    }

    private Calculation pending(String calcId, CalculationSettings settings, int priority) throws IOException {
        Path input = dir.resolve("inputs").resolve(calcId + ".d12");
        Files.createDirectories(input.getParent());
        Files.writeString(input, "Si bulk\nCRYSTAL\nOPTGEOM\nEND\nEND\n");
        calculations.save(Calculation.builder()
                .calcId(calcId)
                .materialId(MATERIAL)
                .kind(CalculationKind.RELAXATION)
                .priority(priority)
                .inputFile(input.toString())
                .settings(settings)
                .build());
        return calculations.findById(calcId).orElseThrow();
    }

    private String submittedRelaxation(String calcId, CalculationSettings settings) throws IOException {
        return submitter.submit(pending(calcId, settings, 0)).orElseThrow();
    }

    private Path writeOutput(String calcId, String content) throws IOException {
        Path output = Path.of(calculations.findById(calcId).orElseThrow().outputFile());
        Files.writeString(output, content);
        return output;
    }

    private Calculation reload(String calcId) {
        return calculations.findById(calcId).orElseThrow();
    }

    @Test
    void runningJobIsMarkedRunning() throws Exception {
        String job = submittedRelaxation("opt-1", null);
        CycleReport queued = loop.runCycle(TriggerMode.STATUS_CHECK);
        assertEquals(0, queued.started());
        assertEquals(CalculationStatus.SUBMITTED, reload("opt-1").status());

        scheduler.queue.put(job, ExternalJobState.RUNNING);
        CycleReport report = loop.runCycle(TriggerMode.STATUS_CHECK);

        assertEquals(1, report.started());
        Calculation calc = reload("opt-1");
        assertEquals(CalculationStatus.RUNNING, calc.status());
        assertEquals("RUNNING", calc.externalState());
        assertNotNull(calc.startedAt());
    }

    @Test
    void completedJobAdvancesWorkflow() throws Exception {
        String job = submittedRelaxation("opt-1", null);
        writeOutput("opt-1", COMPLETED_OUTPUT);
        scheduler.queue.put(job, ExternalJobState.COMPLETED);

        CycleReport report = loop.runCycle(TriggerMode.STATUS_CHECK);

        assertEquals(1, report.completed());
        assertEquals(1, report.created());
        Calculation opt = reload("opt-1");
        assertEquals(CalculationStatus.COMPLETED, opt.status());
        assertEquals("optimization_complete", opt.completionType());
        assertNotNull(opt.completedAt());
        assertFalse(mirror.snapshot().containsKey(job));

        List<Calculation> sp = calculations.findByMaterialAndKind(MATERIAL, CalculationKind.SINGLE_POINT);
        assertEquals(1, sp.size());
        assertEquals(CalculationStatus.PENDING, sp.get(0).status());
        assertEquals("opt-1", sp.get(0).prerequisiteCalcId());

        assertTrue(fileRecords.findByCalculation("opt-1").size() >= 2);
        assertTrue(properties.findByMaterial(MATERIAL).stream().anyMatch(p -> p.name().equals("total_cpu_time")));
    }

    @Test
    void completionModeSubmitsTheNextStep() throws Exception {
        String job = submittedRelaxation("opt-1", null);
        writeOutput("opt-1", COMPLETED_OUTPUT);
        scheduler.queue.put(job, ExternalJobState.COMPLETED);

        CycleReport report = loop.runCycle(TriggerMode.COMPLETION);

        assertEquals(1, report.completed());
        assertEquals(1, report.submitted());
        Calculation sp = calculations.findByMaterialAndKind(MATERIAL, CalculationKind.SINGLE_POINT).get(0);
        assertEquals(CalculationStatus.SUBMITTED, sp.status());
        assertEquals(24, scheduler.submissions.get(1).settings().memoryGb());
    }

    @Test
    void errorOutputOverridesCleanExit() throws Exception {
        String job = submittedRelaxation("opt-1", null);
        writeOutput("opt-1", " CRYSTAL23 CALCULATION\n ERROR **** GEOMETRY OPTIMIZATION FAILED\n");
        scheduler.queue.put(job, ExternalJobState.COMPLETED);

        CycleReport report = loop.runCycle(TriggerMode.STATUS_CHECK);

        assertEquals(0, report.completed());
        assertEquals(1, report.failed());
        assertNotEquals(CalculationStatus.COMPLETED, reload("opt-1").status());
    }

    @Test
    void outOfMemoryIsRecoveredAndResubmitted() throws Exception {
        String job = submittedRelaxation("opt-1", CalculationSettings.of(0, 8, 0));
        writeOutput("opt-1", " CRYSTAL23 CALCULATION\n ERROR **** OUT OF MEMORY ****\n");
        scheduler.queue.put(job, ExternalJobState.FAILED);

        CycleReport report = loop.runCycle(TriggerMode.STATUS_CHECK);

        assertEquals(1, report.failed());
        assertEquals(1, report.recovered());
        assertEquals(1, report.submitted());
        Calculation calc = reload("opt-1");
        assertEquals(CalculationStatus.SUBMITTED, calc.status());
        assertEquals(1, calc.recoveryAttempts());
        assertEquals(12, calc.settings().memoryGb());
        assertNotEquals(job, calc.externalJobId());
        assertNull(calc.startedAt());
        assertEquals(2, scheduler.submissions.size());
        assertEquals(12, scheduler.submissions.get(1).settings().memoryGb());

        Path script = Path.of(calc.jobScript());
        assertEquals(script, scheduler.submissions.get(1).jobScript());
        String text = Files.readString(script);
        assertTrue(text.contains("#SBATCH --mem=12G"));
        assertFalse(text.contains("#SBATCH --mem=8G"));
        assertTrue(fileRecords.findByCalculation("opt-1").isEmpty());
    }

    @Test
    void timeoutAtWalltimeCapStaysFailed() throws Exception {
        String job = submittedRelaxation("opt-1", null);
        writeOutput("opt-1", " CRYSTAL23 CALCULATION\n CYC   3 ETOT(AU) -5.78E+02\n");
        scheduler.queue.put(job, ExternalJobState.TIMEOUT);

        CycleReport report = loop.runCycle(TriggerMode.STATUS_CHECK);

        assertEquals(1, report.failed());
        assertEquals(0, report.recovered());
        Calculation calc = reload("opt-1");
        assertEquals(CalculationStatus.FAILED, calc.status());
        assertEquals("time_limit", calc.errorType());
        assertEquals(0, calc.recoveryAttempts());
        assertEquals(1, scheduler.submissions.size());

        List<FileRecord> files = fileRecords.findByCalculation("opt-1");
        assertTrue(files.stream().anyMatch(f -> f.fileType() == FileType.OUTPUT));
        assertTrue(files.stream().anyMatch(f -> f.fileType() == FileType.SCRIPT));
    }

    @Test
    void externallyCancelledJobIsCancelled() throws Exception {
        String job = submittedRelaxation("opt-1", null);
        scheduler.queue.put(job, ExternalJobState.CANCELLED);

        CycleReport report = loop.runCycle(TriggerMode.STATUS_CHECK);

        assertEquals(1, report.cancelled());
        Calculation calc = reload("opt-1");
        assertEquals(CalculationStatus.CANCELLED, calc.status());
        assertEquals("cancelled", calc.errorType());
        assertTrue(mirror.snapshot().isEmpty());
        assertTrue(fileRecords.findByCalculation("opt-1").stream().anyMatch(f -> f.fileType() == FileType.INPUT));
    }

    @Test
    void vanishedJobIsDecidedFromOutput() throws Exception {
        String job = submittedRelaxation("opt-1", null);
        scheduler.queue.remove(job);

        // no output yet: left alone
        loop.runCycle(TriggerMode.STATUS_CHECK);
        assertEquals(CalculationStatus.SUBMITTED, reload("opt-1").status());

        writeOutput("opt-1", "module load crystal23\n");
        CycleReport report = loop.runCycle(TriggerMode.STATUS_CHECK);

        assertEquals(1, report.failed());
        Calculation calc = reload("opt-1");
        assertEquals(CalculationStatus.FAILED, calc.status());
        assertEquals(MonitorLoop.INCOMPLETE_OUTPUT, calc.errorType());
    }

    @Test
    void vanishedJobWithCompleteOutputIsCompleted() throws Exception {
        String job = submittedRelaxation("opt-1", null);
        scheduler.queue.remove(job);
        writeOutput("opt-1", COMPLETED_OUTPUT);

        CycleReport report = loop.runCycle(TriggerMode.STATUS_CHECK);

        assertEquals(1, report.completed());
        assertEquals(CalculationStatus.COMPLETED, reload("opt-1").status());
    }

    @Test
    void unreachableSchedulerChangesNothing() throws Exception {
        String job = submittedRelaxation("opt-1", null);
        scheduler.queue.put(job, ExternalJobState.RUNNING);
        scheduler.pollUnavailable = true;

        CycleReport report = loop.runCycle(TriggerMode.STATUS_CHECK);

        assertEquals(1, report.errors());
        assertEquals(CalculationStatus.SUBMITTED, reload("opt-1").status());
    }

    @Test
    void submissionFollowsPriorityWithinBudget() throws Exception {
        pending("low", null, 0);
        pending("high", null, 5);
        pending("mid", null, 1);

        CycleReport report = loop.runCycle(TriggerMode.SUBMIT_PENDING);

        assertEquals(2, report.submitted());
        assertEquals(CalculationStatus.SUBMITTED, reload("high").status());
        assertEquals(CalculationStatus.SUBMITTED, reload("mid").status());
        assertEquals(CalculationStatus.PENDING, reload("low").status());
    }

    @Test
    void fullQueueSubmitsNothing() throws Exception {
        config = config.withSubmitLimits(5, 31, 30);
        loop = buildLoop(config);
        submittedRelaxation("running", null);
        pending("waiting", null, 0);

        CycleReport report = loop.runCycle(TriggerMode.SUBMIT_PENDING);

        assertEquals(0, report.submitted());
        assertEquals(CalculationStatus.PENDING, reload("waiting").status());
    }

    @Test
    void concurrentCyclesActOnCompletionOnce() throws Exception {
        String job = submittedRelaxation("opt-1", null);
        writeOutput("opt-1", COMPLETED_OUTPUT);
        scheduler.queue.put(job, ExternalJobState.COMPLETED);
        MonitorLoop other = buildLoop(config);

        ExecutorService pool = Executors.newFixedThreadPool(2);
        CountDownLatch start = new CountDownLatch(1);
        try {
            Future<CycleReport> a = pool.submit(() -> {
                start.await();
                return loop.runCycle(TriggerMode.STATUS_CHECK);
            });
            Future<CycleReport> b = pool.submit(() -> {
                start.await();
                return other.runCycle(TriggerMode.STATUS_CHECK);
            });
            start.countDown();

            int completed = a.get(30, TimeUnit.SECONDS).completed() + b.get(30, TimeUnit.SECONDS).completed();
            assertEquals(1, completed);
        } finally {
            pool.shutdownNow();
        }
        assertEquals(1, calculations.findByMaterialAndKind(MATERIAL, CalculationKind.SINGLE_POINT).size());
    }
}
