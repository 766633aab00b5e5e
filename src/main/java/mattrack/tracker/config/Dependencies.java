package mattrack.tracker.config;

import mattrack.tracker.api.internal.v1.CallbackController;
import mattrack.tracker.api.v1.CalculationController;
import mattrack.tracker.api.v1.HealthController;
import mattrack.tracker.api.v1.StatisticsController;
import mattrack.tracker.api.v1.WorkflowController;
import mattrack.tracker.batch.BatchScheduler;
import mattrack.tracker.batch.CommandRunner;
import mattrack.tracker.batch.JobSubmitter;
import mattrack.tracker.batch.LegacyStatusMirror;
import mattrack.tracker.batch.ProcessCommandRunner;
import mattrack.tracker.batch.SlurmBatchScheduler;
import mattrack.tracker.classify.ErrorClassifier;
import mattrack.tracker.classify.OutputAnalyzer;
import mattrack.tracker.classify.PatternTable;
import mattrack.tracker.model.Calculation;
import mattrack.tracker.model.CalculationStatus;
import mattrack.tracker.monitor.CycleTrigger;
import mattrack.tracker.monitor.EarlyFailureDetector;
import mattrack.tracker.monitor.MonitorLoop;
import mattrack.tracker.recovery.RecoveryConfig;
import mattrack.tracker.recovery.RecoveryEngine;
import mattrack.tracker.repository.CalculationRepository;
import mattrack.tracker.repository.FileRecordRepository;
import mattrack.tracker.repository.MaterialRepository;
import mattrack.tracker.repository.PropertyRepository;
import mattrack.tracker.repository.WorkflowRepository;
import mattrack.tracker.scheduler.MonitorScheduler;
import mattrack.tracker.server.RouterHandler;
import mattrack.tracker.service.CalculationService;
import mattrack.tracker.service.FileRecordService;
import mattrack.tracker.service.MaterialService;
import mattrack.tracker.service.StatisticsService;
import mattrack.tracker.store.Database;
import mattrack.tracker.store.JdbcCalculationRepository;
import mattrack.tracker.store.JdbcFileRecordRepository;
import mattrack.tracker.store.JdbcMaterialRepository;
import mattrack.tracker.store.JdbcPropertyRepository;
import mattrack.tracker.store.JdbcWorkflowRepository;
import mattrack.tracker.util.Debouncer;
import mattrack.tracker.workflow.CommandInputGenerator;
import mattrack.tracker.workflow.TemplateLoader;
import mattrack.tracker.workflow.WorkflowEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Manual dependency injection container.
 * Creates and wires the store, the scheduler adapter, the engines and the HTTP controllers.
 *
 * Usage:
 *
 * <pre>
 * Dependencies deps = Dependencies.create(TrackerConfig.fromEnv());
 * deps.startMonitor(); // periodic full checks
 * deps.monitorLoop().runCycle(TriggerMode.STATUS_CHECK);
 * deps.close();
 * </pre>
 */
public final class Dependencies implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Dependencies.class);

    private final TrackerConfig config;
    private final Database database;

    private final CalculationRepository calculationRepository;
    private final MaterialRepository materialRepository;
    private final PropertyRepository propertyRepository;
    private final FileRecordRepository fileRecordRepository;
    private final WorkflowRepository workflowRepository;

    private final OutputAnalyzer outputAnalyzer;
    private final RecoveryEngine recoveryEngine;
    private final LegacyStatusMirror statusMirror;
    private final BatchScheduler batchScheduler;
    private final JobSubmitter jobSubmitter;
    private final WorkflowEngine workflowEngine;

    private final MaterialService materialService;
    private final CalculationService calculationService;
    private final FileRecordService fileRecordService;
    private final StatisticsService statisticsService;

    private final MonitorLoop monitorLoop;
    private final CycleTrigger cycleTrigger;

    // Router (lazy-initialized)
    private RouterHandler routerHandler;

    // Scheduler (lazy-initialized)
    private MonitorScheduler monitorScheduler;

    private Dependencies(TrackerConfig config, CommandRunner commandRunner) {
        this.config = config;

        log.info("Initializing dependencies with config: {}", config);

        // Infrastructure
        this.database = new Database(config);

        // Repositories
        this.calculationRepository = new JdbcCalculationRepository(database);
        this.materialRepository = new JdbcMaterialRepository(database);
        this.propertyRepository = new JdbcPropertyRepository(database);
        this.fileRecordRepository = new JdbcFileRecordRepository(database);
        this.workflowRepository = new JdbcWorkflowRepository(database);

        // Classification and recovery
        this.outputAnalyzer = new OutputAnalyzer(new ErrorClassifier(PatternTable.load(config.failurePatternsFile())));
        this.recoveryEngine = RecoveryEngine.withDefaultStrategies(calculationRepository,
                RecoveryConfig.load(config.recoveryConfigFile()), config.maxRecoveryAttempts());

        // Batch scheduler
        this.statusMirror = new LegacyStatusMirror(config.legacyStatusFile());
        this.batchScheduler = new SlurmBatchScheduler(config, commandRunner);
        this.jobSubmitter = new JobSubmitter(calculationRepository, batchScheduler, statusMirror, config);

        // Workflows
        this.workflowEngine = new WorkflowEngine(calculationRepository, materialRepository, workflowRepository,
                new CommandInputGenerator(config.inputGeneratorCommand(), commandRunner),
                config.baseWorkDir(), config.defaultTemplateId());
        int seeded = TemplateLoader.seed(workflowRepository);
        if (seeded > 0) {
            log.info("Seeded {} workflow templates", seeded);
        }

        // Services
        this.materialService = new MaterialService(materialRepository, propertyRepository);
        this.calculationService = new CalculationService(calculationRepository, materialRepository,
                batchScheduler, statusMirror);
        this.fileRecordService = new FileRecordService(fileRecordRepository);
        this.statisticsService = new StatisticsService(materialRepository, calculationRepository,
                propertyRepository, fileRecordRepository);

        // Monitor
        EarlyFailureDetector earlyFailures = new EarlyFailureDetector(calculationRepository, batchScheduler,
                outputAnalyzer, statusMirror, config);
        this.monitorLoop = new MonitorLoop(calculationRepository, batchScheduler, jobSubmitter, outputAnalyzer,
                recoveryEngine, workflowEngine, fileRecordService, materialService, earlyFailures, statusMirror, config);
        this.cycleTrigger = new CycleTrigger(monitorLoop,
                new Debouncer("mattrack-callback", config.callbackDebounce().toMillis()));

        rebuildStatusMirror();

        log.info("Dependencies initialized successfully");
    }

    /**
     * Create dependencies with the given config, running scheduler commands as local processes.
     */
    public static Dependencies create(TrackerConfig config) {
        return new Dependencies(config, new ProcessCommandRunner(config.commandTimeout()));
    }

    /**
     * Create dependencies with a custom command runner (tests substitute a fake scheduler CLI).
     */
    public static Dependencies create(TrackerConfig config, CommandRunner commandRunner) {
        return new Dependencies(config, commandRunner);
    }

    /**
     * Create dependencies with environment-based config.
     */
    public static Dependencies create() {
        return create(TrackerConfig.fromEnv());
    }

    private void rebuildStatusMirror() {
        List<Calculation> active = new ArrayList<>(calculationRepository.findByStatus(CalculationStatus.SUBMITTED));
        active.addAll(calculationRepository.findByStatus(CalculationStatus.RUNNING));
        statusMirror.rebuildFrom(active);
        log.debug("Status mirror rebuilt with {} active jobs", active.size());
    }

    // Getters
    public TrackerConfig config() {
        return config;
    }

    public Database database() {
        return database;
    }

    public CalculationRepository calculationRepository() {
        return calculationRepository;
    }

    public MaterialRepository materialRepository() {
        return materialRepository;
    }

    public PropertyRepository propertyRepository() {
        return propertyRepository;
    }

    public FileRecordRepository fileRecordRepository() {
        return fileRecordRepository;
    }

    public WorkflowRepository workflowRepository() {
        return workflowRepository;
    }

    public OutputAnalyzer outputAnalyzer() {
        return outputAnalyzer;
    }

    public RecoveryEngine recoveryEngine() {
        return recoveryEngine;
    }

    public LegacyStatusMirror statusMirror() {
        return statusMirror;
    }

    public BatchScheduler batchScheduler() {
        return batchScheduler;
    }

    public JobSubmitter jobSubmitter() {
        return jobSubmitter;
    }

    public WorkflowEngine workflowEngine() {
        return workflowEngine;
    }

    public MaterialService materialService() {
        return materialService;
    }

    public CalculationService calculationService() {
        return calculationService;
    }

    public FileRecordService fileRecordService() {
        return fileRecordService;
    }

    public StatisticsService statisticsService() {
        return statisticsService;
    }

    public MonitorLoop monitorLoop() {
        return monitorLoop;
    }

    public CycleTrigger cycleTrigger() {
        return cycleTrigger;
    }

    /**
     * Get a fully configured RouterHandler with all controllers registered.
     */
    public RouterHandler routerHandler() {
        if (routerHandler == null) {
            routerHandler = new RouterHandler(config)
                    .registerController(new HealthController(database, calculationRepository,
                            () -> monitorScheduler != null && monitorScheduler.isRunning()))
                    .registerController(new CalculationController(calculationService))
                    .registerController(new WorkflowController(workflowEngine))
                    .registerController(new StatisticsController(statisticsService))
                    .registerController(new CallbackController(cycleTrigger));
            log.info("RouterHandler created with {} controllers", routerHandler.controllerCount());
        }
        return routerHandler;
    }

    /**
     * Get the monitor scheduler (creates it if not yet created).
     */
    public MonitorScheduler monitorScheduler() {
        if (monitorScheduler == null) {
            monitorScheduler = new MonitorScheduler(monitorLoop, config.monitorInterval());
        }
        return monitorScheduler;
    }

    public void startMonitor() {
        monitorScheduler().start();
    }

    public void stopMonitor() {
        if (monitorScheduler != null) {
            monitorScheduler.stop();
        }
    }

    @Override
    public void close() {
        log.info("Closing dependencies...");

        if (monitorScheduler != null) {
            try {
                monitorScheduler.stop();
            } catch (Exception e) {
                log.warn("Error stopping monitor: {}", e.getMessage());
            }
        }

        try {
            cycleTrigger.close();
        } catch (Exception e) {
            log.warn("Error stopping callback debouncer: {}", e.getMessage());
        }

        try {
            database.close();
        } catch (Exception e) {
            log.warn("Error closing database: {}", e.getMessage());
        }

        log.info("Dependencies closed");
    }
}
