package mattrack.tracker.config;

import mattrack.tracker.util.IniConfig;
import mattrack.tracker.util.IniParser;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

/**
 * Configuration holder for tracker settings.
 * All settings have sensible defaults; environment variables and an optional INI file override them.
 */
public final class TrackerConfig {

    // Database settings
    private String databaseUrl = "jdbc:h2:file:./data/mattrack;AUTO_SERVER=TRUE;MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE";
    private int databasePoolSize = 10;
    private Duration lockTimeout = Duration.ofSeconds(10);
    private int busyRetries = 3;
    private Duration busyBackoff = Duration.ofMillis(200);

    // Server settings
    private int serverPort = 8080;
    private String serverHost = "0.0.0.0";
    private String apiKey = null; // If set, internal callers must provide X-Mattrack-Key header

    // Scheduler (SLURM) settings
    private String schedulerUser = defaultUser();
    private String sbatchCommand = "sbatch";
    private String squeueCommand = "squeue";
    private String scancelCommand = "scancel";
    private Duration commandTimeout = Duration.ofSeconds(60);
    private Path scriptsDir = Path.of(".");
    private Path baseWorkDir = Path.of("./workdir");
    private Path legacyStatusFile = Path.of("crystal_job_status.json");

    // Classification and recovery
    private Path failurePatternsFile = null;
    private Path recoveryConfigFile = null;
    private int maxRecoveryAttempts = 3;

    // Monitor loop
    private Duration monitorInterval = Duration.ofMinutes(5);
    private Duration earlyFailureFloor = Duration.ofSeconds(300);
    private long minimalOutputBytes = 1000;
    private int maxSubmitPerCycle = 5;
    private int maxJobs = 250;
    private int reserveSlots = 30;
    private Duration callbackDebounce = Duration.ofSeconds(2);

    // Workflow
    private String defaultTemplateId = "full_characterization";
    private String inputGeneratorCommand = null;

    private TrackerConfig() {
    }

    public static TrackerConfig defaults() {
        return new TrackerConfig();
    }

    public static TrackerConfig fromEnv() {
        TrackerConfig config = new TrackerConfig();

        String iniPath = System.getenv("MATTRACK_CONFIG");
        if (iniPath != null && !iniPath.isBlank() && Files.exists(Path.of(iniPath))) {
            try {
                config.apply(IniParser.parse(Path.of(iniPath)));
            } catch (IOException e) {
                throw new IllegalStateException("Failed to read config file: " + iniPath, e);
            }
        }

        // Override from environment variables
        String dbUrl = System.getenv("MATTRACK_DB_URL");
        if (dbUrl != null && !dbUrl.isBlank()) {
            config.databaseUrl = dbUrl;
        }

        String port = System.getenv("MATTRACK_PORT");
        if (port != null && !port.isBlank()) {
            config.serverPort = Integer.parseInt(port);
        }

        String apiKey = System.getenv("MATTRACK_API_KEY");
        if (apiKey != null && !apiKey.isBlank()) {
            config.apiKey = apiKey;
        }

        String workDir = System.getenv("MATTRACK_WORK_DIR");
        if (workDir != null && !workDir.isBlank()) {
            config.baseWorkDir = Path.of(workDir);
        }

        String maxAttempts = System.getenv("MATTRACK_MAX_RECOVERY_ATTEMPTS");
        if (maxAttempts != null && !maxAttempts.isBlank()) {
            config.maxRecoveryAttempts = Integer.parseInt(maxAttempts);
        }

        String user = System.getenv("MATTRACK_SCHEDULER_USER");
        if (user != null && !user.isBlank()) {
            config.schedulerUser = user;
        }

        return config;
    }

    /**
     * Load defaults overridden by the given INI file.
     */
    public static TrackerConfig fromIni(Path iniPath) throws IOException {
        TrackerConfig config = new TrackerConfig();
        config.apply(IniParser.parse(iniPath));
        return config;
    }

    private void apply(IniConfig ini) {
        if (ini.databaseUrl != null)
            databaseUrl = ini.databaseUrl;
        if (ini.serverPort != null)
            serverPort = ini.serverPort;
        if (ini.apiKey != null)
            apiKey = ini.apiKey;
        if (ini.schedulerUser != null)
            schedulerUser = ini.schedulerUser;
        if (ini.scriptsDir != null)
            scriptsDir = Path.of(ini.scriptsDir);
        if (ini.workDir != null)
            baseWorkDir = Path.of(ini.workDir);
        if (ini.legacyStatusFile != null)
            legacyStatusFile = Path.of(ini.legacyStatusFile);
        if (ini.failurePatterns != null)
            failurePatternsFile = Path.of(ini.failurePatterns);
        if (ini.recoveryConfig != null)
            recoveryConfigFile = Path.of(ini.recoveryConfig);
        if (ini.maxRecoveryAttempts != null)
            maxRecoveryAttempts = ini.maxRecoveryAttempts;
        if (ini.monitorIntervalSeconds != null)
            monitorInterval = Duration.ofSeconds(ini.monitorIntervalSeconds);
        if (ini.earlyFailureFloorSeconds != null)
            earlyFailureFloor = Duration.ofSeconds(ini.earlyFailureFloorSeconds);
        if (ini.maxSubmitPerCycle != null)
            maxSubmitPerCycle = ini.maxSubmitPerCycle;
        if (ini.maxJobs != null)
            maxJobs = ini.maxJobs;
        if (ini.reserveSlots != null)
            reserveSlots = ini.reserveSlots;
        if (ini.defaultTemplate != null)
            defaultTemplateId = ini.defaultTemplate;
        if (ini.inputGenerator != null)
            inputGeneratorCommand = ini.inputGenerator;
    }

    private static String defaultUser() {
        String user = System.getenv("USER");
        return user != null ? user : System.getProperty("user.name", "unknown");
    }

    // Getters
    public String databaseUrl() {
        return databaseUrl;
    }

    public int databasePoolSize() {
        return databasePoolSize;
    }

    public Duration lockTimeout() {
        return lockTimeout;
    }

    public int busyRetries() {
        return busyRetries;
    }

    public Duration busyBackoff() {
        return busyBackoff;
    }

    public int serverPort() {
        return serverPort;
    }

    public String serverHost() {
        return serverHost;
    }

    public String apiKey() {
        return apiKey;
    }

    public boolean hasApiKey() {
        return apiKey != null && !apiKey.isBlank();
    }

    public String schedulerUser() {
        return schedulerUser;
    }

    public String sbatchCommand() {
        return sbatchCommand;
    }

    public String squeueCommand() {
        return squeueCommand;
    }

    public String scancelCommand() {
        return scancelCommand;
    }

    public Duration commandTimeout() {
        return commandTimeout;
    }

    public Path scriptsDir() {
        return scriptsDir;
    }

    public Path baseWorkDir() {
        return baseWorkDir;
    }

    public Path legacyStatusFile() {
        return legacyStatusFile;
    }

    public Path failurePatternsFile() {
        return failurePatternsFile;
    }

    public Path recoveryConfigFile() {
        return recoveryConfigFile;
    }

    public int maxRecoveryAttempts() {
        return maxRecoveryAttempts;
    }

    public Duration monitorInterval() {
        return monitorInterval;
    }

    public Duration earlyFailureFloor() {
        return earlyFailureFloor;
    }

    public long minimalOutputBytes() {
        return minimalOutputBytes;
    }

    public int maxSubmitPerCycle() {
        return maxSubmitPerCycle;
    }

    public int maxJobs() {
        return maxJobs;
    }

    public int reserveSlots() {
        return reserveSlots;
    }

    /** Jobs this tracker may have queued at once. */
    public int queueCapacity() {
        return Math.max(0, maxJobs - reserveSlots);
    }

    public Duration callbackDebounce() {
        return callbackDebounce;
    }

    public String defaultTemplateId() {
        return defaultTemplateId;
    }

    public String inputGeneratorCommand() {
        return inputGeneratorCommand;
    }

    // Fluent setters for testing/customization
    public TrackerConfig withDatabaseUrl(String url) {
        this.databaseUrl = url;
        return this;
    }

    public TrackerConfig withLockTimeout(Duration timeout) {
        this.lockTimeout = timeout;
        return this;
    }

    public TrackerConfig withBusyRetries(int retries, Duration backoff) {
        this.busyRetries = retries;
        this.busyBackoff = backoff;
        return this;
    }

    public TrackerConfig withServerPort(int port) {
        this.serverPort = port;
        return this;
    }

    public TrackerConfig withApiKey(String key) {
        this.apiKey = key;
        return this;
    }

    public TrackerConfig withSchedulerUser(String user) {
        this.schedulerUser = user;
        return this;
    }

    public TrackerConfig withScriptsDir(Path dir) {
        this.scriptsDir = dir;
        return this;
    }

    public TrackerConfig withBaseWorkDir(Path dir) {
        this.baseWorkDir = dir;
        return this;
    }

    public TrackerConfig withLegacyStatusFile(Path file) {
        this.legacyStatusFile = file;
        return this;
    }

    public TrackerConfig withFailurePatternsFile(Path file) {
        this.failurePatternsFile = file;
        return this;
    }

    public TrackerConfig withMaxRecoveryAttempts(int attempts) {
        this.maxRecoveryAttempts = attempts;
        return this;
    }

    public TrackerConfig withMonitorInterval(Duration interval) {
        this.monitorInterval = interval;
        return this;
    }

    public TrackerConfig withEarlyFailureFloor(Duration floor) {
        this.earlyFailureFloor = floor;
        return this;
    }

    public TrackerConfig withSubmitLimits(int maxSubmitPerCycle, int maxJobs, int reserveSlots) {
        this.maxSubmitPerCycle = maxSubmitPerCycle;
        this.maxJobs = maxJobs;
        this.reserveSlots = reserveSlots;
        return this;
    }

    public TrackerConfig withCallbackDebounce(Duration debounce) {
        this.callbackDebounce = debounce;
        return this;
    }

    public TrackerConfig withInputGeneratorCommand(String command) {
        this.inputGeneratorCommand = command;
        return this;
    }

    @Override
    public String toString() {
        return "TrackerConfig{" +
                "databaseUrl='" + databaseUrl + '\'' +
                ", serverPort=" + serverPort +
                ", schedulerUser='" + schedulerUser + '\'' +
                ", baseWorkDir=" + baseWorkDir +
                ", maxRecoveryAttempts=" + maxRecoveryAttempts +
                ", apiKeySet=" + hasApiKey() +
                '}';
    }
}
