package mattrack.tracker.util;

/** Values read from an INI file; null means "not set". */
public class IniConfig {
    public String databaseUrl;
    public Integer serverPort;
    public String apiKey;
    public String schedulerUser;
    public String scriptsDir;
    public String workDir;
    public String legacyStatusFile;
    public String failurePatterns;
    public String recoveryConfig;
    public Integer maxRecoveryAttempts;
    public Integer monitorIntervalSeconds;
    public Integer earlyFailureFloorSeconds;
    public Integer maxSubmitPerCycle;
    public Integer maxJobs;
    public Integer reserveSlots;
    public String defaultTemplate;
    public String inputGenerator;
}
