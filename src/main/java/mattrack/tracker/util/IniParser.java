package mattrack.tracker.util;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads a flat key=value tracker configuration file.
 * Section headers ({@code [name]}) and {@code #}/{@code ;} comments are ignored.
 */
public class IniParser {

    private static final Logger log = LoggerFactory.getLogger(IniParser.class);

    public static IniConfig parse(Path iniPath) throws IOException {
        var cfg = new IniConfig();
        for (var line : Files.readAllLines(iniPath)) {
            line = line.trim();
            if (line.isEmpty() || line.startsWith("#") || line.startsWith(";") || line.startsWith("[")
                    || !line.contains("="))
                continue;
            var kv = line.split("=", 2);
            var k = kv[0].trim().toLowerCase();
            var v = kv[1].trim();

            switch (k) {
                case "db_url", "database_url" -> cfg.databaseUrl = v;
                case "port", "server_port" -> cfg.serverPort = toInt(k, v);
                case "api_key" -> cfg.apiKey = v;
                case "user", "scheduler_user" -> cfg.schedulerUser = v;
                case "scripts_dir" -> cfg.scriptsDir = v;
                case "work_dir", "base_work_dir" -> cfg.workDir = v;
                case "legacy_status_file", "status_file" -> cfg.legacyStatusFile = v;
                case "failure_patterns" -> cfg.failurePatterns = v;
                case "recovery_config" -> cfg.recoveryConfig = v;
                case "max_recovery_attempts" -> cfg.maxRecoveryAttempts = toInt(k, v);
                case "monitor_interval_seconds" -> cfg.monitorIntervalSeconds = toInt(k, v);
                case "early_failure_floor_seconds", "min_runtime" -> cfg.earlyFailureFloorSeconds = toInt(k, v);
                case "max_submit_per_cycle", "max_submit_per_callback" -> cfg.maxSubmitPerCycle = toInt(k, v);
                case "max_jobs" -> cfg.maxJobs = toInt(k, v);
                case "reserve_slots" -> cfg.reserveSlots = toInt(k, v);
                case "default_template" -> cfg.defaultTemplate = v;
                case "input_generator" -> cfg.inputGenerator = v;
                default -> log.warn("Unknown config key '{}' in {}", k, iniPath);
            }
        }
        return cfg;
    }

    private static Integer toInt(String key, String s) {
        try {
            return Integer.parseInt(s);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Config key '" + key + "' expects a number, got: " + s, e);
        }
    }
}
