package mattrack.tracker.config;

import mattrack.tracker.model.CalculationKind;
import mattrack.tracker.model.CalculationSettings;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class TrackerConfigTest {

    @TempDir
    Path dir;

    @Test
    void defaults() {
        TrackerConfig config = TrackerConfig.defaults();

        assertEquals(8080, config.serverPort());
        assertFalse(config.hasApiKey());
        assertEquals(3, config.maxRecoveryAttempts());
        assertEquals(Duration.ofMinutes(5), config.monitorInterval());
        assertEquals(220, config.queueCapacity());
        assertEquals("full_characterization", config.defaultTemplateId());
        assertEquals(Path.of("crystal_job_status.json"), config.legacyStatusFile());
    }

    @Test
    void iniFileOverridesDefaults() throws Exception {
        Path ini = Files.writeString(dir.resolve("mattrack.ini"), """
                # tracker settings
                [database]
                db_url = jdbc:h2:mem:from-ini
                [server]
                port = 9090
                api_key = s3cret
                ; scheduler
                scheduler_user = mendoza
                base_work_dir = /scratch/mendoza/calcs
                max_recovery_attempts = 5
                monitor_interval_seconds = 60
                min_runtime = 120
                max_jobs = 100
                reserve_slots = 10
                max_submit_per_callback = 3
                input_generator = python3 d12creation.py
                no_such_key = 1
                """);

        TrackerConfig config = TrackerConfig.fromIni(ini);

        assertEquals("jdbc:h2:mem:from-ini", config.databaseUrl());
        assertEquals(9090, config.serverPort());
        assertTrue(config.hasApiKey());
        assertEquals("mendoza", config.schedulerUser());
        assertEquals(Path.of("/scratch/mendoza/calcs"), config.baseWorkDir());
        assertEquals(5, config.maxRecoveryAttempts());
        assertEquals(Duration.ofSeconds(60), config.monitorInterval());
        assertEquals(Duration.ofSeconds(120), config.earlyFailureFloor());
        assertEquals(90, config.queueCapacity());
        assertEquals(3, config.maxSubmitPerCycle());
        assertEquals("python3 d12creation.py", config.inputGeneratorCommand());
    }

    @Test
    void nonNumericValueIsRejected() throws Exception {
        Path ini = Files.writeString(dir.resolve("bad.ini"), "port = eighty\n");

        IllegalArgumentException e = assertThrows(IllegalArgumentException.class, () -> TrackerConfig.fromIni(ini));
        assertTrue(e.getMessage().contains("port"));
    }

    @Test
    void queueCapacityNeverNegative() {
        assertEquals(0, TrackerConfig.defaults().withSubmitLimits(5, 10, 30).queueCapacity());
    }

    @Test
    void toStringHidesApiKey() {
        String text = TrackerConfig.defaults().withApiKey("s3cret").toString();

        assertFalse(text.contains("s3cret"));
        assertTrue(text.contains("apiKeySet=true"));
    }

    @Test
    void kindDefaultsFillUnsetResources() {
        CalculationSettings opt = KindDefaults.forKind(CalculationKind.RELAXATION);
        assertEquals(168, opt.walltimeHours());
        assertEquals(KindDefaults.CRYSTAL_SCRIPT, opt.submitScript());

        CalculationSettings band = KindDefaults.resolve(CalculationKind.BAND_STRUCTURE, CalculationSettings.of(2, 0, 0));
        assertEquals(2, band.walltimeHours());
        assertEquals(24, band.memoryGb());
        assertEquals(28, band.cores());
        assertEquals(KindDefaults.PROPERTIES_SCRIPT, band.submitScript());

        assertEquals(KindDefaults.forKind(CalculationKind.FREQUENCY),
                KindDefaults.resolve(CalculationKind.FREQUENCY, null));
    }
}
