package mattrack.tracker.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Per-calculation resource request and engine options.
 * Stored as JSON in {@code calculations.settings_json}; {@code version} tags the layout.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record CalculationSettings(
        @JsonProperty("version") int version,
        @JsonProperty("walltimeHours") int walltimeHours,
        @JsonProperty("memoryGb") int memoryGb,
        @JsonProperty("cores") int cores,
        @JsonProperty("submitScript") String submitScript,
        @JsonProperty("engineOptions") Map<String, String> engineOptions) {

    public static final int CURRENT_VERSION = 1;
    public static final int MAX_ENGINE_OPTIONS = 32;

    public CalculationSettings {
        if (version <= 0) {
            version = CURRENT_VERSION;
        }
        if (walltimeHours < 0 || memoryGb < 0 || cores < 0) {
            throw new IllegalArgumentException("resource values must not be negative");
        }
        engineOptions = engineOptions == null ? Map.of() : Map.copyOf(engineOptions);
        if (engineOptions.size() > MAX_ENGINE_OPTIONS) {
            throw new IllegalArgumentException("too many engine options: " + engineOptions.size()
                    + " (max " + MAX_ENGINE_OPTIONS + ")");
        }
    }

    public static CalculationSettings of(int walltimeHours, int memoryGb, int cores) {
        return new CalculationSettings(CURRENT_VERSION, walltimeHours, memoryGb, cores, null, Map.of());
    }

    public CalculationSettings withWalltimeHours(int hours) {
        return new CalculationSettings(version, hours, memoryGb, cores, submitScript, engineOptions);
    }

    public CalculationSettings withMemoryGb(int gb) {
        return new CalculationSettings(version, walltimeHours, gb, cores, submitScript, engineOptions);
    }

    public CalculationSettings withSubmitScript(String script) {
        return new CalculationSettings(version, walltimeHours, memoryGb, cores, script, engineOptions);
    }

    public CalculationSettings withEngineOption(String key, String value) {
        Map<String, String> options = new LinkedHashMap<>(engineOptions);
        options.put(key, value);
        return new CalculationSettings(version, walltimeHours, memoryGb, cores, submitScript, options);
    }

    /**
     * Fill zero-valued resources from {@code defaults}; explicit values win.
     */
    public CalculationSettings mergedOver(CalculationSettings defaults) {
        if (defaults == null) {
            return this;
        }
        Map<String, String> options = new LinkedHashMap<>(defaults.engineOptions());
        options.putAll(engineOptions);
        return new CalculationSettings(
                version,
                walltimeHours > 0 ? walltimeHours : defaults.walltimeHours(),
                memoryGb > 0 ? memoryGb : defaults.memoryGb(),
                cores > 0 ? cores : defaults.cores(),
                submitScript != null ? submitScript : defaults.submitScript(),
                options);
    }

    /** Walltime formatted for {@code sbatch --time} (hours may exceed 24). */
    @JsonIgnore
    public String slurmWalltime() {
        return String.format("%d:00:00", walltimeHours);
    }
}
