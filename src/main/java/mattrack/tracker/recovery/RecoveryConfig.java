package mattrack.tracker.recovery;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

/**
 * Numeric parameters for each recovery strategy, keyed by failure kind.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record RecoveryConfig(@JsonProperty("strategies") Map<String, Map<String, Double>> strategies) {

    private static final String DEFAULT_RESOURCE = "/mattrack/recovery-config.json";
    private static final ObjectMapper MAPPER = new ObjectMapper();

    public RecoveryConfig {
        strategies = strategies == null ? Map.of() : Map.copyOf(strategies);
    }

    public static RecoveryConfig loadDefault() {
        try (InputStream in = RecoveryConfig.class.getResourceAsStream(DEFAULT_RESOURCE)) {
            if (in == null) {
                throw new IllegalStateException("Missing classpath resource " + DEFAULT_RESOURCE);
            }
            return MAPPER.readValue(in, RecoveryConfig.class);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + DEFAULT_RESOURCE, e);
        }
    }

    public static RecoveryConfig load(Path path) {
        if (path == null) {
            return loadDefault();
        }
        try (InputStream in = Files.newInputStream(path)) {
            return MAPPER.readValue(in, RecoveryConfig.class);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read recovery config from " + path, e);
        }
    }

    public boolean has(String kind) {
        return strategies.containsKey(kind);
    }

    public double param(String kind, String name, double defaultValue) {
        Map<String, Double> params = strategies.get(kind);
        if (params == null) {
            return defaultValue;
        }
        Double value = params.get(name);
        return value != null ? value : defaultValue;
    }
}
