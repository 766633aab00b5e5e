package mattrack.tracker.classify;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Numeric figures pulled from engine output. Informational only; they never influence classification.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record RuntimeDiagnostics(
        @JsonProperty("totalCpuSeconds") Double totalCpuSeconds,
        @JsonProperty("wallSeconds") Double wallSeconds,
        @JsonProperty("scfCycles") Integer scfCycles,
        @JsonProperty("memoryMb") Integer memoryMb) {

    private static final Pattern DECIMAL = Pattern.compile("(\\d+\\.\\d+)");
    private static final Pattern CYCLE = Pattern.compile("CYCLE\\s+(\\d{1,9})");
    private static final Pattern MEGABYTES = Pattern.compile("(\\d{1,9})\\s*MB");

    public static RuntimeDiagnostics empty() {
        return new RuntimeDiagnostics(null, null, null, null);
    }

    /**
     * Scan all lines; later values overwrite earlier ones so the last report wins.
     */
    public static RuntimeDiagnostics extract(List<String> lines) {
        Double cpu = null;
        Double wall = null;
        Integer cycles = null;
        Integer memory = null;

        for (String line : lines) {
            if (line.contains("TOTAL CPU TIME =")) {
                Matcher m = DECIMAL.matcher(line);
                if (m.find())
                    cpu = Double.parseDouble(m.group(1));
            } else if (line.contains("ELAPSED TIME =")) {
                Matcher m = DECIMAL.matcher(line);
                if (m.find())
                    wall = Double.parseDouble(m.group(1));
            } else if (line.contains("SCF CYCLE")) {
                Matcher m = CYCLE.matcher(line);
                if (m.find())
                    cycles = Integer.parseInt(m.group(1));
            } else if (line.contains("MEMORY") && line.contains("MB")) {
                Matcher m = MEGABYTES.matcher(line);
                if (m.find())
                    memory = Integer.parseInt(m.group(1));
            }
        }
        return new RuntimeDiagnostics(cpu, wall, cycles, memory);
    }

    @JsonIgnore
    public boolean isEmpty() {
        return totalCpuSeconds == null && wallSeconds == null && scfCycles == null && memoryMb == null;
    }
}
