package mattrack.tracker.recovery;

import mattrack.tracker.batch.JobScripts;
import mattrack.tracker.model.Calculation;
import mattrack.tracker.model.CalculationSettings;

import java.io.IOException;

/**
 * Out-of-memory failures: enlarge the memory request.
 */
public final class MemoryStrategy implements RecoveryStrategy {

    public static final String KIND = "memory_error";

    private final double factor;
    private final int maxMemoryGb;

    public MemoryStrategy(RecoveryConfig config) {
        this.factor = config.param(KIND, "factor", 1.5);
        this.maxMemoryGb = (int) config.param(KIND, "maxMemoryGb", 200);
    }

    @Override
    public String kind() {
        return KIND;
    }

    @Override
    public RecoveryAction apply(Calculation calculation, int attempt) throws RecoveryException {
        CalculationSettings current = ResourceScaling.currentSettings(calculation);
        int memory = ResourceScaling.scale(current.memoryGb(), factor, maxMemoryGb, "memory");
        try {
            JobScripts.replaceDirective(calculation.jobScript(), "mem", memory + "G");
        } catch (IOException e) {
            throw new RecoveryException("cannot rewrite job script " + calculation.jobScript(), e);
        }
        return new RecoveryAction(current.withMemoryGb(memory),
                "memory " + current.memoryGb() + "G -> " + memory + "G");
    }
}
