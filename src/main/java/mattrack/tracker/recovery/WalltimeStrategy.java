package mattrack.tracker.recovery;

import mattrack.tracker.batch.JobScripts;
import mattrack.tracker.model.Calculation;
import mattrack.tracker.model.CalculationSettings;

import java.io.IOException;

/**
 * Scheduler time-limit failures: extend the walltime request.
 */
public final class WalltimeStrategy implements RecoveryStrategy {

    public static final String KIND = "time_limit";

    private final double factor;
    private final int maxWalltimeHours;

    public WalltimeStrategy(RecoveryConfig config) {
        this.factor = config.param(KIND, "factor", 2.0);
        this.maxWalltimeHours = (int) config.param(KIND, "maxWalltimeHours", 168);
    }

    @Override
    public String kind() {
        return KIND;
    }

    @Override
    public RecoveryAction apply(Calculation calculation, int attempt) throws RecoveryException {
        CalculationSettings current = ResourceScaling.currentSettings(calculation);
        int hours = ResourceScaling.scale(current.walltimeHours(), factor, maxWalltimeHours, "walltime");
        CalculationSettings next = current.withWalltimeHours(hours);
        try {
            JobScripts.replaceDirective(calculation.jobScript(), "time", next.slurmWalltime());
        } catch (IOException e) {
            throw new RecoveryException("cannot rewrite job script " + calculation.jobScript(), e);
        }
        return new RecoveryAction(next, "walltime " + current.walltimeHours() + "h -> " + hours + "h");
    }
}
