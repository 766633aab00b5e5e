package mattrack.tracker.recovery;

import mattrack.tracker.config.KindDefaults;
import mattrack.tracker.model.Calculation;
import mattrack.tracker.model.CalculationSettings;

/**
 * Shared arithmetic for the strategies that grow a resource request.
 */
final class ResourceScaling {

    private ResourceScaling() {
    }

    static CalculationSettings currentSettings(Calculation calculation) {
        return KindDefaults.resolve(calculation.kind(), calculation.settings());
    }

    /**
     * Multiply {@code current} by {@code factor}, rounding up, capped at {@code max}.
     *
     * @throws RecoveryException when {@code current} is already at or above the cap
     */
    static int scale(int current, double factor, int max, String what) throws RecoveryException {
        if (current >= max) {
            throw new RecoveryException(what + " already at limit (" + current + " >= " + max + ")");
        }
        int scaled = (int) Math.ceil(current * factor);
        if (scaled <= current) {
            scaled = current + 1;
        }
        return Math.min(scaled, max);
    }
}
