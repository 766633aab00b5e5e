package mattrack.tracker.recovery;

import mattrack.tracker.model.CalculationSettings;

/**
 * What a strategy changed: the settings to resubmit with and a human-readable summary.
 */
public record RecoveryAction(CalculationSettings settings, String description) {
}
