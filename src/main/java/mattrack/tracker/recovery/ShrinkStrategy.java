package mattrack.tracker.recovery;

import mattrack.tracker.model.Calculation;

import java.nio.file.Path;

/**
 * k-point sampling failures: densify the SHRINK mesh.
 */
public final class ShrinkStrategy implements RecoveryStrategy {

    public static final String KIND = "shrink_error";

    private static final String SHRINK = "SHRINK";

    private final int increment;

    public ShrinkStrategy(RecoveryConfig config) {
        this.increment = (int) config.param(KIND, "shrinkIncrement", 2);
    }

    @Override
    public String kind() {
        return KIND;
    }

    @Override
    public RecoveryAction apply(Calculation calculation, int attempt) throws RecoveryException {
        if (calculation.inputFile() == null) {
            throw new RecoveryException("no input file recorded for " + calculation.calcId());
        }
        InputDeck deck = InputDeck.read(Path.of(calculation.inputFile()));
        String values = deck.valueOf(SHRINK);
        if (values == null) {
            throw new RecoveryException("SHRINK not present in " + calculation.inputFile());
        }
        String[] parts = values.trim().split("\\s+");
        StringBuilder updated = new StringBuilder();
        for (String part : parts) {
            if (updated.length() > 0) {
                updated.append(' ');
            }
            updated.append(InputDeck.parseInt(part, SHRINK) + increment);
        }
        deck.setValue(SHRINK, updated.toString());
        deck.write(attempt);
        return new RecoveryAction(ResourceScaling.currentSettings(calculation)
                .withEngineOption(SHRINK, updated.toString()),
                "SHRINK " + values + " -> " + updated);
    }
}
