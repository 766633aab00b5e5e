package mattrack.tracker.recovery;

import mattrack.tracker.model.Calculation;
import mattrack.tracker.model.CalculationSettings;

import java.nio.file.Path;

/**
 * SCF convergence failures: allow more cycles, and from the second attempt mix in more of the previous density.
 */
public final class ConvergenceStrategy implements RecoveryStrategy {

    public static final String KIND = "scf_convergence";

    static final String MAXCYCLE = "MAXCYCLE";
    static final String FMIXING = "FMIXING";
    private static final int DEFAULT_MAXCYCLE = 800;
    private static final int DEFAULT_FMIXING = 30;

    private final int cycleIncrement;
    private final int mixingStep;
    private final int mixingMin;
    private final int mixingMax;

    public ConvergenceStrategy(RecoveryConfig config) {
        this.cycleIncrement = (int) config.param(KIND, "maxCycleIncrement", 1000);
        this.mixingStep = (int) config.param(KIND, "fmixingStep", 10);
        this.mixingMin = (int) config.param(KIND, "fmixingMin", 10);
        this.mixingMax = (int) config.param(KIND, "fmixingMax", 80);
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
        StringBuilder description = new StringBuilder();

        String cycles = deck.valueOf(MAXCYCLE);
        int current = cycles != null ? InputDeck.parseInt(cycles, MAXCYCLE) : DEFAULT_MAXCYCLE;
        int next = current + cycleIncrement;
        if (cycles != null) {
            deck.setValue(MAXCYCLE, String.valueOf(next));
        } else if (!deck.insert(MAXCYCLE, String.valueOf(next), null)) {
            throw new RecoveryException("no END block to extend in " + calculation.inputFile());
        }
        description.append("MAXCYCLE ").append(current).append(" -> ").append(next);

        CalculationSettings settings = ResourceScaling.currentSettings(calculation)
                .withEngineOption(MAXCYCLE, String.valueOf(next));

        if (attempt >= 2) {
            String mixing = deck.valueOf(FMIXING);
            int from = mixing != null ? InputDeck.parseInt(mixing, FMIXING) : DEFAULT_FMIXING;
            int to = Math.max(mixingMin, Math.min(mixingMax, from + mixingStep));
            if (mixing != null) {
                deck.setValue(FMIXING, String.valueOf(to));
            } else {
                deck.insert(FMIXING, String.valueOf(to), null);
            }
            settings = settings.withEngineOption(FMIXING, String.valueOf(to));
            description.append(", FMIXING ").append(from).append(" -> ").append(to);
        }

        deck.write(attempt);
        return new RecoveryAction(settings, description.toString());
    }
}
