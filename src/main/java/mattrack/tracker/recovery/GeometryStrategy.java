package mattrack.tracker.recovery;

import mattrack.tracker.model.Calculation;

import java.nio.file.Path;
import java.util.Locale;

/**
 * Geometry optimization failures: shrink the optimizer's trust radius.
 */
public final class GeometryStrategy implements RecoveryStrategy {

    public static final String KIND = "geometry_error";

    private static final String OPTGEOM = "OPTGEOM";
    private static final String MAXTRADIUS = "MAXTRADIUS";

    private final double factor;
    private final double defaultRadius;

    public GeometryStrategy(RecoveryConfig config) {
        this.factor = config.param(KIND, "trustRadiusFactor", 0.5);
        this.defaultRadius = config.param(KIND, "defaultTrustRadius", 0.5);
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
        if (deck.indexOf(OPTGEOM).isEmpty()) {
            throw new RecoveryException("OPTGEOM not present in " + calculation.inputFile());
        }
        String value = deck.valueOf(MAXTRADIUS);
        double current = value != null ? InputDeck.parseDouble(value, MAXTRADIUS) : defaultRadius;
        String next = String.format(Locale.ROOT, "%.3f", current * factor);
        if (value != null) {
            deck.setValue(MAXTRADIUS, next);
        } else {
            deck.insert(MAXTRADIUS, next, OPTGEOM);
        }
        deck.write(attempt);
        return new RecoveryAction(ResourceScaling.currentSettings(calculation).withEngineOption(MAXTRADIUS, next),
                "MAXTRADIUS " + current + " -> " + next);
    }
}
