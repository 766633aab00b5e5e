package mattrack.tracker.config;

import mattrack.tracker.model.CalculationKind;
import mattrack.tracker.model.CalculationSettings;

import java.util.EnumMap;
import java.util.Map;

/**
 * Default resource requests and submit scripts per calculation kind.
 * Base request is a 7 day / 40 GB relaxation; other kinds are scaled from it.
 */
public final class KindDefaults {

    public static final String CRYSTAL_SCRIPT = "submitcrystal23.sh";
    public static final String PROPERTIES_SCRIPT = "submit_prop.sh";

    private static final Map<CalculationKind, CalculationSettings> DEFAULTS = new EnumMap<>(CalculationKind.class);

    static {
        DEFAULTS.put(CalculationKind.RELAXATION, CalculationSettings.of(168, 40, 32).withSubmitScript(CRYSTAL_SCRIPT));
        DEFAULTS.put(CalculationKind.SINGLE_POINT, CalculationSettings.of(72, 32, 32).withSubmitScript(CRYSTAL_SCRIPT));
        DEFAULTS.put(CalculationKind.FREQUENCY, CalculationSettings.of(168, 60, 32).withSubmitScript(CRYSTAL_SCRIPT));
        DEFAULTS.put(CalculationKind.BAND_STRUCTURE, CalculationSettings.of(24, 24, 28).withSubmitScript(PROPERTIES_SCRIPT));
        DEFAULTS.put(CalculationKind.DENSITY_OF_STATES, CalculationSettings.of(24, 24, 28).withSubmitScript(PROPERTIES_SCRIPT));
        DEFAULTS.put(CalculationKind.TRANSPORT, CalculationSettings.of(24, 24, 28).withSubmitScript(PROPERTIES_SCRIPT));
        DEFAULTS.put(CalculationKind.CHARGE_POTENTIAL, CalculationSettings.of(24, 24, 28).withSubmitScript(PROPERTIES_SCRIPT));
    }

    private KindDefaults() {
    }

    public static CalculationSettings forKind(CalculationKind kind) {
        return DEFAULTS.get(kind);
    }

    /** Settings with any unset field filled from the kind's defaults. */
    public static CalculationSettings resolve(CalculationKind kind, CalculationSettings requested) {
        if (requested == null) {
            return forKind(kind);
        }
        return requested.mergedOver(forKind(kind));
    }
}
