package mattrack.tracker.model;

import java.util.Arrays;

/**
 * Kind of external-engine calculation.
 * The code is the short tag used in calculation ids, file names and the legacy status mirror.
 */
public enum CalculationKind {
    /** Geometry relaxation */
    RELAXATION("OPT"),
    /** Single-point energy / wavefunction */
    SINGLE_POINT("SP"),
    /** Band structure along a k-path */
    BAND_STRUCTURE("BAND"),
    /** Density of states */
    DENSITY_OF_STATES("DOSS"),
    /** Vibrational frequencies */
    FREQUENCY("FREQ"),
    /** Transport coefficients */
    TRANSPORT("TRANSPORT"),
    /** Charge density and electrostatic potential maps */
    CHARGE_POTENTIAL("CHARGE+POTENTIAL");

    private final String code;

    CalculationKind(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }

    /** Whether this kind runs the properties executable on top of a finished wavefunction. */
    public boolean isPropertyRun() {
        return this == BAND_STRUCTURE || this == DENSITY_OF_STATES
                || this == TRANSPORT || this == CHARGE_POTENTIAL;
    }

    /**
     * Resolve a kind from its code ("OPT", "SP", ...) or enum name.
     *
     * @throws IllegalArgumentException if nothing matches
     */
    public static CalculationKind fromCode(String code) {
        if (code == null || code.isBlank()) {
            throw new IllegalArgumentException("calculation kind is required");
        }
        String normalized = code.trim().toUpperCase();
        return Arrays.stream(values())
                .filter(k -> k.code.equals(normalized) || k.name().equals(normalized))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown calculation kind: " + code));
    }
}
