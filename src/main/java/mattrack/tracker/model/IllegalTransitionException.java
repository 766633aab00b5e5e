package mattrack.tracker.model;

/**
 * Thrown when a status change is not in the allowed-transitions table.
 */
public class IllegalTransitionException extends RuntimeException {

    private final String calcId;
    private final CalculationStatus from;
    private final CalculationStatus to;

    public IllegalTransitionException(String calcId, CalculationStatus from, CalculationStatus to) {
        super("Illegal transition for calculation " + calcId + ": " + from + " -> " + to);
        this.calcId = calcId;
        this.from = from;
        this.to = to;
    }

    public String calcId() {
        return calcId;
    }

    public CalculationStatus from() {
        return from;
    }

    public CalculationStatus to() {
        return to;
    }
}
