package mattrack.tracker.model;

/**
 * Thrown when a calculation is submitted before its prerequisite has completed.
 */
public class PrerequisiteNotMetException extends RuntimeException {

    public PrerequisiteNotMetException(String calcId, String prerequisiteCalcId, CalculationStatus prerequisiteStatus) {
        super("Calculation " + calcId + " requires " + prerequisiteCalcId + " to be completed (currently "
                + (prerequisiteStatus == null ? "missing" : prerequisiteStatus.dbValue()) + ")");
    }
}
