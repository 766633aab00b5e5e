package mattrack.tracker.model;

import java.util.Objects;

/**
 * A requested status transition plus the optional fields written alongside it.
 * {@code expected}, when set, turns the update into a compare-and-set.
 */
public final class StatusUpdate {
    private final String calcId;
    private final CalculationStatus newStatus;
    private final CalculationStatus expected;
    private final String externalJobId;
    private final String externalState;
    private final String outputFile;
    private final Integer exitCode;
    private final String errorType;
    private final String errorMessage;
    private final String completionType;
    private final Integer recoveryCeiling;
    private final CalculationSettings settings;

    private StatusUpdate(Builder builder) {
        this.calcId = Objects.requireNonNull(builder.calcId, "calcId is required");
        this.newStatus = Objects.requireNonNull(builder.newStatus, "newStatus is required");
        this.expected = builder.expected;
        this.externalJobId = builder.externalJobId;
        this.externalState = builder.externalState;
        this.outputFile = builder.outputFile;
        this.exitCode = builder.exitCode;
        this.errorType = builder.errorType;
        this.errorMessage = builder.errorMessage;
        this.completionType = builder.completionType;
        this.recoveryCeiling = builder.recoveryCeiling;
        this.settings = builder.settings;
    }

    public static Builder to(String calcId, CalculationStatus newStatus) {
        return new Builder(calcId, newStatus);
    }

    public String calcId() {
        return calcId;
    }

    public CalculationStatus newStatus() {
        return newStatus;
    }

    public CalculationStatus expected() {
        return expected;
    }

    public String externalJobId() {
        return externalJobId;
    }

    public String externalState() {
        return externalState;
    }

    public String outputFile() {
        return outputFile;
    }

    public Integer exitCode() {
        return exitCode;
    }

    public String errorType() {
        return errorType;
    }

    public String errorMessage() {
        return errorMessage;
    }

    public String completionType() {
        return completionType;
    }

    /** Non-null when this update records a recovery attempt bounded by the given ceiling. */
    public Integer recoveryCeiling() {
        return recoveryCeiling;
    }

    public boolean isRecoveryAttempt() {
        return recoveryCeiling != null;
    }

    /** Replacement settings written with the transition, or null to keep the stored ones. */
    public CalculationSettings settings() {
        return settings;
    }

    public static final class Builder {
        private final String calcId;
        private final CalculationStatus newStatus;
        private CalculationStatus expected;
        private String externalJobId;
        private String externalState;
        private String outputFile;
        private Integer exitCode;
        private String errorType;
        private String errorMessage;
        private String completionType;
        private Integer recoveryCeiling;
        private CalculationSettings settings;

        private Builder(String calcId, CalculationStatus newStatus) {
            this.calcId = calcId;
            this.newStatus = newStatus;
        }

        public Builder expecting(CalculationStatus expected) {
            this.expected = expected;
            return this;
        }

        public Builder externalJobId(String externalJobId) {
            this.externalJobId = externalJobId;
            return this;
        }

        public Builder externalState(String externalState) {
            this.externalState = externalState;
            return this;
        }

        public Builder outputFile(String outputFile) {
            this.outputFile = outputFile;
            return this;
        }

        public Builder exitCode(Integer exitCode) {
            this.exitCode = exitCode;
            return this;
        }

        public Builder error(String errorType, String errorMessage) {
            this.errorType = errorType;
            this.errorMessage = errorMessage;
            return this;
        }

        public Builder completionType(String completionType) {
            this.completionType = completionType;
            return this;
        }

        /**
         * Increment {@code recovery_attempts} with this transition, refusing once it reaches {@code ceiling}.
         */
        public Builder recoveryAttempt(int ceiling) {
            this.recoveryCeiling = ceiling;
            return this;
        }

        public Builder settings(CalculationSettings settings) {
            this.settings = settings;
            return this;
        }

        public StatusUpdate build() {
            return new StatusUpdate(this);
        }
    }
}
