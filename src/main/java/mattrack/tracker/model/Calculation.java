package mattrack.tracker.model;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Objects;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Immutable record of one external-engine job against a material.
 * Status changes go through the store, never through this object.
 */
public final class Calculation {

    /** Marker written to {@code completion_type} when recovery resubmits a calculation. */
    public static final String RECOVERY_ATTEMPT = "recovery_attempt";

    private static final DateTimeFormatter ID_TIMESTAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");

    private final String calcId;
    private final String materialId;
    private final CalculationKind kind;
    private final CalculationStatus status;
    private final int priority;
    private final String externalJobId; // SLURM job id or null
    private final String externalState; // last raw scheduler state
    private final Instant createdAt;
    private final Instant submittedAt;
    private final Instant startedAt;
    private final Instant completedAt;
    private final String inputFile;
    private final String outputFile;
    private final String jobScript;
    private final String workDir;
    private final CalculationSettings settings;
    private final Integer exitCode;
    private final String errorType;
    private final String errorMessage;
    private final int recoveryAttempts;
    private final String completionType;
    private final String prerequisiteCalcId;

    private Calculation(Builder builder) {
        this.calcId = Objects.requireNonNull(builder.calcId, "calcId is required");
        this.materialId = Objects.requireNonNull(builder.materialId, "materialId is required");
        this.kind = Objects.requireNonNull(builder.kind, "kind is required");
        this.status = builder.status != null ? builder.status : CalculationStatus.PENDING;
        this.priority = builder.priority;
        this.externalJobId = builder.externalJobId;
        this.externalState = builder.externalState;
        this.createdAt = builder.createdAt;
        this.submittedAt = builder.submittedAt;
        this.startedAt = builder.startedAt;
        this.completedAt = builder.completedAt;
        this.inputFile = builder.inputFile;
        this.outputFile = builder.outputFile;
        this.jobScript = builder.jobScript;
        this.workDir = builder.workDir;
        this.settings = builder.settings;
        this.exitCode = builder.exitCode;
        this.errorType = builder.errorType;
        this.errorMessage = builder.errorMessage;
        this.recoveryAttempts = builder.recoveryAttempts;
        this.completionType = builder.completionType;
        this.prerequisiteCalcId = builder.prerequisiteCalcId;
    }

    /**
     * New calculation id: {@code <materialId>_<KIND>_<yyyyMMdd_HHmmss>_<6 hex>}.
     */
    public static String newId(String materialId, CalculationKind kind) {
        String suffix = String.format("%06x", ThreadLocalRandom.current().nextInt(0x1000000));
        return materialId + "_" + kind.code() + "_" + LocalDateTime.now().format(ID_TIMESTAMP) + "_" + suffix;
    }

    public String calcId() {
        return calcId;
    }

    public String materialId() {
        return materialId;
    }

    public CalculationKind kind() {
        return kind;
    }

    public CalculationStatus status() {
        return status;
    }

    public int priority() {
        return priority;
    }

    public String externalJobId() {
        return externalJobId;
    }

    public String externalState() {
        return externalState;
    }

    public Instant createdAt() {
        return createdAt;
    }

    public Instant submittedAt() {
        return submittedAt;
    }

    public Instant startedAt() {
        return startedAt;
    }

    public Instant completedAt() {
        return completedAt;
    }

    public String inputFile() {
        return inputFile;
    }

    public String outputFile() {
        return outputFile;
    }

    public String jobScript() {
        return jobScript;
    }

    public String workDir() {
        return workDir;
    }

    public CalculationSettings settings() {
        return settings;
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

    public int recoveryAttempts() {
        return recoveryAttempts;
    }

    public String completionType() {
        return completionType;
    }

    public String prerequisiteCalcId() {
        return prerequisiteCalcId;
    }

    public boolean hasPrerequisite() {
        return prerequisiteCalcId != null && !prerequisiteCalcId.isBlank();
    }

    /** Check if recovery may still run for this calculation */
    public boolean canRecover(int ceiling) {
        return recoveryAttempts < ceiling;
    }

    /** Most recent transition timestamp (used for early-failure age checks). */
    public Instant lastActivityAt() {
        if (startedAt != null)
            return startedAt;
        if (submittedAt != null)
            return submittedAt;
        return createdAt;
    }

    public Builder toBuilder() {
        return new Builder()
                .calcId(calcId)
                .materialId(materialId)
                .kind(kind)
                .status(status)
                .priority(priority)
                .externalJobId(externalJobId)
                .externalState(externalState)
                .createdAt(createdAt)
                .submittedAt(submittedAt)
                .startedAt(startedAt)
                .completedAt(completedAt)
                .inputFile(inputFile)
                .outputFile(outputFile)
                .jobScript(jobScript)
                .workDir(workDir)
                .settings(settings)
                .exitCode(exitCode)
                .errorType(errorType)
                .errorMessage(errorMessage)
                .recoveryAttempts(recoveryAttempts)
                .completionType(completionType)
                .prerequisiteCalcId(prerequisiteCalcId);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String calcId;
        private String materialId;
        private CalculationKind kind;
        private CalculationStatus status;
        private int priority = 0;
        private String externalJobId;
        private String externalState;
        private Instant createdAt;
        private Instant submittedAt;
        private Instant startedAt;
        private Instant completedAt;
        private String inputFile;
        private String outputFile;
        private String jobScript;
        private String workDir;
        private CalculationSettings settings;
        private Integer exitCode;
        private String errorType;
        private String errorMessage;
        private int recoveryAttempts = 0;
        private String completionType;
        private String prerequisiteCalcId;

        private Builder() {
        }

        public Builder calcId(String calcId) {
            this.calcId = calcId;
            return this;
        }

        public Builder materialId(String materialId) {
            this.materialId = materialId;
            return this;
        }

        public Builder kind(CalculationKind kind) {
            this.kind = kind;
            return this;
        }

        public Builder status(CalculationStatus status) {
            this.status = status;
            return this;
        }

        public Builder priority(int priority) {
            this.priority = priority;
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

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder submittedAt(Instant submittedAt) {
            this.submittedAt = submittedAt;
            return this;
        }

        public Builder startedAt(Instant startedAt) {
            this.startedAt = startedAt;
            return this;
        }

        public Builder completedAt(Instant completedAt) {
            this.completedAt = completedAt;
            return this;
        }

        public Builder inputFile(String inputFile) {
            this.inputFile = inputFile;
            return this;
        }

        public Builder outputFile(String outputFile) {
            this.outputFile = outputFile;
            return this;
        }

        public Builder jobScript(String jobScript) {
            this.jobScript = jobScript;
            return this;
        }

        public Builder workDir(String workDir) {
            this.workDir = workDir;
            return this;
        }

        public Builder settings(CalculationSettings settings) {
            this.settings = settings;
            return this;
        }

        public Builder exitCode(Integer exitCode) {
            this.exitCode = exitCode;
            return this;
        }

        public Builder errorType(String errorType) {
            this.errorType = errorType;
            return this;
        }

        public Builder errorMessage(String errorMessage) {
            this.errorMessage = errorMessage;
            return this;
        }

        public Builder recoveryAttempts(int recoveryAttempts) {
            this.recoveryAttempts = recoveryAttempts;
            return this;
        }

        public Builder completionType(String completionType) {
            this.completionType = completionType;
            return this;
        }

        public Builder prerequisiteCalcId(String prerequisiteCalcId) {
            this.prerequisiteCalcId = prerequisiteCalcId;
            return this;
        }

        public Calculation build() {
            return new Calculation(this);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (o == null || getClass() != o.getClass())
            return false;
        Calculation that = (Calculation) o;
        return calcId.equals(that.calcId);
    }

    @Override
    public int hashCode() {
        return calcId.hashCode();
    }

    @Override
    public String toString() {
        return "Calculation{" +
                "calcId='" + calcId + '\'' +
                ", kind=" + kind +
                ", status=" + status +
                ", externalJobId='" + externalJobId + '\'' +
                ", recoveryAttempts=" + recoveryAttempts +
                '}';
    }
}
