package mattrack.tracker.recovery;

import mattrack.tracker.classify.Classification;
import mattrack.tracker.model.Calculation;
import mattrack.tracker.model.CalculationStatus;
import mattrack.tracker.model.StatusUpdate;
import mattrack.tracker.model.TransitionResult;
import mattrack.tracker.repository.CalculationRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Decides whether a failed calculation is retried and prepares it for resubmission.
 *
 * <p>A calculation is recovered only when its failure kind is recoverable, a strategy is
 * registered for it and its attempt counter is below the ceiling. Everything else fails
 * closed: the calculation stays FAILED.
 */
public class RecoveryEngine {

    private static final Logger log = LoggerFactory.getLogger(RecoveryEngine.class);

    private final CalculationRepository calculations;
    private final Map<String, RecoveryStrategy> strategies = new LinkedHashMap<>();
    private final int maxAttempts;

    public RecoveryEngine(CalculationRepository calculations, List<RecoveryStrategy> strategies, int maxAttempts) {
        this.calculations = calculations;
        this.maxAttempts = maxAttempts;
        for (RecoveryStrategy strategy : strategies) {
            this.strategies.put(strategy.kind(), strategy);
        }
    }

    /**
     * Engine with one strategy per recoverable kind, parameterized from {@code config}.
     */
    public static RecoveryEngine withDefaultStrategies(CalculationRepository calculations, RecoveryConfig config,
            int maxAttempts) {
        return new RecoveryEngine(calculations, List.of(
                new MemoryStrategy(config),
                new WalltimeStrategy(config),
                new ConvergenceStrategy(config),
                new ShrinkStrategy(config),
                new GeometryStrategy(config),
                new ResubmitStrategy(config)), maxAttempts);
    }

    public boolean hasStrategy(String kind) {
        return strategies.containsKey(kind);
    }

    public int maxAttempts() {
        return maxAttempts;
    }

    /**
     * Try to recover a FAILED calculation.
     *
     * @param calculation    the calculation as read after its FAILED transition
     * @param classification what the output scan found
     * @return the decision; on {@code RESUBMIT} the calculation is now RESUBMITTED
     */
    public RecoveryOutcome attemptRecovery(Calculation calculation, Classification classification) {
        String calcId = calculation.calcId();
        String kind = classification.kind();

        if (!classification.recoverable()) {
            log.info("Calculation {} failed with {}: not recoverable", calcId, kind);
            return RecoveryOutcome.of(RecoveryOutcome.Decision.NOT_RECOVERABLE, kind + " is not recoverable");
        }
        RecoveryStrategy strategy = strategies.get(kind);
        if (strategy == null) {
            log.warn("Calculation {} failed with {}: no recovery strategy registered", calcId, kind);
            return RecoveryOutcome.of(RecoveryOutcome.Decision.NO_STRATEGY, "no strategy for " + kind);
        }
        int ceiling = Math.min(maxAttempts, strategy.maxAttempts());
        if (!calculation.canRecover(ceiling)) {
            log.warn("Calculation {} reached recovery limit ({}/{}) for {}",
                    calcId, calculation.recoveryAttempts(), ceiling, kind);
            return RecoveryOutcome.of(RecoveryOutcome.Decision.CEILING_REACHED,
                    "recovery attempts exhausted (" + calculation.recoveryAttempts() + "/" + ceiling + ")");
        }

        int attempt = calculation.recoveryAttempts() + 1;
        RecoveryAction action;
        try {
            action = strategy.apply(calculation, attempt);
        } catch (RecoveryException e) {
            log.warn("Recovery of {} ({}) failed: {}", calcId, kind, e.getMessage());
            return RecoveryOutcome.of(RecoveryOutcome.Decision.TRANSFORM_FAILED, e.getMessage());
        }

        TransitionResult result = calculations.updateStatus(
                StatusUpdate.to(calcId, CalculationStatus.RESUBMITTED)
                        .expecting(CalculationStatus.FAILED)
                        .recoveryAttempt(ceiling)
                        .completionType(Calculation.RECOVERY_ATTEMPT)
                        .settings(action.settings())
                        .build());

        return switch (result) {
            case APPLIED -> {
                log.info("Calculation {} queued for recovery attempt {}/{} ({}): {}",
                        calcId, attempt, ceiling, kind, action.description());
                yield new RecoveryOutcome(RecoveryOutcome.Decision.RESUBMIT, action.description(), action.settings());
            }
            case CEILING_REACHED -> RecoveryOutcome.of(RecoveryOutcome.Decision.CEILING_REACHED,
                    "recovery attempts exhausted");
            default -> {
                log.debug("Calculation {} left FAILED before recovery could apply ({})", calcId, result);
                yield RecoveryOutcome.of(RecoveryOutcome.Decision.STALE, "calculation changed: " + result);
            }
        };
    }
}
