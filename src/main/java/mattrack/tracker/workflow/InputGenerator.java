package mattrack.tracker.workflow;

import mattrack.tracker.model.Calculation;
import mattrack.tracker.model.CalculationKind;

import java.nio.file.Path;

/**
 * Produces the engine input of a downstream calculation from a completed one.
 */
public interface InputGenerator {

    /**
     * @param completed the finished upstream calculation
     * @param target    kind of the calculation to prepare
     * @param targetDir working directory of the new calculation (created by the caller)
     * @return path of the generated input file
     * @throws InputGenerationException when no input could be produced
     */
    Path generate(Calculation completed, CalculationKind target, Path targetDir) throws InputGenerationException;
}
