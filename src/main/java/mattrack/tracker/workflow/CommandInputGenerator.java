package mattrack.tracker.workflow;

import mattrack.tracker.batch.CommandResult;
import mattrack.tracker.batch.CommandRunner;
import mattrack.tracker.model.Calculation;
import mattrack.tracker.model.CalculationKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Runs an external converter to build downstream inputs.
 *
 * <p>Invoked in the target directory as
 * {@code <command...> <TARGET_CODE> <upstream output> <upstream input> <target dir>}.
 * The converter writes {@code <materialId>_<code>.d12} (or {@code .d3} for property runs) into the
 * target directory, or prints the path of the file it wrote as its last output line.
 */
public class CommandInputGenerator implements InputGenerator {

    private static final Logger log = LoggerFactory.getLogger(CommandInputGenerator.class);

    private final List<String> command;
    private final CommandRunner runner;

    public CommandInputGenerator(String command, CommandRunner runner) {
        this.command = command == null || command.isBlank()
                ? List.of()
                : Arrays.asList(command.trim().split("\\s+"));
        this.runner = runner;
    }

    public boolean isConfigured() {
        return !command.isEmpty();
    }

    @Override
    public Path generate(Calculation completed, CalculationKind target, Path targetDir)
            throws InputGenerationException {
        if (!isConfigured()) {
            throw new InputGenerationException("no input generator command configured");
        }
        if (completed.outputFile() == null) {
            throw new InputGenerationException("calculation " + completed.calcId() + " has no output file");
        }

        List<String> cmd = new ArrayList<>(command);
        cmd.add(target.code());
        cmd.add(completed.outputFile());
        cmd.add(completed.inputFile() != null ? completed.inputFile() : "");
        cmd.add(targetDir.toAbsolutePath().toString());

        CommandResult result;
        try {
            result = runner.run(cmd, targetDir);
        } catch (IOException e) {
            throw new InputGenerationException("input generator failed: " + e.getMessage(), e);
        }
        if (!result.isSuccess()) {
            throw new InputGenerationException("input generator exited with " + result.exitCode() + ": "
                    + result.output().trim());
        }

        Path expected = targetDir.resolve(expectedName(completed.materialId(), target));
        if (Files.isRegularFile(expected)) {
            return expected;
        }
        Path reported = lastLine(result.output());
        if (reported != null) {
            Path resolved = reported.isAbsolute() ? reported : targetDir.resolve(reported);
            if (Files.isRegularFile(resolved)) {
                return resolved;
            }
        }
        log.debug("Generator output for {} {}: {}", completed.materialId(), target.code(), result.output());
        throw new InputGenerationException("input generator produced no " + expected.getFileName());
    }

    static String expectedName(String materialId, CalculationKind target) {
        String ext = target.isPropertyRun() ? ".d3" : ".d12";
        return materialId + "_" + target.code().toLowerCase() + ext;
    }

    private static Path lastLine(String output) {
        String[] lines = output.trim().split("\\R");
        String last = lines[lines.length - 1].trim();
        if (last.isEmpty()) {
            return null;
        }
        try {
            return Path.of(last);
        } catch (RuntimeException e) {
            return null;
        }
    }
}
