package mattrack.tracker.batch;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Runs an external command and collects its output.
 */
public interface CommandRunner {

    /**
     * @param command   program and arguments
     * @param directory working directory, or null for the current one
     * @throws IOException when the command cannot be started, times out or is interrupted
     */
    CommandResult run(List<String> command, Path directory) throws IOException;
}
