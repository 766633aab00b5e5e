package mattrack.tracker.batch;

/**
 * Exit code and combined stdout/stderr of an external command.
 */
public record CommandResult(int exitCode, String output) {

    public boolean isSuccess() {
        return exitCode == 0;
    }
}
