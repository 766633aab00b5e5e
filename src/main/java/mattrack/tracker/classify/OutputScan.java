package mattrack.tracker.classify;

/**
 * Everything learned from one pass over an output file.
 *
 * @param completionType name of the completion rule that matched, or null
 * @param reason         why the status is UNKNOWN, otherwise null
 */
public record OutputScan(
        ScanStatus status,
        Classification classification,
        String completionType,
        RuntimeDiagnostics diagnostics,
        long fileSize,
        String reason) {

    public static OutputScan unknown(String reason) {
        return new OutputScan(ScanStatus.UNKNOWN, Classification.none(), null, RuntimeDiagnostics.empty(), 0, reason);
    }

    public boolean isCompleted() {
        return status == ScanStatus.COMPLETED;
    }

    public boolean isError() {
        return status == ScanStatus.ERROR;
    }
}
