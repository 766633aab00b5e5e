package mattrack.tracker.monitor;

import mattrack.tracker.model.Calculation;

import java.nio.file.Path;

final class OutputFiles {

    private OutputFiles() {
    }

    /**
     * The recorded output file, else {@code <workDir>/<input stem>.out}; null if neither is known.
     */
    static Path resolve(Calculation calc) {
        if (calc.outputFile() != null) {
            return Path.of(calc.outputFile());
        }
        if (calc.workDir() == null || calc.inputFile() == null) {
            return null;
        }
        String name = Path.of(calc.inputFile()).getFileName().toString();
        int dot = name.lastIndexOf('.');
        String stem = dot > 0 ? name.substring(0, dot) : name;
        return Path.of(calc.workDir()).resolve(stem + ".out");
    }
}
