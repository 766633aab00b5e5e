package mattrack.tracker.batch;

import mattrack.tracker.model.CalculationSettings;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Per-job submit scripts: a copy of the kind's template in the working directory whose
 * {@code #SBATCH} resource directives follow the calculation's settings.
 */
public final class JobScripts {

    private JobScripts() {
    }

    /**
     * Copy {@code template} to {@code target}, setting the job name and resource directives.
     */
    public static Path stage(Path template, Path target, String jobName, CalculationSettings settings)
            throws IOException {
        if (!Files.isRegularFile(template)) {
            throw new IOException("submit script not found: " + template);
        }
        String text = Files.readString(template, StandardCharsets.UTF_8);
        text = withDirective(text, "job-name", jobName);
        if (settings.memoryGb() > 0) {
            text = withDirective(text, "mem", settings.memoryGb() + "G");
        }
        if (settings.walltimeHours() > 0) {
            text = withDirective(text, "time", settings.slurmWalltime());
        }
        if (settings.cores() > 0) {
            text = withDirective(text, "ntasks", String.valueOf(settings.cores()));
        }
        Files.writeString(target, text, StandardCharsets.UTF_8);
        return target;
    }

    /**
     * Replace the value of {@code #SBATCH --<option>=...} if the script sets it.
     *
     * @return true if the script was changed; false when there is no script or no such directive
     */
    public static boolean replaceDirective(String jobScript, String option, String value) throws IOException {
        if (jobScript == null) {
            return false;
        }
        Path script = Path.of(jobScript);
        if (!Files.isRegularFile(script)) {
            return false;
        }
        String text = Files.readString(script, StandardCharsets.UTF_8);
        Matcher m = directive(option).matcher(text);
        if (!m.find()) {
            return false;
        }
        Files.writeString(script, m.replaceAll("$1" + Matcher.quoteReplacement(value)), StandardCharsets.UTF_8);
        return true;
    }

    static String withDirective(String text, String option, String value) {
        Matcher m = directive(option).matcher(text);
        if (m.find()) {
            return m.replaceAll("$1" + Matcher.quoteReplacement(value));
        }
        String line = "#SBATCH --" + option + "=" + value + "\n";
        if (text.startsWith("#!")) {
            int eol = text.indexOf('\n');
            return eol < 0 ? text + "\n" + line : text.substring(0, eol + 1) + line + text.substring(eol + 1);
        }
        return line + text;
    }

    private static Pattern directive(String option) {
        return Pattern.compile("(?m)^(#SBATCH\\s+--" + Pattern.quote(option) + "=)\\S+");
    }
}
