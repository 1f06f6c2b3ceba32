package astgen.asts;

import com.google.common.base.Joiner;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Runs the external formatter of a backend on a generated file. The output of
 * the formatter is passed through to the console, not inspected.
 */
public class Formatter {

    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(60);

    private static final Logger log = LoggerFactory.getLogger(Formatter.class);

    private final boolean enabled;
    private final Duration timeout;

    public Formatter(Duration timeout) {
        this(true, timeout);
    }

    private Formatter(boolean enabled, Duration timeout) {
        Preconditions.checkArgument(!timeout.isNegative() && !timeout.isZero(), "timeout must be positive");
        this.enabled = enabled;
        this.timeout = timeout;
    }

    public static Formatter disabled() {
        return new Formatter(false, DEFAULT_TIMEOUT);
    }

    public boolean isEnabled() {
        return enabled;
    }

    public void format(List<String> command, Path file) throws FormatterException {
        if (!enabled || command.isEmpty()) {
            return;
        }
        List<String> cmd = ImmutableList.<String>builder().addAll(command).add(file.toString()).build();
        log.info("Formatting output \"{}\" ...", Joiner.on(' ').join(cmd));

        Process process;
        try {
            process = new ProcessBuilder(cmd).inheritIO().start();
        } catch (IOException e) {
            throw new FormatterException("Could not run " + cmd.get(0) + ": " + e.getMessage(), e);
        }
        try {
            if (!process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                process.destroyForcibly();
                throw new FormatterException(cmd.get(0) + " did not finish within " + timeout.toMillis() + " ms");
            }
        } catch (InterruptedException e) {
            process.destroyForcibly();
            Thread.currentThread().interrupt();
            throw new FormatterException("Interrupted while formatting " + file, e);
        }
        int exit = process.exitValue();
        if (exit != 0) {
            throw new FormatterException(cmd.get(0) + " exited with status " + exit);
        }
    }
}
