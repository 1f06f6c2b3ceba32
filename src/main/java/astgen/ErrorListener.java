package astgen;

import astgen.asts.FormatterException;
import astgen.asts.GenerationException;
import com.google.common.collect.ImmutableList;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Collects the failures of a generation run. Generation units report from
 * several threads when run in parallel.
 */
public class ErrorListener {
    private final List<String> errors = new ArrayList<>();
    private final List<String> warnings = new ArrayList<>();
    private int errCount = 0;
    private int warnCount = 0;

    public synchronized void generationFailed(String backend, String family, GenerationException e) {
        errors.add(backend + "/" + family + ": " + e.getMessage());
        errCount++;
    }

    public synchronized void formatterFailed(Path file, FormatterException e) {
        warnings.add(file + ": " + e.getMessage());
        warnCount++;
    }

    public synchronized int getErrCount() {
        return errCount;
    }

    public synchronized int getWarnCount() {
        return warnCount;
    }

    public synchronized ImmutableList<String> getErrors() {
        return ImmutableList.copyOf(errors);
    }

    public synchronized ImmutableList<String> getWarnings() {
        return ImmutableList.copyOf(warnings);
    }
}
