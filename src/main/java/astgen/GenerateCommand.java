package astgen;

import astgen.asts.Backend;
import astgen.asts.FileGenerator;
import astgen.asts.Formatter;
import astgen.asts.Generator;
import astgen.asts.ast.LoxSchema;
import astgen.targets.GoBackend;
import astgen.targets.JavaBackend;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParameterException;
import picocli.CommandLine.Spec;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Iterator;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

@Command(name = "generate", mixinStandardHelpOptions = true,
        description = "Generates the expression and statement sources for the selected languages.")
public class GenerateCommand implements Callable<Integer> {

    public static final ImmutableList<String> LANGUAGES = ImmutableList.of(GoBackend.NAME, JavaBackend.NAME);

    private static final Logger log = LoggerFactory.getLogger(GenerateCommand.class);

    @Spec
    CommandSpec spec;

    @Option(names = {"-l", "--languages"}, split = ",", paramLabel = "LANG",
            description = "Languages to generate (default: all of ${COMPLETION-CANDIDATES}).",
            completionCandidates = Languages.class)
    List<String> languages;

    @Option(names = {"-o", "--output"}, defaultValue = ".",
            description = "Directory containing the interpreter projects (default: ${DEFAULT-VALUE}).")
    Path output;

    @Option(names = "--go-package", defaultValue = "main", description = "Package of the Go sources.")
    String goPackage;

    @Option(names = "--java-package", defaultValue = "lox", description = "Package of the Java sources.")
    String javaPackage;

    @Option(names = "--no-format", description = "Do not run the formatter on the generated files.")
    boolean noFormat;

    @Option(names = "--format-timeout", defaultValue = "60", paramLabel = "SECONDS",
            description = "Time a formatter may run per file (default: ${DEFAULT-VALUE}).")
    long formatTimeout;

    @Option(names = {"-j", "--jobs"}, defaultValue = "1",
            description = "Number of files generated in parallel (default: ${DEFAULT-VALUE}).")
    int jobs;

    @Override
    public Integer call() {
        if (jobs < 1) {
            throw new ParameterException(spec.commandLine(), "--jobs must be at least 1");
        }
        if (formatTimeout < 1) {
            throw new ParameterException(spec.commandLine(), "--format-timeout must be at least 1");
        }
        ImmutableList.Builder<Backend> backends = ImmutableList.builder();
        for (String language : ImmutableSet.copyOf(languages == null ? LANGUAGES : languages)) {
            backends.add(createBackend(language));
        }

        ErrorListener errorListener = new ErrorListener();
        Formatter formatter = noFormat ? Formatter.disabled() : new Formatter(Duration.ofSeconds(formatTimeout));
        Generator generator = new Generator(LoxSchema.SCHEMA, new FileGenerator(), formatter, errorListener);

        if (jobs == 1) {
            for (Backend backend : backends.build()) {
                generator.generate(backend);
            }
        } else {
            ExecutorService executor = Executors.newFixedThreadPool(jobs,
                    new ThreadFactoryBuilder().setNameFormat("astgen-%d").build());
            try {
                generator.generate(backends.build(), executor);
            } finally {
                executor.shutdown();
            }
        }

        if (errorListener.getWarnCount() > 0) {
            log.warn("{} file(s) could not be formatted", errorListener.getWarnCount());
        }
        if (errorListener.getErrCount() > 0) {
            log.error("{} file(s) could not be generated", errorListener.getErrCount());
            return 1;
        }
        return 0;
    }

    private Backend createBackend(String language) {
        switch (language) {
            case GoBackend.NAME:
                return new GoBackend(output.resolve("golox"), goPackage, LoxSchema.SCHEMA);
            case JavaBackend.NAME:
                return new JavaBackend(output.resolve("jlox"), javaPackage, true, LoxSchema.SCHEMA);
            default:
                throw new ParameterException(spec.commandLine(),
                        "Unknown language '" + language + "', expected one of " + LANGUAGES);
        }
    }

    static class Languages implements Iterable<String> {
        @Override
        public Iterator<String> iterator() {
            return LANGUAGES.iterator();
        }
    }
}
