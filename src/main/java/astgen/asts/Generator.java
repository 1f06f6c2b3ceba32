package astgen.asts;

import astgen.ErrorListener;
import astgen.asts.ast.AbstractType;
import astgen.asts.ast.Family;
import astgen.asts.ast.Field;
import astgen.asts.ast.NodeDefinition;
import astgen.asts.ast.Schema;
import com.google.common.base.Throwables;
import com.google.common.collect.Lists;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;

/**
 * Drives the backends over the families of a schema. Every family of every
 * backend is an independent unit: it is validated and rendered completely in
 * memory before anything is written, and its failure is reported to the
 * {@link ErrorListener} without affecting the other units.
 */
public final class Generator {

    private static final Logger log = LoggerFactory.getLogger(Generator.class);

    private final Schema schema;
    private final FileGenerator fileGenerator;
    private final Formatter formatter;
    private final ErrorListener errorListener;

    public Generator(Schema schema, FileGenerator fileGenerator, Formatter formatter, ErrorListener errorListener) {
        this.schema = schema;
        this.fileGenerator = fileGenerator;
        this.formatter = formatter;
        this.errorListener = errorListener;
    }

    public void generate(Backend backend) {
        for (Family family : schema.families) {
            generate(backend, family);
        }
    }

    /**
     * Runs every (backend, family) unit on the executor and waits for all of
     * them.
     */
    public void generate(List<Backend> backends, ExecutorService executor) {
        List<Future<Boolean>> futures = Lists.newArrayList();
        for (Backend backend : backends) {
            for (Family family : schema.families) {
                futures.add(executor.submit(() -> generate(backend, family)));
            }
        }
        // wait for all units before rethrowing, none may still be writing afterwards
        Throwable failure = null;
        for (Future<Boolean> future : futures) {
            try {
                future.get();
            } catch (InterruptedException e) {
                for (Future<Boolean> f : futures) {
                    f.cancel(true);
                }
                Thread.currentThread().interrupt();
                throw new IllegalStateException("Interrupted while waiting for generation", e);
            } catch (ExecutionException e) {
                if (failure == null) {
                    failure = e.getCause();
                } else {
                    failure.addSuppressed(e.getCause());
                }
            }
        }
        if (failure != null) {
            Throwables.throwIfUnchecked(failure);
            throw new IllegalStateException(failure);
        }
    }

    /**
     * @return true if the file of the family was written
     */
    public boolean generate(Backend backend, Family family) {
        Path file = backend.getOutputFile(family);
        log.info("Generating {} {}s to \"{}\" ...", backend.getLanguage(), family.getName(), file);
        try {
            fileGenerator.createFile(file, render(backend, family));
        } catch (GenerationException e) {
            log.error("Generating {} {}s failed: {}", backend.getLanguage(), family.getName(), e.getMessage());
            errorListener.generationFailed(backend.getName(), family.getName(), e);
            return false;
        }
        try {
            formatter.format(backend.getFormatCommand(), file);
        } catch (FormatterException e) {
            log.warn("Could not format {}, leaving it unformatted: {}", file, e.getMessage());
            errorListener.formatterFailed(file, e);
        }
        return true;
    }

    /**
     * Renders the file of one family without touching the file system.
     */
    public String render(Backend backend, Family family) {
        check(backend, family);

        StringBuilder sb = new StringBuilder();
        sb.append(backend.header(family));
        sb.append(backend.familyInterface(family));
        for (NodeDefinition node : family.nodes) {
            sb.append(backend.nodeDefinition(family, node));
        }
        sb.append(backend.visitorSurface(family, family.nodes));
        sb.append(backend.footer(family));
        return sb.toString();
    }

    private void check(Backend backend, Family family) {
        if (family.getResultKinds().isEmpty()) {
            throw new InvalidResultConstraintException(family.getName());
        }
        TypeMapper typeMapper = backend.getTypeMapper();
        typeMapper.constraintsFor(family);

        List<String> undefined = Lists.newArrayList();
        for (NodeDefinition node : family.nodes) {
            for (Field field : node.fields) {
                findUndefined(family, field.getTyp())
                        .ifPresent(ref -> undefined.add("node '" + node.getName() + "' -> field '"
                                + field.name + "' -> " + ref));
            }
        }
        if (!undefined.isEmpty()) {
            throw new UnresolvedReferenceException(family.getName(), undefined);
        }

        for (NodeDefinition node : family.nodes) {
            for (Field field : node.fields) {
                typeMapper.map(family, field.getTyp());
            }
        }
    }

    private Optional<String> findUndefined(Family family, AbstractType typ) {
        return typ.match(new AbstractType.Matcher<Optional<String>>() {
            @Override
            public Optional<String> case_Self(AbstractType.Self t) {
                return Optional.empty();
            }

            @Override
            public Optional<String> case_OtherFamily(AbstractType.OtherFamily t) {
                if (schema.getFamily(t.getName()).isPresent()) {
                    return Optional.empty();
                }
                return Optional.of("family '" + t.getName() + "'");
            }

            @Override
            public Optional<String> case_SpecificVariant(AbstractType.SpecificVariant t) {
                if (schema.resolveVariant(family, t.getName()).isPresent()) {
                    return Optional.empty();
                }
                return Optional.of("node kind '" + t.getName() + "'");
            }

            @Override
            public Optional<String> case_Opaque(AbstractType.Opaque t) {
                return Optional.empty();
            }

            @Override
            public Optional<String> case_Dynamic(AbstractType.Dynamic t) {
                return Optional.empty();
            }

            @Override
            public Optional<String> case_Sequence(AbstractType.Sequence t) {
                return findUndefined(family, t.getInner());
            }
        });
    }
}
