package astgen.asts;

import astgen.asts.ast.Family;
import astgen.asts.ast.NodeDefinition;
import com.google.common.collect.ImmutableList;

import java.nio.file.Path;
import java.util.List;

/**
 * A target language. The {@link Generator} calls the emission hooks in a fixed
 * order for every family; a backend only decides how each part is spelled.
 * Hooks must not have side effects, the returned text is collected in memory
 * and written once the whole family rendered successfully.
 */
public interface Backend {

    /** short identifier used on the command line, e.g. {@code go} */
    String getName();

    /** human readable language name for progress messages */
    String getLanguage();

    TypeMapper getTypeMapper();

    /**
     * Whether the target can declare a generic method on an already concrete
     * type. Targets that cannot get facilitator types for families with more
     * than one result type.
     */
    boolean supportsGenericMethods();

    Path getOutputFile(Family family);

    /**
     * Formatter command, the output file is appended as last argument. An empty
     * list disables formatting for this backend.
     */
    ImmutableList<String> getFormatCommand();

    String header(Family family);

    String familyInterface(Family family);

    String nodeDefinition(Family family, NodeDefinition node);

    String visitorSurface(Family family, List<NodeDefinition> nodes);

    default String footer(Family family) {
        return "";
    }

    default DispatchStrategy getDispatchStrategy(Family family) {
        return DispatchStrategy.select(getTypeMapper().constraintsFor(family).size(), supportsGenericMethods());
    }
}
