package astgen.targets;

import astgen.asts.Backend;
import astgen.asts.DispatchStrategy;
import astgen.asts.FileGenerator;
import astgen.asts.ResultType;
import astgen.asts.TypeMapper;
import astgen.asts.ast.Family;
import astgen.asts.ast.Field;
import astgen.asts.ast.NodeDefinition;
import astgen.asts.ast.Schema;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;

import java.nio.file.Path;
import java.util.List;
import java.util.Locale;

/**
 * Go structs with pointer receivers. Go has no generic methods, so families
 * with several result types get one acceptor struct per node and result type.
 * Visitor methods return the result together with an {@code error}.
 */
@SuppressWarnings("StringConcatenationInsideStringBufferAppend")
public class GoBackend implements Backend {

    public static final String NAME = "go";

    private final Path outputDir;
    private final String packageName;
    private final TypeMapper typeMapper;

    public GoBackend(Path outputDir, String packageName, Schema schema) {
        this.outputDir = outputDir;
        this.packageName = packageName;
        this.typeMapper = new GoTypeMapper(schema);
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public String getLanguage() {
        return "Go";
    }

    @Override
    public TypeMapper getTypeMapper() {
        return typeMapper;
    }

    @Override
    public boolean supportsGenericMethods() {
        return false;
    }

    @Override
    public Path getOutputFile(Family family) {
        return outputDir.resolve(family.getName().toLowerCase(Locale.ROOT) + ".go");
    }

    @Override
    public ImmutableList<String> getFormatCommand() {
        return ImmutableList.of("gofmt", "-w");
    }

    @Override
    public String header(Family family) {
        return FileGenerator.GENERATED_COMMENT + "\n"
                + "package " + packageName + "\n";
    }

    @Override
    public String familyInterface(Family family) {
        StringBuilder sb = new StringBuilder();
        sb.append("\ntype " + family.getName() + " interface {\n");
        DispatchStrategy strategy = getDispatchStrategy(family);
        for (ResultType r : typeMapper.constraintsFor(family)) {
            sb.append("\t" + acceptSignature(family, strategy, r) + "\n");
        }
        sb.append("}\n");
        return sb.toString();
    }

    @Override
    public String nodeDefinition(Family family, NodeDefinition node) {
        StringBuilder sb = new StringBuilder();
        String typeName = node.getTypeName(family);

        sb.append("\n");
        node.getNote().ifPresent(note -> sb.append("// " + note + "\n"));
        sb.append("type " + typeName + " struct {\n");
        int width = 0;
        for (Field f : node.fields) {
            width = Math.max(width, fieldName(f).length());
        }
        for (Field f : node.fields) {
            sb.append("\t" + Strings.padEnd(fieldName(f), width, ' ') + " "
                    + typeMapper.map(family, f.getTyp()) + "\n");
        }
        sb.append("}\n");

        DispatchStrategy strategy = getDispatchStrategy(family);
        for (ResultType r : typeMapper.constraintsFor(family)) {
            sb.append("\nfunc (e *" + typeName + ") " + acceptSignature(family, strategy, r) + " {\n");
            if (strategy.usesFacilitators()) {
                sb.append("\treturn " + acceptorName(family, node, r) + "{Node: e}.Accept(visitor)\n");
            } else {
                sb.append("\treturn visitor." + visitMethod(family, node) + "(e)\n");
            }
            sb.append("}\n");
        }
        return sb.toString();
    }

    @Override
    public String visitorSurface(Family family, List<NodeDefinition> nodes) {
        StringBuilder sb = new StringBuilder();
        DispatchStrategy strategy = getDispatchStrategy(family);
        String param = Names.toFirstLower(family.getName());

        for (ResultType r : typeMapper.constraintsFor(family)) {
            sb.append("\ntype " + visitorName(family, strategy, r) + " interface {\n");
            for (NodeDefinition node : nodes) {
                sb.append("\t" + visitMethod(family, node) + "(" + param + " *" + node.getTypeName(family) + ") ("
                        + r.getTypeName() + ", error)\n");
            }
            sb.append("}\n");
        }

        if (strategy.usesFacilitators()) {
            for (NodeDefinition node : nodes) {
                for (ResultType r : typeMapper.constraintsFor(family)) {
                    createAcceptor(family, node, r, visitorName(family, strategy, r), sb);
                }
            }
        }
        return sb.toString();
    }

    private void createAcceptor(Family family, NodeDefinition node, ResultType r, String visitor, StringBuilder sb) {
        String name = acceptorName(family, node, r);
        sb.append("\n// " + name + " dispatches a " + node.getTypeName(family) + " to a " + visitor + ".\n");
        sb.append("type " + name + " struct {\n");
        sb.append("\tNode *" + node.getTypeName(family) + "\n");
        sb.append("}\n");
        sb.append("\nfunc (a " + name + ") Accept(visitor " + visitor + ") (" + r.getTypeName() + ", error) {\n");
        sb.append("\treturn visitor." + visitMethod(family, node) + "(a.Node)\n");
        sb.append("}\n");
    }

    private String acceptSignature(Family family, DispatchStrategy strategy, ResultType r) {
        String method = strategy.isMulti() ? "Accept" + r.getLabel() : "Accept";
        return method + "(visitor " + visitorName(family, strategy, r) + ") (" + r.getTypeName() + ", error)";
    }

    private static String visitorName(Family family, DispatchStrategy strategy, ResultType r) {
        return strategy.isMulti()
                ? family.getName() + r.getLabel() + "Visitor"
                : family.getName() + "Visitor";
    }

    private static String acceptorName(Family family, NodeDefinition node, ResultType r) {
        return node.getTypeName(family) + r.getLabel() + "Acceptor";
    }

    private static String visitMethod(Family family, NodeDefinition node) {
        return "Visit" + node.getTypeName(family);
    }

    private static String fieldName(Field f) {
        return Names.toFirstUpper(f.name);
    }
}
