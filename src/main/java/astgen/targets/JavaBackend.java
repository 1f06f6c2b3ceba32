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
import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Lists;

import java.nio.file.Path;
import java.util.List;

/**
 * One public interface per family. Node types, visitors and acceptors are
 * nested in it, so a family is a single compilation unit.
 */
@SuppressWarnings("StringConcatenationInsideStringBufferAppend")
public class JavaBackend implements Backend {

    public static final String NAME = "java";

    private static final ImmutableSet<String> RESERVED = ImmutableSet.of(
            "abstract", "assert", "boolean", "break", "byte", "case", "catch", "char", "class", "const",
            "continue", "default", "do", "double", "else", "enum", "extends", "final", "finally", "float",
            "for", "goto", "if", "implements", "import", "instanceof", "int", "interface", "long", "native",
            "new", "package", "private", "protected", "public", "return", "short", "static", "strictfp",
            "super", "switch", "synchronized", "this", "throw", "throws", "transient", "try", "void",
            "volatile", "while", "true", "false", "null", "var", "record", "yield", "_");

    private final Path outputDir;
    private final String packageName;
    private final boolean genericMethods;
    private final TypeMapper typeMapper;

    /**
     * @param genericMethods when false, families with several result types
     *                       get acceptor classes instead of direct accept methods
     */
    public JavaBackend(Path outputDir, String packageName, boolean genericMethods, Schema schema) {
        this.outputDir = outputDir;
        this.packageName = packageName;
        this.genericMethods = genericMethods;
        this.typeMapper = new JavaTypeMapper(schema);
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public String getLanguage() {
        return "Java";
    }

    @Override
    public TypeMapper getTypeMapper() {
        return typeMapper;
    }

    @Override
    public boolean supportsGenericMethods() {
        return genericMethods;
    }

    @Override
    public Path getOutputFile(Family family) {
        Path dir = outputDir;
        if (!packageName.isEmpty()) {
            dir = dir.resolve(packageName.replace('.', '/'));
        }
        return dir.resolve(family.getName() + ".java");
    }

    @Override
    public ImmutableList<String> getFormatCommand() {
        // emitted already indented
        return ImmutableList.of();
    }

    @Override
    public String header(Family family) {
        StringBuilder sb = new StringBuilder();
        sb.append(FileGenerator.GENERATED_COMMENT + "\n");
        if (!packageName.isEmpty()) {
            sb.append("package " + packageName + ";\n");
        }
        sb.append("\nimport java.util.List;\n");
        return sb.toString();
    }

    @Override
    public String familyInterface(Family family) {
        StringBuilder sb = new StringBuilder();
        DispatchStrategy strategy = getDispatchStrategy(family);
        sb.append("\npublic interface " + family.getName() + " {\n");
        for (ResultType r : typeMapper.constraintsFor(family)) {
            sb.append("    " + acceptSignature(strategy, r) + ";\n");
        }
        return sb.toString();
    }

    @Override
    public String nodeDefinition(Family family, NodeDefinition node) {
        StringBuilder sb = new StringBuilder();
        String typeName = node.getTypeName(family);

        sb.append("\n");
        node.getNote().ifPresent(note -> sb.append("    // " + note + "\n"));
        sb.append("    final class " + typeName + " implements " + family.getName() + " {\n");
        for (Field f : node.fields) {
            sb.append("        public final " + typeMapper.map(family, f.getTyp()) + " " + fieldName(f) + ";\n");
        }
        if (!node.fields.isEmpty()) {
            sb.append("\n");
        }

        createConstructor(family, node, sb);
        createAcceptMethods(family, node, sb);

        sb.append("    }\n");
        return sb.toString();
    }

    private void createConstructor(Family family, NodeDefinition node, StringBuilder sb) {
        List<String> params = Lists.newArrayList();
        for (Field f : node.fields) {
            params.add(typeMapper.map(family, f.getTyp()) + " " + fieldName(f));
        }
        sb.append("        public " + node.getTypeName(family) + "(" + Joiner.on(", ").join(params) + ") {\n");
        for (Field f : node.fields) {
            sb.append("            this." + fieldName(f) + " = " + fieldName(f) + ";\n");
        }
        sb.append("        }\n");
    }

    private void createAcceptMethods(Family family, NodeDefinition node, StringBuilder sb) {
        DispatchStrategy strategy = getDispatchStrategy(family);
        for (ResultType r : typeMapper.constraintsFor(family)) {
            sb.append("\n");
            sb.append("        @Override\n");
            sb.append("        public " + acceptSignature(strategy, r) + " {\n");
            if (strategy.usesFacilitators()) {
                sb.append("            return new " + acceptorName(family, node, r) + "(this).accept(visitor);\n");
            } else {
                sb.append("            return visitor." + visitMethod(family, node) + "(this);\n");
            }
            sb.append("        }\n");
        }
    }

    @Override
    public String visitorSurface(Family family, List<NodeDefinition> nodes) {
        StringBuilder sb = new StringBuilder();
        DispatchStrategy strategy = getDispatchStrategy(family);
        String param = escape(Names.toFirstLower(family.getName()));

        for (ResultType r : typeMapper.constraintsFor(family)) {
            String returnType = strategy == DispatchStrategy.SINGLE_GENERIC ? "R" : r.getTypeName();
            sb.append("\n");
            sb.append("    interface " + visitorName(strategy, r)
                    + (strategy == DispatchStrategy.SINGLE_GENERIC ? "<R>" : "") + " {\n");
            for (NodeDefinition node : nodes) {
                sb.append("        " + returnType + " " + visitMethod(family, node) + "("
                        + node.getTypeName(family) + " " + param + ");\n");
            }
            sb.append("    }\n");
        }

        if (strategy.usesFacilitators()) {
            for (NodeDefinition node : nodes) {
                for (ResultType r : typeMapper.constraintsFor(family)) {
                    createAcceptor(family, node, r, visitorName(strategy, r), sb);
                }
            }
        }
        return sb.toString();
    }

    private void createAcceptor(Family family, NodeDefinition node, ResultType r, String visitor, StringBuilder sb) {
        String name = acceptorName(family, node, r);
        String typeName = node.getTypeName(family);
        sb.append("\n");
        sb.append("    final class " + name + " {\n");
        sb.append("        private final " + typeName + " node;\n");
        sb.append("\n");
        sb.append("        public " + name + "(" + typeName + " node) {\n");
        sb.append("            this.node = node;\n");
        sb.append("        }\n");
        sb.append("\n");
        sb.append("        public " + r.getTypeName() + " accept(" + visitor + " visitor) {\n");
        sb.append("            return visitor." + visitMethod(family, node) + "(node);\n");
        sb.append("        }\n");
        sb.append("    }\n");
    }

    @Override
    public String footer(Family family) {
        return "}\n";
    }

    private static String acceptSignature(DispatchStrategy strategy, ResultType r) {
        switch (strategy) {
            case SINGLE_GENERIC:
                return "<R> R accept(Visitor<R> visitor)";
            case SINGLE_FIXED:
                return r.getTypeName() + " accept(Visitor visitor)";
            default:
                return r.getTypeName() + " accept" + r.getLabel() + "(" + visitorName(strategy, r) + " visitor)";
        }
    }

    private static String visitorName(DispatchStrategy strategy, ResultType r) {
        return strategy.isMulti() ? r.getLabel() + "Visitor" : "Visitor";
    }

    private static String acceptorName(Family family, NodeDefinition node, ResultType r) {
        return node.getTypeName(family) + r.getLabel() + "Acceptor";
    }

    private static String visitMethod(Family family, NodeDefinition node) {
        return "visit" + node.getTypeName(family);
    }

    private static String fieldName(Field f) {
        return escape(f.name);
    }

    static String escape(String name) {
        return RESERVED.contains(name) ? name + "_" : name;
    }
}
