package astgen.asts.ast;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Sets;

import java.util.Optional;
import java.util.Set;

/**
 * One node kind of a family: its name, its fields in declaration order and an
 * optional note that is emitted as a comment above the generated type.
 */
public final class NodeDefinition {

    public final ImmutableList<Field> fields;
    private final String name;
    private final Optional<String> note;

    public NodeDefinition(String name, Optional<String> note, Iterable<Field> fields) {
        Preconditions.checkArgument(name != null && !name.isEmpty(), "node name must not be empty");
        this.name = name;
        this.note = Preconditions.checkNotNull(note);
        this.fields = ImmutableList.copyOf(fields);

        Set<String> names = Sets.newHashSet();
        for (Field f : this.fields) {
            Preconditions.checkArgument(names.add(f.name),
                    "field <%s> declared twice in node %s", f.name, name);
        }
    }

    public static NodeDefinition node(String name, Field... fields) {
        return new NodeDefinition(name, Optional.empty(), ImmutableList.copyOf(fields));
    }

    public static NodeDefinition node(String name, String note, Field... fields) {
        return new NodeDefinition(name, Optional.of(note), ImmutableList.copyOf(fields));
    }

    public static Field field(String name, AbstractType typ) {
        return new Field(name, typ);
    }

    public String getName() {
        return name;
    }

    public Optional<String> getNote() {
        return note;
    }

    /**
     * Name of the emitted type, e.g. {@code BinaryExpression}.
     */
    public String getTypeName(Family family) {
        return name + family.getName();
    }

    @Override
    public String toString() {
        StringBuilder result = new StringBuilder(name + "(");
        boolean first = true;
        for (Field f : fields) {
            if (!first) {
                result.append(", ");
            }
            result.append(f);
            first = false;
        }
        result.append(")");
        return result.toString();
    }
}
