package astgen.asts.ast;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Sets;

import java.util.Optional;
import java.util.Set;

/**
 * A set of node kinds sharing one dispatch surface, together with the result
 * kinds that visitors over the family may produce.
 */
public final class Family {

    public final ImmutableList<NodeDefinition> nodes;
    private final String name;
    private final ImmutableList<String> resultKinds;

    public Family(String name, Iterable<String> resultKinds, Iterable<NodeDefinition> nodes) {
        Preconditions.checkArgument(name != null && !name.isEmpty(), "family name must not be empty");
        this.name = name;
        // an empty list is accepted here and rejected when generating
        this.resultKinds = ImmutableList.copyOf(resultKinds);
        this.nodes = ImmutableList.copyOf(nodes);

        Set<String> names = Sets.newHashSet();
        for (NodeDefinition n : this.nodes) {
            Preconditions.checkArgument(names.add(n.getName()),
                    "node %s declared twice in family %s", n.getName(), name);
        }
        Preconditions.checkArgument(Sets.newHashSet(this.resultKinds).size() == this.resultKinds.size(),
                "duplicate result kind in family %s: %s", name, this.resultKinds);
    }

    public String getName() {
        return name;
    }

    public ImmutableList<String> getResultKinds() {
        return resultKinds;
    }

    public Optional<NodeDefinition> getNode(String nodeName) {
        for (NodeDefinition n : nodes) {
            if (n.getName().equals(nodeName)) {
                return Optional.of(n);
            }
        }
        return Optional.empty();
    }

    @Override
    public String toString() {
        StringBuilder result = new StringBuilder(name + " = ");
        boolean first = true;
        for (NodeDefinition n : nodes) {
            if (!first) result.append(" | ");
            result.append(n.getName());
            first = false;
        }
        return result.toString();
    }
}
