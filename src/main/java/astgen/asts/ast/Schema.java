package astgen.asts.ast;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Sets;

import java.util.Optional;
import java.util.Set;

/**
 * The node families a generator run works on. Immutable, shared by every
 * backend of a run.
 */
public final class Schema {

    public final ImmutableList<Family> families;

    public Schema(Iterable<Family> families) {
        this.families = ImmutableList.copyOf(families);
        Set<String> names = Sets.newHashSet();
        for (Family f : this.families) {
            Preconditions.checkArgument(names.add(f.getName()), "family %s declared twice", f.getName());
        }
    }

    public static Schema of(Family... families) {
        return new Schema(ImmutableList.copyOf(families));
    }

    public Optional<Family> getFamily(String name) {
        for (Family f : families) {
            if (f.getName().equals(name)) {
                return Optional.of(f);
            }
        }
        return Optional.empty();
    }

    /**
     * Looks up the node a {@code SpecificVariant} refers to: first in the
     * referencing family, then in the other families in declaration order.
     */
    public Optional<Variant> resolveVariant(Family from, String nodeName) {
        Optional<NodeDefinition> local = from.getNode(nodeName);
        if (local.isPresent()) {
            return Optional.of(new Variant(from, local.get()));
        }
        for (Family f : families) {
            if (f.getName().equals(from.getName())) {
                continue;
            }
            Optional<NodeDefinition> n = f.getNode(nodeName);
            if (n.isPresent()) {
                return Optional.of(new Variant(f, n.get()));
            }
        }
        return Optional.empty();
    }

    public static final class Variant {
        public final Family family;
        public final NodeDefinition node;

        Variant(Family family, NodeDefinition node) {
            this.family = family;
            this.node = node;
        }

        public String getTypeName() {
            return node.getTypeName(family);
        }
    }
}
