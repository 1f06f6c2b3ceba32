package astgen.asts;

import com.google.common.base.Preconditions;

/**
 * Concrete return type of a visitor. The label is used in emitted names
 * ({@code AcceptString}, {@code ValueVisitor}), the type name in signatures.
 */
public final class ResultType {

    private final String label;
    private final String typeName;

    public ResultType(String label, String typeName) {
        Preconditions.checkArgument(!label.isEmpty() && !typeName.isEmpty());
        this.label = label;
        this.typeName = typeName;
    }

    public String getLabel() {
        return label;
    }

    public String getTypeName() {
        return typeName;
    }

    @Override
    public boolean equals(Object obj) {
        if (obj instanceof ResultType) {
            ResultType other = (ResultType) obj;
            return label.equals(other.label) && typeName.equals(other.typeName);
        }
        return false;
    }

    @Override
    public int hashCode() {
        return label.hashCode() * 31 + typeName.hashCode();
    }

    @Override
    public String toString() {
        return label + "(" + typeName + ")";
    }
}
