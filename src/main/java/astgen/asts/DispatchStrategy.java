package astgen.asts;

/**
 * How the visitor surface of a family is emitted, chosen from the number of
 * result types and whether the target can declare a generic method on a
 * concrete type.
 */
public enum DispatchStrategy {
    /** one generic visitor, one generic accept method */
    SINGLE_GENERIC,
    /** one visitor, accept returns the single declared type */
    SINGLE_FIXED,
    /** one visitor and one accept method per result type */
    MULTI_DIRECT,
    /** one visitor per result type, accept methods delegate to facilitator types */
    MULTI_FACILITATED;

    public static DispatchStrategy select(int resultTypes, boolean genericMethods) {
        if (resultTypes < 1) {
            throw new IllegalArgumentException("at least one result type required, got " + resultTypes);
        }
        if (resultTypes == 1) {
            return genericMethods ? SINGLE_GENERIC : SINGLE_FIXED;
        }
        return genericMethods ? MULTI_DIRECT : MULTI_FACILITATED;
    }

    public boolean isMulti() {
        return this == MULTI_DIRECT || this == MULTI_FACILITATED;
    }

    public boolean usesFacilitators() {
        return this == MULTI_FACILITATED;
    }
}
