package astgen.asts;

/**
 * The type mapper of a backend has no rule for a field type or result kind.
 */
public class UnmappedTypeException extends GenerationException {

    public UnmappedTypeException(String backend, String family, Object typ) {
        super(backend + " has no mapping for type " + typ + " in family " + family);
    }
}
