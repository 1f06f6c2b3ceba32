package astgen.asts;

public class InvalidResultConstraintException extends GenerationException {

    public InvalidResultConstraintException(String family) {
        super("Family " + family + " declares no result kind, visitors need at least one.");
    }
}
