package astgen.asts;

import com.google.common.base.Joiner;

import java.util.List;

/**
 * A field refers to a node kind or family that no family of the schema declares.
 */
public class UnresolvedReferenceException extends GenerationException {

    public UnresolvedReferenceException(String family, List<String> undefined) {
        super("Undefined references in family " + family + ":\n  - "
                + Joiner.on("\n  - ").join(undefined));
    }
}
