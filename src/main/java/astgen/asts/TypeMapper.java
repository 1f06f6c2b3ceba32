package astgen.asts;

import astgen.asts.ast.AbstractType;
import astgen.asts.ast.Family;
import com.google.common.collect.ImmutableList;

/**
 * Resolves placeholder types to target type names. Implementations are pure
 * functions of the schema and may be called from several threads.
 */
public interface TypeMapper {

    /**
     * @throws UnmappedTypeException if the target has no rule for the type
     */
    String map(Family family, AbstractType typ);

    /**
     * Result types of the visitors over the family, in declaration order.
     *
     * @throws UnmappedTypeException if a result kind has no rule
     */
    ImmutableList<ResultType> constraintsFor(Family family);
}
