package astgen.targets;

import astgen.asts.ResultType;
import astgen.asts.TypeMapper;
import astgen.asts.UnmappedTypeException;
import astgen.asts.UnresolvedReferenceException;
import astgen.asts.ast.AbstractType;
import astgen.asts.ast.Family;
import astgen.asts.ast.LoxSchema;
import astgen.asts.ast.Schema;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

public class JavaTypeMapper implements TypeMapper {

    private static final ImmutableMap<String, ResultType> RESULT_TYPES = ImmutableMap.of(
            LoxSchema.TEXT, new ResultType("String", "String"),
            LoxSchema.VALUE, new ResultType("Value", "Object"));

    private final Schema schema;

    public JavaTypeMapper(Schema schema) {
        this.schema = schema;
    }

    @Override
    public String map(Family family, AbstractType typ) {
        return typ.match(new AbstractType.Matcher<String>() {
            @Override
            public String case_Self(AbstractType.Self t) {
                return family.getName();
            }

            @Override
            public String case_OtherFamily(AbstractType.OtherFamily t) {
                return t.getName();
            }

            @Override
            public String case_SpecificVariant(AbstractType.SpecificVariant t) {
                Schema.Variant v = schema.resolveVariant(family, t.getName())
                        .orElseThrow(() -> new UnresolvedReferenceException(family.getName(),
                                ImmutableList.of("node kind '" + t.getName() + "'")));
                // node types are nested in the interface of their family
                if (v.family.getName().equals(family.getName())) {
                    return v.getTypeName();
                }
                return v.family.getName() + "." + v.getTypeName();
            }

            @Override
            public String case_Opaque(AbstractType.Opaque t) {
                if (t.getName().equals(AbstractType.TOKEN)) {
                    return "Token";
                }
                throw new UnmappedTypeException("java", family.getName(), t);
            }

            @Override
            public String case_Dynamic(AbstractType.Dynamic t) {
                if (t.getName().equals(AbstractType.OBJECT)) {
                    return "Object";
                }
                throw new UnmappedTypeException("java", family.getName(), t);
            }

            @Override
            public String case_Sequence(AbstractType.Sequence t) {
                return "List<" + map(family, t.getInner()) + ">";
            }
        });
    }

    @Override
    public ImmutableList<ResultType> constraintsFor(Family family) {
        ImmutableList.Builder<ResultType> result = ImmutableList.builder();
        for (String kind : family.getResultKinds()) {
            ResultType r = RESULT_TYPES.get(kind);
            if (r == null) {
                throw new UnmappedTypeException("java", family.getName(), "result kind " + kind);
            }
            result.add(r);
        }
        return result.build();
    }
}
