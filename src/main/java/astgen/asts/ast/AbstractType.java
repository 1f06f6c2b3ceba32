package astgen.asts.ast;

import com.google.common.base.Preconditions;

import java.util.Objects;

/**
 * Placeholder type of a node field. The set of variants is closed: every
 * consumer handles all of them through {@link Matcher}.
 */
public abstract class AbstractType {

    public static final String TOKEN = "Token";
    public static final String OBJECT = "Object";

    private static final Self SELF = new Self();

    private AbstractType() {
    }

    public abstract <T> T match(Matcher<T> matcher);

    public interface Matcher<T> {
        T case_Self(Self t);

        T case_OtherFamily(OtherFamily t);

        T case_SpecificVariant(SpecificVariant t);

        T case_Opaque(Opaque t);

        T case_Dynamic(Dynamic t);

        T case_Sequence(Sequence t);
    }

    public static Self self() {
        return SELF;
    }

    public static OtherFamily otherFamily(String name) {
        return new OtherFamily(name);
    }

    public static SpecificVariant specificVariant(String name) {
        return new SpecificVariant(name);
    }

    public static Opaque token() {
        return new Opaque(TOKEN);
    }

    public static Opaque opaque(String name) {
        return new Opaque(name);
    }

    public static Dynamic object() {
        return new Dynamic(OBJECT);
    }

    public static Dynamic dynamic(String name) {
        return new Dynamic(name);
    }

    public static Sequence sequence(AbstractType inner) {
        return new Sequence(inner);
    }

    /** a node of the same family */
    public static final class Self extends AbstractType {
        private Self() {
        }

        @Override
        public <T> T match(Matcher<T> matcher) {
            return matcher.case_Self(this);
        }

        @Override
        public String toString() {
            return "Self";
        }
    }

    /** a node of another, fixed family */
    public static final class OtherFamily extends AbstractType {
        private final String name;

        private OtherFamily(String name) {
            this.name = checkName(name);
        }

        public String getName() {
            return name;
        }

        @Override
        public <T> T match(Matcher<T> matcher) {
            return matcher.case_OtherFamily(this);
        }

        @Override
        public boolean equals(Object obj) {
            return obj instanceof OtherFamily && ((OtherFamily) obj).name.equals(name);
        }

        @Override
        public int hashCode() {
            return Objects.hash("OtherFamily", name);
        }

        @Override
        public String toString() {
            return name;
        }
    }

    /** exactly one node definition instead of the whole family */
    public static final class SpecificVariant extends AbstractType {
        private final String name;

        private SpecificVariant(String name) {
            this.name = checkName(name);
        }

        public String getName() {
            return name;
        }

        @Override
        public <T> T match(Matcher<T> matcher) {
            return matcher.case_SpecificVariant(this);
        }

        @Override
        public boolean equals(Object obj) {
            return obj instanceof SpecificVariant && ((SpecificVariant) obj).name.equals(name);
        }

        @Override
        public int hashCode() {
            return Objects.hash("SpecificVariant", name);
        }

        @Override
        public String toString() {
            return "Variant<" + name + ">";
        }
    }

    /** external lexical type, e.g. Token */
    public static final class Opaque extends AbstractType {
        private final String name;

        private Opaque(String name) {
            this.name = checkName(name);
        }

        public String getName() {
            return name;
        }

        @Override
        public <T> T match(Matcher<T> matcher) {
            return matcher.case_Opaque(this);
        }

        @Override
        public boolean equals(Object obj) {
            return obj instanceof Opaque && ((Opaque) obj).name.equals(name);
        }

        @Override
        public int hashCode() {
            return Objects.hash("Opaque", name);
        }

        @Override
        public String toString() {
            return name;
        }
    }

    /** runtime value of unknown type, e.g. Object */
    public static final class Dynamic extends AbstractType {
        private final String name;

        private Dynamic(String name) {
            this.name = checkName(name);
        }

        public String getName() {
            return name;
        }

        @Override
        public <T> T match(Matcher<T> matcher) {
            return matcher.case_Dynamic(this);
        }

        @Override
        public boolean equals(Object obj) {
            return obj instanceof Dynamic && ((Dynamic) obj).name.equals(name);
        }

        @Override
        public int hashCode() {
            return Objects.hash("Dynamic", name);
        }

        @Override
        public String toString() {
            return name;
        }
    }

    public static final class Sequence extends AbstractType {
        private final AbstractType inner;

        private Sequence(AbstractType inner) {
            this.inner = Preconditions.checkNotNull(inner, "inner");
        }

        public AbstractType getInner() {
            return inner;
        }

        @Override
        public <T> T match(Matcher<T> matcher) {
            return matcher.case_Sequence(this);
        }

        @Override
        public boolean equals(Object obj) {
            return obj instanceof Sequence && ((Sequence) obj).inner.equals(inner);
        }

        @Override
        public int hashCode() {
            return Objects.hash("Sequence", inner);
        }

        @Override
        public String toString() {
            return "List[" + inner + "]";
        }
    }

    private static String checkName(String name) {
        Preconditions.checkArgument(name != null && !name.isEmpty(), "type name must not be empty");
        return name;
    }
}
