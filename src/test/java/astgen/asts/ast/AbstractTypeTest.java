package astgen.asts.ast;

import org.junit.jupiter.api.Test;

import static astgen.asts.ast.AbstractType.*;
import static org.junit.jupiter.api.Assertions.*;

public class AbstractTypeTest {

    private static final Matcher<String> KIND = new Matcher<String>() {
        @Override
        public String case_Self(Self t) {
            return "self";
        }

        @Override
        public String case_OtherFamily(OtherFamily t) {
            return "family " + t.getName();
        }

        @Override
        public String case_SpecificVariant(SpecificVariant t) {
            return "variant " + t.getName();
        }

        @Override
        public String case_Opaque(Opaque t) {
            return "opaque " + t.getName();
        }

        @Override
        public String case_Dynamic(Dynamic t) {
            return "dynamic " + t.getName();
        }

        @Override
        public String case_Sequence(Sequence t) {
            return "list of " + t.getInner().match(this);
        }
    };

    @Test
    public void testMatchDispatchesOnVariant() {
        assertEquals("self", self().match(KIND));
        assertEquals("family Expression", otherFamily("Expression").match(KIND));
        assertEquals("variant Function", specificVariant("Function").match(KIND));
        assertEquals("opaque Token", token().match(KIND));
        assertEquals("dynamic Object", object().match(KIND));
        assertEquals("list of list of opaque Token", sequence(sequence(token())).match(KIND));
    }

    @Test
    public void testToString() {
        assertEquals("List[Self]", sequence(self()).toString());
        assertEquals("List[Variant<Function>]", sequence(specificVariant("Function")).toString());
        assertEquals("Token", token().toString());
        assertEquals("Object", object().toString());
    }

    @Test
    public void testEquality() {
        assertEquals(sequence(token()), sequence(opaque("Token")));
        assertEquals(self(), self());
        assertNotEquals(opaque("Token"), dynamic("Token"));
        assertNotEquals(otherFamily("Variable"), specificVariant("Variable"));
        assertEquals(specificVariant("Function").hashCode(), specificVariant("Function").hashCode());
    }

    @Test
    public void testEmptyNamesRejected() {
        assertThrows(IllegalArgumentException.class, () -> opaque(""));
        assertThrows(IllegalArgumentException.class, () -> specificVariant(null));
        assertThrows(NullPointerException.class, () -> sequence(null));
    }
}
