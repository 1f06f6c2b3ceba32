package astgen.asts;

import org.junit.jupiter.api.Test;

import static astgen.asts.DispatchStrategy.*;
import static org.junit.jupiter.api.Assertions.*;

public class DispatchStrategyTest {

    @Test
    public void testDecisionTable() {
        assertEquals(SINGLE_GENERIC, select(1, true));
        assertEquals(SINGLE_FIXED, select(1, false));
        assertEquals(MULTI_DIRECT, select(2, true));
        assertEquals(MULTI_FACILITATED, select(2, false));
        assertEquals(MULTI_FACILITATED, select(5, false));
    }

    @Test
    public void testOnlyMultiWithoutGenericsUsesFacilitators() {
        assertTrue(MULTI_FACILITATED.usesFacilitators());
        assertFalse(MULTI_DIRECT.usesFacilitators());
        assertFalse(SINGLE_FIXED.usesFacilitators());
        assertFalse(SINGLE_GENERIC.usesFacilitators());
        assertTrue(MULTI_DIRECT.isMulti());
        assertFalse(SINGLE_GENERIC.isMulti());
    }

    @Test
    public void testNoResultType() {
        assertThrows(IllegalArgumentException.class, () -> select(0, true));
    }
}
