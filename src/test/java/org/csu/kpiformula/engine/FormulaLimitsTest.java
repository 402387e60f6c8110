package org.csu.kpiformula.engine;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class FormulaLimitsTest {

    @Test
    void testUnlimitedByDefault() {
        assertTrue(FormulaLimits.UNLIMITED.isUnlimited());
        assertSame(FormulaLimits.UNLIMITED, new FormulaEngine().getLimits());
        assertEquals("FormulaLimits[maxLength=unlimited, maxDepth=unlimited]", FormulaLimits.UNLIMITED.toString());
    }

    @Test
    void testExplicitLimits() {
        FormulaLimits limits = new FormulaLimits(200, 16);
        assertFalse(limits.isUnlimited());
        assertEquals(200, limits.getMaxLength());
        assertEquals(16, limits.getMaxDepth());
        assertEquals("FormulaLimits[maxLength=200, maxDepth=16]", limits.toString());
    }

    @Test
    void testNegativeLimitsAreRejected() {
        assertThrows(IllegalArgumentException.class, () -> new FormulaLimits(-1, 0));
        assertThrows(IllegalArgumentException.class, () -> new FormulaLimits(0, -1));
    }
}
