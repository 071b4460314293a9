package com.raditha.flowcheck.fix;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import static org.junit.jupiter.api.Assertions.*;

class FixModeTest {

    @Test
    void testFromString() {
        assertEquals(FixMode.INTERACTIVE, FixMode.fromString("interactive"));
        assertEquals(FixMode.BATCH, FixMode.fromString("BATCH"));
        assertEquals(FixMode.DRY_RUN, FixMode.fromString("Dry-Run"));
    }

    @Test
    void testInvalidValues() {
        assertThrows(IllegalArgumentException.class, () -> FixMode.fromString(null));
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> FixMode.fromString("dry_run"));
        assertTrue(e.getMessage().contains("expected one of: interactive, batch, dry-run"), e.getMessage());
    }

    @ParameterizedTest
    @EnumSource(FixMode.class)
    void testCliStringRoundTrip(FixMode mode) {
        assertEquals(mode, FixMode.fromString(mode.toCliString()));
    }
}
