/*
 * SSMDE — Align & Stamp Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.ssmde.cli;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class CliOptionsTest {

    @Test
    void parse_defaults() {
        CliOptions o = CliOptions.parse(new String[0]);
        assertFalse(o.demo());
        assertFalse(o.singleRecordRequested());
        assertEquals(CliOptions.DEFAULT_EXAMPLES, o.examples());
        assertNull(o.seed());
        assertEquals("", o.manifestFrom());
    }

    @Test
    void parse_valuesAndFlags() {
        CliOptions o = CliOptions.parse(new String[]{
                "--value", "{\"x\":1}", "--a_raw=[-0.6,-0.64]", "--prev", "abcdef0123",
                "--pretty", "--examples", "3", "--seed", "7", "--manifest-validate"});
        assertEquals("{\"x\":1}", o.value());
        assertEquals("[-0.6,-0.64]", o.aRaw());
        assertEquals("abcdef0123", o.prev());
        assertTrue(o.pretty());
        assertTrue(o.manifestValidate());
        assertEquals(3, o.examples());
        assertEquals(7L, o.seed());
        assertTrue(o.singleRecordRequested());
    }

    @Test
    void parse_rejectsBadArguments() {
        assertThrows(CliUsageException.class, () -> CliOptions.parse(new String[]{"--nope"}));
        assertThrows(CliUsageException.class, () -> CliOptions.parse(new String[]{"--value"}));
        assertThrows(CliUsageException.class, () -> CliOptions.parse(new String[]{"--examples", "many"}));
        assertThrows(CliUsageException.class, () -> CliOptions.parse(new String[]{"--examples", "-1"}));
        assertThrows(CliUsageException.class, () -> CliOptions.parse(new String[]{"--demo=yes"}));
        assertThrows(CliUsageException.class, () -> CliOptions.parse(new String[]{"stray"}));
    }
}
