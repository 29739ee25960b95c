/*
 * SSMDE — Align & Stamp Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.ssmde.cli;

import ai.evacortex.ssmde.core.manifest.Manifest;
import ai.evacortex.ssmde.core.record.AlignRecord;
import ai.evacortex.ssmde.core.record.RecordBuilder;
import ai.evacortex.ssmde.core.stamp.RecordStamper;
import ai.evacortex.ssmde.core.verify.ChainVerifier;
import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

class ExampleGeneratorTest {

    private final RecordBuilder builder = new RecordBuilder(new RecordStamper(
            Clock.fixed(Instant.parse("2025-03-14T12:00:00Z"), ZoneOffset.UTC)));

    @Test
    void generate_producesChainedRecordsNearTargets() {
        List<AlignRecord> records = new ExampleGenerator(builder, new Random(7L)).generate(Manifest.DEFAULT, 12);
        assertEquals(12, records.size());

        assertNull(records.get(0).stamp().previous());
        for (int i = 1; i < records.size(); i++) {
            assertEquals(records.get(i - 1).chainDigest(), records.get(i).stamp().previous());
        }

        assertEquals(-0.60, records.get(0).align(), ExampleGenerator.JITTER + 1e-9);
        assertEquals("AMBER", records.get(0).band());
        assertEquals("CRITICAL", records.get(7).band());
        assertEquals("A++", records.get(4).band());

        List<JsonNode> json = records.stream().map(r -> (JsonNode) r.toJson()).toList();
        assertTrue(ChainVerifier.verify(json).intact());
    }

    @Test
    void generate_isReproducibleForSeed() {
        List<AlignRecord> a = new ExampleGenerator(builder, new Random(99L)).generate(Manifest.DEFAULT, 5);
        List<AlignRecord> b = new ExampleGenerator(builder, new Random(99L)).generate(Manifest.DEFAULT, 5);
        for (int i = 0; i < a.size(); i++) {
            assertEquals(a.get(i).toCanonicalJson(), b.get(i).toCanonicalJson());
        }
    }
}
