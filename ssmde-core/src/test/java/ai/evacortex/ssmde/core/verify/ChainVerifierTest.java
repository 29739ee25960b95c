/*
 * SSMDE — Align & Stamp Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.ssmde.core.verify;

import ai.evacortex.ssmde.core.RecordTestUtils;
import ai.evacortex.ssmde.core.json.CanonicalJson;
import ai.evacortex.ssmde.core.manifest.Manifest;
import ai.evacortex.ssmde.core.record.AlignRecord;
import ai.evacortex.ssmde.core.record.RecordBuilder;
import ai.evacortex.ssmde.core.record.RecordChain;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ChainVerifierTest {

    private List<ObjectNode> records;

    @BeforeEach
    void setUp() throws Exception {
        RecordBuilder builder = RecordTestUtils.builderAt("2025-03-14T08:00:00Z");
        RecordChain chain = RecordChain.start(builder, Manifest.DEFAULT);
        records = new ArrayList<>();
        for (int i = 0; i < 4; i++) {
            AlignRecord r = chain.append(RecordTestUtils.payload("reading", i), new double[]{-0.2 * i, 0.1});
            // round-trip through text, as a verifier would see a JSONL file
            records.add((ObjectNode) CanonicalJson.mapper().readTree(r.toCanonicalJson()));
        }
    }

    @Test
    void verify_acceptsIntactChain() {
        ChainVerification result = ChainVerifier.verify(records);
        assertTrue(result.intact(), () -> result.issues().toString());
        assertEquals(4, result.checked());
        assertEquals(1, result.segments());
    }

    @Test
    void verify_detectsTamperedContent() {
        records.get(2).put("band", "A++");
        ChainVerification result = ChainVerifier.verify(records);
        assertFalse(result.intact());
        assertEquals(1, result.issues().size());
        assertEquals(2, result.issues().get(0).index());
        assertTrue(result.issues().get(0).message().contains("content digest mismatch"));
    }

    @Test
    void verify_detectsRemovedRecord() {
        records.remove(1);
        ChainVerification result = ChainVerifier.verify(records);
        assertFalse(result.intact());
        assertEquals(1, result.issues().get(0).index());
        assertTrue(result.issues().get(0).message().contains("chain break"));
    }

    @Test
    void verify_reportsMalformedAndMissingStamps() {
        records.get(1).put("stamp", "SSMCLOCK1|garbage");
        records.get(3).remove("stamp");
        ChainVerification result = ChainVerifier.verify(records);

        List<Integer> indexes = result.issues().stream().map(ChainVerification.Issue::index).toList();
        assertEquals(List.of(1, 2, 3), indexes);
    }

    @Test
    void verify_countsRestartedChainsAsSegments() {
        RecordBuilder builder = RecordTestUtils.builderAt("2025-03-14T09:00:00Z");
        AlignRecord fresh = builder.build(RecordTestUtils.payload("reading", 9), new double[]{0.3}, Manifest.DEFAULT);
        List<JsonNode> all = new ArrayList<>(records);
        all.add(fresh.toJson());

        ChainVerification result = ChainVerifier.verify(all);
        assertTrue(result.intact());
        assertEquals(2, result.segments());
    }
}
