/*
 * SSMDE — Align & Stamp Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.ssmde.core.json;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class CanonicalJsonTest {

    @Test
    void write_sortsKeysRecursivelyWithCompactSeparators() throws Exception {
        JsonNode node = CanonicalJson.mapper().readTree(
                "{ \"b\": 1, \"a\": { \"d\": [ {\"z\": 1, \"y\": 2} ], \"c\": \"x\" } }");
        assertEquals("{\"a\":{\"c\":\"x\",\"d\":[{\"y\":2,\"z\":1}]},\"b\":1}", CanonicalJson.write(node));
    }

    @Test
    void write_isIndependentOfInsertionOrder() {
        ObjectNode first = CanonicalJson.newObject().put("temp_K", 315.3).put("strain_micro", 220.5);
        ObjectNode second = CanonicalJson.newObject().put("strain_micro", 220.5).put("temp_K", 315.3);
        assertEquals(CanonicalJson.write(first), CanonicalJson.write(second));
    }

    @Test
    void write_escapesNonAscii() {
        ObjectNode node = CanonicalJson.newObject().put("site", "Zürich");
        String json = CanonicalJson.write(node);
        assertFalse(json.contains("ü"));
        assertTrue(json.toLowerCase().contains("\\u00fc"));
    }

    @Test
    void sorted_leavesTheInputUntouched() {
        ObjectNode node = CanonicalJson.newObject().put("b", 1).put("a", 2);
        CanonicalJson.sorted(node);
        assertEquals("b", node.fieldNames().next());
    }
}
