/*
 * SSMDE — Align & Stamp Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.ssmde.cli;

import ai.evacortex.ssmde.core.exceptions.InvalidRecordException;
import ai.evacortex.ssmde.core.manifest.Manifest;
import ai.evacortex.ssmde.core.record.RecordBuilder;
import ai.evacortex.ssmde.core.stamp.RecordStamper;
import ai.evacortex.ssmde.core.stamp.Stamp;
import ai.evacortex.ssmde.core.util.HashingUtil;
import ai.evacortex.ssmde.core.verify.ChainVerifier;
import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class JsonlConverterTest {

    @TempDir
    Path tempDir;

    private final JsonlConverter converter = new JsonlConverter(new RecordBuilder(new RecordStamper(
            Clock.fixed(Instant.parse("2025-03-14T12:00:00Z"), ZoneOffset.UTC))));

    @Test
    void convert_writesChainedCanonicalRecords() throws Exception {
        Path in = tempDir.resolve("in.jsonl");
        Path out = tempDir.resolve("out.jsonl");
        Files.write(in, List.of(
                "{\"value\":{\"temperature_K\":279.9},\"a_raw\":[-0.6,-0.64,-0.62]}",
                "",
                "{\"value\":{\"spo2\":0.95},\"a_raw\":[0.75,0.76,0.74]}",
                "{\"value\":{\"co2_ppm\":980},\"a_raw\":[0.1,0.9],\"weights\":[3,1]}"));

        assertEquals(3, converter.convert(in, out, Manifest.DEFAULT));

        List<String> lines = Files.readAllLines(out);
        assertEquals(3, lines.size());
        assertTrue(lines.get(0).startsWith("{\"align\":"));

        List<JsonNode> records = JsonlConverter.readRecords(out);
        assertEquals("AMBER", records.get(0).get("band").asText());
        assertEquals("A++", records.get(1).get("band").asText());

        Stamp first = Stamp.parse(records.get(0).get("stamp").asText());
        Stamp second = Stamp.parse(records.get(1).get("stamp").asText());
        assertNull(first.previous());
        assertEquals(HashingUtil.sha256Hex(records.get(0).get("stamp").asText()), second.previous());

        assertTrue(ChainVerifier.verify(records).intact());
    }

    @Test
    void convert_honorsExplicitPrevPerLine() throws Exception {
        Path in = tempDir.resolve("in.jsonl");
        Path out = tempDir.resolve("out.jsonl");
        String external = HashingUtil.sha256Hex("upstream");
        Files.write(in, List.of("{\"value\":{\"x\":1},\"a_raw\":[0.1],\"prev\":\"" + external + "\"}"));

        converter.convert(in, out, Manifest.DEFAULT);
        JsonNode rec = JsonlConverter.readRecords(out).get(0);
        assertTrue(rec.get("stamp").asText().endsWith("|prev=" + external));
    }

    @Test
    void convert_failsFastWithLineNumber() throws Exception {
        Path out = tempDir.resolve("out.jsonl");

        Path notObject = tempDir.resolve("a.jsonl");
        Files.write(notObject, List.of("{\"value\":{\"x\":1},\"a_raw\":[0.1]}", "{\"value\":[1],\"a_raw\":[0.1]}"));
        InvalidRecordException e = assertThrows(InvalidRecordException.class,
                () -> converter.convert(notObject, out, Manifest.DEFAULT));
        assertTrue(e.getMessage().contains("line 2"));

        Path badJson = tempDir.resolve("b.jsonl");
        Files.write(badJson, List.of("{\"value\":"));
        assertThrows(InvalidRecordException.class, () -> converter.convert(badJson, out, Manifest.DEFAULT));

        Path noSeries = tempDir.resolve("c.jsonl");
        Files.write(noSeries, List.of("{\"value\":{\"x\":1},\"a_raw\":[]}"));
        assertThrows(InvalidRecordException.class, () -> converter.convert(noSeries, out, Manifest.DEFAULT));

        Path mismatch = tempDir.resolve("d.jsonl");
        Files.write(mismatch, List.of("{\"value\":{\"x\":1},\"a_raw\":[0.1,0.2],\"weights\":[1]}"));
        assertThrows(InvalidRecordException.class, () -> converter.convert(mismatch, out, Manifest.DEFAULT));
    }

    @Test
    void recordInput_fromArgumentsValidatesShapes() {
        RecordInput input = RecordInput.fromArguments("{\"x\":1}", "[0.1,0.2]", "[1,2]", "");
        assertEquals(2, input.series().length);
        assertEquals(2.0, input.weights()[1]);
        assertNull(input.prev());

        assertThrows(InvalidRecordException.class, () -> RecordInput.fromArguments("[1]", "[0.1]", "", ""));
        assertThrows(InvalidRecordException.class, () -> RecordInput.fromArguments("{\"x\":1}", "0.1", "", ""));
        assertThrows(InvalidRecordException.class,
                () -> RecordInput.fromArguments("{\"x\":1}", "[0.1, \"a\"]", "", ""));
        assertThrows(InvalidRecordException.class, () -> RecordInput.fromArguments("{\"x\":", "[0.1]", "", ""));
    }
}
