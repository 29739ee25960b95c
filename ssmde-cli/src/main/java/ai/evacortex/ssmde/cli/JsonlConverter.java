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
import ai.evacortex.ssmde.core.json.CanonicalJson;
import ai.evacortex.ssmde.core.manifest.Manifest;
import ai.evacortex.ssmde.core.record.AlignRecord;
import ai.evacortex.ssmde.core.record.RecordBuilder;
import ai.evacortex.ssmde.core.record.RecordChain;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Line-oriented JSON helpers: converting request lines into chained records and reading
 * record files back.
 */
public class JsonlConverter {

    private static final Logger log = LoggerFactory.getLogger(JsonlConverter.class);

    private final RecordBuilder builder;

    public JsonlConverter(RecordBuilder builder) {
        this.builder = builder;
    }

    /**
     * Reads {@code {value, a_raw, weights?, prev?}} lines from {@code in} and writes one canonical
     * record per line to {@code out}. Records form one chain; a line's own {@code prev} overrides
     * the link to the preceding record. Blank lines are skipped.
     *
     * @return number of records written
     */
    public int convert(Path in, Path out, Manifest manifest) {
        RecordChain chain = RecordChain.start(builder, manifest);
        int lineNo = 0;
        try (BufferedReader reader = Files.newBufferedReader(in, StandardCharsets.UTF_8);
             BufferedWriter writer = Files.newBufferedWriter(out, StandardCharsets.UTF_8)) {
            String line;
            while ((line = reader.readLine()) != null) {
                lineNo++;
                if (line.isBlank()) continue;

                RecordInput input;
                try {
                    input = RecordInput.fromJson(parseLine(line, lineNo));
                } catch (InvalidRecordException e) {
                    throw new InvalidRecordException("line " + lineNo + ": " + e.getMessage(), e);
                }
                AlignRecord record = chain.append(input.value(), input.series(), input.weights(), input.prev());
                writer.write(record.toCanonicalJson());
                writer.newLine();
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to convert " + in + " -> " + out, e);
        }
        log.info("Converted {} record(s) from {} to {}", chain.length(), in, out);
        return (int) chain.length();
    }

    public static List<JsonNode> readRecords(Path path) {
        List<JsonNode> out = new ArrayList<>();
        int lineNo = 0;
        try (BufferedReader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            String line;
            while ((line = reader.readLine()) != null) {
                lineNo++;
                if (line.isBlank()) continue;
                out.add(parseLine(line, lineNo));
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + path, e);
        }
        return out;
    }

    public static void writeRecords(Path path, List<AlignRecord> records) {
        try (BufferedWriter writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8)) {
            for (AlignRecord r : records) {
                writer.write(r.toCanonicalJson());
                writer.newLine();
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write " + path, e);
        }
    }

    public static void writeJson(Path path, JsonNode node) {
        try {
            Files.writeString(path, CanonicalJson.pretty(node) + System.lineSeparator(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write " + path, e);
        }
    }

    private static JsonNode parseLine(String line, int lineNo) {
        try {
            return CanonicalJson.mapper().readTree(line);
        } catch (JsonProcessingException e) {
            throw new InvalidRecordException("line " + lineNo + " is not valid JSON: " + e.getOriginalMessage(), e);
        }
    }
}
