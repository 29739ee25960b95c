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
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * One record request: {@code {value: object, a_raw: [numbers], weights?: [numbers], prev?: hex}}.
 */
public record RecordInput(JsonNode value, double[] series, double[] weights, String prev) {

    public static RecordInput fromJson(JsonNode node) {
        if (node == null || !node.isObject()) {
            throw new InvalidRecordException("input line must be a JSON object");
        }
        JsonNode value = node.get("value");
        if (value == null || !value.isObject()) {
            throw new InvalidRecordException("'value' must be a JSON object");
        }
        double[] series = parseSeries(node.get("a_raw"), "a_raw");
        double[] weights = null;
        JsonNode w = node.get("weights");
        if (w != null && !w.isNull()) {
            weights = parseSeries(w, "weights");
            requireMatchingLength(series, weights);
        }
        JsonNode prev = node.get("prev");
        String prevText = prev != null && prev.isTextual() && !prev.textValue().isBlank() ? prev.textValue() : null;
        return new RecordInput(value, series, weights, prevText);
    }

    /**
     * Builds a request from the separate command line arguments.
     */
    public static RecordInput fromArguments(String valueJson, String seriesJson, String weightsJson, String prev) {
        JsonNode value = readJson(valueJson, "value");
        if (!value.isObject()) {
            throw new InvalidRecordException("value must be a JSON object");
        }
        double[] series = parseSeries(readJson(seriesJson, "a_raw"), "a_raw");
        double[] weights = null;
        if (weightsJson != null && !weightsJson.isBlank()) {
            weights = parseSeries(readJson(weightsJson, "weights"), "weights");
            requireMatchingLength(series, weights);
        }
        return new RecordInput(value, series, weights, prev == null || prev.isBlank() ? null : prev);
    }

    static double[] parseSeries(JsonNode node, String field) {
        if (node == null || !node.isArray() || node.isEmpty()) {
            throw new InvalidRecordException("'" + field + "' must be a JSON list with at least one element");
        }
        double[] out = new double[node.size()];
        for (int i = 0; i < out.length; i++) {
            JsonNode v = node.get(i);
            if (!v.isNumber()) {
                throw new InvalidRecordException("'" + field + "'[" + i + "] is not a number: " + v);
            }
            out[i] = v.doubleValue();
        }
        return out;
    }

    private static void requireMatchingLength(double[] series, double[] weights) {
        if (weights.length != series.length) {
            throw new InvalidRecordException("weights length must match a_raw length ("
                    + weights.length + " != " + series.length + ")");
        }
    }

    private static JsonNode readJson(String text, String field) {
        if (text == null || text.isBlank()) {
            throw new InvalidRecordException("'" + field + "' is required");
        }
        try {
            return CanonicalJson.mapper().readTree(text);
        } catch (JsonProcessingException e) {
            throw new InvalidRecordException("'" + field + "' is not valid JSON: " + e.getOriginalMessage(), e);
        }
    }
}
