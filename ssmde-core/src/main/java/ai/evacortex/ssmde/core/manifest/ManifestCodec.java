/*
 * SSMDE — Align & Stamp Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.ssmde.core.manifest;

import ai.evacortex.ssmde.core.exceptions.InvalidManifestException;
import ai.evacortex.ssmde.core.json.CanonicalJson;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Reads manifests from JSON and renders their effective and template forms.
 *
 * <p>Field precedence for the epsilons is {@code align_computation.eps_*}, then the top-level
 * {@code eps_*}, then the built-in default. Missing bands fall back to the default band set.</p>
 */
public final class ManifestCodec {

    private static final Logger log = LoggerFactory.getLogger(ManifestCodec.class);

    private ManifestCodec() {}

    /**
     * Loads a manifest from a file when {@code source} names an existing file, otherwise parses
     * {@code source} as inline JSON.
     */
    public static Manifest load(String source) {
        Objects.requireNonNull(source, "source must not be null");
        Path path = asExistingFile(source);
        return path != null ? read(path) : parse(source);
    }

    public static Manifest read(Path path) {
        ObjectMapper mapper = CanonicalJson.mapper();
        try (InputStream in = Files.newInputStream(path)) {
            Manifest manifest = fromTree(mapper.readTree(in));
            log.debug("Loaded manifest '{}' from {}", manifest.manifestId(), path);
            return manifest;
        } catch (JsonProcessingException e) {
            throw new InvalidManifestException("malformed JSON in " + path + ": " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read manifest " + path, e);
        }
    }

    public static Manifest parse(String json) {
        try {
            return fromTree(CanonicalJson.mapper().readTree(json));
        } catch (JsonProcessingException e) {
            throw new InvalidManifestException("malformed JSON: " + e.getOriginalMessage(), e);
        }
    }

    public static Manifest fromTree(JsonNode root) {
        if (root == null || !root.isObject()) {
            throw new InvalidManifestException("manifest must be a JSON object");
        }

        ManifestDocument doc;
        try {
            doc = CanonicalJson.mapper().treeToValue(root, ManifestDocument.class);
        } catch (JsonProcessingException e) {
            throw new InvalidManifestException(e.getOriginalMessage(), e);
        }

        Manifest defaults = Manifest.DEFAULT;
        String id = doc.manifestId() != null ? doc.manifestId() : defaults.manifestId();

        ManifestDocument.AlignComputation ac = doc.alignComputation();
        double epsA = firstNonNull(ac != null ? ac.epsA() : null, doc.epsA(), defaults.epsA());
        double epsW = firstNonNull(ac != null ? ac.epsW() : null, doc.epsW(), defaults.epsW());

        List<Band> bands = readBands(doc.bands(), "bands");
        if (bands.isEmpty()) bands = readBands(doc.bandsTuple(), "bands_tuple");
        if (bands.isEmpty()) bands = defaults.bands();

        return new Manifest(id, bands, epsA, epsW);
    }

    /**
     * {@code {manifest_id, eps_a, eps_w, bands_tuple}}, in declaration order.
     */
    public static ObjectNode toEffectiveJson(Manifest manifest) {
        ObjectNode root = CanonicalJson.newObject();
        root.put("manifest_id", manifest.manifestId());
        root.put("eps_a", manifest.epsA());
        root.put("eps_w", manifest.epsW());
        ArrayNode tuples = root.putArray("bands_tuple");
        for (Band b : manifest.bands()) {
            tuples.addArray().add(b.name()).add(b.lower()).add(b.upper());
        }
        return root;
    }

    /**
     * A documented sample manifest built around the default band set.
     */
    public static ObjectNode template() {
        Manifest m = Manifest.DEFAULT;
        ObjectNode root = CanonicalJson.newObject();
        root.put("manifest_id", m.manifestId());
        root.put("domain", "Industrial/Mechanical");
        root.put("description", "Bearing health policy for Plant A, Line 3. "
                + "Align via clamp->atanh->accumulate->tanh; bands carry escalation promises.");

        ObjectNode ac = root.putObject("align_computation");
        ac.put("eps_a", m.epsA());
        ac.put("eps_w", m.epsW());
        ac.put("weights", "uniform");
        ac.putArray("pipeline")
                .add("a_c := clamp(a_raw, -1+eps_a, +1-eps_a)")
                .add("u := atanh(a_c)")
                .add("U += w * u ; W += w")
                .add("align := tanh( U / max(W, eps_w) )");

        ArrayNode bands = root.putArray("bands");
        addTemplateBand(bands, "A++", 0.70, 1.00, "no action", "none");
        addTemplateBand(bands, "A0", -0.30, 0.70, "monitor only", "inspect in <= 8h");
        addTemplateBand(bands, "AMBER", -0.80, -0.30, "inspect", "inspect in <= 30 min");
        addTemplateBand(bands, "CRITICAL", -1.00, -0.80, "stop/evacuate", "human respond in <= 10 min");

        root.put("escalation_owner", "Plant Safety Officer");
        root.put("policy_author", "Reliability Board");
        root.put("policy_version", "v7");
        root.put("revision_notes", "Updated AMBER window from 60 min to 30 min");
        return root;
    }

    private static void addTemplateBand(ArrayNode bands, String name, double lo, double hi,
                                        String action, String window) {
        ObjectNode b = bands.addObject();
        b.put("name", name);
        b.put("align_min", lo);
        b.put("align_max", hi);
        b.put("action", action);
        b.put("window", window);
    }

    static List<Band> readBands(JsonNode node, String field) {
        if (node == null || node.isNull()) return List.of();
        if (!node.isArray()) {
            throw new InvalidManifestException("'" + field + "' must be a list");
        }
        if (node.isEmpty()) return List.of();

        List<Band> out = new ArrayList<>(node.size());
        boolean objects = node.get(0).isObject();
        for (int i = 0; i < node.size(); i++) {
            JsonNode entry = node.get(i);
            String where = field + "[" + i + "]";
            if (objects) {
                if (!entry.isObject()) {
                    throw new InvalidManifestException(where + " must be an object like the first entry");
                }
                out.add(new Band(
                        requireText(entry.get("name"), where + ".name"),
                        requireNumber(entry.get("align_min"), where + ".align_min"),
                        requireNumber(entry.get("align_max"), where + ".align_max")));
            } else {
                if (!entry.isArray() || entry.size() != 3) {
                    throw new InvalidManifestException(where + " must be a [name, lo, hi] triple");
                }
                out.add(new Band(
                        requireText(entry.get(0), where + "[0]"),
                        requireNumber(entry.get(1), where + "[1]"),
                        requireNumber(entry.get(2), where + "[2]")));
            }
        }
        return out;
    }

    private static String requireText(JsonNode node, String where) {
        if (node == null || node.isNull() || node.isContainerNode()) {
            throw new InvalidManifestException(where + " is missing or not a scalar");
        }
        return node.asText();
    }

    private static double requireNumber(JsonNode node, String where) {
        if (node == null || node.isNull()) {
            throw new InvalidManifestException(where + " is missing");
        }
        if (node.isNumber()) return node.doubleValue();
        if (node.isTextual()) {
            try {
                return Double.parseDouble(node.textValue().trim());
            } catch (NumberFormatException e) {
                throw new InvalidManifestException(where + " is not a number: " + node.textValue(), e);
            }
        }
        throw new InvalidManifestException(where + " is not a number: " + node);
    }

    private static double firstNonNull(Double first, Double second, double fallback) {
        if (first != null) return first;
        if (second != null) return second;
        return fallback;
    }

    private static Path asExistingFile(String source) {
        try {
            Path p = Path.of(source);
            return Files.isRegularFile(p) ? p : null;
        } catch (InvalidPathException e) {
            // not a usable path, so the caller parses it as inline JSON
            return null;
        }
    }
}
