/*
 * SSMDE — Align & Stamp Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.ssmde.core.record;

import ai.evacortex.ssmde.core.manifest.Manifest;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.Objects;

/**
 * Caller-owned cursor over one chain of records. Each appended record references the chain
 * digest of the record appended before it, unless the call supplies an explicit previous
 * digest. Appends are serialized so the chain order is the call order.
 */
public class RecordChain {

    private final RecordBuilder builder;
    private final Manifest manifest;
    private String lastDigest;
    private long length;

    private RecordChain(RecordBuilder builder, Manifest manifest, String lastDigest) {
        this.builder = Objects.requireNonNull(builder, "builder must not be null");
        this.manifest = Objects.requireNonNull(manifest, "manifest must not be null");
        this.lastDigest = lastDigest;
    }

    public static RecordChain start(RecordBuilder builder, Manifest manifest) {
        return new RecordChain(builder, manifest, null);
    }

    /**
     * Continues a chain whose last stamp digest is already known.
     */
    public static RecordChain resume(RecordBuilder builder, Manifest manifest, String lastDigest) {
        return new RecordChain(builder, manifest, lastDigest);
    }

    public AlignRecord append(JsonNode value, double[] series) {
        return append(value, series, null, null);
    }

    public synchronized AlignRecord append(JsonNode value, double[] series, double[] weights, String previousDigest) {
        String prev = previousDigest != null && !previousDigest.isBlank() ? previousDigest : lastDigest;
        AlignRecord record = builder.build(value, series, manifest, weights, prev);
        lastDigest = record.chainDigest();
        length++;
        return record;
    }

    public synchronized String lastDigest() {
        return lastDigest;
    }

    public synchronized long length() {
        return length;
    }

    public Manifest manifest() {
        return manifest;
    }
}
