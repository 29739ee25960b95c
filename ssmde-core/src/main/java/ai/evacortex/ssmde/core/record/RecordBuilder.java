/*
 * SSMDE — Align & Stamp Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.ssmde.core.record;

import ai.evacortex.ssmde.core.exceptions.InvalidRecordException;
import ai.evacortex.ssmde.core.manifest.Manifest;
import ai.evacortex.ssmde.core.math.AlignFusion;
import ai.evacortex.ssmde.core.stamp.RecordStamper;
import ai.evacortex.ssmde.core.stamp.Stamp;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Fuses a raw series, classifies the score against a manifest and stamps the result.
 *
 * <p>The builder holds no chain state. Callers thread {@link AlignRecord#chainDigest()} of
 * one record into the {@code previousDigest} of the next, or use {@link RecordChain}.</p>
 */
public class RecordBuilder {

    private static final Logger log = LoggerFactory.getLogger(RecordBuilder.class);

    private final RecordStamper stamper;

    public RecordBuilder() {
        this(new RecordStamper());
    }

    public RecordBuilder(RecordStamper stamper) {
        this.stamper = Objects.requireNonNull(stamper, "stamper must not be null");
    }

    public AlignRecord build(JsonNode value, double[] series, Manifest manifest) {
        return build(value, series, manifest, null, null);
    }

    public AlignRecord build(JsonNode value, double[] series, Manifest manifest, String previousDigest) {
        return build(value, series, manifest, null, previousDigest);
    }

    public AlignRecord build(JsonNode value,
                             double[] series,
                             Manifest manifest,
                             double[] weights,
                             String previousDigest) {
        Objects.requireNonNull(manifest, "manifest must not be null");
        if (value == null || !value.isObject()) {
            throw new InvalidRecordException("value must be a JSON object");
        }
        ObjectNode payload = (ObjectNode) value;

        double align = AlignFusion.fuse(series, weights, manifest.epsA(), manifest.epsW());
        String band = manifest.pickBand(align);
        if (Manifest.UNBANDED.equals(band)) {
            log.warn("Align {} is outside every band of manifest '{}'", align, manifest.manifestId());
        }

        ObjectNode content = AlignRecord.content(payload, align, band, manifest.manifestId());
        Stamp stamp = stamper.stamp(content, previousDigest);

        log.debug("Built record align={} band={} digest={}", align, band, stamp.digest());
        return new AlignRecord(payload, align, band, manifest.manifestId(), stamp);
    }
}
