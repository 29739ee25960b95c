/*
 * SSMDE — Align & Stamp Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.ssmde.core.record;

import ai.evacortex.ssmde.core.json.CanonicalJson;
import ai.evacortex.ssmde.core.stamp.Stamp;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.Objects;

/**
 * One immutable output record. The stamp digests exactly {@link #content()}.
 */
public record AlignRecord(ObjectNode value, double align, String band, String manifestId, Stamp stamp) {

    public static final String VALUE = "value";
    public static final String ALIGN = "align";
    public static final String BAND = "band";
    public static final String MANIFEST_ID = "manifest_id";
    public static final String STAMP = "stamp";

    public AlignRecord {
        Objects.requireNonNull(value, "value must not be null");
        Objects.requireNonNull(band, "band must not be null");
        Objects.requireNonNull(manifestId, "manifestId must not be null");
        Objects.requireNonNull(stamp, "stamp must not be null");
        value = value.deepCopy();
    }

    @Override
    public ObjectNode value() {
        return value.deepCopy();
    }

    /**
     * The pre-stamp fields {@code {value, align, band, manifest_id}}.
     */
    public ObjectNode content() {
        return content(value, align, band, manifestId);
    }

    static ObjectNode content(ObjectNode value, double align, String band, String manifestId) {
        ObjectNode node = CanonicalJson.newObject();
        node.set(VALUE, value.deepCopy());
        node.put(ALIGN, align);
        node.put(BAND, band);
        node.put(MANIFEST_ID, manifestId);
        return node;
    }

    public ObjectNode toJson() {
        ObjectNode node = content();
        node.put(STAMP, stamp.format());
        return node;
    }

    public String toCanonicalJson() {
        return CanonicalJson.write(toJson());
    }

    /**
     * Digest to pass as the previous-stamp reference of the next record.
     */
    public String chainDigest() {
        return stamp.chainDigest();
    }
}
