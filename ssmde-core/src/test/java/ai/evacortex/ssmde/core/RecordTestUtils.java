/*
 * SSMDE — Align & Stamp Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.ssmde.core;

import ai.evacortex.ssmde.core.json.CanonicalJson;
import ai.evacortex.ssmde.core.record.RecordBuilder;
import ai.evacortex.ssmde.core.stamp.RecordStamper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.regex.Pattern;

/**
 * Fixtures shared by record and stamp tests.
 */
public class RecordTestUtils {

    /**
     * The stamp grammar with a full 64-hex or {@code NONE} previous reference.
     */
    public static final Pattern STAMP_RE = Pattern.compile(
            "^SSMCLOCK1\\|"
                    + "\\d{4}-\\d{2}-\\d{2}T\\d{2}:\\d{2}:\\d{2}Z\\|"
                    + "theta=\\d+\\.\\d{2}\\|sha256=[0-9a-f]{64}\\|prev=([0-9a-f]{64}|NONE)$");

    public static Clock fixedClock(String instant) {
        return Clock.fixed(Instant.parse(instant), ZoneOffset.UTC);
    }

    public static RecordBuilder builderAt(String instant) {
        return new RecordBuilder(new RecordStamper(fixedClock(instant)));
    }

    public static ObjectNode payload(String key, double value) {
        return CanonicalJson.newObject().put(key, value);
    }

    public static double[] constant(double value, int length) {
        double[] out = new double[length];
        java.util.Arrays.fill(out, value);
        return out;
    }
}
