/*
 * SSMDE — Align & Stamp Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.ssmde.cli;

import ai.evacortex.ssmde.core.json.CanonicalJson;
import ai.evacortex.ssmde.core.manifest.Manifest;
import ai.evacortex.ssmde.core.record.AlignRecord;
import ai.evacortex.ssmde.core.record.RecordBuilder;
import ai.evacortex.ssmde.core.record.RecordChain;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * Synthesizes chained sample records across several domains. Each sample draws three raw
 * values within ±0.03 of a target align.
 */
public class ExampleGenerator {

    private record Sample(double align, ObjectNode value) {}

    static final double JITTER = 0.03;
    static final double RAW_LIMIT = 0.999999;

    private static final List<Sample> POOL = List.of(
            sample(-0.60, "temperature_K", 279.9, "a_phase", -0.62),
            sample(-0.50, "V_rms", 253.7, "pf", 0.81, "stress_score", 0.72),
            sample(-0.10, "cash_collected_usd", 18420.77),
            sample(0.40, "model_score", 0.912, "uncertainty", 0.18),
            sample(0.75, "spo2", 0.95, "hr_bpm", 78),
            sample(-0.88, "strain_micro", 220.5, "temp_K", 315.3),
            sample(0.60, "throughput_mbps", 512, "error_rate", 0.0012),
            sample(-0.92, "power_kw", 42.3, "temp_K", 330.2),
            sample(-0.15, "co2_ppm", 980, "voc_index", 0.22),
            sample(-0.45, "wind_speed_ms", 18.4, "gust_ms", 26.9)
    );

    private final RecordBuilder builder;
    private final Random random;

    public ExampleGenerator(RecordBuilder builder, Random random) {
        this.builder = builder;
        this.random = random;
    }

    public List<AlignRecord> generate(Manifest manifest, int count) {
        RecordChain chain = RecordChain.start(builder, manifest);
        List<AlignRecord> out = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            Sample s = POOL.get(i % POOL.size());
            double[] raw = new double[3];
            for (int k = 0; k < raw.length; k++) {
                double jitter = (random.nextDouble() * 2.0 - 1.0) * JITTER;
                raw[k] = Math.max(-RAW_LIMIT, Math.min(RAW_LIMIT, s.align() + jitter));
            }
            out.add(chain.append(s.value(), raw));
        }
        return out;
    }

    private static Sample sample(double align, Object... fields) {
        ObjectNode value = CanonicalJson.newObject();
        for (int i = 0; i < fields.length; i += 2) {
            String key = (String) fields[i];
            Object v = fields[i + 1];
            if (v instanceof Integer n) {
                value.put(key, n);
            } else {
                value.put(key, (Double) v);
            }
        }
        return new Sample(align, value);
    }
}
