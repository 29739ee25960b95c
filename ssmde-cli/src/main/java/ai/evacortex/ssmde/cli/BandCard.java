/*
 * SSMDE — Align & Stamp Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.ssmde.cli;

import ai.evacortex.ssmde.core.manifest.BandInterval;
import ai.evacortex.ssmde.core.manifest.Manifest;

import java.util.ArrayList;
import java.util.List;

/**
 * Compact text table of the effective manifest, in lookup order.
 */
public final class BandCard {

    private BandCard() {}

    public static List<String> render(Manifest m) {
        List<String> lines = new ArrayList<>();
        lines.add("Band Card - effective manifest");
        lines.add("manifest_id: " + m.manifestId());
        lines.add("eps_a: " + m.epsA() + ", eps_w: " + m.epsW());
        for (BandInterval interval : m.intervals()) {
            lines.add("- " + interval);
        }
        return lines;
    }
}
