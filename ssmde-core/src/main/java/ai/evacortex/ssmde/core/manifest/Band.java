/*
 * SSMDE — Align & Stamp Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.ssmde.core.manifest;

import java.util.Objects;

/**
 * A named range over the align axis, as declared in a manifest.
 * Bounds are not checked here; {@link ManifestValidator} reports malformed ranges.
 */
public record Band(String name, double lower, double upper) {

    public Band {
        Objects.requireNonNull(name, "band name must not be null");
    }

    public double midpoint() {
        return (lower + upper) / 2.0;
    }

    @Override
    public String toString() {
        return name + " (" + lower + ", " + upper + "]";
    }
}
