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
 * Lookup descriptor for a {@link Band}: open at the lower bound and closed at the upper bound,
 * unless {@code lowerInclusive} is set.
 */
public record BandInterval(Band band, boolean lowerInclusive) {

    public BandInterval {
        Objects.requireNonNull(band, "band must not be null");
    }

    public boolean contains(double score) {
        if (score > band.upper()) return false;
        return lowerInclusive ? score >= band.lower() : score > band.lower();
    }

    @Override
    public String toString() {
        return band.name() + (lowerInclusive ? " [" : " (") + band.lower() + ", " + band.upper() + "]";
    }
}
