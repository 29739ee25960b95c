/*
 * SSMDE — Align & Stamp Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.ssmde.core.manifest;

import ai.evacortex.ssmde.core.math.AlignFusion;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Immutable policy manifest: identity, bands over the align axis and the fusion epsilons.
 *
 * <p>Bands are kept in declaration order for validation and dumps. Lookup walks a separate
 * list of {@link BandInterval}s sorted by upper bound, in which only the interval with the
 * lowest lower bound is closed at both ends. A score no interval contains is
 * {@link #UNBANDED}.</p>
 *
 * <p>Instances are safe to share across threads.</p>
 */
public final class Manifest {

    public static final String UNBANDED = "UNBanded";

    public static final Manifest DEFAULT = new Manifest(
            "PLANT_A_BEARING_SAFETY_v7",
            List.of(
                    new Band("CRITICAL", -1.00, -0.80),
                    new Band("AMBER", -0.80, -0.30),
                    new Band("A0", -0.30, 0.70),
                    new Band("A++", 0.70, 1.00)
            ),
            AlignFusion.DEFAULT_EPS_A,
            AlignFusion.DEFAULT_EPS_W);

    private final String manifestId;
    private final List<Band> bands;
    private final double epsA;
    private final double epsW;
    private final List<BandInterval> intervals;

    public Manifest(String manifestId, List<Band> bands, double epsA, double epsW) {
        this.manifestId = Objects.requireNonNull(manifestId, "manifestId must not be null");
        this.bands = List.copyOf(Objects.requireNonNull(bands, "bands must not be null"));
        this.epsA = epsA;
        this.epsW = epsW;
        this.intervals = buildIntervals(this.bands);
    }

    private static List<BandInterval> buildIntervals(List<Band> bands) {
        if (bands.isEmpty()) return List.of();

        List<Band> sorted = new ArrayList<>(bands);
        sorted.sort(Comparator.comparingDouble(Band::upper));

        Band lowest = sorted.get(0);
        for (Band b : sorted) {
            if (b.lower() < lowest.lower()) lowest = b;
        }

        List<BandInterval> out = new ArrayList<>(sorted.size());
        for (Band b : sorted) {
            out.add(new BandInterval(b, b == lowest));
        }
        return List.copyOf(out);
    }

    public String pickBand(double align) {
        for (BandInterval interval : intervals) {
            if (interval.contains(align)) {
                return interval.band().name();
            }
        }
        return UNBANDED;
    }

    public String manifestId() {
        return manifestId;
    }

    public List<Band> bands() {
        return bands;
    }

    public double epsA() {
        return epsA;
    }

    public double epsW() {
        return epsW;
    }

    public List<BandInterval> intervals() {
        return intervals;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Manifest that)) return false;
        return Double.compare(that.epsA, epsA) == 0 &&
                Double.compare(that.epsW, epsW) == 0 &&
                manifestId.equals(that.manifestId) &&
                bands.equals(that.bands);
    }

    @Override
    public int hashCode() {
        return Objects.hash(manifestId, bands, epsA, epsW);
    }

    @Override
    public String toString() {
        return "Manifest[" + manifestId + ", eps_a=" + epsA + ", eps_w=" + epsW + ", bands=" + bands + "]";
    }
}
