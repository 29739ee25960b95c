/*
 * SSMDE — Align & Stamp Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.ssmde.core.manifest;

import ai.evacortex.ssmde.core.manifest.ValidationReport.Diagnostic;
import ai.evacortex.ssmde.core.manifest.ValidationReport.Severity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Checks a {@link Manifest} for internal consistency.
 *
 * <p>Hard failures: a band outside [-1, 1] or with a non-increasing interval, and overlapping
 * bands. Advisory warnings: declaration not ascending by upper bound, gaps, incomplete
 * coverage of [-1, 1], duplicate names, and epsilons outside their usual magnitude.</p>
 */
public final class ManifestValidator {

    private static final Logger log = LoggerFactory.getLogger(ManifestValidator.class);

    static final double COVERAGE_TOLERANCE = 1e-6;
    static final double EPS_A_LIMIT = 1e-2;
    static final double EPS_W_LIMIT = 1e-6;

    private ManifestValidator() {}

    public static ValidationReport validate(Manifest manifest) {
        List<Diagnostic> out = new ArrayList<>();
        List<Band> bands = manifest.bands();

        if (bands.isEmpty()) {
            out.add(warning("Manifest '" + manifest.manifestId() + "' declares no bands; every score is "
                    + Manifest.UNBANDED));
        }

        for (Band b : bands) {
            if (!(-1.0 <= b.lower() && b.lower() < b.upper() && b.upper() <= 1.0)) {
                out.add(error("Band '" + b.name() + "' out of range or invalid interval: ["
                        + b.lower() + "," + b.upper() + "]"));
            }
        }

        Set<String> seen = new HashSet<>();
        for (Band b : bands) {
            if (!seen.add(b.name())) {
                out.add(warning("Duplicate band name '" + b.name() + "'"));
            }
        }

        List<Band> sorted = new ArrayList<>(bands);
        sorted.sort(Comparator.comparingDouble(Band::upper));
        if (!sorted.equals(bands)) {
            out.add(warning("Bands not sorted by 'align_max' (hi). Recommend ascending by hi."));
        }

        Band previous = null;
        for (Band b : sorted) {
            if (previous != null) {
                if (b.lower() < previous.upper()) {
                    out.add(error("Overlap between band '" + previous.name() + "' ending at " + previous.upper()
                            + " and '" + b.name() + "' starting at " + b.lower()));
                } else if (b.lower() > previous.upper()) {
                    out.add(warning("Gap between band '" + previous.name() + "' hi=" + previous.upper()
                            + " and '" + b.name() + "' lo=" + b.lower()));
                }
            }
            previous = b;
        }

        if (!sorted.isEmpty()) {
            double firstLo = sorted.stream().mapToDouble(Band::lower).min().orElse(-1.0);
            double lastHi = sorted.get(sorted.size() - 1).upper();
            if (firstLo > -1.0 + COVERAGE_TOLERANCE) {
                out.add(warning("Coverage begins at " + firstLo + " (> -1). Consider extending to -1."));
            }
            if (lastHi < 1.0 - COVERAGE_TOLERANCE) {
                out.add(warning("Coverage ends at " + lastHi + " (< 1). Consider extending to +1."));
            }
        }

        if (!(manifest.epsA() > 0.0 && manifest.epsA() < EPS_A_LIMIT)) {
            out.add(warning("eps_a unusual: " + manifest.epsA()));
        }
        if (manifest.epsA() > 0.0 && 1.0 - manifest.epsA() == 1.0) {
            out.add(warning("eps_a " + manifest.epsA() + " is below double resolution at 1.0; clamping uses one ulp instead"));
        }
        if (!(manifest.epsW() > 0.0 && manifest.epsW() < EPS_W_LIMIT)) {
            out.add(warning("eps_w unusual: " + manifest.epsW()));
        }

        boolean passed = out.stream().noneMatch(d -> d.severity() == Severity.ERROR);
        if (log.isDebugEnabled()) {
            log.debug("Validated manifest '{}': passed={}, diagnostics={}", manifest.manifestId(), passed, out.size());
        }
        return new ValidationReport(passed, out);
    }

    private static Diagnostic error(String message) {
        return new Diagnostic(Severity.ERROR, message);
    }

    private static Diagnostic warning(String message) {
        return new Diagnostic(Severity.WARNING, message);
    }
}
