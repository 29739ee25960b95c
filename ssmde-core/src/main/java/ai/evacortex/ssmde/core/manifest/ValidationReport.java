/*
 * SSMDE — Align & Stamp Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.ssmde.core.manifest;

import java.util.List;

/**
 * Outcome of {@link ManifestValidator#validate(Manifest)}. {@code passed} is false when any
 * diagnostic has {@link Severity#ERROR} severity; warnings never fail a manifest.
 */
public record ValidationReport(boolean passed, List<Diagnostic> diagnostics) {

    public enum Severity {
        ERROR,
        WARNING
    }

    public record Diagnostic(Severity severity, String message) {
        @Override
        public String toString() {
            return severity + ": " + message;
        }
    }

    public ValidationReport {
        diagnostics = List.copyOf(diagnostics);
    }

    public List<String> messages() {
        return diagnostics.stream().map(Diagnostic::message).toList();
    }

    public List<Diagnostic> errors() {
        return diagnostics.stream().filter(d -> d.severity() == Severity.ERROR).toList();
    }

    public List<Diagnostic> warnings() {
        return diagnostics.stream().filter(d -> d.severity() == Severity.WARNING).toList();
    }
}
