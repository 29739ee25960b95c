/*
 * SSMDE — Align & Stamp Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.ssmde.core.verify;

import java.util.List;

/**
 * Result of {@link ChainVerifier#verify}.
 *
 * @param checked  number of records inspected
 * @param segments number of chain segments; a record stamped with {@code prev=NONE} starts a new one
 * @param issues   problems found, in record order
 */
public record ChainVerification(int checked, int segments, List<Issue> issues) {

    public record Issue(int index, String message) {
        @Override
        public String toString() {
            return "record " + index + ": " + message;
        }
    }

    public ChainVerification {
        issues = List.copyOf(issues);
    }

    public boolean intact() {
        return issues.isEmpty();
    }
}
