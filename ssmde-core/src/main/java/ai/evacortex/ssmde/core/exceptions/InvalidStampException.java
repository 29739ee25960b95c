/*
 * SSMDE — Align & Stamp Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.ssmde.core.exceptions;

public class InvalidStampException extends RuntimeException {
    public InvalidStampException(String message) {
        super("Invalid stamp: " + message);
    }

    public InvalidStampException(String message, Throwable cause) {
        super("Invalid stamp: " + message, cause);
    }
}
