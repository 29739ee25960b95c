/*
 * SSMDE — Align & Stamp Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.ssmde.core.exceptions;

public class InvalidSeriesException extends RuntimeException {
    public InvalidSeriesException(String message) {
        super("Invalid series: " + message);
    }

    public InvalidSeriesException(String message, Throwable cause) {
        super("Invalid series: " + message, cause);
    }
}
