/*
 * SSMDE — Align & Stamp Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.ssmde.core.exceptions;

public class InvalidRecordException extends RuntimeException {
    public InvalidRecordException(String message) {
        super("Invalid record: " + message);
    }

    public InvalidRecordException(String message, Throwable cause) {
        super("Invalid record: " + message, cause);
    }
}
