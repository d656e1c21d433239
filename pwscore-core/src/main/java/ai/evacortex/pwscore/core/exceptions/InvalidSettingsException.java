/*
 * PWSCore — Spectral Interferometry Analysis Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.pwscore.core.exceptions;

public class InvalidSettingsException extends RuntimeException {
    public InvalidSettingsException(String message) {
        super("Invalid analysis settings: " + message);
    }

    public InvalidSettingsException(String message, Throwable cause) {
        super("Invalid analysis settings: " + message, cause);
    }
}
