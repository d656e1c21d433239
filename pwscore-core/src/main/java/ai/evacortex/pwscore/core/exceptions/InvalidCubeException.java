/*
 * PWSCore — Spectral Interferometry Analysis Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.pwscore.core.exceptions;

public class InvalidCubeException extends RuntimeException {
    public InvalidCubeException(String message) {
        super("Invalid image cube: " + message);
    }

    public InvalidCubeException(String message, Throwable cause) {
        super("Invalid image cube: " + message, cause);
    }
}
