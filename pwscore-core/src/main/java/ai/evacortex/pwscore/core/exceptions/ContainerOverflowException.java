/*
 * PWSCore — Spectral Interferometry Analysis Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.pwscore.core.exceptions;

public class ContainerOverflowException extends RuntimeException {

    public ContainerOverflowException(String message) {
        super(message);
    }

    public ContainerOverflowException(String message, Throwable cause) {
        super(message, cause);
    }
}
