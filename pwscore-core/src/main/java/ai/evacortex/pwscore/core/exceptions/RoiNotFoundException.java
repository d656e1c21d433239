/*
 * PWSCore — Spectral Interferometry Analysis Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.pwscore.core.exceptions;

public class RoiNotFoundException extends RuntimeException {
    public RoiNotFoundException(String name, int number) {
        super("ROI '" + name + "' #" + number + " was not found.");
    }

    public RoiNotFoundException(String name, int number, Throwable cause) {
        super("ROI '" + name + "' #" + number + " was not found.", cause);
    }
}
