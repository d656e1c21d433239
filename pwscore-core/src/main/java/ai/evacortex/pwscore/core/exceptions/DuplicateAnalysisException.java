/*
 * PWSCore — Spectral Interferometry Analysis Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.pwscore.core.exceptions;

public class DuplicateAnalysisException extends RuntimeException {
    public DuplicateAnalysisException(String name) {
        super("Analysis with name already exists: " + name);
    }
}
