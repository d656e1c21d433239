/*
 * PWSCore — Spectral Interferometry Analysis Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.pwscore.core;

import java.util.Objects;

/**
 * Non-fatal condition detected while analysing or compiling. Warnings travel with the result they
 * were produced for and are persisted alongside it.
 *
 * @param shortMessage one-line summary
 * @param longMessage  explanation, including counts or offending values where known
 */
public record AnalysisWarning(String shortMessage, String longMessage) {

    public AnalysisWarning {
        Objects.requireNonNull(shortMessage, "shortMessage must not be null");
        longMessage = longMessage == null ? "" : longMessage;
    }

    @Override
    public String toString() {
        return shortMessage + ": " + longMessage;
    }
}
