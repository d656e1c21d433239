/*
 * PWSCore — Spectral Interferometry Analysis Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.pwscore.core.batch;

import java.nio.file.Path;
import java.util.List;

/**
 * Per-cube outcome of a batch run, in submission order.
 */
public record BatchReport(List<Outcome> outcomes) {

    public enum Status { COMPLETED, SKIPPED, FAILED }

    /**
     * @param identityTag identity of the analysis, {@code null} when the cube could not be loaded
     * @param cause       failure cause, {@code null} unless {@code FAILED}
     */
    public record Outcome(Path cube, Status status, String identityTag, Throwable cause) {}

    public BatchReport {
        outcomes = List.copyOf(outcomes);
    }

    public long count(Status status) {
        return outcomes.stream().filter(o -> o.status() == status).count();
    }

    public List<Outcome> failures() {
        return outcomes.stream().filter(o -> o.status() == Status.FAILED).toList();
    }
}
