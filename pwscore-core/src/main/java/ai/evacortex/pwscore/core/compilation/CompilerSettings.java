/*
 * PWSCore — Spectral Interferometry Analysis Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.pwscore.core.compilation;

import java.util.Collection;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * The set of statistics a compilation computes.
 */
public record CompilerSettings(Set<RoiStatistic> enabled) {

    public CompilerSettings {
        enabled = enabled == null || enabled.isEmpty()
                ? Collections.unmodifiableSet(EnumSet.noneOf(RoiStatistic.class))
                : Collections.unmodifiableSet(EnumSet.copyOf(enabled));
    }

    public static CompilerSettings of(RoiStatistic first, RoiStatistic... rest) {
        return new CompilerSettings(EnumSet.of(first, rest));
    }

    public static CompilerSettings of(Collection<RoiStatistic> statistics) {
        return new CompilerSettings(statistics.isEmpty() ? EnumSet.noneOf(RoiStatistic.class) : EnumSet.copyOf(statistics));
    }

    public static CompilerSettings all() {
        return new CompilerSettings(EnumSet.allOf(RoiStatistic.class));
    }

    public boolean isEnabled(RoiStatistic statistic) {
        return enabled.contains(statistic);
    }
}
