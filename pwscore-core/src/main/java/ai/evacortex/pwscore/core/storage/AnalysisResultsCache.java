/*
 * PWSCore — Spectral Interferometry Analysis Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.pwscore.core.storage;

import ai.evacortex.pwscore.core.AnalysisResults;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;

import java.util.Optional;

/**
 * Bounded in-memory cache of analysis results keyed by identity tag.
 */
public class AnalysisResultsCache {

    public static final long DEFAULT_MAX_ENTRIES = Long.getLong("pwscore.cache.maxEntries", 32L);

    private final Cache<String, AnalysisResults> cache;

    public AnalysisResultsCache() {
        this(DEFAULT_MAX_ENTRIES);
    }

    public AnalysisResultsCache(long maxEntries) {
        this.cache = Caffeine.newBuilder()
                .maximumSize(maxEntries)
                .build();
    }

    public Optional<AnalysisResults> get(String identityTag) {
        return Optional.ofNullable(cache.getIfPresent(identityTag));
    }

    public boolean contains(String identityTag) {
        return cache.getIfPresent(identityTag) != null;
    }

    public void put(AnalysisResults results) {
        cache.put(results.identityTag(), results);
    }

    public void invalidate(String identityTag) {
        cache.invalidate(identityTag);
    }

    public void clear() {
        cache.invalidateAll();
        cache.cleanUp();
    }
}
