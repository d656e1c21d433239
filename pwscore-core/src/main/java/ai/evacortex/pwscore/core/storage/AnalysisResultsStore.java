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
import ai.evacortex.pwscore.core.exceptions.AnalysisNotFoundException;
import ai.evacortex.pwscore.core.exceptions.CorruptContainerException;
import ai.evacortex.pwscore.core.exceptions.DuplicateAnalysisException;

import java.util.Optional;
import java.util.Set;

/**
 * {@code AnalysisResultsStore} keeps the finished analyses of one cube, keyed by a user-chosen
 * analysis name.
 *
 * <p>Each analysis additionally carries the identity tag of the (sample, reference, settings)
 * triple it was computed from, which lets callers skip recomputation of an identical analysis.</p>
 *
 * <p>Implementations must be thread-safe. A save either replaces the stored content entirely or
 * leaves it untouched.</p>
 */
public interface AnalysisResultsStore {

    /**
     * Persists {@code results} under {@code name}.
     *
     * @param overwrite replace an existing analysis of the same name
     * @throws DuplicateAnalysisException if the name exists and {@code overwrite} is {@code false}
     */
    void save(String name, AnalysisResults results, boolean overwrite);

    /**
     * @throws AnalysisNotFoundException  if no analysis of that name exists
     * @throws CorruptContainerException if the stored container fails validation
     */
    AnalysisResults load(String name);

    /**
     * Looks up an analysis saved in this store by identity tag. Results cached on behalf of other
     * stores are not returned.
     */
    Optional<AnalysisResults> findByIdentityTag(String identityTag);

    boolean exists(String name);

    /**
     * @throws AnalysisNotFoundException if no analysis of that name exists
     */
    void delete(String name);

    Set<String> listNames();
}
