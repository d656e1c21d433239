/*
 * PWSCore — Spectral Interferometry Analysis Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.pwscore.core.storage;

import ai.evacortex.pwscore.core.Roi;
import ai.evacortex.pwscore.core.exceptions.DuplicateRoiException;
import ai.evacortex.pwscore.core.exceptions.RoiNotFoundException;

import java.util.List;

/**
 * Named, numbered ROIs of one cube.
 */
public interface RoiStore {

    /**
     * @throws DuplicateRoiException if (name, number) exists and {@code overwrite} is {@code false}
     */
    void save(Roi roi, boolean overwrite);

    /**
     * Loads an ROI. When no outline was stored, the returned ROI carries one traced from the mask.
     *
     * @throws RoiNotFoundException if (name, number) does not exist
     */
    Roi load(String name, int number);

    /** Stored ROIs as (name, number) pairs, ordered by name then number. */
    List<RoiKey> list();

    /**
     * @throws RoiNotFoundException if (name, number) does not exist
     */
    void delete(String name, int number);

    record RoiKey(String name, int number) implements Comparable<RoiKey> {
        @Override
        public int compareTo(RoiKey o) {
            int c = name.compareTo(o.name);
            return c != 0 ? c : Integer.compare(number, o.number);
        }
    }
}
