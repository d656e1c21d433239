/*
 * PWSCore — Spectral Interferometry Analysis Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.pwscore.core;

import ai.evacortex.pwscore.core.exceptions.InvalidCubeException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ImageCubeTest {

    private final CubeMetadata md = CubeTestUtils.metadata(100.0, 0.0);

    @Test
    void testIndexingIsRowMajorWithSpectrumFastest() {
        ImageCube cube = CubeTestUtils.cube(2, 3, new double[]{500, 510, 520}, md,
                (r, c, b, wv) -> 100 * r + 10 * c + b);

        assertEquals(121, cube.get(1, 2, 1));
        assertArrayEquals(new double[]{10, 11, 12}, cube.spectrum(0, 1));
    }

    @Test
    void testRejectsNonIncreasingWavelengths() {
        assertThrows(InvalidCubeException.class,
                () -> new ImageCube(1, 1, new double[]{1, 2, 3}, new double[]{500, 500, 510}, md));
        assertThrows(InvalidCubeException.class,
                () -> new ImageCube(1, 1, new double[]{1, 2, 3}, new double[]{520, 510, 500}, md));
    }

    @Test
    void testRejectsDataLengthMismatch() {
        assertThrows(InvalidCubeException.class,
                () -> new ImageCube(2, 2, new double[7], new double[]{500, 510}, md));
    }

    @Test
    void testSelectWavelengthsUsesNearestBandsInclusive() {
        ImageCube cube = CubeTestUtils.cube(1, 1, CubeTestUtils.wavelengths(500, 600, 10), md,
                (r, c, b, wv) -> wv);

        ImageCube window = cube.selectWavelengths(523, 557);

        assertArrayEquals(new double[]{520, 530, 540, 550, 560}, window.wavelengths());
        assertArrayEquals(new double[]{520, 530, 540, 550, 560}, window.spectrum(0, 0));
    }

    @Test
    void testInstancesAreImmutable() {
        double[] data = {1, 2};
        ImageCube cube = new ImageCube(1, 1, data, new double[]{500, 510}, md);
        data[0] = 42;
        cube.copyData()[1] = 42;

        assertArrayEquals(new double[]{1, 2}, cube.spectrum(0, 0));
    }
}
