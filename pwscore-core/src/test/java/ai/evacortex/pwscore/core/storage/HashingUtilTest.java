/*
 * PWSCore — Spectral Interferometry Analysis Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.pwscore.core.storage;

import ai.evacortex.pwscore.core.AnalysisSettings;
import ai.evacortex.pwscore.core.CubeTestUtils;
import ai.evacortex.pwscore.core.ImageCube;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

class HashingUtilTest {

    private static ImageCube cube(double offset) {
        return CubeTestUtils.cube(2, 2, CubeTestUtils.wavelengths(500, 520, 2),
                CubeTestUtils.metadata(5.0, 100.0), (r, c, b, wv) -> offset + r + c + b);
    }

    @Test
    void testCubeHash_isDeterministicAndContentSensitive() {
        String hash1 = HashingUtil.computeCubeHash(cube(1.0));
        String hash2 = HashingUtil.computeCubeHash(cube(1.0));

        assertEquals(hash1, hash2, "Cube hash must be deterministic for identical cubes");
        assertEquals(32, hash1.length(), "MD5 hex string must be 32 chars long");
        assertTrue(hash1.matches("[0-9a-f]{32}"), "MD5 hex string must be lowercase hex");

        assertNotEquals(hash1, HashingUtil.computeCubeHash(cube(1.5)), "Hashes must differ for different data");
    }

    @Test
    void testCubeHash_coversMetadata() {
        ImageCube a = cube(1.0);
        ImageCube b = CubeTestUtils.cube(2, 2, CubeTestUtils.wavelengths(500, 520, 2),
                CubeTestUtils.metadata(6.0, 100.0), (r, c, bd, wv) -> 1.0 + r + c + bd);

        assertNotEquals(HashingUtil.computeCubeHash(a), HashingUtil.computeCubeHash(b));
    }

    @Test
    void testIdentityTag_dependsOnSettings() {
        AnalysisSettings settings = AnalysisSettings.recommended();
        String tag1 = HashingUtil.computeIdentityTag(cube(1.0), cube(2.0), null, settings);
        String tag2 = HashingUtil.computeIdentityTag(cube(1.0), cube(2.0), null, settings);
        String tag3 = HashingUtil.computeIdentityTag(cube(1.0), cube(2.0), null, settings.withSkipAdvanced(true));
        String swapped = HashingUtil.computeIdentityTag(cube(2.0), cube(1.0), null, settings);

        assertEquals(tag1, tag2);
        assertNotEquals(tag1, tag3);
        assertNotEquals(tag1, swapped);
        assertEquals(HashingUtil.computeSettingsHash(settings), HashingUtil.computeSettingsHash(settings));
    }

    @Test
    void testIdentityTag_dependsOnStrayCube() {
        AnalysisSettings settings = AnalysisSettings.recommended();
        String withoutStray = HashingUtil.computeIdentityTag(cube(1.0), cube(2.0), null, settings);
        String strayA = HashingUtil.computeIdentityTag(cube(1.0), cube(2.0), cube(0.1), settings);
        String strayB = HashingUtil.computeIdentityTag(cube(1.0), cube(2.0), cube(0.2), settings);

        assertNotEquals(withoutStray, strayA);
        assertNotEquals(strayA, strayB, "Different stray cubes must give different tags");
        assertEquals(strayA, HashingUtil.computeIdentityTag(cube(1.0), cube(2.0), cube(0.1), settings));
    }

    @Test
    void testChecksum_detectsSingleBitFlip() {
        byte[] bytes = "payload for checksum".getBytes(StandardCharsets.UTF_8);
        long before = HashingUtil.computeChecksum(bytes, 0, bytes.length);
        bytes[3] ^= 1;

        assertNotEquals(before, HashingUtil.computeChecksum(bytes, 0, bytes.length));
    }
}
