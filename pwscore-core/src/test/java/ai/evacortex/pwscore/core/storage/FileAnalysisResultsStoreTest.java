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
import ai.evacortex.pwscore.core.AnalysisWarning;
import ai.evacortex.pwscore.core.CubeTestUtils;
import ai.evacortex.pwscore.core.OpdCube;
import ai.evacortex.pwscore.core.PixelMap;
import ai.evacortex.pwscore.core.exceptions.AnalysisNotFoundException;
import ai.evacortex.pwscore.core.exceptions.CorruptContainerException;
import ai.evacortex.pwscore.core.exceptions.DuplicateAnalysisException;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.TestInstance;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@TestInstance(TestInstance.Lifecycle.PER_CLASS)
public class FileAnalysisResultsStoreTest {

    private Path tempDir;
    private FileAnalysisResultsStore store;

    @BeforeAll
    void setup() throws Exception {
        tempDir = Files.createTempDirectory("pwscore-results-test");
        store = new FileAnalysisResultsStore(tempDir);
    }

    @AfterAll
    void cleanup() throws Exception {
        CubeTestUtils.deleteDirectoryRecursive(tempDir);
    }

    private static AnalysisResults fullResults(String tag, double base) {
        PixelMap refl = PixelMap.of(new double[][]{{base, base + 0.1, base + 0.2}, {base + 0.3, Double.NaN, base}});
        PixelMap rms = CubeTestUtils.filledMap(2, 3, 0.02);
        PixelMap slope = CubeTestUtils.filledMap(2, 3, -0.4);
        PixelMap r2 = CubeTestUtils.filledMap(2, 3, 0.95);
        PixelMap ld = CubeTestUtils.filledMap(2, 3, 1.7);
        double[] opdData = new double[2 * 3 * 4];
        for (int i = 0; i < opdData.length; i++) opdData[i] = i * 0.5;
        OpdCube opd = new OpdCube(2, 3, opdData, new double[]{0.0, 0.25, 0.5, 0.75});
        return CubeTestUtils.results(tag, refl, rms, rms, slope, r2, ld, opd,
                List.of(new AnalysisWarning("Ignoring reference material", "No material was given")));
    }

    private static void assertSameResults(AnalysisResults expected, AnalysisResults actual) {
        assertEquals(expected.identityTag(), actual.identityTag());
        assertEquals(expected.sampleTag(), actual.sampleTag());
        assertEquals(expected.referenceTag(), actual.referenceTag());
        assertEquals(expected.settings(), actual.settings());
        assertEquals(expected.created(), actual.created());
        assertEquals(expected.reflectance(), actual.reflectance());
        assertEquals(expected.rms(), actual.rms());
        assertEquals(expected.polynomialRms(), actual.polynomialRms());
        assertEquals(expected.autoCorrelationSlope(), actual.autoCorrelationSlope());
        assertEquals(expected.rSquared(), actual.rSquared());
        assertEquals(expected.ld(), actual.ld());
        assertEquals(expected.opd().isPresent(), actual.opd().isPresent());
        if (expected.opd().isPresent()) {
            assertArrayEquals(expected.opd().get().copyData(), actual.opd().get().copyData());
            assertArrayEquals(expected.opd().get().depths(), actual.opd().get().depths());
        }
        assertArrayEquals(expected.detrended().copyData(), actual.detrended().copyData());
        assertArrayEquals(expected.detrended().wavenumbers(), actual.detrended().wavenumbers());
        assertEquals(expected.warnings(), actual.warnings());
    }

    @Test
    void testSaveAndLoadFromDisk() {
        AnalysisResults results = fullResults("tag-roundtrip", 0.3);
        store.save("roundtrip", results, false);

        AnalysisResults loaded = new FileAnalysisResultsStore(tempDir).load("roundtrip");

        assertSameResults(results, loaded);
        assertTrue(store.exists("roundtrip"));
        assertTrue(store.listNames().contains("roundtrip"));
    }

    @Test
    void testOptionalMapsMayBeAbsent() {
        AnalysisResults results = CubeTestUtils.results("tag-basic", CubeTestUtils.filledMap(2, 2, 0.4),
                CubeTestUtils.filledMap(2, 2, 0.01), null, null, null, null, null, List.of());
        store.save("basic", results, false);

        AnalysisResults loaded = new FileAnalysisResultsStore(tempDir).load("basic");

        assertSameResults(results, loaded);
        assertTrue(loaded.opd().isEmpty());
        assertTrue(loaded.ld().isEmpty());
    }

    @Test
    void testDuplicateSaveRequiresOverwrite() {
        store.save("dup", fullResults("tag-dup-1", 0.3), false);

        assertThrows(DuplicateAnalysisException.class, () -> store.save("dup", fullResults("tag-dup-2", 0.5), false));

        AnalysisResults replacement = fullResults("tag-dup-2", 0.5);
        store.save("dup", replacement, true);
        assertSameResults(replacement, new FileAnalysisResultsStore(tempDir).load("dup"));
        assertTrue(store.findByIdentityTag("tag-dup-1").isEmpty());
    }

    @Test
    void testMissingAnalysisThrows() {
        assertThrows(AnalysisNotFoundException.class, () -> store.load("never-saved"));
        assertThrows(AnalysisNotFoundException.class, () -> store.delete("never-saved"));
    }

    @Test
    void testFindByIdentityTagAndDelete() {
        store.save("findme", fullResults("tag-find", 0.2), false);

        FileAnalysisResultsStore fresh = new FileAnalysisResultsStore(tempDir);
        assertEquals("tag-find", fresh.findByIdentityTag("tag-find").orElseThrow().identityTag());
        assertTrue(fresh.findByIdentityTag("tag-unknown").isEmpty());

        fresh.delete("findme");
        assertFalse(fresh.exists("findme"));
        assertFalse(fresh.listNames().contains("findme"));
        assertTrue(new FileAnalysisResultsStore(tempDir).findByIdentityTag("tag-find").isEmpty());
    }

    @Test
    void testInvalidNamesRejected() {
        AnalysisResults results = fullResults("tag-bad", 0.1);
        assertThrows(IllegalArgumentException.class, () -> store.save("bad name", results, false));
        assertThrows(IllegalArgumentException.class, () -> store.save("../escape", results, false));
        assertThrows(IllegalArgumentException.class, () -> store.load(""));
    }

    @Test
    void testCorruptedContainerDetected() throws Exception {
        Path dir = Files.createTempDirectory("pwscore-corrupt-test");
        try {
            new FileAnalysisResultsStore(dir).save("victim", fullResults("tag-victim", 0.3), false);
            Path file = dir.resolve("analysisResults_victim.pwsa");
            byte[] bytes = Files.readAllBytes(file);
            bytes[bytes.length - 1] ^= 0x5A;
            Files.write(file, bytes);

            FileAnalysisResultsStore fresh = new FileAnalysisResultsStore(dir);
            assertThrows(CorruptContainerException.class, () -> fresh.load("victim"));
        } finally {
            CubeTestUtils.deleteDirectoryRecursive(dir);
        }
    }

    @Test
    void testTruncatedContainerDetected() throws Exception {
        Path dir = Files.createTempDirectory("pwscore-truncated-test");
        try {
            new FileAnalysisResultsStore(dir).save("short", fullResults("tag-short", 0.3), false);
            Path file = dir.resolve("analysisResults_short.pwsa");
            byte[] bytes = Files.readAllBytes(file);
            Files.write(file, java.util.Arrays.copyOf(bytes, bytes.length / 2));

            assertThrows(CorruptContainerException.class, () -> new FileAnalysisResultsStore(dir).load("short"));
        } finally {
            CubeTestUtils.deleteDirectoryRecursive(dir);
        }
    }

    @Test
    void testFailedIndexWriteLeavesNoContainer() throws Exception {
        Path dir = Files.createDirectories(tempDir.resolve("index-blocked"));
        FileAnalysisResultsStore blocked = new FileAnalysisResultsStore(dir);
        // a directory where the index file belongs makes every flush fail
        Files.createDirectory(dir.resolve(FileAnalysisResultsStore.INDEX_FILE));

        assertThrows(RuntimeException.class, () -> blocked.save("orphan", fullResults("tag-orphan", 0.3), false));

        assertFalse(blocked.exists("orphan"));
        assertFalse(blocked.listNames().contains("orphan"));
        assertTrue(blocked.findByIdentityTag("tag-orphan").isEmpty());
    }

    @Test
    void testFailedContainerWriteRollsBackIndex() throws Exception {
        Path dir = Files.createDirectories(tempDir.resolve("container-blocked"));
        FileAnalysisResultsStore blocked = new FileAnalysisResultsStore(dir);
        Path target = dir.resolve(FileAnalysisResultsStore.PREFIX + "stuck" + FileAnalysisResultsStore.SUFFIX);
        Files.createDirectories(target.resolve("occupied"));

        assertThrows(RuntimeException.class, () -> blocked.save("stuck", fullResults("tag-stuck", 0.3), true));

        assertFalse(blocked.listNames().contains("stuck"));
        assertFalse(new FileAnalysisResultsStore(dir).listNames().contains("stuck"));
    }
}
