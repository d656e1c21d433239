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
import ai.evacortex.pwscore.core.CubeMetadata;
import ai.evacortex.pwscore.core.ImageCube;
import net.jpountz.xxhash.XXHashFactory;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * Content hashes used as identity tags, and the payload checksum of binary containers.
 */
public final class HashingUtil {

    private static final XXHashFactory XX_HASH = XXHashFactory.fastestInstance();
    private static final long SEED = 0x9747b28cL;

    private static final ThreadLocal<MessageDigest> MD5_DIGEST = ThreadLocal.withInitial(() -> {
        try {
            return MessageDigest.getInstance("MD5");
        } catch (NoSuchAlgorithmException e) {
            throw new RuntimeException("MD5 algorithm not available", e);
        }
    });

    private HashingUtil() {}

    public static byte[] md5(String input) {
        MessageDigest digest = MD5_DIGEST.get();
        digest.reset();
        return digest.digest(input.getBytes(StandardCharsets.UTF_8));
    }

    public static String md5Hex(String input) {
        return HexFormat.of().formatHex(md5(input));
    }

    /**
     * MD5 over the cube's shape, wavelength axis, raw values and acquisition metadata.
     */
    public static String computeCubeHash(ImageCube cube) {
        MessageDigest digest = MD5_DIGEST.get();
        digest.reset();

        ByteBuffer header = ByteBuffer.allocate(12);
        header.putInt(cube.rows()).putInt(cube.cols()).putInt(cube.bands());
        digest.update(header.array());

        double[] wavelengths = cube.wavelengths();
        ByteBuffer axis = ByteBuffer.allocate(wavelengths.length * Double.BYTES);
        for (double w : wavelengths) axis.putDouble(w);
        digest.update(axis.array());

        double[] data = cube.copyData();
        ByteBuffer values = ByteBuffer.allocate(data.length * Double.BYTES);
        for (double v : data) values.putDouble(v);
        digest.update(values.array());

        CubeMetadata md = cube.metadata();
        String meta = md.exposureMs() + "|" + md.darkCounts() + "|" + md.systemId() + "|" + md.acquired();
        digest.update(meta.getBytes(StandardCharsets.UTF_8));

        return HexFormat.of().formatHex(digest.digest());
    }

    public static String computeSettingsHash(AnalysisSettings settings) {
        return md5Hex(settings.toJson());
    }

    /**
     * Identity of an analysis: MD5 over
     * {@code sampleHash|referenceHash|strayHash|settingsHash|extraReflectanceId}.
     *
     * @param strayHash content hash of the stray-reflectance cube, {@code null} when none is applied
     */
    public static String computeIdentityTag(String sampleHash, String referenceHash, String strayHash,
                                            AnalysisSettings settings) {
        String stray = strayHash == null ? "" : strayHash;
        String extra = settings.extraReflectanceId() == null ? "" : settings.extraReflectanceId();
        return md5Hex(sampleHash + "|" + referenceHash + "|" + stray + "|" + computeSettingsHash(settings) + "|" + extra);
    }

    public static String computeIdentityTag(ImageCube sample, ImageCube reference, ImageCube strayReflectance,
                                            AnalysisSettings settings) {
        return computeIdentityTag(computeCubeHash(sample), computeCubeHash(reference),
                strayReflectance == null ? null : computeCubeHash(strayReflectance), settings);
    }

    public static long computeChecksum(byte[] bytes, int offset, int length) {
        return XX_HASH.hash64().hash(bytes, offset, length, SEED);
    }
}
