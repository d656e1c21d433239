/*
 * PWSCore — Spectral Interferometry Analysis Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.pwscore.core.storage.io.codec;

import ai.evacortex.pwscore.core.exceptions.ContainerOverflowException;
import ai.evacortex.pwscore.core.exceptions.CorruptContainerException;
import ai.evacortex.pwscore.core.storage.io.format.BinaryHeader;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;

/**
 * Primitive encoders shared by the codecs. Strings are length-prefixed UTF-8 with {@code -1}
 * marking {@code null}; arrays are length-prefixed.
 */
final class CodecSupport {

    static final int MAX_ARRAY_LENGTH = 1 << 28;
    // largest heap buffer a payload may take, header included
    static final int MAX_PAYLOAD_BYTES = Integer.MAX_VALUE - 8 - BinaryHeader.SIZE;

    private CodecSupport() {}

    static int sizeOf(String s) {
        return 4 + (s == null ? 0 : s.getBytes(StandardCharsets.UTF_8).length);
    }

    static long sizeOfDoubles(long count) {
        return 4L + count * Double.BYTES;
    }

    static int checkedCapacity(long size, String what) {
        if (size > MAX_PAYLOAD_BYTES) {
            throw new ContainerOverflowException(what + " need " + size
                    + " bytes, more than the " + MAX_PAYLOAD_BYTES + " a single container holds");
        }
        return (int) size;
    }

    static void putString(ByteBuffer buf, String s) {
        if (s == null) {
            buf.putInt(-1);
            return;
        }
        byte[] bytes = s.getBytes(StandardCharsets.UTF_8);
        buf.putInt(bytes.length);
        buf.put(bytes);
    }

    static String getString(ByteBuffer buf) {
        int len = getLength(buf, 1);
        if (len < 0) return null;
        byte[] bytes = new byte[len];
        buf.get(bytes);
        return new String(bytes, StandardCharsets.UTF_8);
    }

    /** Writes an array, {@code null} as length {@code -1}. */
    static void putDoubles(ByteBuffer buf, double[] v) {
        if (v == null) {
            buf.putInt(-1);
            return;
        }
        buf.putInt(v.length);
        for (double d : v) buf.putDouble(d);
    }

    static double[] getDoubles(ByteBuffer buf) {
        int len = getLength(buf, Double.BYTES);
        if (len < 0) return null;
        double[] v = new double[len];
        for (int i = 0; i < len; i++) v[i] = buf.getDouble();
        return v;
    }

    private static int getLength(ByteBuffer buf, int elementSize) {
        if (buf.remaining() < 4) {
            throw new CorruptContainerException("Buffer underflow reading length");
        }
        int len = buf.getInt();
        if (len < -1 || len > MAX_ARRAY_LENGTH) {
            throw new CorruptContainerException("Suspicious length: " + len);
        }
        if (len > 0 && (long) len * elementSize > buf.remaining()) {
            throw new CorruptContainerException("Buffer underflow: need " + (long) len * elementSize
                    + " bytes, found " + buf.remaining());
        }
        return len;
    }
}
