/*
 * PWSCore — Spectral Interferometry Analysis Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.pwscore.core.storage.io.codec;

import ai.evacortex.pwscore.core.Roi;
import ai.evacortex.pwscore.core.exceptions.CorruptContainerException;
import ai.evacortex.pwscore.core.exceptions.InvalidCubeException;

import java.nio.BufferUnderflowException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;

/**
 * Binary payload of an ROI container: shape, name, number, the mask packed eight pixels per byte
 * (row-major, least significant bit first) and the optional polygon outline.
 */
public final class RoiCodec {

    public static final int MAGIC = 0x50575352; // 'PWSR'
    public static final int VERSION = 1;
    public static final ByteOrder ORDER = ByteOrder.LITTLE_ENDIAN;

    private RoiCodec() {}

    public static byte[] serialize(Roi roi) {
        boolean[] mask = roi.mask();
        byte[] packed = pack(mask);
        double[][] vertices = roi.vertices().orElse(null);

        long size = 8L + CodecSupport.sizeOf(roi.name()) + 4 + 4 + packed.length + 4
                + (vertices == null ? 0 : vertices.length * 2L * Double.BYTES);
        ByteBuffer buf = ByteBuffer.allocate(CodecSupport.checkedCapacity(size, "ROI " + roi.name())).order(ORDER);
        buf.putInt(roi.rows());
        buf.putInt(roi.cols());
        CodecSupport.putString(buf, roi.name());
        buf.putInt(roi.number());
        buf.putInt(packed.length);
        buf.put(packed);
        if (vertices == null) {
            buf.putInt(-1);
        } else {
            buf.putInt(vertices.length);
            for (double[] v : vertices) {
                buf.putDouble(v[0]);
                buf.putDouble(v[1]);
            }
        }
        return buf.array();
    }

    public static Roi deserialize(ByteBuffer buf) {
        buf.order(ORDER);
        try {
            int rows = buf.getInt();
            int cols = buf.getInt();
            if (rows <= 0 || cols <= 0 || (long) rows * cols > CodecSupport.MAX_ARRAY_LENGTH) {
                throw new CorruptContainerException("Suspicious ROI shape: " + rows + "x" + cols);
            }
            String name = CodecSupport.getString(buf);
            int number = buf.getInt();
            int packedLength = buf.getInt();
            if (packedLength != (rows * cols + 7) / 8) {
                throw new CorruptContainerException("Mask length " + packedLength + " does not match " + rows + "x" + cols);
            }
            byte[] packed = new byte[packedLength];
            buf.get(packed);
            boolean[] mask = unpack(packed, rows * cols);

            int count = buf.getInt();
            double[][] vertices = null;
            if (count >= 0) {
                if ((long) count * 2 * Double.BYTES > buf.remaining()) {
                    throw new CorruptContainerException("Vertex count " + count + " exceeds payload");
                }
                vertices = new double[count][2];
                for (int i = 0; i < count; i++) {
                    vertices[i][0] = buf.getDouble();
                    vertices[i][1] = buf.getDouble();
                }
            }
            return new Roi(name, number, rows, cols, mask, vertices);
        } catch (BufferUnderflowException e) {
            throw new CorruptContainerException("ROI payload is truncated", e);
        } catch (InvalidCubeException | IllegalArgumentException e) {
            throw new CorruptContainerException("ROI payload is inconsistent: " + e.getMessage(), e);
        }
    }

    static byte[] pack(boolean[] mask) {
        byte[] out = new byte[(mask.length + 7) / 8];
        for (int i = 0; i < mask.length; i++) {
            if (mask[i]) out[i >>> 3] |= (byte) (1 << (i & 7));
        }
        return out;
    }

    static boolean[] unpack(byte[] packed, int length) {
        boolean[] out = new boolean[length];
        for (int i = 0; i < length; i++) {
            out[i] = (packed[i >>> 3] & (1 << (i & 7))) != 0;
        }
        return out;
    }
}
