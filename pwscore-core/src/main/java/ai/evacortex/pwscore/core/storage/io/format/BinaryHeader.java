/*
 * PWSCore — Spectral Interferometry Analysis Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.pwscore.core.storage.io.format;

import ai.evacortex.pwscore.core.exceptions.CorruptContainerException;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;

/**
 * Fixed-size header at the start of every binary container written by the stores.
 *
 * <h3>Layout (little-endian)</h3>
 * <ul>
 *   <li>magic, 4 bytes, identifies the container kind</li>
 *   <li>format version, 2 bytes</li>
 *   <li>write timestamp in epoch milliseconds, 8 bytes</li>
 *   <li>payload length in bytes, 8 bytes</li>
 *   <li>xxHash64 of the payload, 8 bytes</li>
 *   <li>padding to a multiple of 4</li>
 * </ul>
 * The payload follows the header directly.
 */
public final class BinaryHeader {

    public static final int MAGIC_LENGTH = 4;
    public static final int VERSION_LENGTH = 2;
    public static final int TIMESTAMP_LENGTH = 8;
    public static final int PAYLOAD_LENGTH_LENGTH = 8;
    public static final int CHECKSUM_LENGTH = 8;
    public static final int SIZE = size();

    private final int magic;
    private final int version;
    private final long timestamp;
    private final long payloadLength;
    private final long checksum;

    private static int size() {
        int raw = MAGIC_LENGTH + VERSION_LENGTH + TIMESTAMP_LENGTH + PAYLOAD_LENGTH_LENGTH + CHECKSUM_LENGTH;
        return (raw % 4 == 0) ? raw : raw + (4 - (raw % 4));
    }

    public BinaryHeader(int magic, int version, long timestamp, long payloadLength, long checksum) {
        if (version < 0 || version > 0xFFFF) {
            throw new IllegalArgumentException("Unsupported version: " + version);
        }
        if (payloadLength < 0) {
            throw new IllegalArgumentException("Negative payload length: " + payloadLength);
        }
        this.magic = magic;
        this.version = version;
        this.timestamp = timestamp;
        this.payloadLength = payloadLength;
        this.checksum = checksum;
    }

    public byte[] toBytes() {
        ByteBuffer buf = ByteBuffer.allocate(SIZE).order(ByteOrder.LITTLE_ENDIAN);
        buf.putInt(magic);
        buf.putShort((short) version);
        buf.putLong(timestamp);
        buf.putLong(payloadLength);
        buf.putLong(checksum);
        while (buf.hasRemaining()) buf.put((byte) 0);
        return buf.array();
    }

    /**
     * Reads a header and checks its magic. The buffer is left positioned at the payload.
     */
    public static BinaryHeader from(ByteBuffer buf, int expectedMagic) {
        if (buf.remaining() < SIZE) {
            throw new CorruptContainerException("Truncated header: " + buf.remaining() + " bytes");
        }
        buf.order(ByteOrder.LITTLE_ENDIAN);
        int start = buf.position();
        int magic = buf.getInt();
        if (magic != expectedMagic) {
            throw new CorruptContainerException("Invalid magic: " + Integer.toHexString(magic));
        }
        int version = buf.getShort() & 0xFFFF;
        long timestamp = buf.getLong();
        long payloadLength = buf.getLong();
        long checksum = buf.getLong();
        buf.position(start + SIZE);
        if (payloadLength < 0) {
            throw new CorruptContainerException("Negative payload length: " + payloadLength);
        }
        return new BinaryHeader(magic, version, timestamp, payloadLength, checksum);
    }

    public int magic()          { return magic; }
    public int version()        { return version; }
    public long timestamp()     { return timestamp; }
    public long payloadLength() { return payloadLength; }
    public long checksum()      { return checksum; }
}
