/*
 * PWSCore — Spectral Interferometry Analysis Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.pwscore.core.storage.io;

import ai.evacortex.pwscore.core.exceptions.CorruptContainerException;
import ai.evacortex.pwscore.core.storage.HashingUtil;
import ai.evacortex.pwscore.core.storage.io.format.BinaryHeader;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;

/**
 * Reads and writes a {@link BinaryHeader} followed by a checksummed payload. Writes go to a
 * temporary sibling first and are moved into place, so readers never observe a partial file.
 */
public final class ContainerFile {

    private ContainerFile() {}

    public static void write(Path path, int magic, int version, byte[] payload) throws IOException {
        long checksum = HashingUtil.computeChecksum(payload, 0, payload.length);
        BinaryHeader header = new BinaryHeader(magic, version, System.currentTimeMillis(), payload.length, checksum);

        Files.createDirectories(path.toAbsolutePath().getParent());
        Path tmp = path.resolveSibling(path.getFileName() + ".tmp");
        try (OutputStream out = Files.newOutputStream(tmp, StandardOpenOption.CREATE,
                StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE)) {
            out.write(header.toBytes());
            out.write(payload);
        }
        try {
            Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    /**
     * @return the verified payload, little-endian, positioned at its start
     */
    public static ByteBuffer read(Path path, int magic, int supportedVersion) throws IOException {
        byte[] bytes = Files.readAllBytes(path);
        ByteBuffer buf = ByteBuffer.wrap(bytes).order(ByteOrder.LITTLE_ENDIAN);
        BinaryHeader header = BinaryHeader.from(buf, magic);
        if (header.version() > supportedVersion) {
            throw new CorruptContainerException("Unsupported version " + header.version() + " in " + path);
        }
        if (header.payloadLength() != buf.remaining()) {
            throw new CorruptContainerException("Payload length mismatch in " + path + ": header says "
                    + header.payloadLength() + ", found " + buf.remaining());
        }
        long actual = HashingUtil.computeChecksum(bytes, buf.position(), buf.remaining());
        if (actual != header.checksum()) {
            throw new CorruptContainerException("Checksum mismatch in " + path);
        }
        return buf.slice().order(ByteOrder.LITTLE_ENDIAN);
    }
}
