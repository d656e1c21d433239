/*
 * PWSCore — Spectral Interferometry Analysis Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.pwscore.core.metadata;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * JSON index of the analyses saved in one directory: name → identity tag, creation time and
 * settings. Every mutation rewrites the file; the previous version is kept as a {@code .bak}
 * sibling and used when the main file cannot be parsed.
 */
public class AnalysisIndex {

    private static final Logger logger = LoggerFactory.getLogger(AnalysisIndex.class);

    private final Path indexFile;
    private final Map<String, Entry> entries;
    private final ObjectMapper mapper;
    private final ReentrantReadWriteLock rwLock;

    /**
     * @param created  ISO-8601 instant
     * @param settings settings JSON as written by {@code AnalysisSettings.toJsonNode()}
     */
    public record Entry(String identityTag, String created, JsonNode settings) {}

    public static AnalysisIndex loadOrCreate(Path path) {
        AnalysisIndex index = new AnalysisIndex(path);
        if (Files.exists(path)) {
            try {
                index.entries.putAll(index.read(path));
            } catch (IOException e) {
                Path backup = backupOf(path);
                if (!Files.exists(backup)) {
                    throw new RuntimeException("Failed to load analysis index " + path, e);
                }
                logger.warn("Analysis index {} is unreadable ({}); restoring from {}", path, e.getMessage(), backup);
                try {
                    index.entries.putAll(index.read(backup));
                } catch (IOException inner) {
                    inner.addSuppressed(e);
                    throw new RuntimeException("Failed to load analysis index backup " + backup, inner);
                }
                index.flush();
            }
        }
        return index;
    }

    private AnalysisIndex(Path indexFile) {
        this.indexFile = indexFile;
        this.mapper = new ObjectMapper();
        this.entries = new TreeMap<>();
        this.rwLock = new ReentrantReadWriteLock();
    }

    private Map<String, Entry> read(Path path) throws IOException {
        try (InputStream in = Files.newInputStream(path)) {
            TypeReference<Map<String, Entry>> typeRef = new TypeReference<>() {};
            Map<String, Entry> loaded = mapper.readValue(in, typeRef);
            return loaded == null ? Map.of() : loaded;
        }
    }

    public void put(String name, Entry entry) {
        rwLock.writeLock().lock();
        try {
            Entry previous = entries.put(name, entry);
            try {
                flush();
            } catch (RuntimeException e) {
                if (previous == null) entries.remove(name);
                else entries.put(name, previous);
                throw e;
            }
        } finally {
            rwLock.writeLock().unlock();
        }
    }

    public void remove(String name) {
        rwLock.writeLock().lock();
        try {
            Entry previous = entries.remove(name);
            if (previous != null) {
                try {
                    flush();
                } catch (RuntimeException e) {
                    entries.put(name, previous);
                    throw e;
                }
            }
        } finally {
            rwLock.writeLock().unlock();
        }
    }

    public Optional<Entry> get(String name) {
        rwLock.readLock().lock();
        try {
            return Optional.ofNullable(entries.get(name));
        } finally {
            rwLock.readLock().unlock();
        }
    }

    public Optional<String> findNameByIdentityTag(String identityTag) {
        rwLock.readLock().lock();
        try {
            return entries.entrySet().stream()
                    .filter(e -> identityTag.equals(e.getValue().identityTag()))
                    .map(Map.Entry::getKey)
                    .findFirst();
        } finally {
            rwLock.readLock().unlock();
        }
    }

    public Map<String, Entry> snapshot() {
        rwLock.readLock().lock();
        try {
            return new TreeMap<>(entries);
        } finally {
            rwLock.readLock().unlock();
        }
    }

    public void flush() {
        rwLock.writeLock().lock();
        try {
            Files.createDirectories(indexFile.toAbsolutePath().getParent());
            if (Files.exists(indexFile)) {
                Files.copy(indexFile, backupOf(indexFile), StandardCopyOption.REPLACE_EXISTING);
            }
            try (OutputStream out = Files.newOutputStream(indexFile, StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING)) {
                mapper.writerWithDefaultPrettyPrinter().writeValue(out, entries);
            }
        } catch (IOException e) {
            throw new RuntimeException("Failed to flush analysis index", e);
        } finally {
            rwLock.writeLock().unlock();
        }
    }

    private static Path backupOf(Path path) {
        return path.resolveSibling(path.getFileName() + ".bak");
    }
}
