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
import ai.evacortex.pwscore.core.exceptions.AnalysisNotFoundException;
import ai.evacortex.pwscore.core.exceptions.DuplicateAnalysisException;
import ai.evacortex.pwscore.core.metadata.AnalysisIndex;
import ai.evacortex.pwscore.core.storage.io.ContainerFile;
import ai.evacortex.pwscore.core.storage.io.codec.AnalysisResultsCodec;
import ai.evacortex.pwscore.core.storage.util.AutoLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.regex.Pattern;

/**
 * {@link AnalysisResultsStore} writing one {@code analysisResults_<name>.pwsa} container per
 * analysis into a cube directory, plus an {@code analyses.json} index.
 */
public class FileAnalysisResultsStore implements AnalysisResultsStore {

    private static final Logger logger = LoggerFactory.getLogger(FileAnalysisResultsStore.class);

    static final Pattern NAME_PATTERN = Pattern.compile("[A-Za-z0-9._-]+");
    static final String PREFIX = "analysisResults_";
    static final String SUFFIX = ".pwsa";
    static final String INDEX_FILE = "analyses.json";

    private final Path directory;
    private final AnalysisIndex index;
    private final AnalysisResultsCache cache;
    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    public FileAnalysisResultsStore(Path directory) {
        this(directory, new AnalysisResultsCache());
    }

    public FileAnalysisResultsStore(Path directory, AnalysisResultsCache cache) {
        this.directory = Objects.requireNonNull(directory, "directory must not be null");
        this.cache = Objects.requireNonNull(cache, "cache must not be null");
        try {
            Files.createDirectories(directory);
        } catch (IOException e) {
            throw new RuntimeException("Failed to create results directory " + directory, e);
        }
        this.index = AnalysisIndex.loadOrCreate(directory.resolve(INDEX_FILE));
    }

    public Path directory() {
        return directory;
    }

    @Override
    public void save(String name, AnalysisResults results, boolean overwrite) {
        validateName(name);
        Objects.requireNonNull(results, "results must not be null");
        byte[] payload = AnalysisResultsCodec.serialize(results);
        try (AutoLock ignored = AutoLock.write(lock)) {
            Path file = fileFor(name);
            if (Files.exists(file) && !overwrite) {
                throw new DuplicateAnalysisException(name);
            }
            Optional<AnalysisIndex.Entry> previous = index.get(name);
            index.put(name, new AnalysisIndex.Entry(results.identityTag(), results.created().toString(),
                    results.settings().toJsonNode()));
            try {
                ContainerFile.write(file, AnalysisResultsCodec.MAGIC, AnalysisResultsCodec.VERSION, payload);
            } catch (IOException | RuntimeException e) {
                restoreIndex(name, previous, e);
                throw e;
            }
            previous.ifPresent(p -> {
                if (!p.identityTag().equals(results.identityTag())) cache.invalidate(p.identityTag());
            });
            cache.put(results);
            logger.info("Saved analysis '{}' ({}) to {}", name, results.identityTag(), file);
        } catch (IOException e) {
            throw new RuntimeException("Failed to save analysis '" + name + "'", e);
        }
    }

    @Override
    public AnalysisResults load(String name) {
        validateName(name);
        try (AutoLock ignored = AutoLock.read(lock)) {
            Optional<AnalysisIndex.Entry> entry = index.get(name);
            if (entry.isPresent()) {
                Optional<AnalysisResults> cached = cache.get(entry.get().identityTag());
                if (cached.isPresent()) return cached.get();
            }
            AnalysisResults results = AnalysisResultsCodec.deserialize(
                    ContainerFile.read(fileFor(name), AnalysisResultsCodec.MAGIC, AnalysisResultsCodec.VERSION));
            cache.put(results);
            return results;
        } catch (NoSuchFileException e) {
            throw new AnalysisNotFoundException(name, e);
        } catch (IOException e) {
            throw new RuntimeException("Failed to load analysis '" + name + "'", e);
        }
    }

    @Override
    public Optional<AnalysisResults> findByIdentityTag(String identityTag) {
        Optional<String> name = index.findNameByIdentityTag(identityTag);
        if (name.isEmpty()) return Optional.empty();
        try {
            return Optional.of(load(name.get()));
        } catch (AnalysisNotFoundException e) {
            logger.warn("Index lists analysis '{}' but its container is missing", name.get());
            return Optional.empty();
        }
    }

    @Override
    public boolean exists(String name) {
        validateName(name);
        try (AutoLock ignored = AutoLock.read(lock)) {
            return Files.exists(fileFor(name));
        }
    }

    @Override
    public void delete(String name) {
        validateName(name);
        try (AutoLock ignored = AutoLock.write(lock)) {
            if (!Files.deleteIfExists(fileFor(name))) {
                throw new AnalysisNotFoundException(name);
            }
            index.get(name).ifPresent(e -> cache.invalidate(e.identityTag()));
            index.remove(name);
            logger.info("Deleted analysis '{}'", name);
        } catch (IOException e) {
            throw new RuntimeException("Failed to delete analysis '" + name + "'", e);
        }
    }

    @Override
    public Set<String> listNames() {
        try (AutoLock ignored = AutoLock.read(lock)) {
            return index.snapshot().keySet();
        }
    }

    private void restoreIndex(String name, Optional<AnalysisIndex.Entry> previous, Exception failure) {
        try {
            if (previous.isPresent()) index.put(name, previous.get());
            else index.remove(name);
        } catch (RuntimeException e) {
            failure.addSuppressed(e);
        }
    }

    private Path fileFor(String name) {
        return directory.resolve(PREFIX + name + SUFFIX);
    }

    static void validateName(String name) {
        if (name == null || !NAME_PATTERN.matcher(name).matches()) {
            throw new IllegalArgumentException("Invalid name '" + name + "': use letters, digits, '.', '_' or '-'");
        }
    }
}
