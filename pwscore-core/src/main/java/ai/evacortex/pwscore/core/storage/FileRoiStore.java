/*
 * PWSCore — Spectral Interferometry Analysis Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.pwscore.core.storage;

import ai.evacortex.pwscore.core.Roi;
import ai.evacortex.pwscore.core.exceptions.DuplicateRoiException;
import ai.evacortex.pwscore.core.exceptions.RoiNotFoundException;
import ai.evacortex.pwscore.core.storage.io.ContainerFile;
import ai.evacortex.pwscore.core.storage.io.codec.RoiCodec;
import ai.evacortex.pwscore.core.storage.util.AutoLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * {@link RoiStore} writing one {@code roi_<name>_<number>.pwsr} container per ROI.
 */
public class FileRoiStore implements RoiStore {

    private static final Logger logger = LoggerFactory.getLogger(FileRoiStore.class);

    private static final Pattern FILE_PATTERN = Pattern.compile("roi_([A-Za-z0-9._-]+)_(-?\\d+)\\.pwsr");

    private final Path directory;
    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    public FileRoiStore(Path directory) {
        this.directory = Objects.requireNonNull(directory, "directory must not be null");
    }

    @Override
    public void save(Roi roi, boolean overwrite) {
        Objects.requireNonNull(roi, "roi must not be null");
        FileAnalysisResultsStore.validateName(roi.name());
        byte[] payload = RoiCodec.serialize(roi);
        try (AutoLock ignored = AutoLock.write(lock)) {
            Path file = fileFor(roi.name(), roi.number());
            if (Files.exists(file) && !overwrite) {
                throw new DuplicateRoiException(roi.name(), roi.number());
            }
            ContainerFile.write(file, RoiCodec.MAGIC, RoiCodec.VERSION, payload);
            logger.debug("Saved {} to {}", roi, file);
        } catch (IOException e) {
            throw new RuntimeException("Failed to save ROI '" + roi.name() + "' #" + roi.number(), e);
        }
    }

    @Override
    public Roi load(String name, int number) {
        FileAnalysisResultsStore.validateName(name);
        Roi roi;
        try (AutoLock ignored = AutoLock.read(lock)) {
            roi = RoiCodec.deserialize(ContainerFile.read(fileFor(name, number), RoiCodec.MAGIC, RoiCodec.VERSION));
        } catch (NoSuchFileException e) {
            throw new RoiNotFoundException(name, number, e);
        } catch (IOException e) {
            throw new RuntimeException("Failed to load ROI '" + name + "' #" + number, e);
        }
        if (roi.vertices().isEmpty()) {
            roi = roi.withVertices(roi.verticesOrTraced());
        }
        return roi;
    }

    @Override
    public List<RoiKey> list() {
        List<RoiKey> keys = new ArrayList<>();
        if (!Files.isDirectory(directory)) {
            return keys;
        }
        try (AutoLock ignored = AutoLock.read(lock);
             DirectoryStream<Path> stream = Files.newDirectoryStream(directory, "roi_*.pwsr")) {
            for (Path p : stream) {
                Matcher m = FILE_PATTERN.matcher(p.getFileName().toString());
                if (m.matches()) {
                    keys.add(new RoiKey(m.group(1), Integer.parseInt(m.group(2))));
                }
            }
        } catch (IOException e) {
            throw new RuntimeException("Failed to list ROIs in " + directory, e);
        }
        Collections.sort(keys);
        return keys;
    }

    @Override
    public void delete(String name, int number) {
        FileAnalysisResultsStore.validateName(name);
        try (AutoLock ignored = AutoLock.write(lock)) {
            if (!Files.deleteIfExists(fileFor(name, number))) {
                throw new RoiNotFoundException(name, number);
            }
        } catch (IOException e) {
            throw new RuntimeException("Failed to delete ROI '" + name + "' #" + number, e);
        }
    }

    private Path fileFor(String name, int number) {
        return directory.resolve("roi_" + name + "_" + number + ".pwsr");
    }
}
