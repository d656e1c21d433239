/*
 * PWSCore — Spectral Interferometry Analysis Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.pwscore.core.batch;

import ai.evacortex.pwscore.core.AnalysisResults;
import ai.evacortex.pwscore.core.AnalysisSettings;
import ai.evacortex.pwscore.core.ImageCube;
import ai.evacortex.pwscore.core.engine.AnalysisPipeline;
import ai.evacortex.pwscore.core.storage.AnalysisResultsCache;
import ai.evacortex.pwscore.core.storage.FileAnalysisResultsStore;
import ai.evacortex.pwscore.core.storage.HashingUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Analyses many cubes against one reference on a fixed thread pool.
 *
 * <p>Loading goes through a single lock; the numeric work runs in parallel. A cube whose identity
 * tag is already saved in its own directory is skipped. Results already cached for another
 * directory are saved without rerunning the pipeline. Results are saved into the cube's own
 * directory under the given analysis name.</p>
 */
public class BatchAnalysisRunner implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(BatchAnalysisRunner.class);

    private static final int DEFAULT_THREADS = Integer.getInteger("pwscore.batch.threads",
            Runtime.getRuntime().availableProcessors());

    private final AnalysisPipeline pipeline;
    private final CubeLoader loader;
    private final AnalysisResultsCache cache;
    private final ExecutorService executor;
    private final ReentrantLock loadLock = new ReentrantLock();

    public BatchAnalysisRunner(AnalysisPipeline pipeline, CubeLoader loader, AnalysisResultsCache cache) {
        this(pipeline, loader, cache, DEFAULT_THREADS);
    }

    public BatchAnalysisRunner(AnalysisPipeline pipeline, CubeLoader loader, AnalysisResultsCache cache, int threads) {
        this.pipeline = Objects.requireNonNull(pipeline, "pipeline must not be null");
        this.loader = Objects.requireNonNull(loader, "loader must not be null");
        this.cache = Objects.requireNonNull(cache, "cache must not be null");
        if (threads < 1) {
            throw new IllegalArgumentException("threads must be >= 1, got " + threads);
        }
        this.executor = Executors.newFixedThreadPool(threads);
    }

    /**
     * Blocks until every cube is processed.
     *
     * @param strayReflectance shared stray reflectance cube, may be {@code null}
     * @param overwrite        replace an existing analysis of the same name with different content
     */
    public BatchReport run(List<Path> cubeDirectories, ImageCube reference, ImageCube strayReflectance,
                           AnalysisSettings settings, String analysisName, boolean overwrite) {
        Objects.requireNonNull(reference, "reference must not be null");
        Objects.requireNonNull(settings, "settings must not be null");
        AnalysisPipeline.checkStrayReflectance(strayReflectance, settings);
        String referenceHash = HashingUtil.computeCubeHash(reference);
        String strayHash = strayReflectance == null ? null : HashingUtil.computeCubeHash(strayReflectance);

        List<Future<BatchReport.Outcome>> futures = new ArrayList<>(cubeDirectories.size());
        for (Path dir : cubeDirectories) {
            futures.add(executor.submit(() ->
                    process(dir, reference, referenceHash, strayReflectance, strayHash, settings, analysisName, overwrite)));
        }

        List<BatchReport.Outcome> outcomes = new ArrayList<>(futures.size());
        for (int i = 0; i < futures.size(); i++) {
            Path dir = cubeDirectories.get(i);
            try {
                outcomes.add(futures.get(i).get());
            } catch (ExecutionException e) {
                Throwable cause = e.getCause() != null ? e.getCause() : e;
                logger.error("Batch item {} failed unexpectedly", dir, cause);
                outcomes.add(new BatchReport.Outcome(dir, BatchReport.Status.FAILED, null, cause));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                outcomes.add(new BatchReport.Outcome(dir, BatchReport.Status.FAILED, null, e));
            }
        }
        BatchReport report = new BatchReport(outcomes);
        logger.info("Batch '{}' finished: {} completed, {} skipped, {} failed", analysisName,
                report.count(BatchReport.Status.COMPLETED), report.count(BatchReport.Status.SKIPPED),
                report.count(BatchReport.Status.FAILED));
        return report;
    }

    private BatchReport.Outcome process(Path dir, ImageCube reference, String referenceHash, ImageCube stray,
                                        String strayHash, AnalysisSettings settings, String analysisName,
                                        boolean overwrite) {
        String identityTag = null;
        try {
            ImageCube cube;
            loadLock.lock();
            try {
                cube = loader.load(dir);
            } finally {
                loadLock.unlock();
            }
            identityTag = HashingUtil.computeIdentityTag(HashingUtil.computeCubeHash(cube), referenceHash,
                    strayHash, settings);

            FileAnalysisResultsStore store = new FileAnalysisResultsStore(dir, cache);
            if (store.findByIdentityTag(identityTag).isPresent()) {
                logger.info("Skipping {}: analysis {} already exists", dir, identityTag);
                return new BatchReport.Outcome(dir, BatchReport.Status.SKIPPED, identityTag, null);
            }

            Optional<AnalysisResults> cached = cache.get(identityTag);
            AnalysisResults results;
            if (cached.isPresent()) {
                logger.info("Reusing cached analysis {} for {}", identityTag, dir);
                results = cached.get();
            } else {
                results = pipeline.run(cube, reference, stray, settings);
            }
            store.save(analysisName, results, overwrite);
            return new BatchReport.Outcome(dir, BatchReport.Status.COMPLETED, identityTag, null);
        } catch (Exception e) {
            logger.error("Analysis of {} failed", dir, e);
            return new BatchReport.Outcome(dir, BatchReport.Status.FAILED, identityTag, e);
        }
    }

    @Override
    public void close() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(30, TimeUnit.SECONDS)) executor.shutdownNow();
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
