/*
 * PWSCore — Spectral Interferometry Analysis Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.pwscore.core.storage.io.codec;

import ai.evacortex.pwscore.core.AnalysisResults;
import ai.evacortex.pwscore.core.AnalysisSettings;
import ai.evacortex.pwscore.core.AnalysisWarning;
import ai.evacortex.pwscore.core.KCube;
import ai.evacortex.pwscore.core.OpdCube;
import ai.evacortex.pwscore.core.PixelMap;
import ai.evacortex.pwscore.core.exceptions.CorruptContainerException;
import ai.evacortex.pwscore.core.exceptions.InvalidCubeException;
import ai.evacortex.pwscore.core.exceptions.InvalidSettingsException;

import java.nio.BufferUnderflowException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Binary payload of an {@link AnalysisResults} container.
 *
 * <h3>Layout (little-endian)</h3>
 * <ul>
 *   <li>rows, cols</li>
 *   <li>identity tag, sample tag, reference tag, settings JSON</li>
 *   <li>creation instant as epoch seconds and nanoseconds</li>
 *   <li>reflectance and RMS maps</li>
 *   <li>polynomial RMS, autocorrelation slope, R² and Ld maps, each possibly absent</li>
 *   <li>detrended k-cube: wavenumbers and values</li>
 *   <li>OPD cube: depths and values, both absent when not computed</li>
 *   <li>warnings as (short, long) message pairs</li>
 * </ul>
 */
public final class AnalysisResultsCodec {

    public static final int MAGIC = 0x50575341; // 'PWSA'
    public static final int VERSION = 1;
    public static final ByteOrder ORDER = ByteOrder.LITTLE_ENDIAN;

    private AnalysisResultsCodec() {}

    public static byte[] serialize(AnalysisResults results) {
        int capacity = CodecSupport.checkedCapacity(estimateSize(results), "Analysis results");
        ByteBuffer buf = ByteBuffer.allocate(capacity).order(ORDER);
        writeTo(buf, results);
        if (buf.hasRemaining()) {
            throw new IllegalStateException("Size estimate off by " + buf.remaining() + " bytes");
        }
        return buf.array();
    }

    public static AnalysisResults deserialize(ByteBuffer buf) {
        try {
            return readFrom(buf.order(ORDER));
        } catch (BufferUnderflowException e) {
            throw new CorruptContainerException("Analysis results payload is truncated", e);
        } catch (InvalidCubeException | InvalidSettingsException e) {
            throw new CorruptContainerException("Analysis results payload is inconsistent: " + e.getMessage(), e);
        }
    }

    public static void writeTo(ByteBuffer buf, AnalysisResults r) {
        buf.order(ORDER);
        buf.putInt(r.rows());
        buf.putInt(r.cols());
        CodecSupport.putString(buf, r.identityTag());
        CodecSupport.putString(buf, r.sampleTag());
        CodecSupport.putString(buf, r.referenceTag());
        CodecSupport.putString(buf, r.settings().toJson());
        buf.putLong(r.created().getEpochSecond());
        buf.putInt(r.created().getNano());

        CodecSupport.putDoubles(buf, r.reflectance().copyValues());
        CodecSupport.putDoubles(buf, r.rms().copyValues());
        CodecSupport.putDoubles(buf, r.polynomialRms().map(PixelMap::copyValues).orElse(null));
        CodecSupport.putDoubles(buf, r.autoCorrelationSlope().map(PixelMap::copyValues).orElse(null));
        CodecSupport.putDoubles(buf, r.rSquared().map(PixelMap::copyValues).orElse(null));
        CodecSupport.putDoubles(buf, r.ld().map(PixelMap::copyValues).orElse(null));

        CodecSupport.putDoubles(buf, r.detrended().wavenumbers());
        CodecSupport.putDoubles(buf, r.detrended().copyData());

        CodecSupport.putDoubles(buf, r.opd().map(OpdCube::depths).orElse(null));
        CodecSupport.putDoubles(buf, r.opd().map(OpdCube::copyData).orElse(null));

        buf.putInt(r.warnings().size());
        for (AnalysisWarning w : r.warnings()) {
            CodecSupport.putString(buf, w.shortMessage());
            CodecSupport.putString(buf, w.longMessage());
        }
    }

    public static AnalysisResults readFrom(ByteBuffer buf) {
        int rows = buf.getInt();
        int cols = buf.getInt();
        if (rows <= 0 || cols <= 0 || (long) rows * cols > CodecSupport.MAX_ARRAY_LENGTH) {
            throw new CorruptContainerException("Suspicious map shape: " + rows + "x" + cols);
        }
        String identityTag = CodecSupport.getString(buf);
        String sampleTag = CodecSupport.getString(buf);
        String referenceTag = CodecSupport.getString(buf);
        AnalysisSettings settings = AnalysisSettings.fromJson(CodecSupport.getString(buf));
        Instant created = Instant.ofEpochSecond(buf.getLong(), buf.getInt());

        PixelMap reflectance = map(rows, cols, CodecSupport.getDoubles(buf));
        PixelMap rms = map(rows, cols, CodecSupport.getDoubles(buf));
        PixelMap polynomialRms = map(rows, cols, CodecSupport.getDoubles(buf));
        PixelMap slope = map(rows, cols, CodecSupport.getDoubles(buf));
        PixelMap rSquared = map(rows, cols, CodecSupport.getDoubles(buf));
        PixelMap ld = map(rows, cols, CodecSupport.getDoubles(buf));

        double[] wavenumbers = CodecSupport.getDoubles(buf);
        double[] kData = CodecSupport.getDoubles(buf);
        KCube detrended = new KCube(rows, cols, kData, wavenumbers);

        double[] depths = CodecSupport.getDoubles(buf);
        double[] opdData = CodecSupport.getDoubles(buf);
        OpdCube opd = depths == null ? null : new OpdCube(rows, cols, opdData, depths);

        int warningCount = buf.getInt();
        if (warningCount < 0 || warningCount > 10_000) {
            throw new CorruptContainerException("Suspicious warning count: " + warningCount);
        }
        List<AnalysisWarning> warnings = new ArrayList<>(warningCount);
        for (int i = 0; i < warningCount; i++) {
            warnings.add(new AnalysisWarning(CodecSupport.getString(buf), CodecSupport.getString(buf)));
        }

        return new AnalysisResults(identityTag, sampleTag, referenceTag, settings, created, reflectance, rms,
                polynomialRms, slope, rSquared, ld, opd, detrended, warnings);
    }

    public static long estimateSize(AnalysisResults r) {
        long size = 8;
        size += CodecSupport.sizeOf(r.identityTag()) + CodecSupport.sizeOf(r.sampleTag())
                + CodecSupport.sizeOf(r.referenceTag()) + CodecSupport.sizeOf(r.settings().toJson());
        size += 12;
        long mapSize = CodecSupport.sizeOfDoubles((long) r.rows() * r.cols());
        size += 2 * mapSize;
        size += r.polynomialRms().isPresent() ? mapSize : 4;
        size += r.autoCorrelationSlope().isPresent() ? mapSize : 4;
        size += r.rSquared().isPresent() ? mapSize : 4;
        size += r.ld().isPresent() ? mapSize : 4;
        KCube k = r.detrended();
        size += CodecSupport.sizeOfDoubles(k.bands());
        size += CodecSupport.sizeOfDoubles((long) k.pixelCount() * k.bands());
        if (r.opd().isPresent()) {
            OpdCube o = r.opd().get();
            size += CodecSupport.sizeOfDoubles(o.bands());
            size += CodecSupport.sizeOfDoubles((long) o.pixelCount() * o.bands());
        } else {
            size += 8;
        }
        size += 4;
        for (AnalysisWarning w : r.warnings()) {
            size += CodecSupport.sizeOf(w.shortMessage()) + CodecSupport.sizeOf(w.longMessage());
        }
        return size;
    }

    private static PixelMap map(int rows, int cols, double[] values) {
        return values == null ? null : new PixelMap(rows, cols, values);
    }
}
