/*
 * PWSCore — Spectral Interferometry Analysis Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.pwscore.core.reference;

import ai.evacortex.pwscore.core.Material;
import ai.evacortex.pwscore.core.exceptions.InvalidCubeException;
import ai.evacortex.pwscore.core.exceptions.UnknownMaterialException;
import ai.evacortex.pwscore.core.math.Complex;
import org.apache.commons.math3.analysis.interpolation.LinearInterpolator;
import org.apache.commons.math3.analysis.polynomials.PolynomialSplineFunction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * {@link ReferenceDataService} backed by CSV tables ({@code wavelength_um,n,k}) loaded from the
 * classpath under {@code refractive-index/}. All tables are read on construction; afterwards the
 * instance is immutable.
 *
 * <p>Interpolation is linear and limited to the range covered by every loaded table.</p>
 */
public final class TabulatedReferenceData implements ReferenceDataService {

    private static final Logger logger = LoggerFactory.getLogger(TabulatedReferenceData.class);
    private static final String TABLE_DIR = "/refractive-index/";

    private final Map<Material, Table> tables;
    private final double minNm;
    private final double maxNm;

    private record Table(PolynomialSplineFunction n, PolynomialSplineFunction k, double minNm, double maxNm) {}

    public TabulatedReferenceData() {
        this(List.of(Material.values()));
    }

    public TabulatedReferenceData(Collection<Material> materials) {
        Map<Material, Table> loaded = new EnumMap<>(Material.class);
        double lo = Double.NEGATIVE_INFINITY;
        double hi = Double.POSITIVE_INFINITY;
        for (Material m : materials) {
            Table t = load(m);
            loaded.put(m, t);
            lo = Math.max(lo, t.minNm());
            hi = Math.min(hi, t.maxNm());
        }
        if (loaded.isEmpty() || !(lo < hi)) {
            throw new IllegalStateException("Reference tables have no common wavelength range");
        }
        this.tables = loaded;
        this.minNm = lo;
        this.maxNm = hi;
        logger.debug("Loaded {} refractive-index tables, common range {}-{} nm", loaded.size(), lo, hi);
    }

    @Override
    public Complex[] refractiveIndex(Material material, double[] wavelengthsNm) {
        Table t = tables.get(material);
        if (t == null) {
            throw new UnknownMaterialException(String.valueOf(material));
        }
        Complex[] out = new Complex[wavelengthsNm.length];
        for (int i = 0; i < wavelengthsNm.length; i++) {
            double wv = wavelengthsNm[i];
            if (!(wv >= minNm && wv <= maxNm)) {
                throw new InvalidCubeException("Wavelength " + wv + " nm outside reference data range ["
                        + minNm + ", " + maxNm + "]");
            }
            double um = wv / 1000.0;
            out[i] = new Complex(t.n().value(um), t.k().value(um));
        }
        return out;
    }

    @Override
    public double[] supportedRange() {
        return new double[]{minNm, maxNm};
    }

    private static Table load(Material material) {
        String resource = TABLE_DIR + material.tableFile();
        List<double[]> rows = new ArrayList<>();
        try (InputStream in = TabulatedReferenceData.class.getResourceAsStream(resource)) {
            if (in == null) {
                throw new UnknownMaterialException(material.name());
            }
            BufferedReader reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8));
            String line;
            boolean header = true;
            while ((line = reader.readLine()) != null) {
                if (header) {
                    header = false;
                    continue;
                }
                if (line.isBlank()) continue;
                String[] parts = line.split(",");
                rows.add(new double[]{
                        Double.parseDouble(parts[0].trim()),
                        Double.parseDouble(parts[1].trim()),
                        Double.parseDouble(parts[2].trim())});
            }
        } catch (IOException | NumberFormatException | ArrayIndexOutOfBoundsException e) {
            throw new IllegalStateException("Failed to read reference table " + resource, e);
        }
        if (rows.size() < 2) {
            throw new IllegalStateException("Reference table " + resource + " needs at least two rows");
        }
        double[] wv = new double[rows.size()];
        double[] n = new double[rows.size()];
        double[] k = new double[rows.size()];
        for (int i = 0; i < rows.size(); i++) {
            wv[i] = rows.get(i)[0];
            n[i] = rows.get(i)[1];
            k[i] = rows.get(i)[2];
        }
        LinearInterpolator interpolator = new LinearInterpolator();
        return new Table(interpolator.interpolate(wv, n), interpolator.interpolate(wv, k),
                wv[0] * 1000.0, wv[wv.length - 1] * 1000.0);
    }
}
