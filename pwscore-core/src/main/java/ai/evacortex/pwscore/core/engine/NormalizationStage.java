/*
 * PWSCore — Spectral Interferometry Analysis Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.pwscore.core.engine;

import ai.evacortex.pwscore.core.AnalysisWarning;
import ai.evacortex.pwscore.core.ImageCube;
import ai.evacortex.pwscore.core.Material;
import ai.evacortex.pwscore.core.exceptions.InvalidCubeException;
import ai.evacortex.pwscore.core.exceptions.InvalidSettingsException;
import ai.evacortex.pwscore.core.reference.ReferenceDataService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Turns a raw sample cube into reflectance relative to a reference acquisition.
 *
 * <p>Steps, in order:</p>
 * <ol>
 *     <li>subtract the dark-count baseline from sample and reference (no clipping);</li>
 *     <li>divide each cube by its own exposure time;</li>
 *     <li>with a stray-reflectance cube {@code Rs} and the theoretical reference reflectance {@code Rt}:
 *         {@code I0 = ref / (Rt + Rs)}, subtract {@code Rs * I0} from sample and reference;</li>
 *     <li>with a reference material, divide the reference by {@code Rt} unless relative units are requested;</li>
 *     <li>divide the sample by the reference, band by band.</li>
 * </ol>
 * Non-positive reference values are not rejected; the affected pixels become NaN or infinite.
 */
public final class NormalizationStage {

    private static final Logger logger = LoggerFactory.getLogger(NormalizationStage.class);

    /** Material the reference interface is formed against. */
    public static final Material INTERFACE_MATERIAL = Material.GLASS;

    private final ReferenceDataService referenceData;

    public record Result(ImageCube cube, List<AnalysisWarning> warnings) {
        public Result {
            warnings = List.copyOf(warnings);
        }
    }

    public NormalizationStage(ReferenceDataService referenceData) {
        this.referenceData = Objects.requireNonNull(referenceData, "referenceData must not be null");
    }

    /**
     * Normalizes using the sample's own dark-count baseline.
     */
    public Result normalize(ImageCube sample, ImageCube reference, ImageCube strayReflectance,
                            Material referenceMaterial) {
        return normalize(sample, reference, sample.metadata().darkCounts(), strayReflectance, referenceMaterial, false);
    }

    public Result normalize(ImageCube sample, ImageCube reference, ImageCube strayReflectance,
                            Material referenceMaterial, boolean relativeUnits) {
        return normalize(sample, reference, sample.metadata().darkCounts(), strayReflectance, referenceMaterial,
                relativeUnits);
    }

    /**
     * @param strayReflectance  stray reflectance as a fraction per pixel and band, may be {@code null}
     * @param referenceMaterial material of the reference acquisition, may be {@code null}
     * @param relativeUnits     leave the reference unscaled, so a sample matching the reference reads 1
     */
    public Result normalize(ImageCube sample, ImageCube reference, double darkCounts, ImageCube strayReflectance,
                            Material referenceMaterial, boolean relativeUnits) {
        Objects.requireNonNull(sample, "sample must not be null");
        Objects.requireNonNull(reference, "reference must not be null");
        requireCompatible(sample, reference, "reference");
        if (strayReflectance != null) {
            requireCompatible(sample, strayReflectance, "stray reflectance");
            if (referenceMaterial == null) {
                throw new InvalidSettingsException(
                        "Stray reflectance correction requires the theoretical reflectance of a reference material");
            }
        }
        checkExposure(sample);
        checkExposure(reference);

        List<AnalysisWarning> warnings = new ArrayList<>();
        int bands = sample.bands();
        double[] wavelengths = sample.wavelengths();

        double[] s = sample.copyData();
        double[] r = reference.copyData();
        double sampleScale = 1.0 / sample.metadata().exposureMs();
        double refScale = 1.0 / reference.metadata().exposureMs();
        for (int i = 0; i < s.length; i++) {
            s[i] = (s[i] - darkCounts) * sampleScale;
            r[i] = (r[i] - darkCounts) * refScale;
        }

        double[] theoryR;
        if (referenceMaterial == null) {
            theoryR = null;
            warnings.add(new AnalysisWarning("Ignoring reference material",
                    "Analysis ignores the reference material correction; stray reflectance subtraction cannot be performed."));
        } else {
            theoryR = referenceData.reflectance(referenceMaterial, INTERFACE_MATERIAL, wavelengths);
            logger.debug("Theoretical {}/{} reflectance spans {} .. {}", referenceMaterial, INTERFACE_MATERIAL,
                    Arrays.stream(theoryR).min().orElse(Double.NaN), Arrays.stream(theoryR).max().orElse(Double.NaN));
        }

        if (strayReflectance != null) {
            double[] stray = strayReflectance.copyData();
            for (int i = 0; i < r.length; i++) {
                double rt = theoryR[i % bands];
                double i0 = r[i] / (rt + stray[i]);
                double contribution = stray[i] * i0;
                s[i] -= contribution;
                r[i] -= contribution;
            }
        } else {
            warnings.add(new AnalysisWarning("Ignoring stray reflectance correction",
                    "No stray reflectance cube was supplied."));
        }

        if (theoryR != null && relativeUnits) {
            warnings.add(new AnalysisWarning("Relative units",
                    "Reflectance is relative to the reference; the theoretical reflectance of "
                            + referenceMaterial + " was not applied."));
        } else if (theoryR != null) {
            for (int i = 0; i < r.length; i++) {
                r[i] /= theoryR[i % bands];
            }
        }

        for (int i = 0; i < s.length; i++) {
            s[i] /= r[i];
        }
        for (AnalysisWarning w : warnings) {
            logger.warn("{}", w);
        }
        return new Result(sample.withData(s), warnings);
    }

    private static void requireCompatible(ImageCube sample, ImageCube other, String what) {
        if (!sample.sameShape(other)) {
            throw new InvalidCubeException("Sample is " + sample.rows() + "x" + sample.cols() + "x" + sample.bands()
                    + " but " + what + " is " + other.rows() + "x" + other.cols() + "x" + other.bands());
        }
        double[] a = sample.wavelengths();
        double[] b = other.wavelengths();
        for (int i = 0; i < a.length; i++) {
            if (Math.abs(a[i] - b[i]) > 1e-6) {
                throw new InvalidCubeException("Wavelength axis of " + what + " differs from the sample at index " + i);
            }
        }
    }

    private static void checkExposure(ImageCube cube) {
        double exposure = cube.metadata().exposureMs();
        if (!(exposure > 0) || Double.isInfinite(exposure)) {
            throw new InvalidCubeException("Exposure must be positive and finite, got " + exposure);
        }
    }
}
