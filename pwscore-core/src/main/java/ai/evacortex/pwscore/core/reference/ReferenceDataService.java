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
import ai.evacortex.pwscore.core.math.Complex;

/**
 * Read-only source of refractive indices and theoretical interface reflectance.
 *
 * <p>Implementations must be safe to share between threads.</p>
 */
public interface ReferenceDataService {

    /**
     * Complex refractive index {@code n + ik} of a material at each requested wavelength.
     *
     * @param wavelengthsNm wavelengths in nanometres
     */
    Complex[] refractiveIndex(Material material, double[] wavelengthsNm);

    /**
     * Normal-incidence Fresnel reflectance of the interface between two materials:
     * {@code |(n1 - n2) / (n1 + n2)|^2}.
     */
    default double[] reflectance(Material first, Material second, double[] wavelengthsNm) {
        Complex[] n1 = refractiveIndex(first, wavelengthsNm);
        Complex[] n2 = refractiveIndex(second, wavelengthsNm);
        double[] out = new double[wavelengthsNm.length];
        for (int i = 0; i < out.length; i++) {
            out[i] = n1[i].subtract(n2[i]).divide(n1[i].add(n2[i])).absSquared();
        }
        return out;
    }

    /** Smallest and largest wavelength (nm) every material can be interpolated at. */
    double[] supportedRange();
}
