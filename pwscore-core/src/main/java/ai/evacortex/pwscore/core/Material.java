/*
 * PWSCore — Spectral Interferometry Analysis Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.pwscore.core;

/**
 * Materials with tabulated refractive indices.
 */
public enum Material {
    GLASS("N-BK7.csv"),
    WATER("Daimon-21.5C.csv"),
    AIR("Ciddor.csv"),
    SILICON("Silicon.csv"),
    OIL_1_7("CargilleOil1_7.csv"),
    OIL_1_4("CargilleOil1_4.csv"),
    IPA("Sani-DellOro-IPA.csv"),
    ETHANOL("Rheims.csv");

    private final String tableFile;

    Material(String tableFile) {
        this.tableFile = tableFile;
    }

    public String tableFile() {
        return tableFile;
    }
}
