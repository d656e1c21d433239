/*
 * PWSCore — Spectral Interferometry Analysis Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.pwscore.core;

import ai.evacortex.pwscore.core.exceptions.InvalidSettingsException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class AnalysisSettingsTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    @Test
    void testJsonRoundTripIsLossless() {
        AnalysisSettings settings = new AnalysisSettings(3, 0.2, 1, Material.GLASS, 500, 700, false, 8,
                "er-2024-01", true, false, 64, FilterCutoffMode.MEASURED, true);

        AnalysisSettings restored = AnalysisSettings.fromJson(settings.toJson());

        assertEquals(settings, restored);
        assertEquals(settings.toJson(), restored.toJson(), "Serialization must be canonical");
    }

    @Test
    void testNullableFieldsRoundTrip() {
        AnalysisSettings settings = new AnalysisSettings(2, 0.15, 0, null, 510, 690, true, 6, null);

        AnalysisSettings restored = AnalysisSettings.fromJson(settings.toJson());

        assertNull(restored.referenceMaterial());
        assertNull(restored.extraReflectanceId());
        assertEquals(FilterCutoffMode.NOMINAL, restored.filterCutoffMode());
        assertEquals(AnalysisSettings.DEFAULT_OPD_STOP_INDEX, restored.opdStopIndex());
        assertFalse(restored.relativeUnits());
    }

    @Test
    void testRelativeUnitsRoundTrip() {
        AnalysisSettings settings = AnalysisSettings.recommended().withRelativeUnits(true);

        AnalysisSettings restored = AnalysisSettings.fromJson(settings.toJson());

        assertTrue(restored.relativeUnits());
        assertNotEquals(AnalysisSettings.recommended().toJson(), settings.toJson());
    }

    @Test
    void testRecommendedPreset() {
        AnalysisSettings settings = AnalysisSettings.recommended();

        assertEquals(2, settings.filterOrder());
        assertEquals(0.15, settings.filterCutoff());
        assertEquals(0, settings.polynomialOrder());
        assertEquals(Material.WATER, settings.referenceMaterial());
        assertEquals(510, settings.wavelengthStart());
        assertEquals(690, settings.wavelengthStop());
        assertTrue(settings.useHannWindow());
        assertEquals(6, settings.autoCorrStopIndex());
        assertNull(settings.extraReflectanceId());
        assertFalse(settings.skipAdvanced());
    }

    @Test
    void testMissingRequiredFieldIsRejected() {
        ObjectNode node = AnalysisSettings.recommended().toJsonNode();
        node.remove("extraReflectanceId");

        InvalidSettingsException e = assertThrows(InvalidSettingsException.class,
                () -> AnalysisSettings.fromJson(node.toString()));
        assertTrue(e.getMessage().contains("extraReflectanceId"));
    }

    @Test
    void testUnknownFieldIsRejected() {
        ObjectNode node = AnalysisSettings.recommended().toJsonNode();
        node.put("numericalAperture", 0.52);

        assertThrows(InvalidSettingsException.class, () -> AnalysisSettings.fromJson(node.toString()));
    }

    @Test
    void testOptionalFieldsMayBeOmitted() throws Exception {
        ObjectNode node = AnalysisSettings.recommended().toJsonNode();
        node.remove("autoCorrMinSub");
        node.remove("skipAdvanced");
        node.remove("opdStopIndex");
        node.remove("filterCutoffMode");

        AnalysisSettings settings = AnalysisSettings.fromJson(MAPPER.writeValueAsString(node));

        assertEquals(AnalysisSettings.recommended(), settings);
    }

    @Test
    void testInvalidValuesAreRejected() {
        assertThrows(InvalidSettingsException.class,
                () -> new AnalysisSettings(0, 0.15, 0, null, 510, 690, true, 6, null));
        assertThrows(InvalidSettingsException.class,
                () -> new AnalysisSettings(2, 1.5, 0, null, 510, 690, true, 6, null));
        assertThrows(InvalidSettingsException.class,
                () -> new AnalysisSettings(2, 0.15, -1, null, 510, 690, true, 6, null));
        assertThrows(InvalidSettingsException.class,
                () -> new AnalysisSettings(2, 0.15, 0, null, 690, 510, true, 6, null));
        assertThrows(InvalidSettingsException.class,
                () -> new AnalysisSettings(2, 0.15, 0, null, 510, 690, true, 1, null));
    }

    @Test
    void testWrongTypesAndMalformedJson() {
        ObjectNode node = AnalysisSettings.recommended().toJsonNode();
        node.put("filterOrder", "two");
        assertThrows(InvalidSettingsException.class, () -> AnalysisSettings.fromJson(node.toString()));

        ObjectNode material = AnalysisSettings.recommended().toJsonNode();
        material.put("referenceMaterial", "UNOBTAINIUM");
        assertThrows(InvalidSettingsException.class, () -> AnalysisSettings.fromJson(material.toString()));

        assertThrows(InvalidSettingsException.class, () -> AnalysisSettings.fromJson("{not json"));
        assertThrows(InvalidSettingsException.class, () -> AnalysisSettings.fromJson("[]"));
    }
}
