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
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.JsonNodeType;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.io.IOException;
import java.io.InputStream;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Immutable configuration of one analysis run.
 *
 * <p>The JSON form has a fixed field set. The nine fields listed in {@link #REQUIRED_FIELDS} must
 * be present ({@code referenceMaterial} and {@code extraReflectanceId} may be {@code null}); the
 * remaining fields are optional and fall back to their defaults. Unknown fields are rejected.
 * {@link #toJson()} always writes every field in a fixed order, which makes the output canonical
 * and suitable for hashing.</p>
 *
 * @param filterOrder        Butterworth order
 * @param filterCutoff       cutoff, interpreted according to {@code filterCutoffMode}
 * @param polynomialOrder    order of the background polynomial removed in k-space
 * @param referenceMaterial  material the reference cube was acquired on, may be {@code null}
 * @param wavelengthStart    first wavelength (nm) of the analysed window
 * @param wavelengthStop     last wavelength (nm) of the analysed window
 * @param useHannWindow      apply a Hann window before the OPD transform
 * @param autoCorrStopIndex  number of autocorrelation lags used in the log-linear fit
 * @param extraReflectanceId identifier of the stray-reflectance cube, may be {@code null}
 * @param autoCorrMinSub     subtract the autocorrelation minimum before taking logs
 * @param skipAdvanced       compute reflectance and RMS only
 * @param opdStopIndex       number of OPD depth bins retained
 * @param filterCutoffMode   interpretation of {@code filterCutoff}
 * @param relativeUnits      keep reflectance relative to the reference instead of scaling the reference
 *                           by the theoretical reflectance of its material
 */
public record AnalysisSettings(
        int filterOrder,
        double filterCutoff,
        int polynomialOrder,
        Material referenceMaterial,
        int wavelengthStart,
        int wavelengthStop,
        boolean useHannWindow,
        int autoCorrStopIndex,
        String extraReflectanceId,
        boolean autoCorrMinSub,
        boolean skipAdvanced,
        int opdStopIndex,
        FilterCutoffMode filterCutoffMode,
        boolean relativeUnits) {

    public static final Set<String> REQUIRED_FIELDS = Set.of(
            "filterOrder", "filterCutoff", "polynomialOrder", "referenceMaterial", "wavelengthStart",
            "wavelengthStop", "useHannWindow", "autoCorrStopIndex", "extraReflectanceId");

    public static final Set<String> OPTIONAL_FIELDS = Set.of(
            "autoCorrMinSub", "skipAdvanced", "opdStopIndex", "filterCutoffMode", "relativeUnits");

    public static final int DEFAULT_OPD_STOP_INDEX = 100;

    private static final String RECOMMENDED_RESOURCE = "/presets/recommended.json";
    private static final ObjectMapper MAPPER = new ObjectMapper();

    public AnalysisSettings {
        if (filterOrder < 1) {
            throw new InvalidSettingsException("filterOrder must be >= 1, got " + filterOrder);
        }
        if (!(filterCutoff > 0.0) || Double.isInfinite(filterCutoff)) {
            throw new InvalidSettingsException("filterCutoff must be positive and finite, got " + filterCutoff);
        }
        if (filterCutoffMode == null) {
            filterCutoffMode = FilterCutoffMode.NOMINAL;
        }
        if (filterCutoffMode == FilterCutoffMode.NOMINAL && !(filterCutoff < 1.0)) {
            throw new InvalidSettingsException("Nominal filterCutoff must lie in (0, 1), got " + filterCutoff);
        }
        if (polynomialOrder < 0) {
            throw new InvalidSettingsException("polynomialOrder must be >= 0, got " + polynomialOrder);
        }
        if (wavelengthStart >= wavelengthStop) {
            throw new InvalidSettingsException("wavelengthStart (" + wavelengthStart
                    + ") must be below wavelengthStop (" + wavelengthStop + ")");
        }
        if (autoCorrStopIndex < 2) {
            throw new InvalidSettingsException("autoCorrStopIndex must be >= 2, got " + autoCorrStopIndex);
        }
        if (opdStopIndex < 1) {
            throw new InvalidSettingsException("opdStopIndex must be >= 1, got " + opdStopIndex);
        }
    }

    /**
     * Settings with the optional fields at their defaults.
     */
    public AnalysisSettings(int filterOrder, double filterCutoff, int polynomialOrder, Material referenceMaterial,
                            int wavelengthStart, int wavelengthStop, boolean useHannWindow, int autoCorrStopIndex,
                            String extraReflectanceId) {
        this(filterOrder, filterCutoff, polynomialOrder, referenceMaterial, wavelengthStart, wavelengthStop,
                useHannWindow, autoCorrStopIndex, extraReflectanceId, false, false, DEFAULT_OPD_STOP_INDEX,
                FilterCutoffMode.NOMINAL, false);
    }

    /**
     * The settings shipped as the {@code recommended} preset.
     */
    public static AnalysisSettings recommended() {
        try (InputStream in = AnalysisSettings.class.getResourceAsStream(RECOMMENDED_RESOURCE)) {
            if (in == null) {
                throw new InvalidSettingsException("Missing preset resource " + RECOMMENDED_RESOURCE);
            }
            return fromJson(new String(in.readAllBytes(), java.nio.charset.StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new InvalidSettingsException("Failed to read preset " + RECOMMENDED_RESOURCE, e);
        }
    }

    public AnalysisSettings withSkipAdvanced(boolean skip) {
        return new AnalysisSettings(filterOrder, filterCutoff, polynomialOrder, referenceMaterial, wavelengthStart,
                wavelengthStop, useHannWindow, autoCorrStopIndex, extraReflectanceId, autoCorrMinSub, skip,
                opdStopIndex, filterCutoffMode, relativeUnits);
    }

    public AnalysisSettings withRelativeUnits(boolean relative) {
        return new AnalysisSettings(filterOrder, filterCutoff, polynomialOrder, referenceMaterial, wavelengthStart,
                wavelengthStop, useHannWindow, autoCorrStopIndex, extraReflectanceId, autoCorrMinSub, skipAdvanced,
                opdStopIndex, filterCutoffMode, relative);
    }

    public ObjectNode toJsonNode() {
        ObjectNode node = MAPPER.createObjectNode();
        node.put("filterOrder", filterOrder);
        node.put("filterCutoff", filterCutoff);
        node.put("polynomialOrder", polynomialOrder);
        if (referenceMaterial == null) node.putNull("referenceMaterial");
        else node.put("referenceMaterial", referenceMaterial.name());
        node.put("wavelengthStart", wavelengthStart);
        node.put("wavelengthStop", wavelengthStop);
        node.put("useHannWindow", useHannWindow);
        node.put("autoCorrStopIndex", autoCorrStopIndex);
        if (extraReflectanceId == null) node.putNull("extraReflectanceId");
        else node.put("extraReflectanceId", extraReflectanceId);
        node.put("autoCorrMinSub", autoCorrMinSub);
        node.put("skipAdvanced", skipAdvanced);
        node.put("opdStopIndex", opdStopIndex);
        node.put("filterCutoffMode", filterCutoffMode.name());
        node.put("relativeUnits", relativeUnits);
        return node;
    }

    public String toJson() {
        try {
            return MAPPER.writeValueAsString(toJsonNode());
        } catch (JsonProcessingException e) {
            throw new InvalidSettingsException("Failed to serialize settings", e);
        }
    }

    public static AnalysisSettings fromJson(String json) {
        JsonNode root;
        try {
            root = MAPPER.readTree(json);
        } catch (JsonProcessingException e) {
            throw new InvalidSettingsException("Malformed settings JSON", e);
        }
        return fromJsonNode(root);
    }

    public static AnalysisSettings fromJsonNode(JsonNode root) {
        if (root == null || !root.isObject()) {
            throw new InvalidSettingsException("Settings JSON must be an object");
        }
        Set<String> unknown = new LinkedHashSet<>();
        for (Iterator<String> it = root.fieldNames(); it.hasNext(); ) {
            String f = it.next();
            if (!REQUIRED_FIELDS.contains(f) && !OPTIONAL_FIELDS.contains(f)) unknown.add(f);
        }
        if (!unknown.isEmpty()) {
            throw new InvalidSettingsException("Unknown fields " + unknown);
        }
        for (String f : REQUIRED_FIELDS) {
            if (!root.has(f)) {
                throw new InvalidSettingsException("Missing required field '" + f + "'");
            }
        }

        String material = text(root, "referenceMaterial", true);
        Material referenceMaterial;
        try {
            referenceMaterial = material == null ? null : Material.valueOf(material);
        } catch (IllegalArgumentException e) {
            throw new InvalidSettingsException("Unknown referenceMaterial '" + material + "'", e);
        }
        String mode = root.has("filterCutoffMode") ? text(root, "filterCutoffMode", false) : FilterCutoffMode.NOMINAL.name();
        FilterCutoffMode cutoffMode;
        try {
            cutoffMode = FilterCutoffMode.valueOf(mode);
        } catch (IllegalArgumentException e) {
            throw new InvalidSettingsException("Unknown filterCutoffMode '" + mode + "'", e);
        }

        return new AnalysisSettings(
                integer(root, "filterOrder"),
                number(root, "filterCutoff"),
                integer(root, "polynomialOrder"),
                referenceMaterial,
                integer(root, "wavelengthStart"),
                integer(root, "wavelengthStop"),
                bool(root, "useHannWindow"),
                integer(root, "autoCorrStopIndex"),
                text(root, "extraReflectanceId", true),
                root.has("autoCorrMinSub") && bool(root, "autoCorrMinSub"),
                root.has("skipAdvanced") && bool(root, "skipAdvanced"),
                root.has("opdStopIndex") ? integer(root, "opdStopIndex") : DEFAULT_OPD_STOP_INDEX,
                cutoffMode,
                root.has("relativeUnits") && bool(root, "relativeUnits"));
    }

    private static int integer(JsonNode root, String field) {
        JsonNode n = root.get(field);
        if (n == null || !n.isIntegralNumber() || !n.canConvertToInt()) {
            throw new InvalidSettingsException("Field '" + field + "' must be an integer");
        }
        return n.intValue();
    }

    private static double number(JsonNode root, String field) {
        JsonNode n = root.get(field);
        if (n == null || !n.isNumber()) {
            throw new InvalidSettingsException("Field '" + field + "' must be a number");
        }
        return n.doubleValue();
    }

    private static boolean bool(JsonNode root, String field) {
        JsonNode n = root.get(field);
        if (n == null || !n.isBoolean()) {
            throw new InvalidSettingsException("Field '" + field + "' must be a boolean");
        }
        return n.booleanValue();
    }

    private static String text(JsonNode root, String field, boolean nullable) {
        JsonNode n = root.get(field);
        if (n == null || n.getNodeType() == JsonNodeType.NULL) {
            if (nullable) return null;
            throw new InvalidSettingsException("Field '" + field + "' must not be null");
        }
        if (!n.isTextual()) {
            throw new InvalidSettingsException("Field '" + field + "' must be a string");
        }
        return n.textValue();
    }
}
