package com.lynkvertx.tbce.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.lynkvertx.tbce.model.PointLoad;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.OptionalDouble;

/**
 * Load Model: turns the raw, user-editable load data of one tier into positioned point loads.
 *
 * Two persisted shapes are accepted:
 * 1. Legacy numeric list, e.g. [1000, 2000]: bare magnitudes (N), spread evenly over the span
 *    at x_i = L * (i + 1) / (n + 1), never on the supports.
 * 2. Structured list, e.g. [{"N": 1000, "x_mm": 400, "label": "Pipe"}]: positions clamped into [0, L].
 *
 * The shape is resolved once here; everything downstream only sees {@link PointLoad}.
 * Malformed entries and magnitudes <= 0 are skipped, never raised.
 */
@Slf4j
@Component
public class LoadNormalizer {

    static final String FIELD_MAGNITUDE = "N";
    static final String FIELD_POSITION = "x_mm";
    static final String FIELD_LABEL = "label";

    /**
     * Normalize the raw loads of one tier.
     *
     * @param rawLoads raw JSON tree for the tier (array in either shape); null means no loads
     * @param spanMm   span length (mm), already non-negative
     * @return ordered, possibly empty list of point loads
     */
    public List<PointLoad> normalizeTierLoads(JsonNode rawLoads, double spanMm) {
        RawTierLoads resolved = RawTierLoads.resolve(rawLoads);
        return resolved.toPointLoads(Math.max(0.0, spanMm));
    }

    // ==================== Input shapes ====================

    /** The two persisted load shapes, resolved from the JSON tree */
    abstract static class RawTierLoads {

        final List<JsonNode> entries;

        RawTierLoads(List<JsonNode> entries) {
            this.entries = entries;
        }

        abstract List<PointLoad> toPointLoads(double spanMm);

        /**
         * An array holding at least one object is structured; any other array is legacy numeric.
         * Non-array values carry no loads.
         */
        static RawTierLoads resolve(JsonNode rawLoads) {
            if (rawLoads == null || rawLoads.isNull() || rawLoads.isMissingNode()) {
                return new LegacyMagnitudes(Collections.emptyList());
            }
            if (!rawLoads.isArray()) {
                log.warn("Ignoring tier loads that are not a list: {}", rawLoads);
                return new LegacyMagnitudes(Collections.emptyList());
            }
            List<JsonNode> entries = new ArrayList<>();
            boolean structured = false;
            for (JsonNode entry : rawLoads) {
                entries.add(entry);
                structured |= entry.isObject();
            }
            return structured ? new StructuredRecords(entries) : new LegacyMagnitudes(entries);
        }
    }

    /** Legacy shape: bare magnitudes, auto-positioned */
    static class LegacyMagnitudes extends RawTierLoads {

        LegacyMagnitudes(List<JsonNode> entries) {
            super(entries);
        }

        @Override
        List<PointLoad> toPointLoads(double spanMm) {
            List<Double> magnitudes = new ArrayList<>();
            for (JsonNode entry : entries) {
                OptionalDouble magnitude = readNumber(entry);
                if (magnitude.isEmpty()) {
                    log.warn("Skipping malformed legacy load entry: {}", entry);
                } else if (magnitude.getAsDouble() > 0) {
                    magnitudes.add(magnitude.getAsDouble());
                }
            }

            int n = magnitudes.size();
            List<PointLoad> loads = new ArrayList<>(n);
            for (int i = 0; i < n; i++) {
                double x = spanMm * (i + 1) / (n + 1);
                loads.add(new PointLoad(magnitudes.get(i), x, defaultLabel(i)));
            }
            return loads;
        }
    }

    /** Structured shape: explicit magnitude, position and optional label */
    static class StructuredRecords extends RawTierLoads {

        StructuredRecords(List<JsonNode> entries) {
            super(entries);
        }

        @Override
        List<PointLoad> toPointLoads(double spanMm) {
            List<PointLoad> loads = new ArrayList<>();
            for (JsonNode entry : entries) {
                if (!entry.isObject()) {
                    log.warn("Skipping load entry that is not a record: {}", entry);
                    continue;
                }
                OptionalDouble magnitude = readNumber(entry.get(FIELD_MAGNITUDE));
                OptionalDouble position = readNumber(entry.get(FIELD_POSITION));
                if (magnitude.isEmpty() || position.isEmpty()) {
                    log.warn("Skipping load record without numeric N/x_mm: {}", entry);
                    continue;
                }
                if (magnitude.getAsDouble() <= 0) {
                    continue;
                }

                double x = Math.min(Math.max(position.getAsDouble(), 0.0), spanMm);
                JsonNode label = entry.get(FIELD_LABEL);
                String text = label != null && label.isValueNode() && !label.isNull() ? label.asText().trim() : "";
                loads.add(new PointLoad(magnitude.getAsDouble(), x, text.isEmpty() ? defaultLabel(loads.size()) : text));
            }
            return loads;
        }
    }

    // ==================== Internal helpers ====================

    /** "Load 1", "Load 2", ... */
    private static String defaultLabel(int index) {
        return "Load " + (index + 1);
    }

    /** Finite number from a numeric node or a numeric string node; empty otherwise */
    private static OptionalDouble readNumber(JsonNode node) {
        if (node == null || node.isNull()) return OptionalDouble.empty();
        double value;
        if (node.isNumber()) {
            value = node.doubleValue();
        } else if (node.isTextual()) {
            try {
                value = Double.parseDouble(node.textValue().trim());
            } catch (NumberFormatException e) {
                return OptionalDouble.empty();
            }
        } else {
            return OptionalDouble.empty();
        }
        return Double.isFinite(value) ? OptionalDouble.of(value) : OptionalDouble.empty();
    }
}
