package com.lynkvertx.tbce.service;

import com.lynkvertx.tbce.config.BracketCheckConfig;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Allowable Derivation: yield stress from the grade label, allowable bending stress and
 * deflection limit.
 *
 * The allowable is a fixed working-stress placeholder (factor x yield), not a
 * code-calibrated resistance.
 */
@Component
@RequiredArgsConstructor
public class AllowableDerivation {

    private final BracketCheckConfig config;

    /**
     * Yield stress (N/mm2) by substring match of the grade label against the configured table,
     * e.g. "S355JR" -> 355. Unrecognized or empty labels fall back to the default (235).
     */
    public double yieldStress(String gradeLabel) {
        if (gradeLabel != null && !gradeLabel.isEmpty()) {
            for (Map.Entry<String, Double> grade : config.resolveGradeYieldStresses().entrySet()) {
                if (gradeLabel.contains(grade.getKey())) {
                    return grade.getValue();
                }
            }
        }
        return config.getDefaultYieldStress();
    }

    /** Allowable bending stress (N/mm2) = factor * yield */
    public double allowableStress(String gradeLabel) {
        return config.getAllowableStressFactor() * yieldStress(gradeLabel);
    }

    /** Deflection limit (mm) = span / ratio; 0 for a zero or negative span */
    public double deflectionLimit(double spanMm) {
        if (spanMm <= 0) {
            return 0.0;
        }
        return spanMm / config.getDeflectionRatio();
    }
}
