package com.lynkvertx.tbce.service;

import com.lynkvertx.tbce.config.BracketCheckConfig;
import com.lynkvertx.tbce.model.PointLoad;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Deflection Model: Euler-Bernoulli deflection of a simply-supported span, built by
 * superposing the closed-form curve of each point load and sampling along the span.
 */
@Component
@RequiredArgsConstructor
public class DeflectionModel {

    private final BracketCheckConfig config;

    /**
     * Maximum absolute deflection (mm), sampled from 0 to L inclusive.
     * At most max-deflection-samples intervals are taken; longer spans get a wider step.
     *
     * @param spanMm span L (mm)
     * @param loads  point loads on the span
     * @param e      elastic modulus (N/mm2)
     * @param ixx    second moment of area (mm4)
     * @return max |deflection|; 0.0 for L, E or I <= 0
     */
    public double maxDeflection(double spanMm, List<PointLoad> loads, double e, double ixx) {
        if (spanMm <= 0 || e <= 0 || ixx <= 0 || loads.isEmpty()) {
            return 0.0;
        }
        double step = samplingStep(spanMm);
        int intervals = (int) Math.ceil(spanMm / step);

        double max = 0.0;
        for (int i = 0; i <= intervals; i++) {
            double x = Math.min(i * step, spanMm);
            max = Math.max(max, Math.abs(deflectionAt(x, spanMm, loads, e, ixx)));
        }
        return max;
    }

    /** Superposed deflection (mm) at x, positive downwards */
    public double deflectionAt(double x, double spanMm, List<PointLoad> loads, double e, double ixx) {
        double total = 0.0;
        for (PointLoad load : loads) {
            total += pointLoadDeflection(x, spanMm, load.getMagnitudeN(), load.getPositionMm(), e, ixx);
        }
        return total;
    }

    /**
     * Single load P at offset a (b = L - a), evaluated at x:
     * for x <= a, d(x) = P*b*x*(L^2 - b^2 - x^2) / (6*L*E*I);
     * for x > a the same formula is mirrored with xr = L - x and a, b swapped.
     */
    static double pointLoadDeflection(double x, double spanMm, double p, double a, double e, double ixx) {
        double b = spanMm - a;
        double l2 = spanMm * spanMm;
        double denominator = 6.0 * spanMm * e * ixx;
        if (x <= a) {
            return p * b * x * (l2 - b * b - x * x) / denominator;
        }
        double xr = spanMm - x;
        return p * a * xr * (l2 - a * a - xr * xr) / denominator;
    }

    /**
     * Sampling step clamp(L / divisor, min, max) in mm, widened to L / max-deflection-samples
     * when the clamped step would need more intervals than that.
     */
    double samplingStep(double spanMm) {
        double step = spanMm / config.getDeflectionStepDivisor();
        step = Math.min(Math.max(step, config.getMinDeflectionStepMm()), config.getMaxDeflectionStepMm());
        return Math.max(step, spanMm / config.getMaxDeflectionSamples());
    }
}
