package com.lynkvertx.tbce.service;

import com.lynkvertx.tbce.model.PointLoad;
import com.lynkvertx.tbce.model.SupportReactions;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.TreeSet;

/**
 * Beam Statics: support reactions and bending moment of a simply-supported span
 * under any number of point loads. Origin at the left support, forces in N, lengths in mm.
 */
@Component
public class BeamStatics {

    /**
     * Lever-arm superposition: each load P at offset a contributes P*(L-a)/L to the left
     * support and P*a/L to the right support.
     *
     * @return reactions; zero for no loads or a zero-length span
     */
    public SupportReactions reactions(double spanMm, List<PointLoad> loads) {
        if (spanMm <= 0 || loads.isEmpty()) {
            return SupportReactions.ZERO;
        }
        double left = 0.0;
        double right = 0.0;
        for (PointLoad load : loads) {
            double p = load.getMagnitudeN();
            double a = load.getPositionMm();
            left += p * (spanMm - a) / spanMm;
            right += p * a / spanMm;
        }
        return new SupportReactions(left, right);
    }

    /**
     * Bending moment (N·mm) at x from the left support:
     * M(x) = R_left * x - sum of P_i * (x - a_i) over loads with a_i <= x.
     */
    public double momentAt(double x, double leftReactionN, List<PointLoad> loads) {
        double moment = leftReactionN * x;
        for (PointLoad load : loads) {
            if (load.getPositionMm() <= x) {
                moment -= load.getMagnitudeN() * (x - load.getPositionMm());
            }
        }
        return moment;
    }

    /**
     * Maximum absolute bending moment (N·mm).
     *
     * The moment diagram is piecewise linear between loads, so its extremes lie on the
     * candidate set: both supports, every load position, plus the midpoint between each pair
     * of neighbouring candidates.
     */
    public double maxMoment(double spanMm, List<PointLoad> loads) {
        if (spanMm <= 0 || loads.isEmpty()) {
            return 0.0;
        }
        double leftReaction = reactions(spanMm, loads).getLeftN();

        TreeSet<Double> candidates = new TreeSet<>();
        candidates.add(0.0);
        candidates.add(spanMm);
        for (PointLoad load : loads) {
            candidates.add(load.getPositionMm());
        }
        Double previous = null;
        for (Double x : new TreeSet<>(candidates)) {
            if (previous != null) {
                candidates.add((previous + x) / 2.0);
            }
            previous = x;
        }

        double max = 0.0;
        for (double x : candidates) {
            max = Math.max(max, Math.abs(momentAt(x, leftReaction, loads)));
        }
        return max;
    }
}
