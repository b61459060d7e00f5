package com.lynkvertx.tbce.model;

import lombok.Value;

/**
 * Analysis figures for one tier, or for the envelope over all tiers.
 */
@Value
public class TierResult {

    public static final TierResult EMPTY = new TierResult(SupportReactions.ZERO, 0.0, 0.0, 0.0);

    SupportReactions reactions;

    /** Maximum absolute bending moment (N·mm) */
    double maxMomentNmm;

    /** Maximum absolute deflection (mm) */
    double maxDeflectionMm;

    /** Supported mass (kg) */
    double weightKg;

    public double getMaxMomentKNm() {
        return maxMomentNmm / 1e6;
    }

    /**
     * Combine with another tier: reactions and weight add up, moment and deflection take the envelope.
     */
    public TierResult envelope(TierResult other) {
        return new TierResult(
            reactions.plus(other.reactions),
            Math.max(maxMomentNmm, other.maxMomentNmm),
            Math.max(maxDeflectionMm, other.maxDeflectionMm),
            weightKg + other.weightKg);
    }
}
