package com.lynkvertx.tbce.model;

import lombok.Value;

/**
 * Vertical reactions (N) at the two supports of a simply-supported span.
 */
@Value
public class SupportReactions {

    public static final SupportReactions ZERO = new SupportReactions(0.0, 0.0);

    double leftN;
    double rightN;

    public SupportReactions plus(SupportReactions other) {
        return new SupportReactions(leftN + other.leftN, rightN + other.rightN);
    }

    /** Reaction at the more heavily loaded support */
    public double governingN() {
        return Math.max(leftN, rightN);
    }
}
