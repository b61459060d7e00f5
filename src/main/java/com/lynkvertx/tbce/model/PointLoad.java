package com.lynkvertx.tbce.model;

import lombok.Value;

/**
 * A concentrated vertical force on one tier, positioned from the left support.
 * Always carries a positive magnitude and a position already clamped into [0, span].
 */
@Value
public class PointLoad {

    /** Force magnitude (N), always > 0 */
    double magnitudeN;

    /** Offset from the left support (mm) */
    double positionMm;

    String label;
}
