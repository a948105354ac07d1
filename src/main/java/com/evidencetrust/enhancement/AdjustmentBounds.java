package com.evidencetrust.enhancement;

import com.evidencetrust.governance.CheckResult;

public record AdjustmentBounds(double min, double max) {
    public AdjustmentBounds {
        if (!Double.isFinite(min) || !Double.isFinite(max) || min > 0.0 || max < 0.0) {
            throw new IllegalArgumentException(
                    "adjustment bounds must satisfy min <= 0 <= max (min=" + min + ", max=" + max + ")");
        }
    }

    public static AdjustmentBounds defaults() {
        return new AdjustmentBounds(-20.0, 10.0);
    }

    public double clamp(double adjustment) {
        return Math.max(min, Math.min(max, adjustment));
    }

    public double apply(double baseScore, double adjustment) {
        return CheckResult.clamp(baseScore + clamp(adjustment));
    }
}
