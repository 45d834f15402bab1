package com.trainingplatform.common.load;

/**
 * Week-over-baseline classification of running volume.
 * <pre>
 *   pctDiff &gt; +20        → AGGRESSIVE
 *   pctDiff &gt; +10        → PROGRESSIVE
 *   pctDiff &lt; −10        → DELOAD
 *   otherwise            → MAINTENANCE
 * </pre>
 */
public enum VolumeTrendStatus {
    AGGRESSIVE,
    PROGRESSIVE,
    MAINTENANCE,
    DELOAD;

    public static VolumeTrendStatus classify(double percentDifference) {
        if (percentDifference > 20.0) return AGGRESSIVE;
        if (percentDifference > 10.0) return PROGRESSIVE;
        if (percentDifference < -10.0) return DELOAD;
        return MAINTENANCE;
    }
}
