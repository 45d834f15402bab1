package com.trainingplatform.common.performance;

import java.util.Locale;

/**
 * Display helpers for paces, clock times and durations.
 * Unknown or unusable values render as {@link #UNKNOWN} rather than {@code 0:00}.
 */
public final class PerformanceFormatter {

    public static final String UNKNOWN = "—";

    private PerformanceFormatter() {}

    /** {@code 5.5 → "5:30"}. Zero, negative and non-finite paces → {@link #UNKNOWN}. */
    public static String formatPace(double minPerKm) {
        if (!Double.isFinite(minPerKm) || minPerKm <= 0) return UNKNOWN;
        long totalSeconds = Math.round(minPerKm * 60.0);
        return String.format(Locale.ROOT, "%d:%02d", totalSeconds / 60, totalSeconds % 60);
    }

    /** {@code 3665 → "1:01:05"}, {@code 65 → "1:05"}. */
    public static String formatSeconds(double totalSeconds) {
        if (!Double.isFinite(totalSeconds) || totalSeconds < 0) return UNKNOWN;
        long rounded = Math.round(totalSeconds);
        long h = rounded / 3600;
        long m = (rounded % 3600) / 60;
        long s = rounded % 60;
        if (h > 0) {
            return String.format(Locale.ROOT, "%d:%02d:%02d", h, m, s);
        }
        return String.format(Locale.ROOT, "%d:%02d", m, s);
    }

    /** {@code 45 → "45 min"}, {@code 124.5 → "2h 5m"}, {@code 120 → "2h"}; "-" when ≤ 0. */
    public static String formatDuration(double minutes) {
        if (!Double.isFinite(minutes) || minutes <= 0) return "-";
        long rounded = Math.round(minutes);
        if (rounded < 60) return rounded + " min";
        long h = rounded / 60;
        long m = rounded % 60;
        return m > 0 ? h + "h " + m + "m" : h + "h";
    }
}
