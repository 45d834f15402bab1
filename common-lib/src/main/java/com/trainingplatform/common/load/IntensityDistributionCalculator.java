package com.trainingplatform.common.load;

import com.trainingplatform.common.model.ActivityRecord;

import java.time.LocalDate;
import java.util.List;

/**
 * Buckets a week's cardio minutes into low / moderate / high.
 *
 * <p>Resolution order per session:
 * <ol>
 *   <li>explicit intensity tag: LOW → low, MODERATE → moderate, HIGH/ULTRA → high</li>
 *   <li>average heart rate against {@code 220 − age}:
 *       &lt;70% → low, &lt;80% → moderate, otherwise high</li>
 *   <li>neither available → moderate (the session is never dropped)</li>
 * </ol>
 *
 * <p>Age is {@code asOf.year − birthYear}, or {@value #DEFAULT_AGE} when unknown.
 */
public final class IntensityDistributionCalculator {

    public static final int DEFAULT_AGE = 30;

    private static final double LOW_CEILING      = 0.70;
    private static final double MODERATE_CEILING = 0.80;

    private IntensityDistributionCalculator() {}

    public static IntensityDistribution compute(WeekWindow week, List<ActivityRecord> activities,
                                                Integer birthYear, LocalDate asOf) {
        int maxHr = estimatedMaxHeartRate(birthYear, asOf);

        double low = 0, moderate = 0, high = 0, total = 0;
        for (ActivityRecord a : WeeklyForecastCalculator.safe(activities)) {
            if (!WeeklyForecastCalculator.counts(a) || !week.contains(a.date())) continue;
            if (a.type() == null || !a.type().isCardio()) continue;

            double minutes = Math.max(0.0, a.durationMinutes());
            total += minutes;

            switch (bucketOf(a, maxHr)) {
                case LOW  -> low += minutes;
                case HIGH -> high += minutes;
                default   -> moderate += minutes;
            }
        }

        if (total <= 0) return IntensityDistribution.EMPTY;
        return new IntensityDistribution(low / total * 100.0, moderate / total * 100.0,
                                         high / total * 100.0, total);
    }

    public static int estimatedMaxHeartRate(Integer birthYear, LocalDate asOf) {
        int age = birthYear != null && asOf != null && birthYear > 0 && birthYear <= asOf.getYear()
            ? asOf.getYear() - birthYear
            : DEFAULT_AGE;
        return 220 - age;
    }

    private enum Bucket { LOW, MODERATE, HIGH }

    private static Bucket bucketOf(ActivityRecord a, int maxHr) {
        if (a.intensity() != null) {
            return switch (a.intensity()) {
                case LOW         -> Bucket.LOW;
                case MODERATE    -> Bucket.MODERATE;
                case HIGH, ULTRA -> Bucket.HIGH;
            };
        }
        if (a.averageHeartRate() != null && a.averageHeartRate() > 0 && maxHr > 0) {
            double ratio = (double) a.averageHeartRate() / maxHr;
            if (ratio < LOW_CEILING) return Bucket.LOW;
            if (ratio < MODERATE_CEILING) return Bucket.MODERATE;
            return Bucket.HIGH;
        }
        return Bucket.MODERATE;
    }
}
