package com.trainingplatform.common.performance;

/**
 * Pure running-physiology math: fitness score (VDOT), race-time prediction,
 * pace zones, Cooper and Riegel formulas, Karvonen heart-rate zones.
 *
 * <h3>Oxygen cost and sustainable fraction</h3>
 * <pre>
 *   VO2(v)    = -4.60 + 0.182258·v + 0.000104·v²          v in m/min
 *   pctMax(t) = 0.8 + 0.1894393·e^(-0.0115·t) + 0.2989558·e^(-0.1932605·t)   t in min
 *   score     = VO2(v) / pctMax(t)
 * </pre>
 *
 * <p>Every operation is total: inputs that are zero, negative or non-finite
 * return the documented sentinel instead of throwing. No state, no I/O.
 */
public final class PerformanceModel {

    private static final double VO2_INTERCEPT = -4.60;
    private static final double VO2_LINEAR    = 0.182258;
    private static final double VO2_QUADRATIC = 0.000104;

    /** Fractions of VO2max that define the training paces. */
    private static final double EASY_FRACTION       = 0.70;
    private static final double MARATHON_FRACTION   = 0.80;
    private static final double THRESHOLD_FRACTION  = 0.88;
    private static final double INTERVAL_FRACTION   = 0.97;
    private static final double REPETITION_FRACTION = 1.05;

    private static final double RIEGEL_EXPONENT = 1.06;

    /** Roughly 0.5–1.5 points per 4-week block is a safe progression. */
    private static final double MAX_SAFE_PROGRESSION_PER_WEEK = 0.25;

    /** Bisection bracket for race-time prediction, in min/km. */
    private static final double FASTEST_PACE_MIN_PER_KM = 1.0;
    private static final double SLOWEST_PACE_MIN_PER_KM = 40.0;
    private static final int    MAX_ITERATIONS = 200;
    private static final double TIME_TOLERANCE_MIN = 1e-6;

    private PerformanceModel() { /* utility class */ }

    /**
     * Converts a race result into a fitness score, rounded to one decimal.
     * A 20:00 5 km yields ≈ 49.6.
     *
     * @return the score, or {@code 0.0} for non-positive / non-finite input
     */
    public static double fitnessScore(double distanceKm, double timeSeconds) {
        if (!isPositive(distanceKm) || !isPositive(timeSeconds)) return 0.0;

        double timeMinutes = timeSeconds / 60.0;
        double velocity = distanceKm * 1000.0 / timeMinutes;
        double score = oxygenCost(velocity) / sustainableFraction(timeMinutes);
        if (!Double.isFinite(score) || score <= 0) return 0.0;
        return round1(score);
    }

    /**
     * Predicts the finishing time at {@code distanceKm} for a given score by
     * solving {@code VO2(d/t) = score·pctMax(t)} for {@code t} with bisection.
     *
     * @return predicted seconds, or {@code 0.0} for unusable input
     */
    public static double predictRaceTime(double score, double distanceKm) {
        if (!isPositive(score) || !isPositive(distanceKm)) return 0.0;

        double lo = distanceKm * FASTEST_PACE_MIN_PER_KM;
        double hi = distanceKm * SLOWEST_PACE_MIN_PER_KM;
        double fLo = predictionError(score, distanceKm, lo);
        double fHi = predictionError(score, distanceKm, hi);
        if (fLo < 0 || fHi > 0) return 0.0; // score outside the modelled range

        for (int i = 0; i < MAX_ITERATIONS && hi - lo > TIME_TOLERANCE_MIN; i++) {
            double mid = (lo + hi) / 2.0;
            if (predictionError(score, distanceKm, mid) > 0) {
                lo = mid;
            } else {
                hi = mid;
            }
        }
        return (lo + hi) / 2.0 * 60.0;
    }

    /**
     * Derives training paces (min/km) from a fitness score.
     *
     * @return zones, or {@link PaceZones#UNKNOWN} for a non-positive score
     */
    public static PaceZones paceZones(double score) {
        if (!isPositive(score)) return PaceZones.UNKNOWN;
        return new PaceZones(
            paceAt(score * EASY_FRACTION),
            paceAt(score * MARATHON_FRACTION),
            paceAt(score * THRESHOLD_FRACTION),
            paceAt(score * INTERVAL_FRACTION),
            paceAt(score * REPETITION_FRACTION)
        );
    }

    /**
     * Cooper 12-minute test: {@code (distance − 504.9) / 44.73}.
     *
     * @return VO2max estimate, floored at {@code 0.0}
     */
    public static double cooperVO2(double distanceInTwelveMinutesMeters) {
        if (!isPositive(distanceInTwelveMinutesMeters)) return 0.0;
        return Math.max(0.0, (distanceInTwelveMinutesMeters - 504.9) / 44.73);
    }

    /**
     * Riegel endurance model: {@code knownTime · (target/known)^1.06}.
     *
     * @return predicted seconds, or {@code 0.0} for unusable input
     */
    public static double riegelPredict(double knownTimeSeconds, double knownDistanceKm,
                                       double targetDistanceKm) {
        if (!isPositive(knownTimeSeconds) || !isPositive(knownDistanceKm)
            || !isPositive(targetDistanceKm)) {
            return 0.0;
        }
        return knownTimeSeconds * Math.pow(targetDistanceKm / knownDistanceKm, RIEGEL_EXPONENT);
    }

    /**
     * Score after a body-weight change, assuming absolute VO2 stays constant.
     * Invalid weights return {@code score} unchanged.
     */
    public static double weightAdjustedScore(double score, double currentWeightKg,
                                             double targetWeightKg) {
        if (!isPositive(currentWeightKg) || !isPositive(targetWeightKg)) return score;
        return round1(score * currentWeightKg / targetWeightKg);
    }

    public static GoalFeasibility assessGoalFeasibility(double currentScore, double targetScore,
                                                        int weeksLeft) {
        double gap = targetScore - currentScore;
        if (!(gap > 0)) return GoalFeasibility.ALREADY_REACHED;

        double neededWeekly = gap / Math.max(1, weeksLeft);
        double probability = 1.0 - neededWeekly / (MAX_SAFE_PROGRESSION_PER_WEEK * 2.0);
        probability = Math.max(0.0, Math.min(1.0, probability));
        return new GoalFeasibility(probability, gap, neededWeekly);
    }

    /** Karvonen: {@code round((max − rest) · fraction + rest)}. */
    public static int heartRateAt(int maxHr, int restingHr, double fraction) {
        int reserve = maxHr - restingHr;
        return (int) Math.round(reserve * fraction + restingHr);
    }

    public static HeartRateZones heartRateZones(int maxHr, int restingHr) {
        return new HeartRateZones(
            zone(maxHr, restingHr, 0.50, 0.60),
            zone(maxHr, restingHr, 0.60, 0.70),
            zone(maxHr, restingHr, 0.70, 0.80),
            zone(maxHr, restingHr, 0.80, 0.90),
            zone(maxHr, restingHr, 0.90, 1.00)
        );
    }

    // ── helpers ────────────────────────────────────────────────────────────

    static double oxygenCost(double velocityMetersPerMinute) {
        return VO2_INTERCEPT
            + VO2_LINEAR * velocityMetersPerMinute
            + VO2_QUADRATIC * velocityMetersPerMinute * velocityMetersPerMinute;
    }

    static double sustainableFraction(double timeMinutes) {
        return 0.8
            + 0.1894393 * Math.exp(-0.0115 * timeMinutes)
            + 0.2989558 * Math.exp(-0.1932605 * timeMinutes);
    }

    /** Positive while the candidate time is faster than the score allows. */
    private static double predictionError(double score, double distanceKm, double timeMinutes) {
        double velocity = distanceKm * 1000.0 / timeMinutes;
        return oxygenCost(velocity) - score * sustainableFraction(timeMinutes);
    }

    /** Inverts the oxygen-cost quadratic and converts m/min to min/km. */
    private static double paceAt(double vo2) {
        double c = -(-VO2_INTERCEPT + vo2);
        double discriminant = VO2_LINEAR * VO2_LINEAR - 4 * VO2_QUADRATIC * c;
        double velocity = (-VO2_LINEAR + Math.sqrt(discriminant)) / (2 * VO2_QUADRATIC);
        return 1000.0 / velocity;
    }

    private static HeartRateZones.Zone zone(int maxHr, int restingHr, double low, double high) {
        return new HeartRateZones.Zone(heartRateAt(maxHr, restingHr, low),
                                       heartRateAt(maxHr, restingHr, high));
    }

    private static boolean isPositive(double value) {
        return Double.isFinite(value) && value > 0;
    }

    private static double round1(double value) {
        return Math.round(value * 10.0) / 10.0;
    }
}
