package com.trainingplatform.common.performance;

/**
 * Race distances used for prediction tables.
 */
public enum StandardDistance {
    FIVE_K(5.0),
    TEN_K(10.0),
    HALF_MARATHON(21.0975),
    MARATHON(42.195);

    private final double km;

    StandardDistance(double km) {
        this.km = km;
    }

    public double km() {
        return km;
    }
}
