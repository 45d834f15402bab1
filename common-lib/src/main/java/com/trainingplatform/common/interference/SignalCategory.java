package com.trainingplatform.common.interference;

/**
 * Dominant cellular signalling pathway an activity triggers.
 */
public enum SignalCategory {
    /** Strength and hypertrophy work. */
    MTOR,
    /** Hard or long endurance work. */
    AMPK_HIGH,
    /** Easy endurance and recovery work. */
    AMPK_LOW,
    /** Mixed race-style sessions (Hyrox); interferes like hard cardio. */
    HYBRID,
    /** Rest, yoga, stretching. */
    NEUTRAL,
    UNKNOWN
}
