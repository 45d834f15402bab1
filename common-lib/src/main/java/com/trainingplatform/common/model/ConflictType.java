package com.trainingplatform.common.model;

public enum ConflictType {
    /** Strength and hard endurance signalling on the same day. */
    INTERFERENCE_EFFECT,
    /** Two or more strength sessions on the same day. */
    DOUBLE_STRENGTH,
    /** A hybrid race-style session combined with heavy strength. */
    RECOVERY_RISK
}
