package com.trainingplatform.common.model;

/**
 * Category of a session in the planning calendar.
 */
public enum PlannedCategory {
    EASY,
    LONG_RUN,
    INTERVALS,
    RECOVERY,
    TEMPO,
    STRENGTH,
    REST;

    /** Categories that contribute running kilometres to the weekly forecast. */
    public boolean isRunning() {
        return this == EASY || this == LONG_RUN || this == INTERVALS
            || this == RECOVERY || this == TEMPO;
    }
}
