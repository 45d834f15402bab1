package com.trainingplatform.common.load;

import com.trainingplatform.common.model.ActivityRecord;
import com.trainingplatform.common.model.WeeklyForecast;

import java.util.List;

/**
 * Compares this week's forecast running distance with the mean of the four
 * completed weeks before it. A zero baseline yields a 0% difference.
 */
public final class VolumeTrendAnalyzer {

    private VolumeTrendAnalyzer() {}

    public static VolumeTrend analyze(WeekWindow week, List<ActivityRecord> activities,
                                      WeeklyForecast forecast) {
        double average = WeeklyForecastCalculator.trailingAverageRunningKm(week, activities);
        double current = forecast == null ? 0.0 : forecast.runningKm();
        double diff = current - average;
        double pctDiff = average > 0 ? diff / average * 100.0 : 0.0;
        return new VolumeTrend(average, current, diff, pctDiff, VolumeTrendStatus.classify(pctDiff));
    }
}
