package com.z254.butterfly.sentinel.forecast;

/**
 * Recurring peak found in a series' history.
 *
 * @param kind        daily or weekly cycle
 * @param peakSlot    hour of day (0-23) or ISO day of week (1-7)
 * @param peakMean    mean value in the peak slot
 * @param overallMean mean value over the whole history
 */
public record SeasonalPattern(Kind kind, int peakSlot, double peakMean, double overallMean) {

    public enum Kind {
        DAILY_PEAK,
        WEEKLY_PEAK
    }

    /**
     * Peak amplitude relative to the overall mean.
     */
    public double strength() {
        return overallMean == 0 ? 0.0 : (peakMean - overallMean) / Math.abs(overallMean);
    }
}
