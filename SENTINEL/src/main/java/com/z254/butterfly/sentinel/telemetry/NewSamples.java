package com.z254.butterfly.sentinel.telemetry;

/**
 * Samples a series received since the last detection pass.
 *
 * @param history the series' newest samples; the last {@code count} of them are new
 * @param count   number of new samples, never more than {@code history.size()}
 */
public record NewSamples(MetricWindow history, int count) {

    /**
     * Index one past the oldest new sample, i.e. the end of the first window to judge.
     */
    public int firstEnd() {
        return history.size() - count + 1;
    }
}
