package in.voltedge.service.signal;

import in.voltedge.config.VolumeConfirmationConfig;
import in.voltedge.domain.common.EventType;
import in.voltedge.domain.market.Sample;
import in.voltedge.domain.signal.Signal;
import in.voltedge.domain.signal.VolumeConfirmation;
import in.voltedge.domain.signal.VolumeTrend;
import in.voltedge.service.core.EventService;

import java.util.ArrayList;
import java.util.List;

/**
 * Accepts or rejects a candidate signal on relative volume.
 *
 * The average is taken over the {@code period} samples before the current one, so a spike
 * does not dilute its own baseline.
 */
public final class VolumeConfirmationFilter {

    private static final double TREND_UP = 1.2;
    private static final double TREND_DOWN = 0.8;

    private final VolumeConfirmationConfig config;
    private final EventService events;

    public VolumeConfirmationFilter(VolumeConfirmationConfig config, EventService events) {
        this.config = config;
        this.events = events;
    }

    public VolumeConfirmation confirm(List<Sample> samples, Signal candidate) {
        double[] volumes = new double[samples.size()];
        for (int i = 0; i < volumes.length; i++) {
            volumes[i] = samples.get(i).volume();
        }
        VolumeConfirmation result = confirm(volumes);
        if (candidate != null) {
            events.emit(EventType.VOLUME_CHECKED, candidate.symbol(), "volume-filter", result);
        }
        return result;
    }

    public VolumeConfirmation confirm(double[] volumes) {
        int period = config.period();
        double ratio = 1.0;
        double percentile = 0.5;
        VolumeTrend trend = VolumeTrend.STABLE;

        if (volumes.length >= period + 1) {
            double current = volumes[volumes.length - 1];
            double avg = mean(volumes, volumes.length - 1 - period, volumes.length - 1);
            ratio = avg > 0.0 ? current / avg : 1.0;

            int lookback = Math.min(volumes.length, period * 2);
            int below = 0;
            for (int i = volumes.length - lookback; i < volumes.length; i++) {
                if (volumes[i] < current) {
                    below++;
                }
            }
            percentile = (double) below / lookback;

            if (volumes.length >= period * 2) {
                double recent = mean(volumes, volumes.length - period, volumes.length);
                double older = mean(volumes, volumes.length - 2 * period, volumes.length - period);
                double trendRatio = older > 0.0 ? recent / older : 1.0;
                trend = trendRatio > TREND_UP ? VolumeTrend.INCREASING
                    : trendRatio < TREND_DOWN ? VolumeTrend.DECREASING : VolumeTrend.STABLE;
            }
        }
        boolean spike = ratio >= config.spikeThreshold();
        boolean confirmed = ratio >= config.thresholdMultiplier();

        double score = 0.0;
        List<String> reasons = new ArrayList<>();

        if (confirmed) {
            score += 0.3;
            reasons.add(String.format("Volume %.2fx above average", ratio));
        } else {
            reasons.add(String.format("Volume only %.2fx average (below %.2fx threshold)",
                ratio, config.thresholdMultiplier()));
        }

        if (config.requireSpike()) {
            if (spike) {
                score += 0.3;
                reasons.add("Volume spike detected");
            } else {
                reasons.add("No volume spike detected");
            }
        }

        if (percentile >= config.minPercentile()) {
            score += 0.2;
            reasons.add(String.format("Volume in %.0f%% percentile", percentile * 100));
        } else {
            reasons.add(String.format("Volume below %.0f%% percentile", config.minPercentile() * 100));
        }

        switch (trend) {
            case INCREASING -> {
                score += 0.2;
                reasons.add("Volume trend increasing");
            }
            case STABLE -> {
                score += 0.1;
                reasons.add("Volume trend stable");
            }
            case DECREASING -> reasons.add("Volume trend decreasing");
        }

        return new VolumeConfirmation(confirmed, Math.min(1.0, score), ratio, percentile, spike, trend, reasons);
    }

    private static double mean(double[] values, int from, int to) {
        double sum = 0.0;
        for (int i = from; i < to; i++) {
            sum += values[i];
        }
        return to > from ? sum / (to - from) : 0.0;
    }
}
