package in.voltedge.domain.market;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Bar resolutions used for multi-timeframe validation.
 */
public enum Timeframe {
    /**
     * 1-minute bars. Lowest priority during conflict resolution.
     */
    ONE_MIN("1Min", 1, 0),

    /**
     * 5-minute bars. Default primary timeframe.
     */
    FIVE_MIN("5Min", 5, 1),

    FIFTEEN_MIN("15Min", 15, 2),

    /**
     * 1-hour bars. Highest priority during conflict resolution.
     */
    ONE_HOUR("1Hour", 60, 3);

    private final String label;
    private final int minutes;
    private final int priority;

    Timeframe(String label, int minutes, int priority) {
        this.label = label;
        this.minutes = minutes;
        this.priority = priority;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }

    public int getMinutes() {
        return minutes;
    }

    /**
     * Higher value wins when timeframes disagree and nothing else resolves the conflict.
     */
    public int getPriority() {
        return priority;
    }

    @JsonCreator
    public static Timeframe fromLabel(String label) {
        for (Timeframe tf : values()) {
            if (tf.label.equalsIgnoreCase(label) || tf.name().equalsIgnoreCase(label)) {
                return tf;
            }
        }
        throw new IllegalArgumentException("Unknown timeframe: " + label);
    }

    @Override
    public String toString() {
        return label;
    }
}
