package com.signal.model;

import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Supported bar timeframes. {@link #ONE_MINUTE} is the base interval ticks are folded into;
 * every other timeframe is an integer multiple of it.
 */
public enum Timeframe {

    ONE_MINUTE("1m", 1),
    FIVE_MINUTES("5m", 5),
    FIFTEEN_MINUTES("15m", 15),
    THIRTY_MINUTES("30m", 30),
    FORTY_FIVE_MINUTES("45m", 45),
    ONE_HOUR("1h", 60);

    public static final Timeframe BASE = ONE_MINUTE;

    /** Expiry used for signal timeframe labels that cannot be parsed. */
    static final int FALLBACK_MINUTES = 5;

    private final String label;
    private final int minutes;

    private static final Map<String, Timeframe> BY_LABEL = Arrays.stream(values())
            .collect(Collectors.toMap(Timeframe::getLabel, Function.identity()));

    Timeframe(String label, int minutes) {
        this.label = label;
        this.minutes = minutes;
    }

    public String getLabel() {
        return label;
    }

    public long getMillis() {
        return TimeUnit.MINUTES.toMillis(minutes);
    }

    /**
     * Start of the bucket a Unix millisecond timestamp falls into.
     */
    public long bucketStart(long timestampMillis) {
        return Math.floorDiv(timestampMillis, getMillis()) * getMillis();
    }

    public static Optional<Timeframe> fromLabel(String label) {
        return Optional.ofNullable(BY_LABEL.get(label));
    }

    /**
     * Resolve configured labels, failing on the first unknown one.
     */
    public static List<Timeframe> parseAll(String... labels) {
        return Arrays.stream(labels)
                .map(String::trim)
                .filter(label -> !label.isEmpty())
                .map(label -> fromLabel(label)
                        .orElseThrow(() -> new IllegalStateException("Unsupported timeframe: " + label)))
                .distinct()
                .toList();
    }

    public static String[] supportedLabels() {
        return Arrays.stream(values()).map(Timeframe::getLabel).toArray(String[]::new);
    }

    /**
     * Signal expiry for a timeframe label: {@code "Nm"} is N minutes, {@code "Nh"} is N hours.
     * Labels that do not parse fall back to five minutes.
     */
    public static long durationMillis(String label) {
        int minutes = FALLBACK_MINUTES;
        if (label != null && label.length() > 1) {
            char unit = label.charAt(label.length() - 1);
            try {
                int amount = Integer.parseInt(label.substring(0, label.length() - 1));
                if (unit == 'm') minutes = amount;
                else if (unit == 'h') minutes = amount * 60;
            } catch (NumberFormatException e) {
                minutes = FALLBACK_MINUTES;
            }
        }
        return TimeUnit.MINUTES.toMillis(minutes);
    }
}
