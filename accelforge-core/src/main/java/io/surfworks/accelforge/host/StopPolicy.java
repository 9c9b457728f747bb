package io.surfworks.accelforge.host;

import java.util.Locale;

/**
 * Disposition applied to a host's remote instance on teardown.
 */
public enum StopPolicy {
    /** Terminate and delete the instance */
    TERMINATE,

    /** Stop the instance but keep it for later reuse */
    PAUSE,

    /** Leave the instance running */
    KEEP;

    /**
     * Parses a stop policy.
     *
     * <p>Accepts the enum names (any case) as well as the short forms
     * {@code term}, {@code stop}, {@code keep} and the numeric forms {@code 0}, {@code 1}, {@code 2}.
     *
     * @param value the text to parse
     * @return the policy, or null if {@code value} is null or blank
     * @throws IllegalArgumentException if the value is not a known policy
     */
    public static StopPolicy parse(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "term", "terminate", "0" -> TERMINATE;
            case "stop", "pause", "1" -> PAUSE;
            case "keep", "2" -> KEEP;
            default -> throw new IllegalArgumentException(
                    "Invalid stop policy '" + value + "'. Possible values are: term, stop, keep");
        };
    }

    /**
     * Returns the short form used in configuration files.
     */
    public String shortName() {
        return switch (this) {
            case TERMINATE -> "term";
            case PAUSE -> "stop";
            case KEEP -> "keep";
        };
    }
}
