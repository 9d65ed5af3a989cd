package com.agenttrace.cli.render;

import java.util.Locale;

/** How much of each node {@link TraceRenderer} prints. */
public enum Verbosity {
    /** Tree structure, timing and status only. */
    MINIMAL,
    /** Adds annotations and errors. */
    STANDARD,
    /** Adds input, output and metadata. */
    FULL;

    /**
     * @throws IllegalArgumentException for anything but minimal, standard or full (any case)
     */
    public static Verbosity parse(String value) {
        return switch (value.toLowerCase(Locale.ROOT)) {
            case "minimal" -> MINIMAL;
            case "standard" -> STANDARD;
            case "full" -> FULL;
            default -> throw new IllegalArgumentException(
                "Invalid verbosity '" + value + "'. Expected one of: minimal, standard, full");
        };
    }
}
