package com.agenttrace.core.config;

import com.google.gson.annotations.SerializedName;

import java.util.Locale;

/**
 * How much data a span records.
 *
 * MINIMAL keeps structure, status, timing, annotations and error message/type.
 * STANDARD adds input, output and metadata. FULL also keeps error stack traces.
 */
public enum CaptureLevel {
    @SerializedName("minimal")  MINIMAL,
    @SerializedName("standard") STANDARD,
    @SerializedName("full")     FULL;

    public boolean capturesData() {
        return this != MINIMAL;
    }

    public boolean capturesTraceback() {
        return this == FULL;
    }

    /**
     * Parses "minimal", "standard" or "full" (case-insensitive).
     *
     * @throws TracerConfig.ConfigurationException for any other value
     */
    public static CaptureLevel parse(String value) {
        if (value == null) {
            throw new TracerConfig.ConfigurationException("capture_level must not be null");
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new TracerConfig.ConfigurationException(
                "Unsupported capture_level '" + value + "'. Use minimal, standard or full.", e);
        }
    }
}
