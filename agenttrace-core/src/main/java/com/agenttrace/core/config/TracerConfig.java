package com.agenttrace.core.config;

import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Immutable tracer configuration. Validated at construction; invalid settings fail immediately.
 *
 * @param captureLevel    how much data spans record
 * @param autoInstrument  type-name prefixes whose interfaces are traced method-by-method
 * @param redactPatterns  regular expressions (case-insensitive, find semantics) matched against captured keys
 * @param maxInputSize    max length of captured input strings; 0 = unlimited
 * @param maxOutputSize   max length of captured output strings; 0 = unlimited
 */
public record TracerConfig(
    CaptureLevel captureLevel,
    List<String> autoInstrument,
    List<String> redactPatterns,
    int maxInputSize,
    int maxOutputSize
) {

    public TracerConfig {
        if (captureLevel == null) {
            throw new ConfigurationException("captureLevel must not be null");
        }
        if (maxInputSize < 0) {
            throw new ConfigurationException("max_input_size must be >= 0, got " + maxInputSize);
        }
        if (maxOutputSize < 0) {
            throw new ConfigurationException("max_output_size must be >= 0, got " + maxOutputSize);
        }
        autoInstrument = autoInstrument == null ? List.of() : List.copyOf(autoInstrument);
        redactPatterns = redactPatterns == null ? List.of() : List.copyOf(redactPatterns);
        for (String pattern : redactPatterns) {
            compile(pattern);
        }
    }

    public static TracerConfig defaults() {
        return new TracerConfig(CaptureLevel.FULL, List.of(), List.of(), 0, 0);
    }

    public TracerConfig withCaptureLevel(CaptureLevel level) {
        return new TracerConfig(level, autoInstrument, redactPatterns, maxInputSize, maxOutputSize);
    }

    public TracerConfig withAutoInstrument(List<String> prefixes) {
        return new TracerConfig(captureLevel, prefixes, redactPatterns, maxInputSize, maxOutputSize);
    }

    public TracerConfig withRedactPatterns(List<String> patterns) {
        return new TracerConfig(captureLevel, autoInstrument, patterns, maxInputSize, maxOutputSize);
    }

    public TracerConfig withMaxInputSize(int size) {
        return new TracerConfig(captureLevel, autoInstrument, redactPatterns, size, maxOutputSize);
    }

    public TracerConfig withMaxOutputSize(int size) {
        return new TracerConfig(captureLevel, autoInstrument, redactPatterns, maxInputSize, size);
    }

    /** True if {@code typeName} starts with one of the auto-instrument prefixes. */
    public boolean isAutoInstrumented(String typeName) {
        for (String prefix : autoInstrument) {
            if (typeName.startsWith(prefix)) return true;
        }
        return false;
    }

    public List<Pattern> compiledRedactPatterns() {
        return redactPatterns.stream().map(TracerConfig::compile).toList();
    }

    private static Pattern compile(String pattern) {
        Objects.requireNonNull(pattern, "redact pattern");
        try {
            return Pattern.compile(pattern, Pattern.CASE_INSENSITIVE);
        } catch (PatternSyntaxException e) {
            throw new ConfigurationException("Invalid redact pattern '" + pattern + "': " + e.getDescription(), e);
        }
    }

    /** Invalid tracer settings. Raised at construction time; tracing cannot proceed until fixed. */
    public static class ConfigurationException extends RuntimeException {
        public ConfigurationException(String message) { super(message); }
        public ConfigurationException(String message, Throwable cause) { super(message, cause); }
    }
}
