package com.agenttrace.core;

import com.agenttrace.core.config.TracerConfig;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Applies a {@link TracerConfig} to captured key/value pairs: redaction, then sanitization, then
 * truncation of top-level strings.
 */
final class ValueCapture {

    static final String REDACTED = "[REDACTED]";

    private final TracerConfig config;
    private final List<Pattern> redactPatterns;

    ValueCapture(TracerConfig config) {
        this.config = config;
        this.redactPatterns = config.compiledRedactPatterns();
    }

    boolean capturesData() {
        return config.captureLevel().capturesData();
    }

    boolean capturesTraceback() {
        return config.captureLevel().capturesTraceback();
    }

    Map<String, Object> input(Map<String, ?> values) {
        return capture(values, config.maxInputSize());
    }

    Map<String, Object> output(Map<String, ?> values) {
        return capture(values, config.maxOutputSize());
    }

    Map<String, Object> metadata(Map<String, ?> values) {
        return capture(values, 0);
    }

    private Map<String, Object> capture(Map<String, ?> values, int limit) {
        Map<String, Object> out = new LinkedHashMap<>();
        for (Map.Entry<String, ?> entry : values.entrySet()) {
            String key = entry.getKey();
            if (isRedacted(key)) {
                out.put(key, REDACTED);
            } else {
                out.put(key, ValueSanitizer.truncate(ValueSanitizer.sanitize(entry.getValue()), limit));
            }
        }
        return out;
    }

    private boolean isRedacted(String key) {
        for (Pattern pattern : redactPatterns) {
            if (pattern.matcher(key).find()) return true;
        }
        return false;
    }
}
