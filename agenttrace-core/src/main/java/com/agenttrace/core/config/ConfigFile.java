package com.agenttrace.core.config;

import com.google.gson.annotations.SerializedName;

import java.util.Collections;
import java.util.List;

/**
 * Deserialized form of an agenttrace JSON config file. Every key is optional.
 *
 * <pre>
 * {
 *   "capture_level": "standard",
 *   "auto_instrument": ["com.example.tools."],
 *   "redact_patterns": ["api[_-]?key", "password"],
 *   "max_input_size": 2000,
 *   "max_output_size": 4000,
 *   "storage": "file:///var/traces"
 * }
 * </pre>
 */
public class ConfigFile {

    @SerializedName("capture_level")
    private String captureLevel;

    @SerializedName("auto_instrument")
    private List<String> autoInstrument;

    @SerializedName("redact_patterns")
    private List<String> redactPatterns;

    @SerializedName("max_input_size")
    private Integer maxInputSize;

    @SerializedName("max_output_size")
    private Integer maxOutputSize;

    /** "memory" (default) or "file://&lt;directory&gt;". */
    @SerializedName("storage")
    private String storage;

    public String getCaptureLevel()       { return captureLevel != null ? captureLevel : "full"; }
    public List<String> getAutoInstrument() { return autoInstrument != null ? autoInstrument : Collections.emptyList(); }
    public List<String> getRedactPatterns() { return redactPatterns != null ? redactPatterns : Collections.emptyList(); }
    public int getMaxInputSize()          { return maxInputSize != null ? maxInputSize : 0; }
    public int getMaxOutputSize()         { return maxOutputSize != null ? maxOutputSize : 0; }
    public String getStorage()            { return storage != null ? storage : "memory"; }

    /**
     * @throws TracerConfig.ConfigurationException if any value is invalid
     */
    public TracerConfig toTracerConfig() {
        return new TracerConfig(
            CaptureLevel.parse(getCaptureLevel()),
            getAutoInstrument(),
            getRedactPatterns(),
            getMaxInputSize(),
            getMaxOutputSize()
        );
    }
}
