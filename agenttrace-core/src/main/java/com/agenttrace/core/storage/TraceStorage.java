package com.agenttrace.core.storage;

import com.agenttrace.core.config.TracerConfig;
import com.agenttrace.core.model.TraceGraph;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * Persistence for finished traces.
 *
 * A {@link com.agenttrace.core.Tracer} calls {@link #save} once per trace and turns any
 * {@link StorageException} into a diagnostic, so a failing store never breaks the traced program.
 */
public interface TraceStorage {

    String MEMORY = "memory";
    String FILE_PREFIX = "file://";

    /**
     * @throws StorageException if the trace cannot be written
     */
    void save(TraceGraph graph);

    /** The stored trace, or empty if there is none with that id. */
    Optional<TraceGraph> load(String traceId);

    List<String> listTraces();

    /**
     * Resolves a storage setting: {@code "memory"} (or null) for an in-memory store,
     * {@code "file://<directory>"} for a {@link FileStore}.
     *
     * @throws TracerConfig.ConfigurationException for any other value, or an unusable directory
     */
    static TraceStorage fromUri(String uri) {
        if (uri == null || uri.equals(MEMORY)) {
            return new MemoryStore();
        }
        if (uri.startsWith(FILE_PREFIX) && uri.length() > FILE_PREFIX.length()) {
            return new FileStore(Path.of(uri.substring(FILE_PREFIX.length())));
        }
        throw new TracerConfig.ConfigurationException(
            "Unsupported storage '" + uri + "'. Expected \"memory\" or \"file://<directory>\"");
    }

    class StorageException extends RuntimeException {
        public StorageException(String message) { super(message); }
        public StorageException(String message, Throwable cause) { super(message, cause); }
    }
}
