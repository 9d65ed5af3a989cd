package com.agenttrace.core.storage;

import com.agenttrace.core.config.TracerConfig;
import com.agenttrace.core.model.TraceGraph;
import com.agenttrace.core.serialization.TraceSerializer;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * One JSON file per trace: {@code <directory>/<trace_id>.json}.
 */
public class FileStore implements TraceStorage {

    private static final String SUFFIX = ".json";

    private final Path directory;
    private final TraceSerializer serializer;

    public FileStore(Path directory) {
        this(directory, new TraceSerializer());
    }

    /**
     * @throws TracerConfig.ConfigurationException if the directory cannot be created or is not writable
     */
    public FileStore(Path directory, TraceSerializer serializer) {
        this.directory = directory;
        this.serializer = serializer;
        try {
            Files.createDirectories(directory);
        } catch (IOException e) {
            throw new TracerConfig.ConfigurationException(
                "Could not create trace directory: " + directory + ": " + e.getMessage(), e);
        }
        if (!Files.isWritable(directory)) {
            throw new TracerConfig.ConfigurationException("Trace directory is not writable: " + directory);
        }
    }

    public Path directory() {
        return directory;
    }

    @Override
    public void save(TraceGraph graph) {
        Path file = fileFor(graph.traceId());
        try {
            serializer.write(graph, file);
        } catch (IOException e) {
            throw new StorageException("Failed to write trace file " + file + ": " + e.getMessage(), e);
        }
    }

    /**
     * @throws TraceSerializer.TraceLoadException if the stored file is not a valid trace
     */
    @Override
    public Optional<TraceGraph> load(String traceId) {
        Path file = fileFor(traceId);
        if (!Files.exists(file)) {
            return Optional.empty();
        }
        try {
            return Optional.of(serializer.read(file));
        } catch (IOException e) {
            throw new StorageException("Failed to read trace file " + file + ": " + e.getMessage(), e);
        }
    }

    @Override
    public List<String> listTraces() {
        try (Stream<Path> files = Files.list(directory)) {
            return files
                .map(p -> p.getFileName().toString())
                .filter(name -> name.endsWith(SUFFIX))
                .map(name -> name.substring(0, name.length() - SUFFIX.length()))
                .sorted()
                .collect(Collectors.toList());
        } catch (IOException e) {
            throw new StorageException("Failed to list trace directory " + directory + ": " + e.getMessage(), e);
        }
    }

    private Path fileFor(String traceId) {
        if (traceId == null || traceId.isEmpty() || traceId.contains("/") || traceId.contains("\\")
                || traceId.startsWith(".")) {
            throw new IllegalArgumentException("Invalid trace id for file storage: " + traceId);
        }
        return directory.resolve(traceId + SUFFIX);
    }
}
