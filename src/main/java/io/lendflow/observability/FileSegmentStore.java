package io.lendflow.observability;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;

public final class FileSegmentStore implements SegmentStore {
    private final Path directory;

    public FileSegmentStore(Path directory) {
        this.directory = directory;
        try {
            Files.createDirectories(directory);
        } catch (IOException e) {
            throw new RuntimeException("Failed to initialize audit directory: " + directory, e);
        }
    }

    public Path directory() {
        return directory;
    }

    public Path segmentFile(String segmentKey) {
        if (segmentKey == null || segmentKey.isBlank() || segmentKey.contains("/") || segmentKey.contains("\\")) {
            throw new IllegalArgumentException("Invalid segment key: " + segmentKey);
        }
        return directory.resolve(segmentKey);
    }

    @Override
    public void append(String segmentKey, byte[] bytes) {
        Path file = segmentFile(segmentKey);
        try {
            Files.write(file, bytes, StandardOpenOption.CREATE, StandardOpenOption.APPEND, StandardOpenOption.WRITE);
        } catch (IOException e) {
            throw new RuntimeException("Failed to append audit segment: " + file, e);
        }
    }

    @Override
    public byte[] read(String segmentKey) {
        Path file = segmentFile(segmentKey);
        if (!Files.exists(file)) {
            return new byte[0];
        }
        try {
            return Files.readAllBytes(file);
        } catch (IOException e) {
            throw new RuntimeException("Failed to read audit segment: " + file, e);
        }
    }

    @Override
    public List<String> listSegments() {
        List<String> out = new ArrayList<>();
        if (!Files.isDirectory(directory)) {
            return out;
        }
        try (Stream<Path> stream = Files.list(directory)) {
            stream.filter(Files::isRegularFile)
                    .map(p -> p.getFileName().toString())
                    .sorted()
                    .forEach(out::add);
        } catch (IOException e) {
            throw new RuntimeException("Failed to list audit segments in " + directory, e);
        }
        return out;
    }

    @Override
    public boolean delete(String segmentKey) {
        try {
            return Files.deleteIfExists(segmentFile(segmentKey));
        } catch (IOException e) {
            throw new RuntimeException("Failed to delete audit segment: " + segmentKey, e);
        }
    }
}
