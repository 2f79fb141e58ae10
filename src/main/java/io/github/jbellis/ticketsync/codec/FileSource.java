package io.github.jbellis.ticketsync.codec;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;

/**
 * Somewhere rendered ticket files can be read back from: a directory on disk, or a revision of a history.
 */
@FunctionalInterface
public interface FileSource {
    /**
     * @return the file's text, or empty if the file does not exist in this source
     */
    Optional<String> read(String relativePath) throws IOException;

    static FileSource directory(Path root) {
        return relativePath -> {
            var file = root.resolve(relativePath);
            if (!Files.isRegularFile(file)) {
                return Optional.empty();
            }
            return Optional.of(Files.readString(file, StandardCharsets.UTF_8));
        };
    }

    static FileSource of(Map<String, byte[]> files) {
        return relativePath -> Optional.ofNullable(files.get(relativePath))
                .map(bytes -> new String(bytes, StandardCharsets.UTF_8));
    }
}
