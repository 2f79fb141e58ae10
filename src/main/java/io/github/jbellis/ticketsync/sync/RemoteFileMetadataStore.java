package io.github.jbellis.ticketsync.sync;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import io.github.jbellis.ticketsync.TicketLayout;
import io.github.jbellis.ticketsync.util.AtomicWrites;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.TreeMap;

/**
 * Remembers, per attachment filename, the remote "created" token of the version last downloaded or uploaded.
 * Lives inside the shadow checkout so it travels with the remote rendering.
 */
public class RemoteFileMetadataStore {
    private static final ObjectMapper objectMapper = new ObjectMapper()
            .enable(SerializationFeature.INDENT_OUTPUT);

    private final Path file;

    public RemoteFileMetadataStore(Path shadowRoot) {
        this.file = shadowRoot.resolve(TicketLayout.METADATA_DIR).resolve(TicketLayout.REMOTE_FILES);
    }

    public Path file() {
        return file;
    }

    /**
     * @return filename to created token, sorted by filename; empty if nothing was recorded yet
     */
    public Map<String, String> read() throws IOException {
        if (!Files.exists(file)) {
            return new TreeMap<>();
        }
        Map<String, String> stored = objectMapper.readValue(file.toFile(), new TypeReference<Map<String, String>>() {});
        return new TreeMap<>(stored);
    }

    public void write(Map<String, String> metadata) throws IOException {
        AtomicWrites.atomicOverwrite(file, objectMapper.writeValueAsString(new TreeMap<>(metadata)) + "\n");
    }
}
