package io.github.jbellis.ticketsync.sync;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.jbellis.ticketsync.issues.ConnectionOptions;
import io.github.jbellis.ticketsync.issues.IssueSnapshot;
import io.github.jbellis.ticketsync.util.AtomicWrites;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Keeps the raw payload of the last fetched issue, with the connection it came from, in
 * {@code .ticketsync/issue.json}.
 */
public class IssueSnapshotStore {
    private static final Logger logger = LogManager.getLogger(IssueSnapshotStore.class);
    private static final ObjectMapper objectMapper = new ObjectMapper();

    private final Path file;

    public IssueSnapshotStore(Path file) {
        this.file = file;
    }

    public Path file() {
        return file;
    }

    public void write(IssueSnapshot issue, ConnectionOptions options) throws IOException {
        var root = objectMapper.createObjectNode();
        root.set("options", objectMapper.valueToTree(options));
        root.set("raw", issue.raw());
        AtomicWrites.atomicOverwrite(file, objectMapper.writeValueAsString(root));
    }

    /**
     * @return the stored snapshot, or empty when there is none or it cannot be read
     */
    public Optional<IssueSnapshot> read() {
        if (!Files.exists(file)) {
            return Optional.empty();
        }
        try {
            var root = objectMapper.readTree(file.toFile());
            return Optional.of(IssueSnapshot.fromRaw(root.path("raw")));
        } catch (IOException | IllegalArgumentException e) {
            logger.warn("Unable to read cached issue from {}: {}", file, e.getMessage());
            return Optional.empty();
        }
    }
}
