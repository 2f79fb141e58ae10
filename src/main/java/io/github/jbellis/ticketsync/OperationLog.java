package io.github.jbellis.ticketsync;

import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.util.List;

/**
 * Append-only record of what happened to one ticket folder.
 * <p>
 * Each event goes to the class logger, gets appended to {@code .ticketsync/operation.log} as
 * {@code timestamp<TAB>LEVEL<TAB>message}, and is echoed to the console when at or above the echo level.
 */
public class OperationLog {
    private static final Logger logger = LogManager.getLogger(OperationLog.class);

    private final String key;
    private final Path file;
    private final TicketConsole console;
    private final Level echoLevel;

    public OperationLog(String key, Path file, TicketConsole console, Level echoLevel) {
        this.key = key;
        this.file = file;
        this.console = console;
        this.echoLevel = echoLevel;
    }

    public Path file() {
        return file;
    }

    public void log(Level level, String message) {
        logger.log(level, "[{}] {}", key, message);

        var line = Instant.now() + "\t" + level.name() + "\t" + escape(message) + "\n";
        try {
            Files.writeString(file, line, StandardCharsets.UTF_8,
                              StandardOpenOption.CREATE, StandardOpenOption.APPEND);
        } catch (IOException e) {
            logger.error("Unable to append to operation log {}", file, e);
            console.toolError("[ERROR " + key + "] Unable to append to " + file + ": " + e.getMessage());
        }

        if (level.isMoreSpecificThan(echoLevel)) {
            var echoed = "[" + level.name() + " " + key + "] " + message;
            if (level.isMoreSpecificThan(Level.WARN)) {
                console.toolError(echoed);
            } else {
                console.actionOutput(echoed);
            }
        }
    }

    public void debug(String message) {
        log(Level.DEBUG, message);
    }

    public void info(String message) {
        log(Level.INFO, message);
    }

    public void warn(String message) {
        log(Level.WARN, message);
    }

    public void error(String message) {
        log(Level.ERROR, message);
    }

    /**
     * @return every recorded line, oldest first; empty if nothing was logged yet
     */
    public List<String> lines() throws IOException {
        if (!Files.exists(file)) {
            return List.of();
        }
        return Files.readAllLines(file, StandardCharsets.UTF_8);
    }

    private static String escape(String message) {
        return message.replace("\\", "\\\\").replace("\r", "\\r").replace("\n", "\\n");
    }
}
