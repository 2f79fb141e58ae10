package io.github.jbellis.ticketsync;

import io.github.jbellis.ticketsync.util.AtomicWrites;
import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Properties;
import java.util.Set;

/**
 * User-level settings, stored in {@code ~/.config/ticketsync/ticketsync.properties}.
 * <p>
 * The tracker server and token may also come from the environment, which wins over the file.
 */
public class TicketSyncConfig {
    private static final Logger logger = LogManager.getLogger(TicketSyncConfig.class);

    public static final String JIRA_SERVER = "jira.server";
    public static final String JIRA_USERNAME = "jira.username";
    public static final String JIRA_TOKEN = "jira.token";
    public static final String ECHO_LEVEL = "echo.level";

    public static final Set<String> KNOWN_KEYS = Set.of(JIRA_SERVER, JIRA_USERNAME, JIRA_TOKEN, ECHO_LEVEL);

    private static final Map<String, String> ENV_OVERRIDES = Map.of(
            JIRA_SERVER, "TICKETSYNC_JIRA_SERVER",
            JIRA_TOKEN, "TICKETSYNC_JIRA_TOKEN");

    private final Path userHome;
    private final Path propertiesFile;
    private final Properties props = new Properties();
    private final Map<String, String> env;

    public TicketSyncConfig(Path userHome, Map<String, String> env) {
        this.userHome = userHome;
        this.env = env;
        this.propertiesFile = userHome.resolve(".config").resolve("ticketsync").resolve("ticketsync.properties");
        if (Files.exists(propertiesFile)) {
            try (var reader = Files.newBufferedReader(propertiesFile)) {
                props.load(reader);
            } catch (IOException e) {
                logger.warn("Unable to read settings from {}: {}", propertiesFile, e.getMessage());
            }
        }
    }

    public static TicketSyncConfig load() {
        return new TicketSyncConfig(Path.of(System.getProperty("user.home")), System.getenv());
    }

    public Path userHome() {
        return userHome;
    }

    public Path propertiesFile() {
        return propertiesFile;
    }

    public String get(String key) {
        var envName = ENV_OVERRIDES.get(key);
        if (envName != null) {
            var fromEnv = env.get(envName);
            if (fromEnv != null && !fromEnv.isBlank()) {
                return fromEnv.trim();
            }
        }
        return props.getProperty(key, "").trim();
    }

    public String jiraServer() {
        var server = get(JIRA_SERVER);
        return server.endsWith("/") ? server.substring(0, server.length() - 1) : server;
    }

    public String jiraUsername() {
        return get(JIRA_USERNAME);
    }

    public String jiraToken() {
        return get(JIRA_TOKEN);
    }

    /**
     * Minimum level of operation-log events that are echoed to the console.
     */
    public Level echoLevel() {
        var raw = get(ECHO_LEVEL);
        return raw.isEmpty() ? Level.INFO : Level.toLevel(raw, Level.INFO);
    }

    public void set(String key, String value) throws IOException {
        if (!KNOWN_KEYS.contains(key)) {
            throw new IllegalArgumentException("Unknown setting '" + key + "'; expected one of " + KNOWN_KEYS);
        }
        props.setProperty(key, value);
        AtomicWrites.atomicSaveProperties(propertiesFile, props, "ticketsync settings");
        logger.debug("Saved {} to {}", key, propertiesFile);
    }
}
