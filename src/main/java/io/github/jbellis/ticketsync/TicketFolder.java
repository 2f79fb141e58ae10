package io.github.jbellis.ticketsync;

import com.google.common.collect.ImmutableList;
import io.github.jbellis.ticketsync.codec.FieldCodec;
import io.github.jbellis.ticketsync.codec.IndentedFieldCodec;
import io.github.jbellis.ticketsync.git.TicketHistory;
import io.github.jbellis.ticketsync.issues.IssueTrackerClient;
import io.github.jbellis.ticketsync.migration.MigrationRunner;
import io.github.jbellis.ticketsync.sync.IssueAccessor;
import io.github.jbellis.ticketsync.sync.IssueSnapshotStore;
import io.github.jbellis.ticketsync.sync.SyncEngine;
import io.github.jbellis.ticketsync.util.AtomicWrites;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.eclipse.jgit.api.errors.GitAPIException;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * A directory mirroring one remote ticket. Its name is the ticket key, and its {@code .ticketsync}
 * directory holds the histories, the cached issue and the operation log.
 */
public class TicketFolder {
    private static final Logger logger = LogManager.getLogger(TicketFolder.class);
    private static final Pattern TICKET_KEY = Pattern.compile("^\\w+-\\d+$", Pattern.CASE_INSENSITIVE);

    private final Path path;
    private final String key;
    private final IssueTrackerClient client;
    private final TicketSyncConfig config;
    private final FieldCodec codec;
    private final OperationLog log;
    private final IssueAccessor issues;

    private TicketFolder(Path path, IssueTrackerClient client, TicketSyncConfig config, TicketConsole console) {
        this.path = path;
        this.key = inferKey(path);
        this.client = client;
        this.config = config;
        this.codec = new IndentedFieldCodec();
        this.log = new OperationLog(key, metadataDir().resolve(TicketLayout.OPERATION_LOG), console, config.echoLevel());
        this.issues = new IssueAccessor(key, client,
                                        new IssueSnapshotStore(metadataDir().resolve(TicketLayout.CACHED_ISSUE)),
                                        log);
    }

    /**
     * Opens an existing ticket folder and brings it up to the current layout version.
     */
    public static TicketFolder open(Path path, IssueTrackerClient client, TicketSyncConfig config, TicketConsole console)
            throws IOException, GitAPIException {
        return open(path, client, config, console, true);
    }

    public static TicketFolder open(Path path,
                                    IssueTrackerClient client,
                                    TicketSyncConfig config,
                                    TicketConsole console,
                                    boolean migrate) throws IOException, GitAPIException {
        var absolute = path.toAbsolutePath().normalize();
        if (!Files.isDirectory(absolute.resolve(TicketLayout.METADATA_DIR))) {
            throw new NotTicketFolderException(absolute);
        }
        var folder = new TicketFolder(absolute, client, config, console);
        if (migrate) {
            folder.runMigrations(false);
        }
        folder.ensureNewCommentFile();
        return folder;
    }

    /**
     * Turns {@code path} into a ticket folder: metadata directory, primary history with an initial commit,
     * and every migration applied.
     */
    public static TicketFolder initialize(Path path, IssueTrackerClient client, TicketSyncConfig config, TicketConsole console)
            throws IOException, GitAPIException {
        var absolute = path.toAbsolutePath().normalize();
        inferKey(absolute);
        if (Files.exists(TicketHistory.gitDir(absolute))) {
            throw new TicketFolderException(absolute + " is already a ticket folder");
        }
        Files.createDirectories(absolute.resolve(TicketLayout.METADATA_DIR));
        TicketHistory.initPrimary(absolute);

        var folder = new TicketFolder(absolute, client, config, console);
        folder.log().debug("Initialized ticket folder at " + absolute);
        folder.runMigrations(true);
        folder.ensureNewCommentFile();
        return folder;
    }

    /**
     * Creates {@code path}, initializes it and runs a first full sync.
     */
    public static TicketFolder cloneTicket(Path path, IssueTrackerClient client, TicketSyncConfig config, TicketConsole console)
            throws IOException, GitAPIException {
        Files.createDirectories(path);
        var folder = initialize(path, client, config, console);
        new SyncEngine(folder).sync();
        return folder;
    }

    /**
     * @return the ticket key the directory name spells, upper-cased
     */
    public static String inferKey(Path path) {
        var name = path.toAbsolutePath().normalize().getFileName();
        if (name == null || !TICKET_KEY.matcher(name.toString()).matches()) {
            throw new CannotInferTicketNumberException(path);
        }
        return name.toString().toUpperCase(Locale.ROOT);
    }

    public Path path() {
        return path;
    }

    public String key() {
        return key;
    }

    public Path metadataDir() {
        return path.resolve(TicketLayout.METADATA_DIR);
    }

    public IssueTrackerClient client() {
        return client;
    }

    public TicketSyncConfig config() {
        return config;
    }

    public FieldCodec codec() {
        return codec;
    }

    public OperationLog log() {
        return log;
    }

    public IssueAccessor issues() {
        return issues;
    }

    public List<String> getLog() throws IOException {
        return log.lines();
    }

    /**
     * Layout version of this folder; 1 for folders that predate version tracking.
     */
    public int version() throws IOException {
        var file = metadataDir().resolve(TicketLayout.VERSION_FILE);
        if (!Files.exists(file)) {
            return 1;
        }
        var text = Files.readString(file, StandardCharsets.UTF_8).strip();
        try {
            return Integer.parseInt(text);
        } catch (NumberFormatException e) {
            throw new IOException("Corrupt version file " + file + ": '" + text + "'", e);
        }
    }

    public void setVersion(int version) throws IOException {
        AtomicWrites.atomicOverwrite(metadataDir().resolve(TicketLayout.VERSION_FILE), version + "\n");
    }

    public void runMigrations(boolean silent) throws IOException, GitAPIException {
        MigrationRunner.standard().run(this, silent);
    }

    public Path newCommentFile() {
        return path.resolve(TicketLayout.TICKET_NEW_COMMENT);
    }

    void ensureNewCommentFile() throws IOException {
        var file = newCommentFile();
        if (!Files.exists(file)) {
            Files.writeString(file, "", StandardCharsets.UTF_8);
            logger.debug("Created empty comment buffer {}", file);
        }
    }

    /**
     * Files that are never uploaded: everything the codec renders plus the comment buffer.
     */
    public List<String> builtInIgnores() {
        return ImmutableList.<String>builder()
                .addAll(codec.renderedFileNames())
                .add(TicketLayout.TICKET_NEW_COMMENT)
                .build();
    }

    /**
     * Patterns of local files that are not uploaded.
     */
    public IgnoreGlobSet localIgnores() throws IOException {
        return IgnoreGlobSet.load(builtInIgnores(), path, config.userHome(), TicketLayout.IGNORE_FILE);
    }

    /**
     * Patterns of remote attachments that are not downloaded.
     */
    public IgnoreGlobSet remoteIgnores() throws IOException {
        return IgnoreGlobSet.load(builtInIgnores(), path, config.userHome(), TicketLayout.REMOTE_IGNORE_FILE);
    }

    @Override
    public String toString() {
        return key + " at " + path;
    }
}
