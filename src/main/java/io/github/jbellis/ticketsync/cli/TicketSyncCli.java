package io.github.jbellis.ticketsync.cli;

import io.github.jbellis.ticketsync.TicketConsole;
import io.github.jbellis.ticketsync.TicketFolder;
import io.github.jbellis.ticketsync.TicketFolderException;
import io.github.jbellis.ticketsync.TicketSyncConfig;
import io.github.jbellis.ticketsync.issues.IssueTrackerClient;
import io.github.jbellis.ticketsync.issues.JiraAuth;
import io.github.jbellis.ticketsync.issues.JiraIssueTrackerClient;
import io.github.jbellis.ticketsync.migration.MigrationRunner;
import io.github.jbellis.ticketsync.sync.SyncEngine;
import io.github.jbellis.ticketsync.sync.SyncStatus;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.eclipse.jgit.api.errors.GitAPIException;
import org.jetbrains.annotations.Nullable;
import picocli.CommandLine;

import java.io.IOException;
import java.nio.file.Path;
import java.util.concurrent.Callable;
import java.util.function.Function;

@CommandLine.Command(
        name = "ticketsync",
        mixinStandardHelpOptions = true,
        description = "Edit a Jira ticket as a folder of plain-text files.",
        subcommands = {
                TicketSyncCli.CloneCommand.class,
                TicketSyncCli.StatusCommand.class,
                TicketSyncCli.FetchCommand.class,
                TicketSyncCli.MergeCommand.class,
                TicketSyncCli.PullCommand.class,
                TicketSyncCli.PushCommand.class,
                TicketSyncCli.SyncCommand.class,
                TicketSyncCli.LogCommand.class,
                TicketSyncCli.MigrateCommand.class,
                TicketSyncCli.ConfigCommand.class
        })
public final class TicketSyncCli implements Callable<Integer> {
    private static final Logger logger = LogManager.getLogger(TicketSyncCli.class);

    private final TicketSyncConfig config;
    private final Function<TicketSyncConfig, IssueTrackerClient> clientFactory;
    private final TicketConsole console;

    public TicketSyncCli() {
        this(TicketSyncConfig.load(), cfg -> new JiraIssueTrackerClient(new JiraAuth(cfg)), TicketConsole.stdio());
    }

    public TicketSyncCli(TicketSyncConfig config,
                         Function<TicketSyncConfig, IssueTrackerClient> clientFactory,
                         TicketConsole console) {
        this.config = config;
        this.clientFactory = clientFactory;
        this.console = console;
    }

    public static void main(String[] args) {
        logger.debug("Starting ticketsync");
        int exitCode = new CommandLine(new TicketSyncCli()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() {
        CommandLine.usage(this, System.out);
        return 0;
    }

    TicketFolder openFolder(Path path) throws IOException, GitAPIException {
        return TicketFolder.open(path, clientFactory.apply(config), config, console);
    }

    /**
     * Runs {@code action}, reporting folder, tracker and git failures on the console instead of as stack traces.
     */
    int run(FolderAction action) {
        try {
            action.run();
            return 0;
        } catch (TicketFolderException | IOException | GitAPIException e) {
            logger.debug("Command failed", e);
            console.toolError("Error: " + e.getMessage());
            return 1;
        }
    }

    @FunctionalInterface
    interface FolderAction {
        void run() throws IOException, GitAPIException;
    }

    abstract static class FolderCommand implements Callable<Integer> {
        @CommandLine.ParentCommand
        @Nullable
        TicketSyncCli parent;

        @CommandLine.Option(names = "--folder", defaultValue = ".", description = "Ticket folder to operate on.")
        Path folder = Path.of(".");

        TicketSyncCli cli() {
            if (parent == null) {
                throw new IllegalStateException("Subcommand used without its parent command");
            }
            return parent;
        }

        @Override
        public Integer call() {
            return cli().run(() -> execute(new SyncEngine(cli().openFolder(folder))));
        }

        abstract void execute(SyncEngine engine) throws IOException, GitAPIException;
    }

    @CommandLine.Command(name = "clone", description = "Create a ticket folder for KEY and sync it.")
    static final class CloneCommand implements Callable<Integer> {
        @CommandLine.ParentCommand
        @Nullable
        TicketSyncCli parent;

        @CommandLine.Parameters(index = "0", paramLabel = "KEY", description = "Ticket key, e.g. PROJ-123.")
        String key = "";

        @CommandLine.Parameters(index = "1", arity = "0..1", paramLabel = "DIR",
                description = "Target directory; defaults to KEY in the current directory.")
        @Nullable
        Path directory;

        @Override
        public Integer call() {
            var cli = parent;
            if (cli == null) {
                throw new IllegalStateException("Subcommand used without its parent command");
            }
            var target = directory != null ? directory : Path.of(key);
            return cli.run(() -> {
                var folder = TicketFolder.cloneTicket(target, cli.clientFactory.apply(cli.config), cli.config, cli.console);
                cli.console.actionOutput("Cloned " + folder.key() + " into " + folder.path());
            });
        }
    }

    @CommandLine.Command(name = "status", description = "Show what a push would send.")
    static final class StatusCommand extends FolderCommand {
        @Override
        void execute(SyncEngine engine) throws IOException, GitAPIException {
            cli().console.actionOutput(format(engine.status()));
        }

        static String format(SyncStatus status) {
            if (status.isClean()) {
                return "No local changes.";
            }
            var out = new StringBuilder();
            if (!status.toUpload().isEmpty()) {
                out.append("Ready for upload:\n");
                status.toUpload().forEach(file -> out.append("    ").append(file).append('\n'));
            }
            if (!status.localDiffers().isEmpty()) {
                out.append("Changed fields:\n");
                status.localDiffers().forEach((field, diff) -> out.append("    ").append(field)
                        .append(": \"").append(diff.original()).append("\" -> \"")
                        .append(diff.local() == null ? "" : diff.local()).append("\"\n"));
            }
            if (!status.newComment().isEmpty()) {
                out.append("New comment:\n");
                status.newComment().lines().forEach(line -> out.append("    ").append(line).append('\n'));
            }
            return out.toString().stripTrailing();
        }
    }

    @CommandLine.Command(name = "fetch", description = "Fetch the remote ticket into the tracking branch.")
    static final class FetchCommand extends FolderCommand {
        @Override
        void execute(SyncEngine engine) throws IOException, GitAPIException {
            engine.fetch();
        }
    }

    @CommandLine.Command(name = "merge", description = "Merge fetched remote changes into the folder.")
    static final class MergeCommand extends FolderCommand {
        @Override
        void execute(SyncEngine engine) throws IOException, GitAPIException {
            engine.merge();
        }
    }

    @CommandLine.Command(name = "pull", description = "Fetch, then merge.")
    static final class PullCommand extends FolderCommand {
        @Override
        void execute(SyncEngine engine) throws IOException, GitAPIException {
            engine.pull();
        }
    }

    @CommandLine.Command(name = "push", description = "Send local files, fields and the new comment to the tracker.")
    static final class PushCommand extends FolderCommand {
        @Override
        void execute(SyncEngine engine) throws IOException, GitAPIException {
            engine.push();
        }
    }

    @CommandLine.Command(name = "sync", description = "Pull, then push.")
    static final class SyncCommand extends FolderCommand {
        @Override
        void execute(SyncEngine engine) throws IOException, GitAPIException {
            engine.sync();
        }
    }

    @CommandLine.Command(name = "log", description = "Print the folder's operation log.")
    static final class LogCommand implements Callable<Integer> {
        @CommandLine.ParentCommand
        @Nullable
        TicketSyncCli parent;

        @CommandLine.Option(names = "--folder", defaultValue = ".", description = "Ticket folder to operate on.")
        Path folder = Path.of(".");

        @Override
        public Integer call() {
            var cli = parent;
            if (cli == null) {
                throw new IllegalStateException("Subcommand used without its parent command");
            }
            return cli.run(() -> {
                var ticketFolder = TicketFolder.open(folder, cli.clientFactory.apply(cli.config), cli.config,
                                                     cli.console, false);
                ticketFolder.getLog().forEach(cli.console::actionOutput);
            });
        }
    }

    @CommandLine.Command(name = "migrate", description = "Upgrade the folder layout to version "
                                                         + MigrationRunner.CURRENT_VERSION + ".")
    static final class MigrateCommand implements Callable<Integer> {
        @CommandLine.ParentCommand
        @Nullable
        TicketSyncCli parent;

        @CommandLine.Option(names = "--folder", defaultValue = ".", description = "Ticket folder to operate on.")
        Path folder = Path.of(".");

        @Override
        public Integer call() {
            var cli = parent;
            if (cli == null) {
                throw new IllegalStateException("Subcommand used without its parent command");
            }
            return cli.run(() -> {
                var ticketFolder = TicketFolder.open(folder, cli.clientFactory.apply(cli.config), cli.config,
                                                     cli.console, false);
                var applied = MigrationRunner.standard().run(ticketFolder, false);
                cli.console.actionOutput(ticketFolder.key() + " is at version " + ticketFolder.version()
                                         + " (" + applied + " migration(s) applied)");
            });
        }
    }

    @CommandLine.Command(name = "config", description = "Save a user setting, e.g. jira.server.")
    static final class ConfigCommand implements Callable<Integer> {
        @CommandLine.ParentCommand
        @Nullable
        TicketSyncCli parent;

        @CommandLine.Parameters(index = "0", paramLabel = "KEY")
        String key = "";

        @CommandLine.Parameters(index = "1", paramLabel = "VALUE")
        String value = "";

        @Override
        public Integer call() {
            var cli = parent;
            if (cli == null) {
                throw new IllegalStateException("Subcommand used without its parent command");
            }
            try {
                cli.config.set(key, value);
                cli.console.actionOutput("Saved " + key + " to " + cli.config.propertiesFile());
                return 0;
            } catch (IllegalArgumentException | IOException e) {
                cli.console.toolError("Error: " + e.getMessage());
                return 1;
            }
        }
    }
}
