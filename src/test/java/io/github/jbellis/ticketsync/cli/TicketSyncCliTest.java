package io.github.jbellis.ticketsync.cli;

import io.github.jbellis.ticketsync.TicketFolder;
import io.github.jbellis.ticketsync.TicketSyncConfig;
import io.github.jbellis.ticketsync.sync.FieldDiff;
import io.github.jbellis.ticketsync.sync.SyncStatus;
import io.github.jbellis.ticketsync.testutil.FakeIssueTrackerClient;
import io.github.jbellis.ticketsync.testutil.TestConsole;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class TicketSyncCliTest {
    @TempDir
    Path tempDir;

    private TicketSyncConfig config;
    private FakeIssueTrackerClient client;
    private TestConsole console;
    private CommandLine commandLine;

    @BeforeEach
    void setUp() throws Exception {
        config = new TicketSyncConfig(Files.createDirectories(tempDir.resolve("home")), Map.of());
        client = new FakeIssueTrackerClient("PROJ-3").setField("summary", "From the CLI");
        console = new TestConsole();
        commandLine = new CommandLine(new TicketSyncCli(config, cfg -> client, console));
    }

    @Test
    void testConfigSavesSetting() {
        assertEquals(0, commandLine.execute("config", TicketSyncConfig.JIRA_SERVER, "https://jira.example.com"));

        assertEquals("https://jira.example.com",
                     new TicketSyncConfig(config.userHome(), Map.of()).jiraServer());
    }

    @Test
    void testConfigRejectsUnknownKey() {
        assertEquals(1, commandLine.execute("config", "nope", "x"));
        assertTrue(console.getErrorLog().contains("Unknown setting"), console.getErrorLog());
    }

    @Test
    void testStatusOutsideTicketFolderFails() throws Exception {
        var plain = Files.createDirectories(tempDir.resolve("PROJ-3"));

        assertEquals(1, commandLine.execute("status", "--folder", plain.toString()));
        assertTrue(console.getErrorLog().contains("not a ticket folder"), console.getErrorLog());
    }

    @Test
    void testCloneThenStatus() {
        var target = tempDir.resolve("PROJ-3");

        assertEquals(0, commandLine.execute("clone", "PROJ-3", target.toString()));
        assertTrue(Files.exists(target.resolve("fields.ticket.txt")));

        assertEquals(0, commandLine.execute("status", "--folder", target.toString()));
        assertTrue(console.getOutputLog().contains("No local changes."), console.getOutputLog());
    }

    @Test
    void testLogPrintsOperationLog() throws Exception {
        var folder = TicketFolder.initialize(Files.createDirectories(tempDir.resolve("PROJ-3")), client, config, console);
        folder.log().debug("something happened");

        assertEquals(0, commandLine.execute("log", "--folder", folder.path().toString()));
        assertTrue(console.getOutputLog().contains("something happened"));
    }

    @Test
    void testStatusFormatting() {
        var status = new SyncStatus(List.of("notes.txt"),
                                    Map.of("summary", new FieldDiff("Old", "New")),
                                    "looks good");

        assertEquals("""
                     Ready for upload:
                         notes.txt
                     Changed fields:
                         summary: "Old" -> "New"
                     New comment:
                         looks good""",
                     TicketSyncCli.StatusCommand.format(status));
    }
}
