package io.github.jbellis.ticketsync;

import io.github.jbellis.ticketsync.testutil.TestConsole;
import org.apache.logging.log4j.Level;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class OperationLogTest {
    @TempDir
    Path tempDir;

    @Test
    void testAppendsTabSeparatedLines() throws Exception {
        var log = new OperationLog("PROJ-1", tempDir.resolve("operation.log"), new TestConsole(), Level.INFO);

        log.info("first");
        log.warn("two\nlines");

        var lines = log.lines();
        assertEquals(2, lines.size());
        var fields = lines.get(0).split("\t");
        assertEquals(3, fields.length);
        assertTrue(fields[0].matches("\\d{4}-\\d{2}-\\d{2}T.*Z"), fields[0]);
        assertEquals("INFO", fields[1]);
        assertEquals("first", fields[2]);
        assertTrue(lines.get(1).endsWith("\tWARN\ttwo\\nlines"), lines.get(1));
    }

    @Test
    void testEchoesAtOrAboveThreshold() {
        var console = new TestConsole();
        var log = new OperationLog("PROJ-1", tempDir.resolve("operation.log"), console, Level.INFO);

        log.debug("hidden");
        log.info("shown");
        log.error("broken");

        assertEquals("[INFO PROJ-1] shown\n", console.getOutputLog());
        assertEquals("[ERROR PROJ-1] broken\n", console.getErrorLog());
    }

    @Test
    void testFailedAppendIsReportedOnConsole() throws Exception {
        var console = new TestConsole();
        var unwritable = Files.createDirectories(tempDir.resolve("operation.log"));
        var log = new OperationLog("PROJ-1", unwritable, console, Level.OFF);

        log.debug("lost");

        assertTrue(console.getErrorLog().contains("Unable to append to " + unwritable), console.getErrorLog());
        assertEquals("", console.getOutputLog());
    }

    @Test
    void testLinesOfMissingLogIsEmpty() throws Exception {
        var log = new OperationLog("PROJ-1", tempDir.resolve("absent.log"), new TestConsole(), Level.WARN);
        assertTrue(log.lines().isEmpty());
    }
}
