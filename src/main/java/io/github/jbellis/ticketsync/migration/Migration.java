package io.github.jbellis.ticketsync.migration;

import io.github.jbellis.ticketsync.TicketFolder;
import org.eclipse.jgit.api.errors.GitAPIException;

import java.io.IOException;

/**
 * One step of the folder layout. Applying it to a folder at {@code targetVersion() - 1} leaves the folder at
 * {@code targetVersion()}; writing that version is the last thing {@link #apply} does.
 */
public interface Migration {
    int targetVersion();

    String description();

    void apply(TicketFolder folder) throws IOException, GitAPIException;
}
