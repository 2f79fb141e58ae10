package io.github.jbellis.ticketsync;

import java.nio.file.Path;

public class NotTicketFolderException extends TicketFolderException {
    public NotTicketFolderException(Path path) {
        super(path + " is not a ticket folder (no " + TicketLayout.METADATA_DIR + " directory)");
    }
}
