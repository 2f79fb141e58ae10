package io.github.jbellis.ticketsync;

/**
 * A directory cannot be used as a ticket folder.
 */
public class TicketFolderException extends RuntimeException {
    public TicketFolderException(String message) {
        super(message);
    }

    public TicketFolderException(String message, Throwable cause) {
        super(message, cause);
    }
}
