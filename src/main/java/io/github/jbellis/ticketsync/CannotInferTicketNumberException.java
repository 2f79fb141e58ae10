package io.github.jbellis.ticketsync;

import java.nio.file.Path;

/**
 * The folder's name does not look like a ticket key such as {@code PROJ-123}.
 */
public class CannotInferTicketNumberException extends TicketFolderException {
    public CannotInferTicketNumberException(Path path) {
        super("Cannot infer a ticket key from the folder name '" + path.getFileName() + "'");
    }
}
