package io.github.jbellis.ticketsync;

import java.util.List;
import java.util.Set;

/**
 * File and directory names that make up a ticket folder.
 */
public final class TicketLayout {
    private TicketLayout() {
    }

    public static final String METADATA_DIR = ".ticketsync";
    public static final String GIT_DIR = "git";
    public static final String SHADOW_DIR = "shadow";
    public static final String VERSION_FILE = "version";
    public static final String OPERATION_LOG = "operation.log";
    public static final String CACHED_ISSUE = "issue.json";
    public static final String REMOTE_FILES = "remote_files.json";

    public static final String TICKET_DETAILS = "fields.ticket.txt";
    public static final String TICKET_COMMENTS = "comments.read_only.ticket.txt";
    public static final String TICKET_NEW_COMMENT = "new_comment.ticket.txt";
    public static final String TICKET_FILE_FIELD_TEMPLATE = "%s.ticket.txt";

    public static final String IGNORE_FILE = ".ticketsync_ignore";
    public static final String REMOTE_IGNORE_FILE = ".ticketsync_remote_ignore";

    /** Fields rendered into their own file instead of the details file. */
    public static final List<String> FILE_FIELDS = List.of("description");

    /** Fields never rendered into the details file. */
    public static final Set<String> NO_DETAIL_FIELDS = Set.of("comment", "attachment", "watches", "worklog");

    /** Branch of the primary history that holds the user's edits. */
    public static final String LOCAL_BRANCH = "master";

    /** Branch the shadow checkout works on and pushes into the primary history. */
    public static final String TRACKING_BRANCH = "jira";

    public static String fileFieldName(String field) {
        return TICKET_FILE_FIELD_TEMPLATE.formatted(field);
    }
}
