package io.github.jbellis.ticketsync.issues;

import java.io.IOException;
import java.util.Map;

/**
 * The remote side of a ticket folder. Every call is a single blocking request; callers own any retry policy.
 */
public interface IssueTrackerClient {
    IssueSnapshot issue(String key) throws IOException;

    byte[] download(RemoteAttachment attachment) throws IOException;

    RemoteAttachment addAttachment(String key, String filename, byte[] content) throws IOException;

    void deleteAttachment(RemoteAttachment attachment) throws IOException;

    /**
     * Applies all field values in a single update request.
     */
    void update(String key, Map<String, String> fields) throws IOException;

    void addComment(String key, String body) throws IOException;

    ConnectionOptions connectionOptions();
}
