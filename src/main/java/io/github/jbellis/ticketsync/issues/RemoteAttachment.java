package io.github.jbellis.ticketsync.issues;

import org.jetbrains.annotations.Nullable;

/**
 * An attachment as reported by the tracker. {@code created} doubles as the change token:
 * re-uploading a file under the same name produces a new attachment with a new timestamp.
 */
public record RemoteAttachment(
        String id,
        String filename,
        String created,
        @Nullable String contentUrl) {}
