package io.github.jbellis.ticketsync.codec;

import io.github.jbellis.ticketsync.issues.IssueSnapshot;

import java.io.IOException;
import java.util.List;
import java.util.Map;

/**
 * Converts an issue into a deterministic set of plain-text files and reads the editable fields back.
 */
public interface FieldCodec {
    /**
     * @return file name relative to the ticket folder, mapped to its content
     */
    Map<String, byte[]> render(IssueSnapshot issue);

    /**
     * Reads every locally editable field from {@code source}. Missing files contribute no fields.
     */
    Map<String, String> parse(FileSource source) throws IOException;

    /**
     * Names of the files {@link #render} owns; these are never uploaded as attachments.
     */
    List<String> renderedFileNames();
}
