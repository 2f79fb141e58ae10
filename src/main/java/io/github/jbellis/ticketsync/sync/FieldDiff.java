package io.github.jbellis.ticketsync.sync;

import org.jetbrains.annotations.Nullable;

/**
 * A field whose on-disk value differs from the value at the last sync point.
 *
 * @param original value at the merge base of the local and tracking branches
 * @param local    value on disk, or null when the field is no longer present
 */
public record FieldDiff(String original, @Nullable String local) {
}
