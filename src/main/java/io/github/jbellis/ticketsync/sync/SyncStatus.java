package io.github.jbellis.ticketsync.sync;

import com.google.common.collect.ImmutableSortedMap;

import java.util.List;
import java.util.Map;

/**
 * What a push would send.
 *
 * @param toUpload     files to upload as attachments, relative to the folder, sorted
 * @param localDiffers fields edited since the last sync, by field name
 * @param newComment   the pending comment, stripped; empty when there is none
 */
public record SyncStatus(List<String> toUpload, Map<String, FieldDiff> localDiffers, String newComment) {
    public SyncStatus {
        toUpload = List.copyOf(toUpload);
        localDiffers = ImmutableSortedMap.copyOf(localDiffers);
    }

    public boolean isClean() {
        return toUpload.isEmpty() && localDiffers.isEmpty() && newComment.isEmpty();
    }
}
