package io.github.jbellis.ticketsync.sync;

import com.google.common.collect.ImmutableList;
import io.github.jbellis.ticketsync.TicketFolder;
import io.github.jbellis.ticketsync.TicketLayout;
import io.github.jbellis.ticketsync.codec.FileSource;
import io.github.jbellis.ticketsync.git.TicketCheckout;
import io.github.jbellis.ticketsync.git.TicketHistory;
import io.github.jbellis.ticketsync.issues.IssueSnapshot;
import io.github.jbellis.ticketsync.util.AtomicWrites;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.eclipse.jgit.api.errors.GitAPIException;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Moves changes between a ticket folder, its shadow checkout and the remote ticket.
 * <p>
 * {@link #fetch()} renders the remote ticket into the shadow and publishes it on the tracking branch.
 * {@link #merge()} merges the tracking branch into the folder. {@link #push()} sends local edits to the
 * tracker, commits them locally and records uploaded files in the shadow; edited fields reach the tracking
 * branch with the next fetch.
 * <p>
 * Not thread-safe. Nothing is rolled back when a step fails; re-running the operation is the recovery.
 */
public class SyncEngine {
    private static final Logger logger = LogManager.getLogger(SyncEngine.class);

    private final TicketFolder folder;

    public SyncEngine(TicketFolder folder) {
        this.folder = folder;
    }

    public SyncStatus status() throws IOException, GitAPIException {
        try (var primary = TicketHistory.openPrimary(folder.path())) {
            return new SyncStatus(locallyChanged(primary), localDifferingFields(primary), readNewComment());
        }
    }

    /**
     * Re-fetches the ticket, downloads changed attachments and commits the fresh rendering to the tracking branch.
     */
    public void fetch() throws IOException, GitAPIException {
        var issue = folder.issues().refresh();
        var remoteIgnores = folder.remoteIgnores();

        try (var shadow = TicketHistory.openShadow(folder.path())) {
            var metadataStore = new RemoteFileMetadataStore(shadow.root());
            var fileMeta = metadataStore.read();

            for (var attachment : issue.attachments()) {
                var filename = attachment.filename();
                if (remoteIgnores.matches(filename)) {
                    logger.debug("Skipping remotely ignored attachment {}", filename);
                    continue;
                }
                if (attachment.created().equals(fileMeta.get(filename))) {
                    continue;
                }
                var target = shadow.root().resolve(filename).normalize();
                if (!target.startsWith(shadow.root()) || filename.startsWith(".")) {
                    folder.log().warn("Refusing to download attachment with unsafe name \"" + filename + "\"");
                    continue;
                }
                folder.log().info("Download file \"" + filename + "\"");
                AtomicWrites.atomicOverwrite(target, folder.client().download(attachment));
                fileMeta.put(filename, attachment.created());
            }
            metadataStore.write(fileMeta);

            shadow.write(folder.codec().render(issue));
            folder.issues().store(issue);

            shadow.commit("Pulled remote changes");
            shadow.pushTo(TicketLayout.TRACKING_BRANCH);
        }
    }

    /**
     * Merges the tracking branch into the folder, setting aside uncommitted work while it runs.
     */
    public void merge() throws IOException, GitAPIException {
        try (var primary = TicketHistory.openPrimary(folder.path())) {
            var stashed = stash(primary);
            var conflicts = primary.merge(TicketLayout.TRACKING_BRANCH);
            if (!conflicts.isEmpty()) {
                folder.log().warn("Merge of remote changes left conflicts in " + conflicts
                                  + "; resolve them before pushing");
            }
            if (stashed && !primary.popStash()) {
                folder.log().warn("Could not restore uncommitted changes after merging; they remain stashed");
            }
        }
    }

    public void pull() throws IOException, GitAPIException {
        fetch();
        merge();
    }

    /**
     * Uploads new and changed files, posts the pending comment and sends edited fields, then commits the
     * result on both sides.
     */
    public void push() throws IOException, GitAPIException {
        var status = status();
        var key = folder.key();
        var client = folder.client();

        try (var shadow = TicketHistory.openShadow(folder.path())) {
            var metadataStore = new RemoteFileMetadataStore(shadow.root());
            var fileMeta = metadataStore.read();
            var uploadedContent = new LinkedHashMap<String, byte[]>();

            if (!status.toUpload().isEmpty()) {
                IssueSnapshot issue = folder.issues().current();
                for (var filename : status.toUpload()) {
                    folder.log().info("Uploading file \"" + filename + "\"");
                    for (var existing : issue.attachments()) {
                        if (existing.filename().equals(filename)) {
                            client.deleteAttachment(existing);
                        }
                    }
                    var content = Files.readAllBytes(folder.path().resolve(filename));
                    var uploaded = client.addAttachment(key, filename, content);
                    fileMeta.put(filename, uploaded.created());
                    uploadedContent.put(filename, content);
                }
            }

            var comment = status.newComment();
            if (!comment.isEmpty()) {
                folder.log().info("Adding comment \"" + comment + "\"");
                client.addComment(key, comment);
            }
            clearNewComment();

            var updates = new LinkedHashMap<String, String>();
            status.localDiffers().forEach((field, diff) -> {
                if (diff.local() == null) {
                    folder.log().warn("Field " + field + " is missing locally; leaving the remote value alone");
                } else {
                    updates.put(field, diff.local());
                }
            });
            if (!updates.isEmpty()) {
                folder.log().info("Updating fields " + updates);
                client.update(key, updates);
            }

            try (var primary = TicketHistory.openPrimary(folder.path())) {
                primary.stageAll();
                primary.commit("Pushed local changes");
            }

            // the tracking branch holds only tracker content; uploaded files now are tracker content
            shadow.fetch();
            shadow.write(uploadedContent);
            metadataStore.write(fileMeta);
            shadow.commit("Recorded pushed changes");
            shadow.pushTo(TicketLayout.TRACKING_BRANCH);
        }
    }

    public void sync() throws IOException, GitAPIException {
        pull();
        push();
    }

    private boolean stash(TicketCheckout primary) {
        try {
            return primary.stash("ticketsync: changes set aside during merge");
        } catch (GitAPIException e) {
            logger.warn("Unable to stash changes in {}; merging without stashing", folder, e);
            return false;
        }
    }

    /**
     * New and modified files eligible for upload: not ignored, regular, and not hidden.
     */
    private ImmutableList<String> locallyChanged(TicketCheckout primary) throws IOException, GitAPIException {
        var ignores = folder.localIgnores();
        var candidates = new TreeSet<String>();
        candidates.addAll(primary.untrackedFiles());
        candidates.addAll(primary.modifiedFiles());

        var assets = new ArrayList<String>();
        for (var filename : candidates) {
            if (ignores.matches(filename)) {
                continue;
            }
            if (!Files.isRegularFile(folder.path().resolve(filename))) {
                continue;
            }
            if (isHidden(filename)) {
                continue;
            }
            assets.add(filename);
        }
        return ImmutableList.copyOf(assets);
    }

    /**
     * Fields whose on-disk value differs from the merge base of the local and tracking branches. Fields absent
     * at the merge base are never reported.
     */
    private Map<String, FieldDiff> localDifferingFields(TicketCheckout primary) throws IOException, GitAPIException {
        var base = primary.mergeBase(TicketLayout.LOCAL_BRANCH, TicketLayout.TRACKING_BRANCH);
        if (base.isEmpty()) {
            return Map.of();
        }
        var baseRevision = base.get();
        FileSource atBase = path -> {
            try {
                return primary.readFile(baseRevision, path);
            } catch (GitAPIException e) {
                throw new IOException("Unable to read " + path + " at " + baseRevision, e);
            }
        };

        var original = folder.codec().parse(atBase);
        var local = folder.codec().parse(FileSource.directory(folder.path()));

        var differing = new TreeMap<String, FieldDiff>();
        original.forEach((field, value) -> {
            var localValue = local.get(field);
            if (!value.equals(localValue)) {
                differing.put(field, new FieldDiff(value, localValue));
            }
        });
        return differing;
    }

    private String readNewComment() throws IOException {
        var file = folder.newCommentFile();
        if (!Files.exists(file)) {
            return "";
        }
        return Files.readString(file, StandardCharsets.UTF_8).strip();
    }

    private void clearNewComment() throws IOException {
        var file = folder.newCommentFile();
        if (Files.exists(file) && Files.size(file) > 0) {
            Files.writeString(file, "", StandardCharsets.UTF_8);
        }
    }

    static boolean isHidden(String relativePath) {
        for (var segment : relativePath.split("/")) {
            if (segment.startsWith(".")) {
                return true;
            }
        }
        return false;
    }
}
