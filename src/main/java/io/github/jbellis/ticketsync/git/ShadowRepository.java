package io.github.jbellis.ticketsync.git;

import io.github.jbellis.ticketsync.TicketLayout;
import io.github.jbellis.ticketsync.util.AtomicWrites;
import org.eclipse.jgit.api.errors.GitAPIException;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;

/**
 * The checkout that holds the last-known rendering of the remote ticket. It works on the tracking branch
 * and its {@code origin} is the folder's primary history.
 */
public class ShadowRepository implements AutoCloseable {
    private final TicketCheckout checkout;

    public ShadowRepository(TicketCheckout checkout) {
        this.checkout = checkout;
    }

    public Path root() {
        return checkout.workTree();
    }

    /**
     * Overwrites each named file (relative to the shadow root) with the given bytes.
     */
    public void write(Map<String, byte[]> files) throws IOException {
        for (var entry : files.entrySet()) {
            AtomicWrites.atomicOverwrite(root().resolve(entry.getKey()), entry.getValue());
        }
    }

    /**
     * Stages everything, deletions included, and commits.
     *
     * @return the commit id, or empty when nothing changed
     */
    public Optional<String> commit(String message) throws GitAPIException {
        checkout.stageAll();
        return checkout.commit(message);
    }

    /**
     * Pushes the shadow's tracking branch into {@code branch} of the primary history.
     */
    public void pushTo(String branch) throws GitAPIException {
        checkout.push(TicketLayout.TRACKING_BRANCH, branch);
    }

    /**
     * Fetches the primary history so the shadow's remote-tracking refs are current.
     */
    public void fetch() throws GitAPIException {
        checkout.fetch();
    }

    @Override
    public void close() {
        checkout.close();
    }
}
