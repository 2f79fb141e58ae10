package io.github.jbellis.ticketsync.sync;

import io.github.jbellis.ticketsync.OperationLog;
import io.github.jbellis.ticketsync.issues.IssueSnapshot;
import io.github.jbellis.ticketsync.issues.IssueTrackerClient;
import org.jetbrains.annotations.Nullable;

import java.io.IOException;

/**
 * Hands out the folder's issue either live from the tracker or from the on-disk cache.
 * The live issue is fetched at most once per accessor unless {@link #refresh()} is called.
 */
public class IssueAccessor {
    private final String key;
    private final IssueTrackerClient client;
    private final IssueSnapshotStore store;
    private final OperationLog log;
    @Nullable
    private IssueSnapshot current;
    @Nullable
    private IssueSnapshot cached;

    public IssueAccessor(String key, IssueTrackerClient client, IssueSnapshotStore store, OperationLog log) {
        this.key = key;
        this.client = client;
        this.store = store;
        this.log = log;
    }

    public IssueSnapshot current() throws IOException {
        if (current == null) {
            return refresh();
        }
        return current;
    }

    public IssueSnapshot refresh() throws IOException {
        log.debug("Fetching " + key + " from " + client.connectionOptions().server());
        current = client.issue(key);
        return current;
    }

    /**
     * The snapshot stored by the last fetch, read from disk once per accessor. Falls back to the live issue
     * when there is none.
     */
    public IssueSnapshot cached() throws IOException {
        if (cached == null) {
            var stored = store.read();
            if (stored.isPresent()) {
                cached = stored.get();
            } else {
                log.error("No readable cached issue at " + store.file() + "; fetching " + key + " instead");
                cached = current();
            }
        }
        return cached;
    }

    public void store(IssueSnapshot issue) throws IOException {
        store.write(issue, client.connectionOptions());
        cached = issue;
    }
}
