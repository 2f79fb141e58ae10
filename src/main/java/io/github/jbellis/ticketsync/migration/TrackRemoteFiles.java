package io.github.jbellis.ticketsync.migration;

import io.github.jbellis.ticketsync.TicketFolder;
import io.github.jbellis.ticketsync.TicketLayout;
import io.github.jbellis.ticketsync.git.TicketHistory;
import io.github.jbellis.ticketsync.sync.RemoteFileMetadataStore;
import org.eclipse.jgit.api.errors.GitAPIException;

import java.io.IOException;

/**
 * Starts recording remote attachment tokens in the shadow checkout.
 */
public class TrackRemoteFiles implements Migration {
    @Override
    public int targetVersion() {
        return 3;
    }

    @Override
    public String description() {
        return "track remote attachment metadata";
    }

    @Override
    public void apply(TicketFolder folder) throws IOException, GitAPIException {
        try (var shadow = TicketHistory.openShadow(folder.path())) {
            // keeps tokens recorded by an earlier attempt
            var store = new RemoteFileMetadataStore(shadow.root());
            store.write(store.read());
            shadow.commit("Start tracking remote file metadata");
            shadow.pushTo(TicketLayout.TRACKING_BRANCH);
        }
        folder.setVersion(targetVersion());
    }
}
