package io.github.jbellis.ticketsync.migration;

import io.github.jbellis.ticketsync.TicketFolder;
import io.github.jbellis.ticketsync.TicketLayout;
import io.github.jbellis.ticketsync.git.TicketHistory;
import org.eclipse.jgit.api.errors.GitAPIException;

import java.io.IOException;

/**
 * Clones the primary history into the shadow checkout and publishes its tracking branch.
 */
public class CreateShadowRepository implements Migration {
    @Override
    public int targetVersion() {
        return 2;
    }

    @Override
    public String description() {
        return "create shadow checkout";
    }

    @Override
    public void apply(TicketFolder folder) throws IOException, GitAPIException {
        try (var shadow = TicketHistory.cloneShadow(folder.path())) {
            shadow.pushTo(TicketLayout.TRACKING_BRANCH);
        }
        folder.setVersion(targetVersion());
    }
}
