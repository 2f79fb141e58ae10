package io.github.jbellis.ticketsync.git;

import io.github.jbellis.ticketsync.TicketLayout;
import io.github.jbellis.ticketsync.util.AtomicWrites;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.eclipse.jgit.api.Git;
import org.eclipse.jgit.api.errors.GitAPIException;
import org.eclipse.jgit.lib.Constants;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Locates, creates and opens the two histories of a ticket folder: the primary one, whose work tree is the
 * folder itself and whose git directory is tucked inside the metadata directory, and the shadow checkout.
 */
public final class TicketHistory {
    private static final Logger logger = LogManager.getLogger(TicketHistory.class);

    private TicketHistory() {
    }

    public static Path gitDir(Path folder) {
        return folder.resolve(TicketLayout.METADATA_DIR).resolve(TicketLayout.GIT_DIR);
    }

    public static Path shadowDir(Path folder) {
        return folder.resolve(TicketLayout.METADATA_DIR).resolve(TicketLayout.SHADOW_DIR);
    }

    /**
     * Creates the primary history for {@code folder}, excludes the metadata directory from it,
     * and records an empty "Initialized" commit on the local branch.
     */
    public static void initPrimary(Path folder) throws GitAPIException, IOException {
        var gitDir = gitDir(folder);
        logger.debug("Initializing ticket history at {}", gitDir);
        try (var git = Git.init()
                .setGitDir(gitDir.toFile())
                .setDirectory(folder.toFile())
                .setInitialBranch(TicketLayout.LOCAL_BRANCH)
                .call()) {
            AtomicWrites.atomicOverwrite(gitDir.resolve("info").resolve("exclude"),
                                         "/" + TicketLayout.METADATA_DIR + "/\n");
            git.commit()
                    .setMessage("Initialized")
                    .setAllowEmpty(true)
                    .setSign(false)
                    .call();
        }
    }

    public static GitCheckout openPrimary(Path folder) throws IOException {
        return GitCheckout.open(gitDir(folder), folder);
    }

    /**
     * Clones the primary history into the shadow directory and switches the clone to the tracking branch.
     * The clone's {@code origin} is the primary history, so objects travel between the two by fetch and push.
     * A shadow left behind by an earlier, interrupted attempt is reused and switched to the tracking branch.
     */
    public static ShadowRepository cloneShadow(Path folder) throws GitAPIException, IOException {
        var shadowDir = shadowDir(folder);
        if (Files.exists(shadowDir.resolve(Constants.DOT_GIT))) {
            logger.debug("Shadow checkout {} already exists; reusing it", shadowDir);
            return resumeShadow(shadowDir);
        }
        logger.debug("Cloning {} into shadow checkout {}", gitDir(folder), shadowDir);
        var git = Git.cloneRepository()
                .setURI(gitDir(folder).toAbsolutePath().toUri().toString())
                .setDirectory(shadowDir.toFile())
                .setBranch(TicketLayout.LOCAL_BRANCH)
                .call();
        var checkout = new GitCheckout(git.getRepository());
        try {
            git.checkout()
                    .setCreateBranch(true)
                    .setName(TicketLayout.TRACKING_BRANCH)
                    .call();
        } catch (GitAPIException e) {
            checkout.close();
            throw e;
        }
        return new ShadowRepository(checkout);
    }

    private static ShadowRepository resumeShadow(Path shadowDir) throws GitAPIException, IOException {
        var checkout = GitCheckout.open(shadowDir.resolve(Constants.DOT_GIT), shadowDir);
        try {
            var repository = checkout.getRepository();
            if (!TicketLayout.TRACKING_BRANCH.equals(repository.getBranch())) {
                var hasBranch = repository.findRef(Constants.R_HEADS + TicketLayout.TRACKING_BRANCH) != null;
                Git.wrap(repository).checkout()
                        .setCreateBranch(!hasBranch)
                        .setName(TicketLayout.TRACKING_BRANCH)
                        .call();
            }
        } catch (GitAPIException | IOException e) {
            checkout.close();
            throw e;
        }
        return new ShadowRepository(checkout);
    }

    public static ShadowRepository openShadow(Path folder) throws IOException {
        var shadowDir = shadowDir(folder);
        return new ShadowRepository(GitCheckout.open(shadowDir.resolve(Constants.DOT_GIT), shadowDir));
    }
}
