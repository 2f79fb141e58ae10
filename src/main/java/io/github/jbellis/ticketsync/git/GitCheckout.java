package io.github.jbellis.ticketsync.git;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.eclipse.jgit.api.Git;
import org.eclipse.jgit.api.MergeResult;
import org.eclipse.jgit.api.errors.EmptyCommitException;
import org.eclipse.jgit.api.errors.GitAPIException;
import org.eclipse.jgit.api.errors.JGitInternalException;
import org.eclipse.jgit.lib.ObjectId;
import org.eclipse.jgit.lib.Repository;
import org.eclipse.jgit.revwalk.RevWalk;
import org.eclipse.jgit.revwalk.filter.RevFilter;
import org.eclipse.jgit.storage.file.FileRepositoryBuilder;
import org.eclipse.jgit.transport.PushResult;
import org.eclipse.jgit.transport.RefSpec;
import org.eclipse.jgit.transport.RemoteRefUpdate;
import org.eclipse.jgit.treewalk.TreeWalk;
import org.jetbrains.annotations.Nullable;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * JGit implementation of {@link TicketCheckout}. The git directory need not live inside the work tree.
 */
public class GitCheckout implements TicketCheckout {
    private static final Logger logger = LogManager.getLogger(GitCheckout.class);

    public static final String REMOTE = "origin";
    private static final String LATEST_STASH = "stash@{0}";

    private final Path workTree;
    private final Repository repository;
    private final Git git;

    public GitCheckout(Repository repository) {
        this.repository = repository;
        this.git = new Git(repository);
        this.workTree = repository.getWorkTree().toPath();
    }

    /**
     * Opens an existing repository whose history lives in {@code gitDir} and whose files live in {@code workTree}.
     */
    public static GitCheckout open(Path gitDir, Path workTree) throws IOException {
        var repository = new FileRepositoryBuilder()
                .setGitDir(gitDir.toFile())
                .setWorkTree(workTree.toFile())
                .setMustExist(true)
                .build();
        return new GitCheckout(repository);
    }

    @Override
    public Path workTree() {
        return workTree;
    }

    public Repository getRepository() {
        return repository;
    }

    @Override
    public void stageAll() throws GitAPIException {
        git.add().addFilepattern(".").call();
        // a second pass with setUpdate stages removals of tracked files
        git.add().addFilepattern(".").setUpdate(true).call();
    }

    @Override
    public Optional<String> commit(String message) throws GitAPIException {
        try {
            var commit = git.commit()
                    .setMessage(message)
                    .setAllowEmpty(false)
                    .setSign(false)
                    .call();
            logger.debug("Committed {} in {}: {}", commit.getName(), workTree, message);
            return Optional.of(commit.getName());
        } catch (EmptyCommitException e) {
            logger.debug("Nothing to commit in {}", workTree);
            return Optional.empty();
        }
    }

    @Override
    public List<String> merge(String ref) throws GitAPIException {
        var result = git.merge()
                .include(ref, resolveRequired(ref))
                .setMessage("Merge " + ref)
                .call();
        var status = result.getMergeStatus();
        logger.debug("Merge of {} into {}: {}", ref, workTree, status);
        if (status == MergeResult.MergeStatus.CONFLICTING) {
            var conflicts = result.getConflicts();
            return conflicts == null ? List.of() : ImmutableList.sortedCopyOf(conflicts.keySet());
        }
        if (!status.isSuccessful()) {
            var failing = result.getFailingPaths();
            throw new GitCheckoutException("Merge of " + ref + " failed with status " + status
                                           + (failing == null ? "" : ": " + failing.keySet()));
        }
        return List.of();
    }

    @Override
    public void push(String localBranch, String remoteBranch) throws GitAPIException {
        var refSpec = new RefSpec("refs/heads/" + localBranch + ":refs/heads/" + remoteBranch);
        Iterable<PushResult> results = git.push().setRemote(REMOTE).setRefSpecs(refSpec).call();
        var rejectionMessages = new StringBuilder();

        for (var result : results) {
            for (var rru : result.getRemoteUpdates()) {
                var status = rru.getStatus();
                if (status != RemoteRefUpdate.Status.OK && status != RemoteRefUpdate.Status.UP_TO_DATE) {
                    if (rejectionMessages.length() > 0) {
                        rejectionMessages.append("\n");
                    }
                    rejectionMessages.append("Ref '").append(rru.getRemoteName()).append("' update failed: ")
                            .append(status);
                    if (rru.getMessage() != null) {
                        rejectionMessages.append(" (").append(rru.getMessage()).append(")");
                    }
                }
            }
        }

        if (rejectionMessages.length() > 0) {
            throw new GitCheckoutException("Push rejected:\n" + rejectionMessages);
        }
        logger.debug("Pushed {} to {}/{}", localBranch, REMOTE, remoteBranch);
    }

    @Override
    public void fetch() throws GitAPIException {
        git.fetch().setRemote(REMOTE).call();
    }

    @Override
    public Optional<String> readFile(String rev, String path) throws GitAPIException {
        var commitId = resolve(rev);
        if (commitId == null) {
            logger.debug("Could not resolve {}; no content for {}", rev, path);
            return Optional.empty();
        }
        try (var revWalk = new RevWalk(repository)) {
            var commit = revWalk.parseCommit(commitId);
            try (var treeWalk = TreeWalk.forPath(repository, path, commit.getTree())) {
                if (treeWalk == null) {
                    return Optional.empty();
                }
                var loader = repository.open(treeWalk.getObjectId(0));
                return Optional.of(new String(loader.getBytes(), StandardCharsets.UTF_8));
            }
        } catch (IOException e) {
            throw new GitCheckoutException("Unable to read " + path + " at " + rev, e);
        }
    }

    @Override
    public Set<String> untrackedFiles() throws GitAPIException {
        return ImmutableSet.copyOf(git.status().call().getUntracked());
    }

    @Override
    public Set<String> modifiedFiles() throws GitAPIException {
        return ImmutableSet.copyOf(git.status().call().getModified());
    }

    @Override
    public boolean stash(String message) throws GitAPIException {
        var stashId = git.stashCreate()
                .setWorkingDirectoryMessage(message)
                .setIncludeUntracked(true)
                .call();
        logger.debug("Stash created with ID: {}", (stashId != null ? stashId.getName() : "none"));
        return stashId != null;
    }

    @Override
    public boolean popStash() {
        try {
            git.stashApply()
                    .setStashRef(LATEST_STASH)
                    .setRestoreIndex(false)
                    .setRestoreUntracked(true)
                    .ignoreRepositoryState(true)
                    .call();
            git.stashDrop().setStashRef(0).call();
            logger.debug("Stash pop completed in {}", workTree);
            return true;
        } catch (GitAPIException | JGitInternalException e) {
            logger.warn("Could not restore stashed changes in {}; they remain in {}", workTree, LATEST_STASH, e);
            return false;
        }
    }

    @Override
    public Optional<String> mergeBase(String first, String second) throws GitAPIException {
        var firstId = resolve(first);
        var secondId = resolve(second);
        if (firstId == null || secondId == null) {
            logger.warn("Could not resolve heads for {} or {}", first, second);
            return Optional.empty();
        }
        try (var revWalk = new RevWalk(repository)) {
            revWalk.setRevFilter(RevFilter.MERGE_BASE);
            revWalk.markStart(revWalk.parseCommit(firstId));
            revWalk.markStart(revWalk.parseCommit(secondId));
            var mergeBase = revWalk.next();
            return mergeBase == null ? Optional.empty() : Optional.of(mergeBase.getName());
        } catch (IOException e) {
            throw new GitCheckoutException("Unable to compute merge base of " + first + " and " + second, e);
        }
    }

    @Nullable
    public ObjectId resolve(String revstr) throws GitAPIException {
        try {
            return repository.resolve(revstr);
        } catch (IOException e) {
            throw new GitCheckoutException("Unable to resolve " + revstr, e);
        }
    }

    private ObjectId resolveRequired(String revstr) throws GitAPIException {
        var id = resolve(revstr);
        if (id == null) {
            throw new GitCheckoutException("Unknown revision " + revstr + " in " + workTree);
        }
        return id;
    }

    @Override
    public void close() {
        git.close();
        repository.close();
    }
}
