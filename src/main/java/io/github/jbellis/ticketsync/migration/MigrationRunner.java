package io.github.jbellis.ticketsync.migration;

import com.google.common.collect.ImmutableList;
import io.github.jbellis.ticketsync.TicketFolder;
import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.eclipse.jgit.api.errors.GitAPIException;

import java.io.IOException;
import java.util.List;

/**
 * Brings a ticket folder's on-disk layout up to {@link #CURRENT_VERSION}, one version at a time.
 * A failing migration propagates and leaves the folder at the last version that completed.
 */
public class MigrationRunner {
    private static final Logger logger = LogManager.getLogger(MigrationRunner.class);

    public static final int CURRENT_VERSION = 3;

    private static final MigrationRunner STANDARD = new MigrationRunner(
            List.of(new CreateShadowRepository(), new TrackRemoteFiles()), CURRENT_VERSION);

    private final List<Migration> migrations;
    private final int currentVersion;

    /**
     * @param migrations one migration per version from 2 to {@code currentVersion}, in order
     * @throws IllegalStateException when a version is missing, duplicated or out of order
     */
    public MigrationRunner(List<Migration> migrations, int currentVersion) {
        var expected = 2;
        for (var migration : migrations) {
            if (migration.targetVersion() != expected) {
                throw new IllegalStateException("Migration '" + migration.description() + "' targets version "
                                                + migration.targetVersion() + " but version " + expected
                                                + " was expected next");
            }
            expected++;
        }
        if (expected - 1 != currentVersion) {
            throw new IllegalStateException("Migrations stop at version " + (expected - 1)
                                            + " but the current version is " + currentVersion);
        }
        this.migrations = ImmutableList.copyOf(migrations);
        this.currentVersion = currentVersion;
    }

    public static MigrationRunner standard() {
        return STANDARD;
    }

    public int currentVersion() {
        return currentVersion;
    }

    /**
     * Applies every migration the folder has not seen yet.
     *
     * @param silent log progress at DEBUG instead of INFO
     * @return how many migrations ran
     */
    public int run(TicketFolder folder, boolean silent) throws IOException, GitAPIException {
        var level = silent ? Level.DEBUG : Level.INFO;
        var applied = 0;
        var version = folder.version();
        if (version < 1) {
            throw new IOException(folder + " has invalid layout version " + version);
        }
        if (version > currentVersion) {
            logger.warn("{} is at version {}, newer than this tool's {}", folder, version, currentVersion);
        }
        while (version < currentVersion) {
            var migration = migrations.get(version + 1 - 2);
            folder.log().log(level, "Migrating to version " + migration.targetVersion() + ": " + migration.description());
            migration.apply(folder);
            var reached = folder.version();
            if (reached != migration.targetVersion()) {
                throw new IllegalStateException("Migration '" + migration.description() + "' left " + folder
                                                + " at version " + reached + " instead of "
                                                + migration.targetVersion());
            }
            version = reached;
            applied++;
        }
        return applied;
    }
}
