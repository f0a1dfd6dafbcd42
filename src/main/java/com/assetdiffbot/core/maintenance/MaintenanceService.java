package com.assetdiffbot.core.maintenance;

import com.assetdiffbot.core.checkout.CheckoutManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Stream;

/**
 * Periodic housekeeping: removes old artifact directories and prunes stale worktree entries.
 */
public class MaintenanceService {

    private static final Logger log = LoggerFactory.getLogger(MaintenanceService.class);

    private final Path outputRoot;
    private final Path reposDir;
    private final Duration retention;
    private final CheckoutManager checkoutManager;
    private final Clock clock;

    public MaintenanceService(Path outputRoot, Path reposDir, Duration retention,
                              CheckoutManager checkoutManager, Clock clock) {
        this.outputRoot = outputRoot;
        this.reposDir = reposDir;
        this.retention = retention;
        this.checkoutManager = checkoutManager;
        this.clock = clock;
    }

    public record Report(List<Path> removedDirectories, List<Path> prunedClones) {}

    public Report runCleanup() {
        var removed = removeExpiredArtifacts();
        var pruned = pruneWorktrees();
        log.info("Maintenance finished: removed {} artifact directories, pruned {} clones",
                removed.size(), pruned.size());
        return new Report(removed, pruned);
    }

    /**
     * Deletes {@code <root>/<owner>/<pull_request>} directories in which nothing was modified
     * within the retention period, then any owner directory left empty. Age is taken from the
     * newest entry in the tree, since rewriting an existing file does not touch its directory.
     */
    List<Path> removeExpiredArtifacts() {
        var removed = new ArrayList<Path>();
        if (!Files.isDirectory(outputRoot)) {
            return removed;
        }
        Instant cutoff = clock.instant().minus(retention);
        for (Path owner : listDirectories(outputRoot)) {
            for (Path pull : listDirectories(owner)) {
                if (newestModification(pull).toInstant().isBefore(cutoff)) {
                    deleteRecursively(pull);
                    removed.add(pull);
                    log.debug("Removed expired artifacts {}", pull);
                }
            }
            if (isEmpty(owner)) {
                deleteRecursively(owner);
            }
        }
        return removed;
    }

    /**
     * Prunes worktree entries in every clone under {@code <repos>/<owner>/<name>}.
     */
    List<Path> pruneWorktrees() {
        var pruned = new ArrayList<Path>();
        if (!Files.isDirectory(reposDir)) {
            return pruned;
        }
        for (Path owner : listDirectories(reposDir)) {
            for (Path clone : listDirectories(owner)) {
                if (Files.isDirectory(clone.resolve(".git"))) {
                    checkoutManager.pruneWorktrees(clone);
                    pruned.add(clone);
                }
            }
        }
        return pruned;
    }

    private static List<Path> listDirectories(Path dir) {
        try (Stream<Path> stream = Files.list(dir)) {
            return stream.filter(Files::isDirectory).sorted().toList();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to list " + dir, e);
        }
    }

    private static boolean isEmpty(Path dir) {
        try (Stream<Path> stream = Files.list(dir)) {
            return stream.findAny().isEmpty();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to list " + dir, e);
        }
    }

    private static FileTime newestModification(Path dir) {
        try (Stream<Path> walk = Files.walk(dir)) {
            FileTime newest = Files.getLastModifiedTime(dir);
            for (Path path : walk.toList()) {
                FileTime modified = Files.getLastModifiedTime(path);
                if (modified.compareTo(newest) > 0) {
                    newest = modified;
                }
            }
            return newest;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to stat " + dir, e);
        }
    }

    private static void deleteRecursively(Path dir) {
        try (Stream<Path> walk = Files.walk(dir)) {
            for (Path path : walk.sorted(Comparator.reverseOrder()).toList()) {
                Files.delete(path);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to delete " + dir, e);
        }
    }
}
