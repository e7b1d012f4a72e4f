package com.dds.app.sweep;

import java.io.IOException;
import java.nio.file.AccessDeniedException;
import java.nio.file.DirectoryIteratorException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.NoSuchFileException;
import java.nio.file.NotDirectoryException;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.dds.app.sweep.WalkResult.Anomaly;

/**
 * Lists a single directory: files named like the target are matches, readable
 * non-excluded subdirectories are children. Symbolic links are never followed.
 */
public final class DirectoryWalker implements DirectoryScanner {

    private static final Logger logger = LoggerFactory.getLogger(DirectoryWalker.class);

    private final String targetName;
    private final SystemPathFilter filter;

    public DirectoryWalker(String targetName, SystemPathFilter filter) {
        this.targetName = targetName;
        this.filter = filter;
    }

    public static DirectoryWalker forConfig(SweepConfig cfg) {
        return new DirectoryWalker(cfg.targetName(), SystemPathFilter.forRoot(cfg.root(), cfg.excludeGlobs()));
    }

    @Override
    public WalkResult scan(Path dir, CancellationToken token) {
        BasicFileAttributes self;
        try {
            self = Files.readAttributes(dir, BasicFileAttributes.class, LinkOption.NOFOLLOW_LINKS);
        } catch (IOException e) {
            return classify(dir, e);
        }
        if (self.isSymbolicLink()) return WalkResult.failed(dir, Anomaly.SYMLINK, null);
        if (!self.isDirectory()) return WalkResult.failed(dir, Anomaly.VANISHED, "not a directory");
        // queued before the exclusion applied (resumed session, cached subtree)
        if (filter.isExcluded(dir)) return WalkResult.failed(dir, Anomaly.EXCLUDED, null);

        List<Path> matches = new ArrayList<>();
        List<Path> children = new ArrayList<>();
        int skipped = 0;
        boolean interrupted = false;

        try (DirectoryStream<Path> stream = Files.newDirectoryStream(dir)) {
            for (Path entry : stream) {
                if (token.isCancelled() || Thread.currentThread().isInterrupted()) {
                    interrupted = true;
                    break;
                }

                BasicFileAttributes attrs;
                try {
                    attrs = Files.readAttributes(entry, BasicFileAttributes.class, LinkOption.NOFOLLOW_LINKS);
                } catch (IOException e) {
                    // entry vanished or is unreadable between listing and stat
                    logger.debug("Skipping {}: {}", entry, safeMsg(e));
                    continue;
                }

                if (attrs.isSymbolicLink()) continue;

                if (attrs.isDirectory()) {
                    if (filter.isExcluded(entry)) {
                        logger.debug("Excluded {}", entry);
                        skipped++;
                    } else if (!Files.isReadable(entry)) {
                        logger.debug("Unreadable {}", entry);
                        skipped++;
                    } else {
                        children.add(entry);
                    }
                } else if (attrs.isRegularFile() && targetName.equals(entry.getFileName().toString())) {
                    matches.add(entry);
                }
            }
        } catch (DirectoryIteratorException e) {
            return classify(dir, e.getCause());
        } catch (IOException e) {
            return classify(dir, e);
        }

        return new WalkResult(dir, matches, children, skipped, null, null, interrupted);
    }

    static WalkResult classify(Path dir, IOException e) {
        if (e instanceof AccessDeniedException) return WalkResult.failed(dir, Anomaly.PERMISSION_DENIED, null);
        if (e instanceof NoSuchFileException) return WalkResult.failed(dir, Anomaly.VANISHED, null);
        if (e instanceof NotDirectoryException) return WalkResult.failed(dir, Anomaly.VANISHED, "not a directory");
        return WalkResult.failed(dir, Anomaly.IO_ERROR, safeMsg(e));
    }

    private static String safeMsg(Throwable t) {
        return (t.getMessage() == null || t.getMessage().isBlank())
                ? t.getClass().getSimpleName()
                : t.getMessage();
    }
}
