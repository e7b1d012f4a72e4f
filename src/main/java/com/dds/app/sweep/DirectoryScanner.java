package com.dds.app.sweep;

import java.nio.file.Path;

/**
 * Lists one directory. Implementations must not throw for filesystem problems; those are
 * reported through {@link WalkResult#anomaly()}.
 */
@FunctionalInterface
public interface DirectoryScanner {

    WalkResult scan(Path dir, CancellationToken token);
}
