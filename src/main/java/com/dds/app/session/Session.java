package com.dds.app.session;

import java.nio.file.Path;
import java.time.Instant;

import com.dds.app.database.Database.SessionRow;

public record Session(
        String id,
        Path root,
        boolean recursive,
        boolean force,
        boolean dryRun,
        SessionStatus status,
        Instant createdAt,
        Instant updatedAt,
        Instant completedAt,
        long dirsNew,
        long dirsResumed,
        long dirsSkipped,
        long dirsErrored,
        long filesFound,
        long filesDeleted
) {

    static Session from(SessionRow row) {
        return new Session(
                row.id(),
                Path.of(row.root()),
                row.recursive(),
                row.force(),
                row.dryRun(),
                SessionStatus.valueOf(row.status()),
                Instant.ofEpochMilli(row.createdAt()),
                Instant.ofEpochMilli(row.updatedAt()),
                row.completedAt() == null ? null : Instant.ofEpochMilli(row.completedAt()),
                row.dirsNew(),
                row.dirsResumed(),
                row.dirsSkipped(),
                row.dirsErrored(),
                row.filesFound(),
                row.filesDeleted()
        );
    }
}
