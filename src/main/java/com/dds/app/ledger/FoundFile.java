package com.dds.app.ledger;

import java.nio.file.Path;
import java.time.Instant;

import com.dds.app.database.Database.FoundFileRow;

/**
 * A matched file. {@code outcome} is null until the deletion step decides it.
 */
public record FoundFile(String sessionId, Path path, Instant foundAt, DeletionOutcome outcome, String error) {

    static FoundFile from(FoundFileRow row) {
        return new FoundFile(
                row.sessionId(),
                Path.of(row.path()),
                Instant.ofEpochMilli(row.foundAt()),
                row.outcome() == null ? null : DeletionOutcome.valueOf(row.outcome()),
                row.error()
        );
    }
}
