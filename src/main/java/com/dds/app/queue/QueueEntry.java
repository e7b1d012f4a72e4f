package com.dds.app.queue;

import java.nio.file.Path;
import java.time.Instant;

import com.dds.app.database.Database.QueueRow;

public record QueueEntry(String sessionId, Path path, QueueState state, Instant enqueuedAt, String note) {

    static QueueEntry from(QueueRow row) {
        return new QueueEntry(
                row.sessionId(),
                Path.of(row.path()),
                QueueState.valueOf(row.state()),
                Instant.ofEpochMilli(row.enqueuedAt()),
                row.error()
        );
    }
}
