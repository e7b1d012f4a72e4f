package com.dds.app.queue;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * What resuming a session has to do to its queue, computed from persisted rows only.
 * Entries left {@code IN_PROGRESS} were never confirmed complete, so they go back to
 * {@code PENDING}; terminal entries are left alone.
 */
public record ResumePlan(List<Path> alreadyPending, List<Path> toReset) {

    public static ResumePlan reconcile(Collection<QueueEntry> persisted) {
        List<Path> pending = new ArrayList<>();
        List<Path> reset = new ArrayList<>();
        for (QueueEntry e : persisted) {
            switch (e.state()) {
                case PENDING -> pending.add(e.path());
                case IN_PROGRESS -> reset.add(e.path());
                case COMPLETED, FAILED -> { }
            }
        }
        return new ResumePlan(List.copyOf(pending), List.copyOf(reset));
    }

    /** Entries that will be pending once the plan is applied. */
    public int resumableCount() {
        return alreadyPending.size() + toReset.size();
    }

    public boolean isEmpty() {
        return resumableCount() == 0;
    }
}
