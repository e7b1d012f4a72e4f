package com.dds.app.sweep;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import com.dds.app.database.SweepDao.CacheUpdate;
import com.dds.app.database.SweepDao.QueueCompletion;
import com.dds.app.queue.QueueState;

/**
 * Task outcomes waiting for the next flush. Owned by the coordinator thread; not thread-safe.
 */
final class WriteBuffer {

    record Batch(
            List<QueueCompletion> completions,
            List<String> released,
            List<String> discovered,
            List<String> found,
            List<CacheUpdate> cacheUpdates
    ) {}

    private List<QueueCompletion> completions = new ArrayList<>();
    private List<String> released = new ArrayList<>();
    private Set<String> discovered = new LinkedHashSet<>();
    private Set<String> found = new LinkedHashSet<>();
    private List<CacheUpdate> cacheUpdates = new ArrayList<>();

    void complete(Path dir, QueueState state, String note) {
        completions.add(new QueueCompletion(dir.toString(), state.name(), note));
    }

    void release(Path dir) {
        released.add(dir.toString());
    }

    void discover(Collection<Path> dirs) {
        for (Path p : dirs) discovered.add(p.toString());
    }

    void found(Collection<Path> files) {
        for (Path p : files) found.add(p.toString());
    }

    void cache(CacheUpdate update) {
        cacheUpdates.add(update);
    }

    /** Number of directory outcomes buffered; this is what the flush threshold counts. */
    int size() {
        return completions.size() + released.size();
    }

    int discoveredCount() {
        return discovered.size();
    }

    boolean isEmpty() {
        return completions.isEmpty() && released.isEmpty() && discovered.isEmpty()
                && found.isEmpty() && cacheUpdates.isEmpty();
    }

    Batch drain() {
        Batch b = new Batch(completions, released, List.copyOf(discovered), List.copyOf(found), cacheUpdates);
        completions = new ArrayList<>();
        released = new ArrayList<>();
        discovered = new LinkedHashSet<>();
        found = new LinkedHashSet<>();
        cacheUpdates = new ArrayList<>();
        return b;
    }
}
