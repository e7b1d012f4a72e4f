package com.dds.app.cache;

/**
 * Where a directory stands relative to the cache window.
 */
public enum CacheStatus {
    /** Never searched, or force refresh is on. */
    NOT_CACHED,
    /** Searched inside the window but the search did not finish. */
    INCOMPLETE,
    /** Last search is older than the window. */
    STALE,
    /** Searched to completion inside the window. */
    FRESH;

    public boolean needsScan() {
        return this != FRESH;
    }
}
