package com.dds.app.sweep;

public enum Verbosity {
    QUIET,
    NORMAL,
    VERBOSE;

    public static Verbosity fromFlags(boolean verbose, boolean quiet) {
        if (verbose && !quiet) return VERBOSE;
        if (quiet && !verbose) return QUIET;
        return NORMAL;
    }
}
