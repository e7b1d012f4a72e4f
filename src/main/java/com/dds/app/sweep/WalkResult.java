package com.dds.app.sweep;

import java.nio.file.Path;
import java.util.List;

/**
 * What one directory scan produced. {@code anomaly} is null for a clean scan; {@code interrupted}
 * means the scan stopped early because its token was cancelled and the lists are partial.
 */
public record WalkResult(
        Path dir,
        List<Path> matches,
        List<Path> children,
        int skippedChildren,
        Anomaly anomaly,
        String error,
        boolean interrupted
) {

    public enum Anomaly {
        PERMISSION_DENIED("permission denied"),
        VANISHED("vanished"),
        SYMLINK("symlink"),
        EXCLUDED("excluded"),
        IO_ERROR("io error");

        private final String label;

        Anomaly(String label) {
            this.label = label;
        }

        public String label() {
            return label;
        }
    }

    public WalkResult {
        matches = List.copyOf(matches);
        children = List.copyOf(children);
    }

    public static WalkResult failed(Path dir, Anomaly anomaly, String detail) {
        String error = detail == null || detail.isBlank() ? anomaly.label() : anomaly.label() + ": " + detail;
        return new WalkResult(dir, List.of(), List.of(), 0, anomaly, error, false);
    }

    public boolean isError() {
        return anomaly != null;
    }
}
