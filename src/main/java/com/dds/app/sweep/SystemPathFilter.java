package com.dds.app.sweep;

import java.nio.file.FileSystems;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Decides which child directories are never descended into: OS-managed and virtual
 * locations, trash folders, and user-supplied globs.
 *
 * <p>Prefix exclusions that contain the sweep root are dropped, so sweeping inside
 * {@code /tmp} still works when {@code /tmp} itself is excluded.
 */
public final class SystemPathFilter {

    private static final Set<String> EXCLUDED_NAMES = Set.of(
            ".Trash",
            ".Trashes",
            ".Spotlight-V100",
            ".fseventsd",
            ".DocumentRevisions-V100",
            ".TemporaryItems",
            ".MobileBackups",
            "System Volume Information",
            "$Recycle.Bin"
    );

    private final Path root;
    private final List<Path> excludedPrefixes;
    private final List<PathMatcher> matchers;

    private SystemPathFilter(Path root, List<Path> excludedPrefixes, List<PathMatcher> matchers) {
        this.root = root;
        this.excludedPrefixes = excludedPrefixes;
        this.matchers = matchers;
    }

    public static SystemPathFilter forRoot(Path root, List<String> excludeGlobs) {
        Path rootAbs = root.toAbsolutePath().normalize();
        List<Path> prefixes = new ArrayList<>();
        for (Path p : defaultPrefixes()) {
            if (!rootAbs.startsWith(p)) prefixes.add(p);
        }
        return new SystemPathFilter(rootAbs, List.copyOf(prefixes), compileMatchers(excludeGlobs));
    }

    /** The sweep root itself is never excluded. */
    public boolean isExcluded(Path dir) {
        Path abs = dir.toAbsolutePath().normalize();
        if (abs.equals(root)) return false;

        Path name = dir.getFileName();
        if (name != null && EXCLUDED_NAMES.contains(name.toString())) return true;

        for (Path prefix : excludedPrefixes) {
            if (abs.startsWith(prefix)) return true;
        }

        if (!matchers.isEmpty()) {
            Path rel = abs.startsWith(root) ? root.relativize(abs) : abs;
            for (PathMatcher m : matchers) {
                if (m.matches(rel)) return true;
                if (name != null && m.matches(name)) return true;
            }
        }
        return false;
    }

    private static boolean isWindows() {
        return System.getProperty("os.name", "generic").toLowerCase(Locale.ROOT).contains("win");
    }

    private static boolean isMac() {
        return System.getProperty("os.name", "generic").toLowerCase(Locale.ROOT).contains("mac");
    }

    private static List<Path> defaultPrefixes() {
        if (isWindows()) return List.of();

        List<Path> out = new ArrayList<>();
        String home = System.getProperty("user.home", "");
        if (isMac()) {
            out.add(Path.of("/System/Volumes"));
            out.add(Path.of("/private/var/folders"));
            out.add(Path.of("/private/var/vm"));
            out.add(Path.of("/private/tmp"));
            out.add(Path.of("/dev"));
            out.add(Path.of("/.vol"));
            out.add(Path.of("/Volumes/com.apple.TimeMachine.localsnapshots"));
        } else {
            out.add(Path.of("/proc"));
            out.add(Path.of("/sys"));
            out.add(Path.of("/dev"));
            out.add(Path.of("/run"));
            out.add(Path.of("/tmp"));
            out.add(Path.of("/var/tmp"));
            out.add(Path.of("/var/cache"));
        }
        if (!home.isBlank()) out.add(Path.of(home, ".local", "share", "Trash"));
        return out;
    }

    private static List<PathMatcher> compileMatchers(List<String> globs) {
        var fs = FileSystems.getDefault();
        var out = new ArrayList<PathMatcher>(globs == null ? 0 : globs.size());
        if (globs == null) return out;
        for (String g : globs) {
            if (g == null || g.isBlank()) continue;
            out.add(fs.getPathMatcher("glob:" + g.trim()));
        }
        return out;
    }
}
