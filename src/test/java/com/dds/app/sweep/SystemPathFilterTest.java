package com.dds.app.sweep;

import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;
import java.util.Locale;

import static org.junit.jupiter.api.Assertions.*;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

public class SystemPathFilterTest {

    private static boolean isLinux() {
        return System.getProperty("os.name", "").toLowerCase(Locale.ROOT).contains("linux");
    }

    @Test
    void wellKnownSystemFoldersAreExcludedByName() {
        SystemPathFilter f = SystemPathFilter.forRoot(Path.of("/srv/data"), List.of());

        assertTrue(f.isExcluded(Path.of("/srv/data/.Trashes")));
        assertTrue(f.isExcluded(Path.of("/srv/data/usb/.Spotlight-V100")));
        assertTrue(f.isExcluded(Path.of("/srv/data/.fseventsd")));
        assertFalse(f.isExcluded(Path.of("/srv/data/photos")));
    }

    @Test
    void virtualFilesystemsAreExcludedOnLinux() {
        assumeTrue(isLinux());
        SystemPathFilter f = SystemPathFilter.forRoot(Path.of("/"), List.of());

        assertTrue(f.isExcluded(Path.of("/proc")));
        assertTrue(f.isExcluded(Path.of("/proc/1/fd")));
        assertTrue(f.isExcluded(Path.of("/sys/kernel")));
        assertFalse(f.isExcluded(Path.of("/home")));
        assertFalse(f.isExcluded(Path.of("/processing")), "Prefixes match whole path segments");
    }

    @Test
    void prefixContainingTheRootIsIgnored() {
        assumeTrue(isLinux());
        SystemPathFilter f = SystemPathFilter.forRoot(Path.of("/tmp/work"), List.of());

        assertFalse(f.isExcluded(Path.of("/tmp/work/sub")));
        assertTrue(f.isExcluded(Path.of("/proc/self")));
    }

    @Test
    void globsMatchNamesAndRootRelativePaths() {
        SystemPathFilter f = SystemPathFilter.forRoot(Path.of("/srv/data"),
                List.of("node_modules", "build/**", " ", "*.git"));

        assertTrue(f.isExcluded(Path.of("/srv/data/app/node_modules")));
        assertTrue(f.isExcluded(Path.of("/srv/data/build/classes")));
        assertTrue(f.isExcluded(Path.of("/srv/data/lib/repo.git")));
        assertFalse(f.isExcluded(Path.of("/srv/data/app/src")));
        assertFalse(f.isExcluded(Path.of("/srv/data/app/build")), "Relative glob is anchored at the root");
    }
}
