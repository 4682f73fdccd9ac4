package me.golemcore.mindbase.collector.support;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PlatformPathsTest {

    @TempDir
    Path home;

    @Test
    void shouldIncludeMacSupportDirectoryOnlyOnMac() {
        PlatformPaths mac = new PlatformPaths(home, "Mac OS X");
        PlatformPaths linux = new PlatformPaths(home, "Linux");

        assertTrue(mac.isMac());
        assertTrue(mac.appDataRoots().contains(home.resolve("Library/Application Support")));
        assertFalse(linux.appDataRoots().contains(home.resolve("Library/Application Support")));
        assertTrue(linux.appDataRoots().contains(home.resolve(".config")));
    }

    @Test
    void shouldKeepOnlyExistingPathsWithoutDuplicates() throws IOException {
        Path config = Files.createDirectories(home.resolve(".config/Claude"));
        PlatformPaths paths = new PlatformPaths(home, "Linux");

        List<Path> existing = PlatformPaths.existing(paths.underAppData("Claude", "Claude", "Missing"));

        assertEquals(List.of(config.toAbsolutePath().normalize()), existing);
    }
}
