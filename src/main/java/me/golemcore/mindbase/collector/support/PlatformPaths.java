package me.golemcore.mindbase.collector.support;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Per-OS application data roots below a home directory.
 */
public class PlatformPaths {

    private final Path home;
    private final boolean mac;

    public PlatformPaths(Path home, String osName) {
        this.home = home;
        this.mac = osName != null && osName.toLowerCase(Locale.ROOT).contains("mac");
    }

    public static PlatformPaths forCurrentSystem(Path home) {
        return new PlatformPaths(home, System.getProperty("os.name"));
    }

    public Path home() {
        return home;
    }

    public boolean isMac() {
        return mac;
    }

    /**
     * Application support roots: macOS {@code Library/Application Support} (on
     * macOS only), the Linux XDG directories and the Windows roaming and local
     * app data directories.
     */
    public List<Path> appDataRoots() {
        List<Path> roots = new ArrayList<>();
        if (mac) {
            roots.add(home.resolve("Library/Application Support"));
        }
        roots.add(home.resolve(".config"));
        roots.add(home.resolve(".local/share"));
        roots.add(home.resolve(".cache"));
        roots.add(home.resolve("AppData/Roaming"));
        roots.add(home.resolve("AppData/Local"));
        return roots;
    }

    /**
     * Resolves each relative path against each app data root.
     */
    public List<Path> underAppData(String... relativePaths) {
        List<Path> paths = new ArrayList<>();
        for (Path root : appDataRoots()) {
            for (String relative : relativePaths) {
                paths.add(root.resolve(relative));
            }
        }
        return paths;
    }

    /**
     * Keeps existing paths only, in order and without duplicates.
     */
    public static List<Path> existing(List<Path> candidates) {
        Set<Path> seen = new LinkedHashSet<>();
        for (Path candidate : candidates) {
            Path normalized = candidate.toAbsolutePath().normalize();
            if (Files.exists(normalized)) {
                seen.add(normalized);
            }
        }
        return new ArrayList<>(seen);
    }
}
