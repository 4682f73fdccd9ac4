package me.golemcore.mindbase.adapter.outbound.storage;

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

import me.golemcore.mindbase.infrastructure.config.MindbaseProperties;
import me.golemcore.mindbase.port.outbound.StoragePort;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.stream.Stream;

/**
 * Filesystem workspace behind {@link StoragePort}. Layout under the base path:
 * <ul>
 * <li>raw/ - one JSON document per captured conversation
 * <li>derived/ - one JSON document per embedded conversation
 * <li>checkpoints/ - one JSON document per collector source
 * </ul>
 *
 * <p>
 * The base path comes from {@code mindbase.storage.local.base-path}; a leading
 * {@code ~} or a {@code ${user.home}} placeholder expands to the user's home.
 * Every relative path is resolved inside the base path or rejected.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class LocalStorageAdapter implements StoragePort {

    static final List<String> WORKSPACE_DIRECTORIES = List.of("raw", "derived", "checkpoints");

    private static final String TEMP_SUFFIX = ".tmp";
    private static final String BACKUP_SUFFIX = ".bak";

    private final MindbaseProperties properties;

    private Path basePath;

    @PostConstruct
    public void init() {
        basePath = expandHome(properties.getStorage().getLocal().getBasePath());
        try {
            for (String directory : WORKSPACE_DIRECTORIES) {
                Files.createDirectories(basePath.resolve(directory));
            }
            log.info("[Storage] Workspace ready at {}", basePath);
        } catch (IOException e) {
            log.error("[Storage] Cannot create workspace at {}", basePath, e);
        }
    }

    static Path expandHome(String configured) {
        String home = System.getProperty("user.home");
        String expanded = configured.replace("${user.home}", home);
        if (expanded.equals("~") || expanded.startsWith("~/")) {
            expanded = home + expanded.substring(1);
        }
        return Path.of(expanded).toAbsolutePath().normalize();
    }

    @Override
    public CompletableFuture<Void> putText(String directory, String path, String content) {
        return CompletableFuture.runAsync(() -> {
            Path target = resolve(directory, path);
            try {
                createParent(target);
                Files.writeString(target, content, StandardCharsets.UTF_8);
            } catch (IOException e) {
                throw new UncheckedIOException("Cannot write " + directory + "/" + path, e);
            }
        });
    }

    @Override
    public CompletableFuture<String> getText(String directory, String path) {
        return CompletableFuture.supplyAsync(() -> {
            Path source = resolve(directory, path);
            if (!Files.isRegularFile(source)) {
                return null;
            }
            try {
                return Files.readString(source, StandardCharsets.UTF_8);
            } catch (IOException e) {
                throw new UncheckedIOException("Cannot read " + directory + "/" + path, e);
            }
        });
    }

    @Override
    public CompletableFuture<Boolean> exists(String directory, String path) {
        return CompletableFuture.supplyAsync(() -> Files.isRegularFile(resolve(directory, path)));
    }

    @Override
    public CompletableFuture<List<String>> listObjects(String directory, String prefix) {
        return CompletableFuture.supplyAsync(() -> {
            Path root = resolve(directory, "");
            Path start = prefix == null || prefix.isEmpty() ? root : resolve(directory, prefix);
            if (!Files.exists(start)) {
                return List.of();
            }
            try (Stream<Path> walk = Files.walk(start)) {
                return walk.filter(Files::isRegularFile)
                        .map(file -> root.relativize(file).toString())
                        .sorted()
                        .toList();
            } catch (IOException e) {
                throw new UncheckedIOException("Cannot list " + directory + "/" + prefix, e);
            }
        });
    }

    @Override
    public CompletableFuture<Void> ensureDirectory(String directory) {
        return CompletableFuture.runAsync(() -> {
            try {
                Files.createDirectories(resolve(directory, ""));
            } catch (IOException e) {
                throw new UncheckedIOException("Cannot create " + directory, e);
            }
        });
    }

    /**
     * Writes through a synced sibling temp file renamed over the target, so a
     * reader sees either the old document or the new one.
     */
    @Override
    public CompletableFuture<Void> putTextAtomic(String directory, String path, String content, boolean backup) {
        return CompletableFuture.runAsync(() -> {
            Path target = resolve(directory, path);
            Path temp = target.resolveSibling(target.getFileName() + TEMP_SUFFIX);
            try {
                createParent(target);
                writeSynced(temp, content.getBytes(StandardCharsets.UTF_8));
                if (backup && Files.exists(target)) {
                    Files.copy(target, target.resolveSibling(target.getFileName() + BACKUP_SUFFIX),
                            StandardCopyOption.REPLACE_EXISTING);
                }
                replace(temp, target);
                log.debug("[Storage] Wrote {}/{}", directory, path);
            } catch (IOException e) {
                deleteQuietly(temp);
                throw new UncheckedIOException("Atomic write failed: " + directory + "/" + path, e);
            }
        });
    }

    private static void writeSynced(Path file, byte[] bytes) throws IOException {
        try (FileChannel channel = FileChannel.open(file, StandardOpenOption.CREATE,
                StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE)) {
            ByteBuffer buffer = ByteBuffer.wrap(bytes);
            while (buffer.hasRemaining()) {
                channel.write(buffer);
            }
            channel.force(true);
        }
        if (Files.size(file) != bytes.length) {
            throw new IOException("Size mismatch after writing " + file);
        }
    }

    private static void replace(Path source, Path target) throws IOException {
        try {
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            log.warn("[Storage] Atomic rename unsupported for {}, falling back to plain move", target);
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private static void createParent(Path file) throws IOException {
        Path parent = file.getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
    }

    private static void deleteQuietly(Path file) {
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            log.warn("[Storage] Could not remove temp file {}: {}", file, e.getMessage());
        }
    }

    private Path resolve(String directory, String path) {
        Path resolved = basePath.resolve(directory).resolve(path).normalize();
        if (!resolved.startsWith(basePath)) {
            throw new IllegalArgumentException("Path escapes workspace: " + directory + "/" + path);
        }
        return resolved;
    }
}
