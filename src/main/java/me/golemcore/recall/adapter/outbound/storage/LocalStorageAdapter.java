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
package me.golemcore.recall.adapter.outbound.storage;

import me.golemcore.recall.domain.model.FileSnapshot;
import me.golemcore.recall.port.outbound.StoragePort;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Local filesystem implementation of StoragePort.
 *
 * <p>
 * Two instances are wired: one rooted at the state directory holding the JSON
 * store documents ({@code corrections/}, {@code tool-failures/},
 * {@code task-ledger/}, {@code scratch/}, {@code session-state/},
 * {@code execution-plans/}, plus the global {@code proactive-triggers.json}),
 * and one rooted at the agent workspace holding the markdown artifacts under
 * {@code memory/}.
 *
 * <p>
 * Root paths come from {@code recall.storage.state-path} and
 * {@code recall.storage.workspace-path}; {@code ${user.home}} is expanded.
 * Every operation resolves inside the root; anything escaping it fails with
 * {@link IllegalArgumentException}.
 *
 * @see me.golemcore.recall.port.outbound.StoragePort
 */
@Slf4j
public class LocalStorageAdapter implements StoragePort {

    private static final String USER_HOME = "${user.home}";
    private static final String TEMP_SUFFIX = ".tmp";
    private static final String BACKUP_SUFFIX = ".bak";

    private final String configuredPath;
    private final List<String> knownDirectories;

    private Path basePath;

    public LocalStorageAdapter(String configuredPath, List<String> knownDirectories) {
        this.configuredPath = configuredPath;
        this.knownDirectories = List.copyOf(knownDirectories);
    }

    public void init() {
        this.basePath = Paths.get(configuredPath.replace(USER_HOME, System.getProperty("user.home")))
                .toAbsolutePath().normalize();

        try {
            Files.createDirectories(basePath);
            for (String dir : knownDirectories) {
                Files.createDirectories(basePath.resolve(dir));
            }
            log.info("[Storage] Root ready at {} ({} store directories)", basePath, knownDirectories.size());
        } catch (IOException e) {
            log.error("[Storage] Cannot prepare root {}", basePath, e);
        }
    }

    public Path getBasePath() {
        return basePath;
    }

    @Override
    public CompletableFuture<Void> putText(String directory, String path, String content) {
        return run("write", directory, path, file -> {
            createParent(file);
            Files.writeString(file, content, StandardCharsets.UTF_8);
            return null;
        });
    }

    @Override
    public CompletableFuture<String> getText(String directory, String path) {
        return run("read", directory, path,
                file -> Files.exists(file) ? Files.readString(file, StandardCharsets.UTF_8) : null);
    }

    @Override
    public CompletableFuture<Boolean> exists(String directory, String path) {
        return run("check", directory, path, Files::exists);
    }

    @Override
    public CompletableFuture<Void> deleteObject(String directory, String path) {
        return run("delete", directory, path, file -> {
            Files.deleteIfExists(file);
            return null;
        });
    }

    @Override
    public CompletableFuture<Void> appendText(String directory, String path, String content) {
        return run("append to", directory, path, file -> {
            createParent(file);
            Files.writeString(file, content, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND);
            return null;
        });
    }

    /**
     * Writes to a synced sibling temp file, optionally copies the current file
     * to {@code .bak}, then moves the temp file over the target. Readers see
     * either the old or the new document, never a partial one.
     */
    @Override
    public CompletableFuture<Void> putTextAtomic(String directory, String path, String content, boolean backup) {
        return run("atomically write", directory, path, target -> {
            Path temp = sibling(target, TEMP_SUFFIX);
            try {
                createParent(target);
                writeSynced(temp, content.getBytes(StandardCharsets.UTF_8));
                if (backup && Files.exists(target)) {
                    Files.copy(target, sibling(target, BACKUP_SUFFIX), StandardCopyOption.REPLACE_EXISTING);
                }
                promote(temp, target);
                log.debug("[Storage] Replaced {}/{}", directory, path);
                return null;
            } catch (IOException e) {
                discard(temp);
                throw e;
            }
        });
    }

    @Override
    public CompletableFuture<FileSnapshot> stat(String directory, String path) {
        return run("stat", directory, path, file -> {
            if (!Files.isRegularFile(file)) {
                return null;
            }
            BasicFileAttributes attributes = Files.readAttributes(file, BasicFileAttributes.class);
            return new FileSnapshot(attributes.size(), attributes.lastModifiedTime().toMillis());
        });
    }

    private <T> CompletableFuture<T> run(String verb, String directory, String path, FileAction<T> action) {
        return CompletableFuture.supplyAsync(() -> {
            Path file = resolvePath(directory, path);
            try {
                return action.apply(file);
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to " + verb + " file: " + directory + "/" + path, e);
            }
        });
    }

    private static void writeSynced(Path temp, byte[] bytes) throws IOException {
        try (FileChannel channel = FileChannel.open(temp, StandardOpenOption.CREATE, StandardOpenOption.WRITE,
                StandardOpenOption.TRUNCATE_EXISTING)) {
            ByteBuffer buffer = ByteBuffer.wrap(bytes);
            while (buffer.hasRemaining()) {
                channel.write(buffer);
            }
            channel.force(true);
        }
        if (Files.size(temp) != bytes.length) {
            throw new IOException("Size mismatch after writing " + temp);
        }
    }

    private static void promote(Path temp, Path target) throws IOException {
        try {
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            log.warn("[Storage] Atomic move unsupported for {}, falling back to plain move", target);
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private static void discard(Path temp) {
        try {
            Files.deleteIfExists(temp);
        } catch (IOException e) {
            log.warn("[Storage] Could not remove temp file {}: {}", temp, e.getMessage());
        }
    }

    private static Path sibling(Path target, String suffix) {
        return target.resolveSibling(target.getFileName() + suffix);
    }

    private static void createParent(Path file) throws IOException {
        Path parent = file.getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
    }

    private Path resolvePath(String directory, String path) {
        Path resolved = basePath.resolve(directory).resolve(path).normalize();
        if (!resolved.startsWith(basePath)) {
            throw new IllegalArgumentException("Path traversal blocked: " + directory + "/" + path);
        }
        return resolved;
    }

    @FunctionalInterface
    private interface FileAction<T> {
        T apply(Path file) throws IOException;
    }
}
