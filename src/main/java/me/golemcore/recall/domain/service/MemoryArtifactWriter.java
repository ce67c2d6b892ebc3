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

package me.golemcore.recall.domain.service;

import lombok.extern.slf4j.Slf4j;
import me.golemcore.recall.domain.exception.PersistenceException;
import me.golemcore.recall.infrastructure.config.RecallProperties;
import me.golemcore.recall.port.outbound.StoragePort;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Writes human-readable markdown artifacts into the workspace memory directory
 * ({@code memory/<kind>/...}) where an external indexer picks them up.
 *
 * <p>
 * Daily files get a header on first creation; every entry after that is
 * appended behind a {@code ---} separator.
 */
@Service
@Slf4j
public class MemoryArtifactWriter {

    static final String ENTRY_SEPARATOR = "\n\n---\n\n";

    private final StoragePort workspaceStorage;
    private final String memoryDirectory;
    private final Map<String, ReentrantLock> locks = new ConcurrentHashMap<>();

    public MemoryArtifactWriter(@Qualifier("workspaceStoragePort") StoragePort workspaceStorage,
            RecallProperties properties) {
        this.workspaceStorage = workspaceStorage;
        this.memoryDirectory = properties.getStorage().getMemoryDirectory();
    }

    /**
     * Appends an entry to {@code memory/<kind>/<date>.md}, writing the header
     * first when the file does not exist yet.
     *
     * @return workspace-relative path of the daily file
     */
    public String appendDaily(String kind, LocalDate date, String header, String entry) {
        String fileName = kind + "/" + date + ".md";
        ReentrantLock lock = locks.computeIfAbsent(fileName, key -> new ReentrantLock());
        lock.lock();
        try {
            boolean exists = Boolean.TRUE.equals(await(workspaceStorage.exists(memoryDirectory, fileName),
                    fileName));
            if (exists) {
                await(workspaceStorage.appendText(memoryDirectory, fileName, ENTRY_SEPARATOR + entry), fileName);
            } else {
                await(workspaceStorage.putText(memoryDirectory, fileName, header + ENTRY_SEPARATOR + entry),
                        fileName);
            }
        } finally {
            lock.unlock();
        }
        return relativePath(fileName);
    }

    /**
     * Writes a whole artifact file, replacing any previous content.
     *
     * @return workspace-relative path of the file
     */
    public String write(String kind, String fileName, String content) {
        String path = kind + "/" + fileName;
        await(workspaceStorage.putTextAtomic(memoryDirectory, path, content, false), path);
        return relativePath(path);
    }

    public void delete(String kind, String fileName) {
        String path = kind + "/" + fileName;
        await(workspaceStorage.deleteObject(memoryDirectory, path), path);
    }

    private String relativePath(String fileName) {
        return memoryDirectory + "/" + fileName;
    }

    private <T> T await(CompletableFuture<T> future, String fileName) {
        try {
            return future.join();
        } catch (CompletionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            throw new PersistenceException("Artifact write failed for " + relativePath(fileName) + ": "
                    + cause.getMessage(), cause);
        }
    }
}
