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

package me.golemcore.recall.port.outbound;

import me.golemcore.recall.domain.model.FileSnapshot;

import java.util.concurrent.CompletableFuture;

/**
 * Port for file operations under one storage root (the state root or the
 * workspace root). Paths are relative to a directory inside that root; an
 * empty directory addresses the root itself.
 */
public interface StoragePort {

    /**
     * Write text content to file, replacing it.
     */
    CompletableFuture<Void> putText(String directory, String path, String content);

    /**
     * Read text content from file, or null when the file does not exist.
     */
    CompletableFuture<String> getText(String directory, String path);

    CompletableFuture<Boolean> exists(String directory, String path);

    /**
     * Delete a file. Missing files are ignored.
     */
    CompletableFuture<Void> deleteObject(String directory, String path);

    /**
     * Append text to a file, creating it if needed.
     */
    CompletableFuture<Void> appendText(String directory, String path, String content);

    /**
     * Replaces a file so that readers never observe a partially written
     * document. The store documents go through this method; markdown
     * artifacts use {@link #putText} and {@link #appendText}.
     *
     * @param backup
     *            keep the replaced content next to the file as {@code .bak}
     */
    CompletableFuture<Void> putTextAtomic(String directory, String path, String content, boolean backup);

    /**
     * Size and modification time of a file, or null when it does not exist.
     */
    CompletableFuture<FileSnapshot> stat(String directory, String path);
}
