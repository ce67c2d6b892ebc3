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

package me.golemcore.recall.domain.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.recall.domain.exception.PersistenceException;
import me.golemcore.recall.domain.exception.ValidationException;
import me.golemcore.recall.domain.model.VersionedDocument;
import me.golemcore.recall.port.outbound.StoragePort;

import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;
import java.util.function.Supplier;
import java.util.regex.Pattern;

/**
 * One JSON document per owner key under a store directory, loaded fully,
 * mutated in memory and rewritten atomically.
 *
 * <p>
 * {@link #update(String, Function)} holds a per-document lock for the whole
 * read-modify-write, so concurrent writers inside this process never lose each
 * other's changes. Nothing guards against a second process writing the same
 * owner's file: one process must own a given owner key at a time.
 *
 * <p>
 * A missing file reads as an empty document. A file that cannot be parsed or
 * carries a different {@code version} is rejected with
 * {@link PersistenceException} and never overwritten.
 *
 * @param <D>
 *            document type
 */
@Slf4j
public class JsonDocumentStore<D extends VersionedDocument> {

    private static final Pattern UNSAFE_KEY_CHARS = Pattern.compile("[^a-zA-Z0-9_-]");
    private static final int MAX_KEY_LENGTH = 60;
    private static final String JSON_SUFFIX = ".json";

    private final StoragePort storage;
    private final ObjectMapper objectMapper;
    private final String directory;
    private final Class<D> documentType;
    private final Supplier<D> emptyDocument;
    private final boolean backup;
    private final Map<String, ReentrantLock> locks = new ConcurrentHashMap<>();

    public JsonDocumentStore(StoragePort storage, ObjectMapper objectMapper, String directory,
            Class<D> documentType, Supplier<D> emptyDocument, boolean backup) {
        this.storage = storage;
        this.objectMapper = objectMapper;
        this.directory = directory;
        this.documentType = documentType;
        this.emptyDocument = emptyDocument;
        this.backup = backup;
    }

    /**
     * Replaces characters outside {@code [a-zA-Z0-9_-]} with {@code _} and caps
     * the key at {@value #MAX_KEY_LENGTH} characters.
     */
    public static String sanitizeKey(String ownerKey) {
        if (ownerKey == null || ownerKey.isBlank()) {
            throw new ValidationException("Owner key is required");
        }
        String safe = UNSAFE_KEY_CHARS.matcher(ownerKey).replaceAll("_");
        return safe.length() > MAX_KEY_LENGTH ? safe.substring(0, MAX_KEY_LENGTH) : safe;
    }

    public D read(String ownerKey) {
        String fileName = fileName(ownerKey);
        String json = await(storage.getText(directory, fileName), "Read", fileName);
        if (json == null || json.isBlank()) {
            return emptyDocument.get();
        }

        D document;
        try {
            document = objectMapper.readValue(json, documentType);
        } catch (JsonProcessingException e) {
            throw new PersistenceException("Corrupt document " + directory + "/" + fileName, e);
        }
        if (document == null) {
            return emptyDocument.get();
        }
        if (document.getVersion() != VersionedDocument.CURRENT_VERSION) {
            throw new PersistenceException("Unsupported version " + document.getVersion() + " in "
                    + directory + "/" + fileName);
        }
        return document;
    }

    /**
     * Loads the owner's document, applies the mutation and persists the result,
     * all under the owner's lock. Exceptions thrown by the mutation abort the
     * write.
     */
    public <R> R update(String ownerKey, Function<D, R> mutation) {
        String fileName = fileName(ownerKey);
        ReentrantLock lock = locks.computeIfAbsent(fileName, key -> new ReentrantLock());
        lock.lock();
        try {
            D document = read(ownerKey);
            R result = mutation.apply(document);
            write(fileName, document);
            return result;
        } finally {
            lock.unlock();
        }
    }

    public void delete(String ownerKey) {
        String fileName = fileName(ownerKey);
        ReentrantLock lock = locks.computeIfAbsent(fileName, key -> new ReentrantLock());
        lock.lock();
        try {
            await(storage.deleteObject(directory, fileName), "Delete", fileName);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Serialized form of a document as it would be written.
     */
    public String toJson(D document) {
        try {
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(document);
        } catch (JsonProcessingException e) {
            throw new PersistenceException("Failed to serialize " + documentType.getSimpleName(), e);
        }
    }

    private void write(String fileName, D document) {
        await(storage.putTextAtomic(directory, fileName, toJson(document), backup), "Write", fileName);
        log.trace("[Storage] Saved {}/{}", directory, fileName);
    }

    private String fileName(String ownerKey) {
        return sanitizeKey(ownerKey) + JSON_SUFFIX;
    }

    private <T> T await(CompletableFuture<T> future, String action, String fileName) {
        try {
            return future.join();
        } catch (CompletionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            throw new PersistenceException(action + " failed for " + directory + "/" + fileName + ": "
                    + cause.getMessage(), cause);
        }
    }
}
