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

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.recall.domain.exception.CapacityExceededException;
import me.golemcore.recall.domain.exception.NotFoundException;
import me.golemcore.recall.domain.exception.ValidationException;
import me.golemcore.recall.domain.model.SessionStateDocument;
import me.golemcore.recall.infrastructure.config.RecallProperties;
import me.golemcore.recall.port.outbound.StoragePort;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Small key/value notebook per session ({@code session-state/<sessionKey>.json})
 * that the agent uses to pin facts it must not lose to compaction.
 */
@Component
@Slf4j
public class SessionStateStore {

    static final String DIRECTORY = "session-state";

    private final JsonDocumentStore<SessionStateDocument> documents;
    private final RecallProperties.SessionStateProperties config;

    public SessionStateStore(StoragePort storagePort, ObjectMapper objectMapper, RecallProperties properties) {
        this.documents = new JsonDocumentStore<>(storagePort, objectMapper, DIRECTORY, SessionStateDocument.class,
                SessionStateDocument::new, properties.getStorage().isBackupOnWrite());
        this.config = properties.getSessionState();
    }

    public Optional<String> get(String sessionKey, String key) {
        requireKey(key);
        return Optional.ofNullable(documents.read(sessionKey).getValues().get(key));
    }

    public void set(String sessionKey, String key, String value) {
        requireKey(key);
        if (value == null) {
            throw new ValidationException("Value is required");
        }
        if (value.length() > config.getMaxValueChars()) {
            throw new CapacityExceededException("Value exceeds " + config.getMaxValueChars() + " character limit.");
        }

        documents.update(sessionKey, document -> {
            Map<String, String> values = document.getValues();
            if (!values.containsKey(key) && values.size() >= config.getMaxKeys()) {
                throw new CapacityExceededException("Maximum " + config.getMaxKeys()
                        + " keys reached. Delete a key first.");
            }
            values.put(key, value);
            int bytes = documents.toJson(document).getBytes(StandardCharsets.UTF_8).length;
            if (bytes > config.getMaxBytes()) {
                throw new CapacityExceededException("State would exceed " + config.getMaxBytes() + " bytes limit.");
            }
            return null;
        });
        log.debug("[SessionState] Set {} for {}", key, sessionKey);
    }

    public void delete(String sessionKey, String key) {
        requireKey(key);
        documents.update(sessionKey, document -> {
            if (document.getValues().remove(key) == null) {
                throw new NotFoundException("Key not found: " + key);
            }
            return null;
        });
        log.debug("[SessionState] Deleted {} for {}", key, sessionKey);
    }

    public Map<String, String> list(String sessionKey) {
        return new LinkedHashMap<>(documents.read(sessionKey).getValues());
    }

    /**
     * Renders all pinned values, or null when the session has none.
     */
    public String readStateForInjection(String sessionKey) {
        Map<String, String> values = documents.read(sessionKey).getValues();
        if (values.isEmpty()) {
            return null;
        }
        StringBuilder sb = new StringBuilder("## Active Session State\n");
        values.forEach((key, value) -> sb.append("- **").append(key).append(":** ").append(value).append('\n'));
        return sb.toString().stripTrailing();
    }

    private static void requireKey(String key) {
        if (key == null || key.isBlank()) {
            throw new ValidationException("Key is required");
        }
    }
}
