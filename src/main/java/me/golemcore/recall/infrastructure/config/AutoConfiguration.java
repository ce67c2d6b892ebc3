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

package me.golemcore.recall.infrastructure.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.recall.adapter.outbound.storage.LocalStorageAdapter;
import me.golemcore.recall.port.outbound.StoragePort;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.info.BuildProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;

import java.time.Clock;
import java.util.List;

/**
 * Spring configuration of the shared infrastructure beans.
 *
 * <p>
 * This configuration:
 * <ul>
 * <li>Provides the {@link Clock} and the Jackson {@link ObjectMapper} used by
 * every store</li>
 * <li>Creates the state storage (JSON documents) and the workspace storage
 * (markdown artifacts, watched files)</li>
 * <li>Logs startup information</li>
 * </ul>
 *
 * @since 1.0
 */
@Configuration
@RequiredArgsConstructor
@Slf4j
public class AutoConfiguration {

    private static final List<String> STATE_DIRECTORIES = List.of(
            "corrections", "tool-failures", "task-ledger", "scratch", "session-state", "execution-plans");

    private final RecallProperties properties;
    private final ObjectProvider<BuildProperties> buildPropertiesProvider;

    @Bean
    public static Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public static ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }

    @Bean
    @Primary
    public StoragePort stateStoragePort() {
        LocalStorageAdapter adapter = new LocalStorageAdapter(properties.getStorage().getStatePath(),
                STATE_DIRECTORIES);
        adapter.init();
        return adapter;
    }

    @Bean
    public StoragePort workspaceStoragePort() {
        LocalStorageAdapter adapter = new LocalStorageAdapter(properties.getStorage().getWorkspacePath(),
                List.of(properties.getStorage().getMemoryDirectory()));
        adapter.init();
        return adapter;
    }

    @PostConstruct
    public void init() {
        BuildProperties buildProps = buildPropertiesProvider.getIfAvailable();
        String version = buildProps != null ? buildProps.getVersion() : "dev";
        log.info("GolemCore Recall v{} starting...", version);
        log.info("State Path: {}", properties.getStorage().getStatePath());
        log.info("Workspace Path: {}", properties.getStorage().getWorkspacePath());
        log.info("Proactive triggers: {}", properties.getTriggers().isEnabled() ? "enabled" : "disabled");
    }
}
