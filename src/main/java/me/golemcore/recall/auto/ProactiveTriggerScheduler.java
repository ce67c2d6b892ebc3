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

package me.golemcore.recall.auto;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.recall.domain.model.TriggerEvaluation;
import me.golemcore.recall.domain.service.ProactiveTriggerService;
import me.golemcore.recall.infrastructure.config.RecallProperties;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Heartbeat that evaluates proactive triggers for the configured owners.
 *
 * <p>
 * Ticks at {@code recall.triggers.interval} on a daemon thread. Each tick runs
 * {@link ProactiveTriggerService#evaluateAndPark(String)} per owner, so the
 * alert block waits for that owner's next turn. A tick that is still running
 * causes the following ones to be skipped.
 *
 * @since 1.0
 * @see ProactiveTriggerService
 */
@Component
@Slf4j
public class ProactiveTriggerScheduler {

    private final ProactiveTriggerService triggerService;
    private final RecallProperties.TriggersProperties config;
    private final AtomicBoolean executing = new AtomicBoolean(false);

    private ScheduledExecutorService scheduler;
    private ScheduledFuture<?> tickTask;

    public ProactiveTriggerScheduler(ProactiveTriggerService triggerService, RecallProperties properties) {
        this.triggerService = triggerService;
        this.config = properties.getTriggers();
    }

    @PostConstruct
    public void init() {
        if (!config.isEnabled()) {
            log.info("[Triggers] Heartbeat disabled");
            return;
        }
        if (config.getOwners().isEmpty()) {
            log.info("[Triggers] Heartbeat enabled but no owners configured");
            return;
        }

        scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "recall-trigger-heartbeat");
            t.setDaemon(true);
            return t;
        });

        long intervalMillis = Math.max(1000L, config.getInterval().toMillis());
        tickTask = scheduler.scheduleAtFixedRate(
                this::tick,
                intervalMillis,
                intervalMillis,
                TimeUnit.MILLISECONDS);

        log.info("[Triggers] Heartbeat started for {} owner(s), interval: {}", config.getOwners().size(),
                config.getInterval());
    }

    @PreDestroy
    public void shutdown() {
        if (tickTask != null) {
            tickTask.cancel(false);
        }
        if (scheduler != null) {
            scheduler.shutdown();
            try {
                if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                    scheduler.shutdownNow();
                }
            } catch (InterruptedException e) {
                scheduler.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }
        log.info("[Triggers] Heartbeat shut down");
    }

    /**
     * Evaluates every configured owner once. Returns the number of alerts
     * parked, or -1 when the tick was skipped.
     */
    int tick() {
        if (!executing.compareAndSet(false, true)) {
            log.debug("[Triggers] Tick skipped: previous execution still in progress");
            return -1;
        }

        try {
            int parked = 0;
            List<String> owners = config.getOwners();
            for (String agentId : owners) {
                TriggerEvaluation evaluation = triggerService.evaluateAndPark(agentId);
                parked += evaluation.triggers().size();
            }
            if (parked > 0) {
                log.debug("[Triggers] Tick parked {} alert(s)", parked);
            }
            return parked;
        } catch (RuntimeException e) {
            log.error("[Triggers] Tick failed: {}", e.getMessage(), e);
            return 0;
        } finally {
            executing.set(false);
        }
    }
}
