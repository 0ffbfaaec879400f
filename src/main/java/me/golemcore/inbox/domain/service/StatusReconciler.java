package me.golemcore.inbox.domain.service;

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

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.inbox.domain.model.MalformedStatusEventException;
import me.golemcore.inbox.domain.model.ProcessStatusEvent;
import me.golemcore.inbox.domain.model.QueueMessage;
import me.golemcore.inbox.infrastructure.config.InboxProperties;
import me.golemcore.inbox.port.outbound.StatusQueuePort;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Background consumer that applies process status events from the status queue
 * to the {@link ProcessRegistry}. It is the only component that updates
 * existing registry entries.
 *
 * <p>
 * A message is completed only after its event has been applied. If the update
 * throws, the message is left unacknowledged and the queue delivers it again
 * once its lock expires. Applying the same event twice leaves the registry in
 * the same state, so redelivery is harmless.
 *
 * <p>
 * Receive failures are retried with exponential backoff; the loop ends only on
 * {@link #shutdown()}.
 */
@Service
@Slf4j
public class StatusReconciler {

    private final StatusQueuePort statusQueue;
    private final StatusEventCodec codec;
    private final ProcessRegistry processRegistry;
    private final InboxProperties.ReconcilerProperties settings;
    private final AtomicBoolean running = new AtomicBoolean(false);

    private volatile Thread worker;

    public StatusReconciler(StatusQueuePort statusQueue, StatusEventCodec codec,
            ProcessRegistry processRegistry, InboxProperties properties) {
        this.statusQueue = statusQueue;
        this.codec = codec;
        this.processRegistry = processRegistry;
        this.settings = properties.getReconciler();
    }

    @PostConstruct
    public void init() {
        if (!settings.isEnabled()) {
            log.info("[Reconciler] Disabled");
            return;
        }
        start();
    }

    public void start() {
        if (!running.compareAndSet(false, true)) {
            return;
        }
        Thread thread = new Thread(this::consumeLoop, "status-reconciler");
        thread.setDaemon(true);
        worker = thread;
        thread.start();
        log.info("[Reconciler] Started (batch={}, maxWait={})", settings.getMaxBatchSize(), settings.getMaxWait());
    }

    @PreDestroy
    public void shutdown() {
        if (!running.compareAndSet(true, false)) {
            return;
        }
        Thread thread = worker;
        if (thread == null) {
            return;
        }
        try {
            thread.join(settings.getShutdownTimeout().toMillis());
            if (thread.isAlive()) {
                thread.interrupt();
                thread.join(settings.getShutdownTimeout().toMillis());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        log.info("[Reconciler] Shut down");
    }

    public boolean isRunning() {
        return running.get();
    }

    private void consumeLoop() {
        Duration backoff = settings.getInitialBackoff();
        while (running.get()) {
            try {
                List<QueueMessage> batch = statusQueue.receiveBatch(settings.getMaxBatchSize(), settings.getMaxWait());
                for (QueueMessage message : batch) {
                    handle(message);
                }
                backoff = settings.getInitialBackoff();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            } catch (RuntimeException e) {
                log.warn("[Reconciler] Receive failed, retrying in {}: {}", backoff, e.getMessage());
                if (!sleep(backoff)) {
                    break;
                }
                backoff = next(backoff);
            }
        }
        log.debug("[Reconciler] Consumer loop exited");
    }

    /**
     * Applies one queue message.
     *
     * @return {@code true} if the message was settled (completed, dropped or
     *         dead-lettered)
     */
    boolean handle(QueueMessage message) {
        ProcessStatusEvent event;
        try {
            event = codec.decode(message.body());
        } catch (MalformedStatusEventException e) {
            return settleMalformed(message, e);
        }

        try {
            boolean applied = processRegistry.update(event.processId(), event.status(), event.message());
            log.debug("[Reconciler] Process {} -> {} ({})", event.processId(), event.status().getWireValue(),
                    applied ? "applied" : "ignored, terminal");
        } catch (RuntimeException e) {
            log.warn("[Reconciler] Update failed for process {}, leaving message {} for redelivery: {}",
                    event.processId(), message.messageId(), e.getMessage());
            return false;
        }

        try {
            statusQueue.complete(message);
            return true;
        } catch (RuntimeException e) {
            log.warn("[Reconciler] Failed to complete message {}: {}", message.messageId(), e.getMessage());
            return false;
        }
    }

    private boolean settleMalformed(QueueMessage message, MalformedStatusEventException cause) {
        try {
            if (settings.getMalformedEventPolicy() == InboxProperties.MalformedEventPolicy.DROP) {
                log.warn("[Reconciler] Dropping malformed message {}: {}", message.messageId(), cause.getMessage());
                statusQueue.complete(message);
            } else {
                log.warn("[Reconciler] Dead-lettering malformed message {}: {}", message.messageId(),
                        cause.getMessage());
                statusQueue.deadLetter(message, cause.getMessage());
            }
            return true;
        } catch (RuntimeException e) {
            log.warn("[Reconciler] Failed to settle malformed message {}: {}", message.messageId(), e.getMessage());
            return false;
        }
    }

    private Duration next(Duration current) {
        Duration doubled = current.multipliedBy(2);
        return doubled.compareTo(settings.getMaxBackoff()) > 0 ? settings.getMaxBackoff() : doubled;
    }

    private boolean sleep(Duration duration) {
        try {
            Thread.sleep(duration.toMillis());
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
