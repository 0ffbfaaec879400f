package me.golemcore.inbox.adapter.outbound.queue;

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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.inbox.domain.model.DeadLetter;
import me.golemcore.inbox.domain.model.QueueMessage;
import me.golemcore.inbox.infrastructure.config.InboxProperties;
import me.golemcore.inbox.port.outbound.StatusQueuePort;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * In-process status queue with peek-lock semantics.
 *
 * <p>
 * A received message stays locked for {@code inbox.queue.lock-duration}. If it
 * is neither completed nor dead-lettered by then, it becomes available again
 * with a higher delivery count. A message delivered more than
 * {@code inbox.queue.max-delivery-count} times is moved to the dead-letter
 * store, which is kept in memory for inspection.
 */
@Component
@Slf4j
public class InMemoryStatusQueueAdapter implements StatusQueuePort {

    private static final long MAX_IDLE_WAIT_NANOS = TimeUnit.MILLISECONDS.toNanos(200);

    private final Clock clock;
    private final String queueName;
    private final Duration lockDuration;
    private final int maxDeliveryCount;

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition available = lock.newCondition();
    private final Deque<Entry> ready = new ArrayDeque<>();
    private final Map<String, Entry> inflight = new LinkedHashMap<>();
    private final List<DeadLetter> deadLetters = new ArrayList<>();

    public InMemoryStatusQueueAdapter(InboxProperties properties, Clock clock) {
        InboxProperties.QueueProperties queue = properties.getQueue();
        this.clock = clock;
        this.queueName = queue.getName();
        this.lockDuration = queue.getLockDuration();
        this.maxDeliveryCount = queue.getMaxDeliveryCount();
    }

    @Override
    public void send(String body) {
        if (body == null) {
            throw new IllegalArgumentException("Message body must not be null");
        }
        Entry entry = new Entry(UUID.randomUUID().toString(), body, clock.instant());
        lock.lock();
        try {
            ready.addLast(entry);
            available.signal();
        } finally {
            lock.unlock();
        }
        log.trace("[Queue:{}] Enqueued message {}", queueName, entry.messageId);
    }

    @Override
    public List<QueueMessage> receiveBatch(int maxCount, Duration maxWait) throws InterruptedException {
        if (maxCount <= 0) {
            return List.of();
        }
        long remaining = maxWait.toNanos();
        lock.lockInterruptibly();
        try {
            releaseExpiredLocks();
            while (ready.isEmpty() && remaining > 0) {
                // wake up periodically so expired locks are released while idle
                long waited = Math.min(remaining, MAX_IDLE_WAIT_NANOS);
                long left = available.awaitNanos(waited);
                remaining -= waited - Math.max(left, 0);
                releaseExpiredLocks();
            }

            List<QueueMessage> batch = new ArrayList<>();
            Instant lockedUntil = clock.instant().plus(lockDuration);
            while (batch.size() < maxCount && !ready.isEmpty()) {
                Entry entry = ready.pollFirst();
                entry.deliveryCount++;
                if (entry.deliveryCount > maxDeliveryCount) {
                    deadLetters.add(new DeadLetter(entry.toMessage(), "Max delivery count exceeded", clock.instant()));
                    log.warn("[Queue:{}] Message {} exceeded {} deliveries, dead-lettered",
                            queueName, entry.messageId, maxDeliveryCount);
                    continue;
                }
                entry.lockedUntil = lockedUntil;
                inflight.put(entry.messageId, entry);
                batch.add(entry.toMessage());
            }
            return batch;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void complete(QueueMessage message) {
        lock.lock();
        try {
            takeLocked(message);
        } finally {
            lock.unlock();
        }
        log.trace("[Queue:{}] Completed message {}", queueName, message.messageId());
    }

    @Override
    public void deadLetter(QueueMessage message, String reason) {
        lock.lock();
        try {
            Entry entry = takeLocked(message);
            deadLetters.add(new DeadLetter(entry.toMessage(), reason, clock.instant()));
        } finally {
            lock.unlock();
        }
        log.info("[Queue:{}] Dead-lettered message {}: {}", queueName, message.messageId(), reason);
    }

    @Override
    public List<DeadLetter> getDeadLetters() {
        lock.lock();
        try {
            return List.copyOf(deadLetters);
        } finally {
            lock.unlock();
        }
    }

    private Entry takeLocked(QueueMessage message) {
        Entry entry = inflight.get(message.messageId());
        if (entry == null || entry.deliveryCount != message.deliveryCount()) {
            throw new IllegalStateException("Lock lost for message " + message.messageId());
        }
        if (clock.instant().isAfter(entry.lockedUntil)) {
            inflight.remove(entry.messageId);
            entry.lockedUntil = null;
            ready.addFirst(entry);
            available.signal();
            throw new IllegalStateException("Lock expired for message " + message.messageId());
        }
        inflight.remove(entry.messageId);
        return entry;
    }

    private void releaseExpiredLocks() {
        Instant now = clock.instant();
        Iterator<Entry> iterator = inflight.values().iterator();
        while (iterator.hasNext()) {
            Entry entry = iterator.next();
            if (now.isAfter(entry.lockedUntil)) {
                iterator.remove();
                entry.lockedUntil = null;
                ready.addLast(entry);
                log.debug("[Queue:{}] Lock expired for message {}, redelivering", queueName, entry.messageId);
            }
        }
    }

    private static final class Entry {

        private final String messageId;
        private final String body;
        private final Instant enqueuedAt;
        private int deliveryCount;
        private Instant lockedUntil;

        private Entry(String messageId, String body, Instant enqueuedAt) {
            this.messageId = messageId;
            this.body = body;
            this.enqueuedAt = enqueuedAt;
        }

        private QueueMessage toMessage() {
            return new QueueMessage(messageId, body, deliveryCount, enqueuedAt);
        }
    }
}
