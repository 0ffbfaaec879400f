package me.golemcore.inbox.port.outbound;

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

import me.golemcore.inbox.domain.model.DeadLetter;
import me.golemcore.inbox.domain.model.QueueMessage;

import java.time.Duration;
import java.util.List;

/**
 * Port for the message queue that carries process status events. Delivery is
 * at-least-once: a received message that is not completed is delivered again.
 */
public interface StatusQueuePort {

    void send(String body);

    /**
     * Receives up to {@code maxCount} messages, waiting at most {@code maxWait}
     * for the first one. Returns an empty list when nothing arrived.
     */
    List<QueueMessage> receiveBatch(int maxCount, Duration maxWait) throws InterruptedException;

    /**
     * Acknowledges a received message so it is removed from the queue.
     */
    void complete(QueueMessage message);

    /**
     * Moves a received message to the dead-letter store.
     */
    void deadLetter(QueueMessage message, String reason);

    /**
     * Messages moved to the dead-letter store, oldest first.
     */
    List<DeadLetter> getDeadLetters();
}
