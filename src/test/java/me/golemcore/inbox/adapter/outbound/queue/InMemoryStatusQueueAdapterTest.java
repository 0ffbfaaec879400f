package me.golemcore.inbox.adapter.outbound.queue;

import me.golemcore.inbox.domain.model.QueueMessage;
import me.golemcore.inbox.infrastructure.config.InboxProperties;
import me.golemcore.inbox.testsupport.time.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class InMemoryStatusQueueAdapterTest {

    private static final Duration NO_WAIT = Duration.ZERO;

    private MutableClock clock;
    private InboxProperties properties;
    private InMemoryStatusQueueAdapter queue;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2026-03-01T12:00:00Z"));
        properties = new InboxProperties();
        properties.getQueue().setLockDuration(Duration.ofSeconds(30));
        properties.getQueue().setMaxDeliveryCount(3);
        queue = new InMemoryStatusQueueAdapter(properties, clock);
    }

    @Test
    void shouldDeliverInFifoOrder() throws Exception {
        queue.send("a");
        queue.send("b");
        queue.send("c");

        List<QueueMessage> batch = queue.receiveBatch(2, NO_WAIT);

        assertEquals(List.of("a", "b"), batch.stream().map(QueueMessage::body).toList());
        assertEquals(1, batch.get(0).deliveryCount());
        assertEquals("c", queue.receiveBatch(10, NO_WAIT).get(0).body());
    }

    @Test
    void shouldRemoveCompletedMessage() throws Exception {
        queue.send("a");
        QueueMessage message = queue.receiveBatch(1, NO_WAIT).get(0);

        queue.complete(message);

        clock.advance(Duration.ofMinutes(5));
        assertTrue(queue.receiveBatch(1, NO_WAIT).isEmpty());
    }

    @Test
    void shouldHideLockedMessageUntilLockExpires() throws Exception {
        queue.send("a");
        queue.receiveBatch(1, NO_WAIT);

        assertTrue(queue.receiveBatch(1, NO_WAIT).isEmpty());

        clock.advance(Duration.ofSeconds(31));
        List<QueueMessage> redelivered = queue.receiveBatch(1, NO_WAIT);
        assertEquals(1, redelivered.size());
        assertEquals(2, redelivered.get(0).deliveryCount());
    }

    @Test
    void shouldRejectCompleteAfterLockExpired() throws Exception {
        queue.send("a");
        QueueMessage message = queue.receiveBatch(1, NO_WAIT).get(0);
        clock.advance(Duration.ofSeconds(31));

        assertThrows(IllegalStateException.class, () -> queue.complete(message));
        assertEquals(1, queue.receiveBatch(1, NO_WAIT).size());
    }

    @Test
    void shouldRejectCompleteOfStaleDelivery() throws Exception {
        queue.send("a");
        QueueMessage first = queue.receiveBatch(1, NO_WAIT).get(0);
        clock.advance(Duration.ofSeconds(31));
        QueueMessage second = queue.receiveBatch(1, NO_WAIT).get(0);

        assertThrows(IllegalStateException.class, () -> queue.complete(first));
        queue.complete(second);
        clock.advance(Duration.ofSeconds(31));
        assertTrue(queue.receiveBatch(1, NO_WAIT).isEmpty());
    }

    @Test
    void shouldDeadLetterAfterMaxDeliveries() throws Exception {
        queue.send("poison");
        for (int i = 0; i < 3; i++) {
            assertEquals(1, queue.receiveBatch(1, NO_WAIT).size());
            clock.advance(Duration.ofSeconds(31));
        }

        assertTrue(queue.receiveBatch(1, NO_WAIT).isEmpty());
        assertEquals(1, queue.getDeadLetters().size());
        assertEquals("poison", queue.getDeadLetters().get(0).message().body());
        assertEquals(clock.instant(), queue.getDeadLetters().get(0).deadLetteredAt());
    }

    @Test
    void shouldDeadLetterOnRequest() throws Exception {
        queue.send("bad");
        QueueMessage message = queue.receiveBatch(1, NO_WAIT).get(0);

        queue.deadLetter(message, "malformed");

        assertEquals("malformed", queue.getDeadLetters().get(0).reason());
        clock.advance(Duration.ofSeconds(31));
        assertTrue(queue.receiveBatch(1, NO_WAIT).isEmpty());
    }

    @Test
    void shouldWakeReceiverWhenMessageArrives() throws Exception {
        Thread sender = new Thread(() -> {
            try {
                Thread.sleep(50);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            queue.send("late");
        });
        sender.start();

        List<QueueMessage> batch = queue.receiveBatch(1, Duration.ofSeconds(5));
        sender.join();

        assertEquals("late", batch.get(0).body());
    }

    @Test
    void shouldReturnEmptyBatchAfterWaitElapses() throws Exception {
        assertTrue(queue.receiveBatch(5, Duration.ofMillis(20)).isEmpty());
    }
}
