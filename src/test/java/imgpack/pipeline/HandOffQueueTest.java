package imgpack.pipeline;

import org.junit.jupiter.api.*;

import java.util.*;
import java.util.concurrent.*;
import java.util.concurrent.atomic.*;

import static org.junit.jupiter.api.Assertions.*;

class HandOffQueueTest {

    @Test
    void deliversInOrderThenSignalsEndRepeatedly() throws InterruptedException {
        HandOffQueue<String> queue = new HandOffQueue<>(3);
        queue.put("a");
        queue.put("b");
        queue.close();

        assertEquals("a", queue.take());
        assertEquals("b", queue.take());
        assertNull(queue.take());
        assertNull(queue.take());
    }

    @Test
    void rejectsPutAfterClose() throws InterruptedException {
        HandOffQueue<String> queue = new HandOffQueue<>(1);
        queue.close();

        assertThrows(IllegalStateException.class, () -> queue.put("late"));
        assertTrue(queue.isClosed());
    }

    @Test
    void nullItemsCannotBeConfusedWithEndOfStream() throws InterruptedException {
        HandOffQueue<String> queue = new HandOffQueue<>(2);

        assertThrows(NullPointerException.class, () -> queue.put(null));
        queue.put("only");
        queue.close();

        assertEquals(1, queue.size());
        assertEquals("only", queue.take());
        assertEquals(0, queue.size());
        assertNull(queue.take());
    }

    @Test
    void rejectsNonPositiveCapacity() {
        assertThrows(IllegalArgumentException.class, () -> new HandOffQueue<String>(0));
    }

    @Test
    void producerBlocksWhileFull() throws Exception {
        HandOffQueue<String> queue = new HandOffQueue<>(1);
        queue.put("first");
        CountDownLatch secondPut = new CountDownLatch(1);

        Thread producer = new Thread(() -> {
            try {
                queue.put("second");
                secondPut.countDown();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        });
        producer.start();

        assertFalse(secondPut.await(200, TimeUnit.MILLISECONDS));
        assertEquals(1, queue.size());
        assertEquals("first", queue.take());
        assertTrue(secondPut.await(5, TimeUnit.SECONDS));
        assertEquals("second", queue.take());
        producer.join(5_000);
    }

    @Test
    void everyConsumerSeesEndOfStream() throws Exception {
        HandOffQueue<Integer> queue = new HandOffQueue<>(2);
        AtomicInteger consumed = new AtomicInteger();
        ExecutorService consumers = Executors.newFixedThreadPool(3);
        List<Future<?>> loops = new ArrayList<>();
        for (int i = 0; i < 3; i++) {
            loops.add(consumers.submit(() -> {
                while (queue.take() != null) {
                    consumed.incrementAndGet();
                }
                return null;
            }));
        }

        for (int i = 0; i < 10; i++) {
            queue.put(i);
            assertTrue(queue.size() <= queue.capacity());
        }
        queue.close();

        for (Future<?> loop : loops) {
            loop.get(5, TimeUnit.SECONDS);
        }
        consumers.shutdown();
        assertEquals(10, consumed.get());
    }
}
