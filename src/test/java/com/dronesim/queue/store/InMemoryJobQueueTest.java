package com.dronesim.queue.store;

import com.dronesim.queue.exception.AlreadyQueuedException;
import com.dronesim.queue.model.QueueEntry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryJobQueueTest {

    private InMemoryJobQueue queue;

    @BeforeEach
    void setUp() {
        queue = new InMemoryJobQueue();
    }

    @Test
    void shouldClaimInEnqueueOrder() throws Exception {
        queue.enqueue("a");
        queue.enqueue("b");
        queue.enqueue("c");

        assertEquals(Optional.of("a"), queue.claimNext(Duration.ZERO));
        assertEquals(Optional.of("b"), queue.claimNext(Duration.ZERO));
        assertEquals(Optional.of("c"), queue.claimNext(Duration.ZERO));
        assertEquals(Optional.empty(), queue.claimNext(Duration.ZERO));
    }

    @Test
    void shouldRejectDuplicateWhileQueued() {
        queue.enqueue("a");

        assertThrows(AlreadyQueuedException.class, () -> queue.enqueue("a"));
        assertEquals(1, queue.pending().size());
    }

    @Test
    void shouldAcceptIdAgainAfterClaim() throws Exception {
        queue.enqueue("a");
        queue.claimNext(Duration.ZERO);

        queue.enqueue("a");

        assertEquals(List.of("a"), queue.pending().stream().map(QueueEntry::getJobId).toList());
    }

    @Test
    void shouldTimeOutOnEmptyQueue() throws Exception {
        long start = System.nanoTime();

        Optional<String> claimed = queue.claimNext(Duration.ofMillis(100));

        assertTrue(claimed.isEmpty());
        assertTrue(System.nanoTime() - start >= TimeUnit.MILLISECONDS.toNanos(90));
    }

    @Test
    void shouldWakeBlockedClaimantOnEnqueue() throws Exception {
        ExecutorService pool = Executors.newSingleThreadExecutor();
        try {
            Future<Optional<String>> claim = pool.submit(() -> queue.claimNext(Duration.ofSeconds(10)));
            Thread.sleep(50);

            queue.enqueue("late");

            assertEquals(Optional.of("late"), claim.get(2, TimeUnit.SECONDS));
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void shouldRemoveUnclaimedEntry() throws Exception {
        queue.enqueue("a");
        queue.enqueue("b");

        assertTrue(queue.remove("a"));
        assertFalse(queue.remove("a"));

        assertEquals(Optional.of("b"), queue.claimNext(Duration.ZERO));
        assertEquals(Optional.empty(), queue.claimNext(Duration.ZERO));
    }

    @Test
    void shouldHandSingleIdToExactlyOneOfManyClaimants() throws Exception {
        int claimants = 8;
        queue.enqueue("only");
        ExecutorService pool = Executors.newFixedThreadPool(claimants);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<Optional<String>>> results = new ArrayList<>();
            for (int i = 0; i < claimants; i++) {
                Callable<Optional<String>> claim = () -> {
                    start.await();
                    return queue.claimNext(Duration.ofMillis(200));
                };
                results.add(pool.submit(claim));
            }
            start.countDown();

            int winners = 0;
            for (Future<Optional<String>> result : results) {
                Optional<String> claimed = result.get(5, TimeUnit.SECONDS);
                if (claimed.isPresent()) {
                    assertEquals("only", claimed.get());
                    winners++;
                }
            }
            assertEquals(1, winners);
        } finally {
            pool.shutdownNow();
        }
    }
}
