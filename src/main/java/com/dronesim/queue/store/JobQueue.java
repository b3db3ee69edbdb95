package com.dronesim.queue.store;

import com.dronesim.queue.exception.AlreadyQueuedException;
import com.dronesim.queue.model.QueueEntry;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * FIFO of pending job ids. A claimed id leaves the queue; two claimants never
 * receive the same id.
 */
public interface JobQueue {

    /**
     * @throws AlreadyQueuedException if {@code jobId} is already waiting in the queue
     */
    void enqueue(String jobId);

    /**
     * Removes and returns the head of the queue, waiting up to {@code timeout} for
     * an id to arrive when the queue is empty.
     */
    Optional<String> claimNext(Duration timeout) throws InterruptedException;

    /**
     * Drops a not yet claimed id.
     *
     * @return whether the id was waiting in the queue
     */
    boolean remove(String jobId);

    /**
     * Waiting entries, head first.
     */
    List<QueueEntry> pending();

    /**
     * Hint that an id may have arrived; wakes claimants blocked in {@link #claimNext}.
     */
    default void wakeUp() {
    }
}
