package com.dronesim.queue.store;

import com.dronesim.queue.exception.ConflictException;
import com.dronesim.queue.exception.JobNotFoundException;
import com.dronesim.queue.model.Job;

import java.util.List;
import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * Persistence for job records keyed by job id.
 *
 * <p>Records handed out are copies; mutating them has no effect on the store.
 * All state transitions go through {@link #compareAndUpdate}.</p>
 */
public interface JobStore {

    /**
     * Inserts or fully replaces the record with the job's id.
     */
    void put(Job job);

    /**
     * Inserts the record unless one with the same id already exists. The check and
     * the write are one atomic step.
     *
     * @return whether the record was inserted
     */
    boolean insert(Job job);

    Optional<Job> get(String id);

    /**
     * All records, in no particular order.
     */
    List<Job> list();

    /**
     * @throws JobNotFoundException if no record exists for {@code id}
     */
    void delete(String id);

    /**
     * Applies {@code mutation} to a copy of the current record and writes the result
     * back only if no other writer changed the record in between. Exceptions thrown by
     * the mutation propagate and nothing is written.
     *
     * @return the record as written
     * @throws JobNotFoundException if no record exists for {@code id}
     * @throws ConflictException    if a concurrent write won the race
     */
    Job compareAndUpdate(String id, UnaryOperator<Job> mutation);
}
