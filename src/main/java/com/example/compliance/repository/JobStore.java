package com.example.compliance.repository;

import com.example.compliance.model.Job;

import java.util.List;
import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * Keyed storage of analysis jobs.
 * <p>
 * Jobs are immutable values; {@link #update} replaces the stored job with the result of
 * applying a transition to it. Implementations must apply each update atomically per id.
 */
public interface JobStore {

    /**
     * Stores a new job.
     *
     * @throws IllegalStateException if a job with the same id already exists
     */
    void insert(Job job);

    Optional<Job> find(String id);

    /**
     * Replaces the job with {@code transition.apply(current)}.
     *
     * @return the stored result
     * @throws java.util.NoSuchElementException if no job has this id
     */
    Job update(String id, UnaryOperator<Job> transition);

    List<Job> findAll();
}
