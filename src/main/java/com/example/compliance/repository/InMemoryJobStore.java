package com.example.compliance.repository;

import com.example.compliance.model.Job;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

import java.util.Comparator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.UnaryOperator;

/**
 * Process-local job store; jobs are lost on restart.
 */
@Repository
@ConditionalOnProperty(prefix = "compliance.jobs", name = "store", havingValue = "memory", matchIfMissing = true)
public class InMemoryJobStore implements JobStore {

    private final ConcurrentMap<String, Job> jobs = new ConcurrentHashMap<>();

    @Override
    public void insert(Job job) {
        if (jobs.putIfAbsent(job.id(), job) != null) {
            throw new IllegalStateException("Job id already in use: " + job.id());
        }
    }

    @Override
    public Optional<Job> find(String id) {
        return Optional.ofNullable(jobs.get(id));
    }

    @Override
    public Job update(String id, UnaryOperator<Job> transition) {
        Job updated = jobs.computeIfPresent(id, (key, current) -> transition.apply(current));
        if (updated == null) {
            throw new NoSuchElementException("Unknown job: " + id);
        }
        return updated;
    }

    @Override
    public List<Job> findAll() {
        return jobs.values().stream()
                .sorted(Comparator.comparing(Job::createdAt, Comparator.nullsLast(Comparator.naturalOrder())))
                .toList();
    }
}
