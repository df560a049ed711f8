package com.example.compliance.repository;

import com.example.compliance.model.Job;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.UnaryOperator;

/**
 * Job store backed by MongoDB, enabled with {@code compliance.jobs.store=mongo}.
 * <p>
 * Each job is written by the single worker thread running it, so updates only need
 * to be serialized within this process.
 */
@Repository
@ConditionalOnProperty(prefix = "compliance.jobs", name = "store", havingValue = "mongo")
public class MongoJobStore implements JobStore {

    private final JobRepository jobRepository;
    private final ReentrantLock writeLock = new ReentrantLock();

    public MongoJobStore(JobRepository jobRepository) {
        this.jobRepository = jobRepository;
    }

    @Override
    public void insert(Job job) {
        writeLock.lock();
        try {
            if (jobRepository.existsById(job.id())) {
                throw new IllegalStateException("Job id already in use: " + job.id());
            }
            jobRepository.insert(job);
        } finally {
            writeLock.unlock();
        }
    }

    @Override
    public Optional<Job> find(String id) {
        return jobRepository.findById(id);
    }

    @Override
    public Job update(String id, UnaryOperator<Job> transition) {
        writeLock.lock();
        try {
            Job current = jobRepository.findById(id)
                    .orElseThrow(() -> new NoSuchElementException("Unknown job: " + id));
            return jobRepository.save(transition.apply(current));
        } finally {
            writeLock.unlock();
        }
    }

    @Override
    public List<Job> findAll() {
        return jobRepository.findAll();
    }
}
