package com.example.compliance.repository;

import com.example.compliance.model.Job;
import org.springframework.data.mongodb.repository.MongoRepository;

/**
 * Spring Data access to the {@code analysis_jobs} collection.
 */
public interface JobRepository extends MongoRepository<Job, String> {
}
