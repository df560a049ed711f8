package com.example.compliance.repository;

import com.example.compliance.model.Job;
import com.example.compliance.model.JobStatus;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.NoSuchElementException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class InMemoryJobStoreTest {

    private final InMemoryJobStore store = new InMemoryJobStore();

    @Test
    @DisplayName("Insert rejects a duplicate id")
    void insertRejectsDuplicate() {
        store.insert(Job.pending("job-1", "a.pdf", Instant.EPOCH));

        assertThrows(IllegalStateException.class, () -> store.insert(Job.pending("job-1", "b.pdf", Instant.EPOCH)));
        assertEquals("a.pdf", store.find("job-1").orElseThrow().documentName());
    }

    @Test
    @DisplayName("Update applies the transition and stores the result")
    void updateAppliesTransition() {
        store.insert(Job.pending("job-1", "a.pdf", Instant.EPOCH));

        Job updated = store.update("job-1", Job::processing);

        assertEquals(JobStatus.PROCESSING, updated.status());
        assertEquals(JobStatus.PROCESSING, store.find("job-1").orElseThrow().status());
    }

    @Test
    @DisplayName("Unknown ids are absent and cannot be updated")
    void unknownJob() {
        assertTrue(store.find("missing").isEmpty());
        assertThrows(NoSuchElementException.class, () -> store.update("missing", Job::processing));
    }

    @Test
    @DisplayName("A failed transition leaves the stored job unchanged")
    void failedTransitionKeepsJob() {
        store.insert(Job.pending("job-1", "a.pdf", Instant.EPOCH).failed("boom", Instant.EPOCH));

        assertThrows(IllegalStateException.class, () -> store.update("job-1", Job::processing));
        assertEquals(JobStatus.FAILED, store.find("job-1").orElseThrow().status());
    }

    @Test
    @DisplayName("findAll lists jobs by creation time")
    void findAllOrdersByCreation() {
        store.insert(Job.pending("late", "b", Instant.ofEpochSecond(20)));
        store.insert(Job.pending("early", "a", Instant.ofEpochSecond(10)));

        assertThat(store.findAll()).extracting(Job::id).containsExactly("early", "late");
    }
}
