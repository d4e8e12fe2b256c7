package com.whereq.foundry.store;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * In-memory home of every job. One lock guards all records, so a job's status,
 * progress and output always change together. Callbacks run inside the lock and
 * must not block on I/O.
 *
 * @author WhereQ Inc.
 */
@Slf4j
@Component
public class JobRecordStore {

    private final ReentrantLock lock = new ReentrantLock();

    // insertion order = creation order
    private final Map<String, JobRecord> records = new LinkedHashMap<>();

    /**
     * Add a new job.
     *
     * @throws IllegalStateException if the id is taken
     */
    public void register(JobRecord record) {
        lock.lock();
        try {
            if (records.containsKey(record.getId())) {
                throw new IllegalStateException("Job id collision: " + record.getId());
            }
            records.put(record.getId(), record);
        } finally {
            lock.unlock();
        }
        log.debug("Registered job {}", record.getId());
    }

    public Optional<JobSnapshot> find(String jobId) {
        lock.lock();
        try {
            JobRecord record = records.get(jobId);
            return record == null ? Optional.empty() : Optional.of(record.snapshot());
        } finally {
            lock.unlock();
        }
    }

    public boolean contains(String jobId) {
        lock.lock();
        try {
            return records.containsKey(jobId);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Run a mutation against one job atomically.
     *
     * @param jobId job identifier
     * @param mutation change to apply; its result is handed back
     * @return result of the mutation, empty if the job is unknown or the mutation returned null
     */
    public <R> Optional<R> update(String jobId, Function<JobRecord, R> mutation) {
        lock.lock();
        try {
            JobRecord record = records.get(jobId);
            return record == null ? Optional.empty() : Optional.ofNullable(mutation.apply(record));
        } finally {
            lock.unlock();
        }
    }

    /**
     * Visit every job atomically and collect the non-null results.
     */
    public <R> List<R> sweep(Function<JobRecord, R> visitor) {
        lock.lock();
        try {
            List<R> results = new ArrayList<>();
            for (JobRecord record : records.values()) {
                R result = visitor.apply(record);
                if (result != null) {
                    results.add(result);
                }
            }
            return results;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Remove a job. The returned record is no longer reachable by anyone else.
     */
    public Optional<JobRecord> remove(String jobId) {
        lock.lock();
        try {
            return Optional.ofNullable(records.remove(jobId));
        } finally {
            lock.unlock();
        }
    }

    /**
     * Remove every job whose snapshot satisfies the filter.
     *
     * @return the removed records
     */
    public List<JobRecord> removeIf(Predicate<JobSnapshot> filter) {
        lock.lock();
        try {
            List<JobRecord> removed = new ArrayList<>();
            Iterator<JobRecord> it = records.values().iterator();
            while (it.hasNext()) {
                JobRecord record = it.next();
                if (filter.test(record.snapshot())) {
                    it.remove();
                    removed.add(record);
                }
            }
            return removed;
        } finally {
            lock.unlock();
        }
    }

    public List<JobSnapshot> snapshots() {
        lock.lock();
        try {
            return records.values().stream().map(JobRecord::snapshot).toList();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Last {@code limit} output lines of a job, oldest first.
     */
    public Optional<List<String>> outputTail(String jobId, int limit) {
        lock.lock();
        try {
            JobRecord record = records.get(jobId);
            if (record == null) {
                return Optional.empty();
            }
            return Optional.of(record.outputTail(limit));
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return records.size();
        } finally {
            lock.unlock();
        }
    }
}
