package com.phillippitts.ozconverter.service.queue;

import com.phillippitts.ozconverter.domain.JobDescriptor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;

/**
 * Unbounded FIFO of jobs shared by the coordinator (producer) and all workers (consumers).
 *
 * <p>Shutdown uses a sentinel entry: a worker that dequeues one exits its loop. The pool
 * enqueues exactly one sentinel per live worker, after any jobs already queued.
 */
@Component
public class JobQueue {

    private static final Entry SENTINEL = new Entry(null);

    private final BlockingQueue<Entry> queue = new LinkedBlockingQueue<>();

    private record Entry(JobDescriptor job) {
        boolean isSentinel() {
            return job == null;
        }
    }

    public void put(JobDescriptor job) {
        Objects.requireNonNull(job, "job");
        queue.add(new Entry(job));
    }

    public void putSentinel() {
        queue.add(SENTINEL);
    }

    /**
     * Blocks until a job or a sentinel is available.
     *
     * @return the next job, or empty when the caller should stop
     * @throws InterruptedException if interrupted while waiting
     */
    public Optional<JobDescriptor> take() throws InterruptedException {
        Entry entry = queue.take();
        return entry.isSentinel() ? Optional.empty() : Optional.of(entry.job());
    }

    /**
     * Removes every job not yet taken by a worker. Sentinels stay in place.
     *
     * @return the removed jobs in queue order
     */
    public List<JobDescriptor> drainPending() {
        List<JobDescriptor> dropped = new ArrayList<>();
        queue.removeIf(entry -> {
            if (entry.isSentinel()) {
                return false;
            }
            dropped.add(entry.job());
            return true;
        });
        return dropped;
    }

    /**
     * Jobs waiting to be taken, sentinels excluded.
     */
    public int pendingJobs() {
        int count = 0;
        for (Entry entry : queue) {
            if (!entry.isSentinel()) {
                count++;
            }
        }
        return count;
    }

    public boolean hasPendingJobs() {
        return pendingJobs() > 0;
    }
}
