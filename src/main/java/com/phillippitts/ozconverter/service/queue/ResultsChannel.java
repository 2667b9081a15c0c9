package com.phillippitts.ozconverter.service.queue;

import com.phillippitts.ozconverter.service.events.JobEvent;
import com.phillippitts.ozconverter.service.events.JobEventSink;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;

/**
 * Events flowing from the workers to the coordinator.
 *
 * <p>Workers only emit; the coordinator only drains, and draining never blocks.
 */
@Component
public class ResultsChannel implements JobEventSink {

    private final BlockingQueue<JobEvent> events = new LinkedBlockingQueue<>();

    @Override
    public void emit(JobEvent event) {
        events.add(Objects.requireNonNull(event, "event"));
    }

    /**
     * Takes everything currently available without waiting.
     */
    public List<JobEvent> drain() {
        List<JobEvent> batch = new ArrayList<>();
        events.drainTo(batch);
        return batch;
    }

    public boolean isEmpty() {
        return events.isEmpty();
    }
}
