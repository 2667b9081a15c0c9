package com.phillippitts.ozconverter.service.events;

import com.phillippitts.ozconverter.domain.BatchSummary;

import java.time.Instant;

/**
 * Published once when every submitted job has reached a terminal state and the queue is empty.
 *
 * @param summary final counts
 * @param timestamp when completion was detected
 */
public record BatchCompletedEvent(BatchSummary summary, Instant timestamp) {}
