package com.phillippitts.ozconverter.service.events;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Logs the outcome of each finished batch.
 */
@Component
class BatchEventsListener {
    private static final Logger LOG = LogManager.getLogger(BatchEventsListener.class);

    @EventListener
    void onBatchCompleted(BatchCompletedEvent e) {
        if (e.summary().failed() > 0) {
            LOG.warn("Batch finished with failures: {} succeeded, {} failed ({} cancelled) of {}",
                    e.summary().succeeded(), e.summary().failed(), e.summary().cancelled(), e.summary().submitted());
        } else {
            LOG.info("Batch finished: all {} job(s) succeeded", e.summary().succeeded());
        }
    }
}
