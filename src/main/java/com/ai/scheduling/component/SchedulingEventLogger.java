package com.ai.scheduling.component;

import com.ai.scheduling.dto.SchedulingEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

/**
 * Default notification sink: records every emitted event once its transaction commits.
 * A delivery channel (SMS, email, push) replaces or sits alongside this listener.
 */
@Component
public class SchedulingEventLogger {

    private static final Logger log = LoggerFactory.getLogger(SchedulingEventLogger.class);

    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT, fallbackExecution = true)
    public void onSchedulingEvent(SchedulingEvent event) {
        log.info("Scheduling event {} booking={} candidate={} payload={}",
                event.getType(), event.getBookingId(), event.getCandidateId(), event.getPayload());
    }
}
