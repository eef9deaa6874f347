package com.ai.scheduling.service;

import com.ai.scheduling.component.SchedulingCriticalSection;
import com.ai.scheduling.dto.SchedulingEvent;
import com.ai.scheduling.entity.InterviewBooking;
import com.ai.scheduling.repository.InterviewBookingRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Emits a reminder event for each live booking taking place tomorrow, once per booking.
 */
@Service
public class ReminderService {

    private static final Logger log = LoggerFactory.getLogger(ReminderService.class);

    private final InterviewBookingRepository bookingRepository;
    private final SchedulingCriticalSection criticalSection;
    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;

    public ReminderService(InterviewBookingRepository bookingRepository,
                           SchedulingCriticalSection criticalSection,
                           ApplicationEventPublisher eventPublisher,
                           Clock clock) {
        this.bookingRepository = bookingRepository;
        this.criticalSection = criticalSection;
        this.eventPublisher = eventPublisher;
        this.clock = clock;
    }

    public int sendReminders() {
        LocalDate tomorrow = LocalDate.now(clock).plusDays(1);
        Map<String, List<Long>> dueByResource = bookingRepository
                .findByBookingDateAndStatusInAndReminderSentFalse(tomorrow, InterviewBooking.LIVE_STATUSES).stream()
                .collect(Collectors.groupingBy(InterviewBooking::getResourceId, TreeMap::new,
                        Collectors.mapping(InterviewBooking::getId, Collectors.toList())));

        int sent = 0;
        for (Map.Entry<String, List<Long>> e : dueByResource.entrySet()) {
            sent += criticalSection.execute(e.getKey(), () -> {
                int count = 0;
                for (InterviewBooking b : bookingRepository.findAllById(e.getValue())) {
                    // status or date may have moved since the scan
                    if (b.isReminderSent() || !b.isLive() || !tomorrow.equals(b.getBookingDate())) continue;
                    eventPublisher.publishEvent(SchedulingEvent.forBooking(SchedulingEvent.Type.INTERVIEW_REMINDER, b));
                    b.setReminderSent(true);
                    bookingRepository.save(b);
                    count++;
                }
                return count;
            });
        }
        log.info("Sent {} interview reminders for {}", sent, tomorrow);
        return sent;
    }
}
