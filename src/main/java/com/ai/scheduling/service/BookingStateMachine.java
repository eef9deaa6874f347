package com.ai.scheduling.service;

import com.ai.scheduling.component.SchedulingCriticalSection;
import com.ai.scheduling.config.CapacityConfig;
import com.ai.scheduling.config.SchedulingProperties;
import com.ai.scheduling.dto.BookingRequest;
import com.ai.scheduling.dto.CapacityCheck;
import com.ai.scheduling.dto.SchedulingEvent;
import com.ai.scheduling.dto.SchedulingResult;
import com.ai.scheduling.entity.ConversionEvent;
import com.ai.scheduling.entity.InterviewBooking;
import com.ai.scheduling.entity.InterviewBooking.Status;
import com.ai.scheduling.entity.QueueEntry;
import com.ai.scheduling.exception.SchedulingIntegrityException;
import com.ai.scheduling.repository.AvailabilityWindowRepository;
import com.ai.scheduling.repository.CandidateRepository;
import com.ai.scheduling.repository.InterviewBookingRepository;
import com.ai.scheduling.repository.QueueEntryRepository;
import org.apache.commons.lang3.RandomStringUtils;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Owns the booking lifecycle: creation, status transitions and reschedule.
 * Every mutation runs inside the booking's resource critical section.
 */
@Service
public class BookingStateMachine {

    private static final Logger log = LoggerFactory.getLogger(BookingStateMachine.class);

    private static final Map<Status, Set<Status>> TRANSITIONS = new EnumMap<>(Status.class);

    static {
        TRANSITIONS.put(Status.SCHEDULED, EnumSet.of(Status.CONFIRMED, Status.CANCELLED, Status.NO_SHOW));
        TRANSITIONS.put(Status.CONFIRMED, EnumSet.of(Status.COMPLETED, Status.CANCELLED, Status.NO_SHOW));
        TRANSITIONS.put(Status.COMPLETED, EnumSet.noneOf(Status.class));
        TRANSITIONS.put(Status.CANCELLED, EnumSet.noneOf(Status.class));
        TRANSITIONS.put(Status.NO_SHOW, EnumSet.noneOf(Status.class));
    }

    private final InterviewBookingRepository bookingRepository;
    private final CandidateRepository candidateRepository;
    private final AvailabilityWindowRepository windowRepository;
    private final QueueEntryRepository queueRepository;
    private final SlotAllocator slotAllocator;
    private final SchedulingCriticalSection criticalSection;
    private final ControlSwitch controlSwitch;
    private final ConversionTracker conversionTracker;
    private final ApplicationEventPublisher eventPublisher;
    private final SchedulingProperties properties;
    private final Clock clock;

    public BookingStateMachine(InterviewBookingRepository bookingRepository,
                               CandidateRepository candidateRepository,
                               AvailabilityWindowRepository windowRepository,
                               QueueEntryRepository queueRepository,
                               SlotAllocator slotAllocator,
                               SchedulingCriticalSection criticalSection,
                               ControlSwitch controlSwitch,
                               ConversionTracker conversionTracker,
                               ApplicationEventPublisher eventPublisher,
                               SchedulingProperties properties,
                               Clock clock) {
        this.bookingRepository = bookingRepository;
        this.candidateRepository = candidateRepository;
        this.windowRepository = windowRepository;
        this.queueRepository = queueRepository;
        this.slotAllocator = slotAllocator;
        this.criticalSection = criticalSection;
        this.controlSwitch = controlSwitch;
        this.conversionTracker = conversionTracker;
        this.eventPublisher = eventPublisher;
        this.properties = properties;
        this.clock = clock;
    }

    public static boolean isLegal(Status from, Status to) {
        return TRANSITIONS.getOrDefault(from, Set.of()).contains(to);
    }

    /**
     * Books an explicit slot. Freedom and capacity are re-checked inside the
     * resource's critical section; a lost race is retried once.
     */
    public SchedulingResult book(BookingRequest request) {
        validate(request);
        CapacityConfig config = properties.capacitySnapshot();
        return criticalSection.executeWithRetry(request.resourceId(), "book",
                () -> bookWithinSection(request, config));
    }

    /**
     * Commits a booking. Caller must already hold the critical section for
     * {@code request.resourceId()}.
     */
    SchedulingResult bookWithinSection(BookingRequest request, CapacityConfig config) {
        if (controlSwitch.isStopped()) {
            return SchedulingResult.policyViolation(SchedulingResult.Reason.SCHEDULING_PAUSED, "Scheduling is stopped.");
        }
        if (!candidateRepository.existsById(request.candidateId())) {
            log.error("Booking refused: candidate {} does not exist", request.candidateId());
            throw new SchedulingIntegrityException("Candidate " + request.candidateId() + " does not exist");
        }
        if (!windowRepository.existsByResourceId(request.resourceId())) {
            log.error("Booking refused: resource {} has no availability on record", request.resourceId());
            throw new SchedulingIntegrityException("Resource " + request.resourceId() + " does not exist");
        }
        if (LocalDateTime.of(request.date(), request.startTime()).isBefore(LocalDateTime.now(clock))) {
            return SchedulingResult.policyViolation(SchedulingResult.Reason.SLOT_IN_PAST,
                    "Cannot book a slot in the past.");
        }
        if (!slotAllocator.isSlotFree(request.resourceId(), request.date(), request.startTime(), 1, null, config)) {
            return SchedulingResult.conflict(SchedulingResult.Reason.SLOT_TAKEN,
                    "Slot " + request.date() + " " + request.startTime() + " is not available.");
        }
        CapacityCheck capacity = slotAllocator.checkCapacity(request.resourceId(), request.date(), config);
        if (!capacity.canSchedule()) {
            return SchedulingResult.policyViolation(capacityReason(capacity), capacity.reason());
        }

        InterviewBooking booking = InterviewBooking.builder()
                .candidateId(request.candidateId())
                .resourceId(request.resourceId())
                .bookingDate(request.date())
                .startTime(request.startTime())
                .durationMinutes(config.slotDurationMinutes())
                .status(Status.SCHEDULED)
                .interviewType(request.interviewType() != null
                        ? request.interviewType() : InterviewBooking.InterviewType.ONBOARDING)
                .meetingReference(meetingLink())
                .notes(StringUtils.trimToNull(request.notes()))
                .createdAt(clock.instant())
                .build();
        booking = bookingRepository.saveAndFlush(booking);

        eventPublisher.publishEvent(SchedulingEvent.forBooking(SchedulingEvent.Type.BOOKING_SCHEDULED, booking));
        // confirmation event emitted; delivery is up to the listeners
        booking.setConfirmationSent(true);
        booking = bookingRepository.save(booking);
        log.info("Booked interview {} for candidate {} on {} {} with {}", booking.getId(), booking.getCandidateId(),
                booking.getBookingDate(), booking.getStartTime(), booking.getResourceId());
        return SchedulingResult.success(booking);
    }

    /**
     * Moves a booking along its lifecycle. Re-applying the current status is a
     * successful no-op; any other transition outside the lifecycle is a policy violation.
     */
    public SchedulingResult transition(Long bookingId, Status target, String notes) {
        if (bookingId == null || target == null) {
            throw new IllegalArgumentException("bookingId and target status are required");
        }
        Optional<String> resourceId = bookingRepository.findById(bookingId).map(InterviewBooking::getResourceId);
        if (resourceId.isEmpty()) {
            return SchedulingResult.notFound(SchedulingResult.Reason.BOOKING_NOT_FOUND, "Booking not found.");
        }
        return criticalSection.executeWithRetry(resourceId.get(), "transition",
                () -> applyTransition(bookingId, target, notes));
    }

    private SchedulingResult applyTransition(Long bookingId, Status target, String notes) {
        InterviewBooking booking = bookingRepository.findByIdForUpdate(bookingId).orElse(null);
        if (booking == null) {
            return SchedulingResult.notFound(SchedulingResult.Reason.BOOKING_NOT_FOUND, "Booking not found.");
        }
        Status current = booking.getStatus();
        if (current == target) {
            log.debug("Booking {} already {}, ignoring duplicate trigger", bookingId, target);
            return SchedulingResult.unchanged(booking);
        }
        if (!isLegal(current, target)) {
            return SchedulingResult.policyViolation(SchedulingResult.Reason.ILLEGAL_TRANSITION,
                    "Cannot move booking from " + current + " to " + target + ".");
        }

        booking.setStatus(target);
        if (target == Status.COMPLETED) {
            booking.setCompletedAt(clock.instant());
        }
        if (StringUtils.isNotBlank(notes)) {
            booking.setNotes(appendNote(booking.getNotes(), notes.trim()));
        }
        booking.syncLiveSlotKey();
        booking = bookingRepository.saveAndFlush(booking);

        if (target == Status.COMPLETED) {
            conversionTracker.record(booking.getCandidateId(), ConversionEvent.Stage.INTERVIEWED,
                    "interview_completed", "Interview " + booking.getId() + " completed");
            queueRepository.findFirstByCandidateIdAndStatusInOrderByAddedAtDesc(
                            booking.getCandidateId(), EnumSet.of(QueueEntry.Status.SCHEDULED))
                    .ifPresent(entry -> {
                        entry.setStatus(QueueEntry.Status.PROCESSED);
                        queueRepository.save(entry);
                    });
        }
        eventPublisher.publishEvent(SchedulingEvent.forBooking(SchedulingEvent.forStatus(target), booking));
        log.info("Booking {} {} -> {}", bookingId, current, target);
        return SchedulingResult.success(booking);
    }

    /**
     * Moves a live booking to a new date and time. Refused once the booking is
     * within the reschedule lock (24h by default) of its current start.
     */
    public SchedulingResult reschedule(Long bookingId, LocalDate newDate, LocalTime newTime, String reason) {
        if (bookingId == null || newDate == null || newTime == null) {
            throw new IllegalArgumentException("bookingId, newDate and newTime are required");
        }
        Optional<String> resourceId = bookingRepository.findById(bookingId).map(InterviewBooking::getResourceId);
        if (resourceId.isEmpty()) {
            return SchedulingResult.notFound(SchedulingResult.Reason.BOOKING_NOT_FOUND, "Booking not found.");
        }
        CapacityConfig config = properties.capacitySnapshot();
        return criticalSection.executeWithRetry(resourceId.get(), "reschedule",
                () -> applyReschedule(bookingId, newDate, newTime.withSecond(0).withNano(0), reason, config));
    }

    private SchedulingResult applyReschedule(Long bookingId, LocalDate newDate, LocalTime newTime, String reason,
                                             CapacityConfig config) {
        InterviewBooking booking = bookingRepository.findByIdForUpdate(bookingId).orElse(null);
        if (booking == null) {
            return SchedulingResult.notFound(SchedulingResult.Reason.BOOKING_NOT_FOUND, "Booking not found.");
        }
        if (!booking.isLive()) {
            return SchedulingResult.policyViolation(SchedulingResult.Reason.NOT_RESCHEDULABLE,
                    "Only scheduled or confirmed interviews can be rescheduled.");
        }
        LocalDateTime now = LocalDateTime.now(clock);
        int lockHours = properties.getBooking().getRescheduleLockHours();
        if (!now.isBefore(booking.startsAt().minusHours(lockHours))) {
            return SchedulingResult.policyViolation(SchedulingResult.Reason.RESCHEDULE_LOCKED,
                    "Interviews cannot be rescheduled within " + lockHours + " hours of the start time.");
        }
        if (LocalDateTime.of(newDate, newTime).isBefore(now)) {
            return SchedulingResult.policyViolation(SchedulingResult.Reason.SLOT_IN_PAST,
                    "Cannot reschedule to a time in the past.");
        }
        if (newDate.equals(booking.getBookingDate()) && newTime.equals(booking.getStartTime())) {
            return SchedulingResult.unchanged(booking);
        }

        int slots = Math.max(1, (booking.getDurationMinutes() + config.slotDurationMinutes() - 1)
                / config.slotDurationMinutes());
        if (!slotAllocator.isSlotFree(booking.getResourceId(), newDate, newTime, slots, booking.getId(), config)) {
            return SchedulingResult.conflict(SchedulingResult.Reason.SLOT_TAKEN,
                    "Slot " + newDate + " " + newTime + " is not available.");
        }
        boolean dateChanges = !newDate.equals(booking.getBookingDate());
        boolean weekChanges = !newDate.with(DayOfWeek.MONDAY).equals(booking.getBookingDate().with(DayOfWeek.MONDAY));
        if (dateChanges) {
            CapacityCheck capacity = slotAllocator.checkCapacity(booking.getResourceId(), newDate, config);
            if (capacity.dailyRemaining() == 0) {
                return SchedulingResult.policyViolation(SchedulingResult.Reason.DAILY_CAPACITY_REACHED, capacity.reason());
            }
            if (weekChanges && capacity.weeklyRemaining() == 0) {
                return SchedulingResult.policyViolation(SchedulingResult.Reason.WEEKLY_CAPACITY_REACHED, capacity.reason());
            }
        }

        String previousDate = booking.getBookingDate().toString();
        String previousTime = booking.getStartTime().toString();
        booking.setBookingDate(newDate);
        booking.setStartTime(newTime);
        booking.setReminderSent(false);
        booking.setNotes(appendNote(booking.getNotes(),
                "Rescheduled: " + StringUtils.defaultIfBlank(reason, "no reason given")));
        booking.syncLiveSlotKey();
        booking = bookingRepository.saveAndFlush(booking);

        LocalDateTime scheduledFor = booking.startsAt();
        queueRepository.findFirstByCandidateIdAndStatusInOrderByAddedAtDesc(
                        booking.getCandidateId(), EnumSet.of(QueueEntry.Status.SCHEDULED))
                .ifPresent(entry -> {
                    entry.setScheduledFor(scheduledFor);
                    queueRepository.save(entry);
                });

        eventPublisher.publishEvent(SchedulingEvent.rescheduled(booking, previousDate, previousTime));
        log.info("Booking {} rescheduled from {} {} to {} {}", bookingId, previousDate, previousTime, newDate, newTime);
        return SchedulingResult.success(booking);
    }

    @Transactional(readOnly = true)
    public Optional<InterviewBooking> findBooking(Long bookingId) {
        return bookingRepository.findById(bookingId);
    }

    @Transactional(readOnly = true)
    public List<InterviewBooking> bookingsForCandidate(Long candidateId) {
        return bookingRepository.findByCandidateIdOrderByBookingDateDescStartTimeDesc(candidateId);
    }

    private String meetingLink() {
        return StringUtils.removeEnd(properties.getBooking().getMeetingBaseUrl(), "/")
                + "/" + RandomStringUtils.randomAlphanumeric(12).toLowerCase();
    }

    private static SchedulingResult.Reason capacityReason(CapacityCheck capacity) {
        return capacity.dailyRemaining() == 0
                ? SchedulingResult.Reason.DAILY_CAPACITY_REACHED
                : SchedulingResult.Reason.WEEKLY_CAPACITY_REACHED;
    }

    private static String appendNote(String existing, String note) {
        String combined = StringUtils.isBlank(existing) ? note : existing + "\n" + note;
        return StringUtils.abbreviate(combined, 2000);
    }

    private static void validate(BookingRequest request) {
        if (request == null || request.candidateId() == null || StringUtils.isBlank(request.resourceId())
                || request.date() == null || request.startTime() == null) {
            throw new IllegalArgumentException("candidateId, resourceId, date and startTime are required");
        }
    }
}
