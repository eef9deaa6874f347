package com.ai.scheduling.service;

import com.ai.scheduling.dto.BookingRequest;
import com.ai.scheduling.dto.CandidateProfile;
import com.ai.scheduling.dto.CapacityCheck;
import com.ai.scheduling.dto.SchedulingResult;
import com.ai.scheduling.dto.SearchWindow;
import com.ai.scheduling.dto.SlotProposal;
import com.ai.scheduling.entity.AvailabilityWindow;
import com.ai.scheduling.entity.Candidate;
import com.ai.scheduling.entity.InterviewBooking;
import com.ai.scheduling.support.AbstractSchedulingIntegrationTest;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

class SlotAllocatorIntegrationTest extends AbstractSchedulingIntegrationTest {

    private static final LocalDate JUNE_3 = LocalDate.of(2024, 6, 3);

    @Autowired private SlotAllocator slotAllocator;
    @Autowired private BookingStateMachine stateMachine;

    private Candidate alice;
    private Candidate bob;

    @BeforeEach
    void setUp() {
        clock.set(LocalDateTime.of(2024, 6, 2, 10, 0));
        alice = candidate("Alice");
        bob = candidate("Bob");
    }

    private Optional<SlotProposal> find(Candidate c, LocalDate from, LocalDate to) {
        return slotAllocator.findSlot(CandidateProfile.of(c.getId()), new SearchWindow(RESOURCE, from, to));
    }

    @Nested
    @DisplayName("first-fit search")
    class FirstFit {

        @Test
        @DisplayName("earliest increment of the first window wins")
        void earliestIncrement() {
            window(JUNE_3, "14:00", "18:00");
            window(JUNE_3, "09:00", "13:00");

            SlotProposal slot = find(alice, JUNE_3, JUNE_3).orElseThrow();

            assertThat(slot.date()).isEqualTo(JUNE_3);
            assertThat(slot.startTime()).isEqualTo(LocalTime.of(9, 0));
            assertThat(slot.endTime()).isEqualTo(LocalTime.of(9, 30));
            assertThat(slot.softDenied()).isFalse();
        }

        @Test
        @DisplayName("after 09:00 is committed with a daily cap of 1 the next search finds nothing")
        void dailyCapOfOne() {
            properties.getCapacity().setMaxDailyBookings(1);
            window(JUNE_3, "09:00", "13:00");

            SlotProposal first = find(alice, JUNE_3, JUNE_3).orElseThrow();
            assertThat(stateMachine.book(BookingRequest.fromProposal(alice.getId(), first, null)).success()).isTrue();

            assertThat(find(bob, JUNE_3, JUNE_3)).isEmpty();
        }

        @Test
        @DisplayName("after 09:00 is committed with room left the next search returns 09:30")
        void nextIncrementAfterCommit() {
            window(JUNE_3, "09:00", "13:00");

            SlotProposal first = find(alice, JUNE_3, JUNE_3).orElseThrow();
            stateMachine.book(BookingRequest.fromProposal(alice.getId(), first, null));

            assertThat(find(bob, JUNE_3, JUNE_3).orElseThrow().startTime()).isEqualTo(LocalTime.of(9, 30));
        }

        @Test
        @DisplayName("increments already in the past are skipped")
        void skipsPast() {
            window(JUNE_3, "09:00", "13:00");
            clock.set(LocalDateTime.of(2024, 6, 3, 10, 10));

            assertThat(find(alice, JUNE_3, JUNE_3).orElseThrow().startTime()).isEqualTo(LocalTime.of(10, 30));
        }

        @Test
        @DisplayName("the last increment must end by the window end")
        void incrementFitsWindow() {
            window(JUNE_3, "09:00", "09:45");
            existingBooking(bob.getId(), JUNE_3, "09:00", 30, InterviewBooking.Status.SCHEDULED);

            assertThat(find(alice, JUNE_3, JUNE_3)).isEmpty();
        }
    }

    @Nested
    @DisplayName("conflicts")
    class Conflicts {

        @Test
        @DisplayName("a one-hour booking blocks both increments it covers")
        void multiIncrementOverlap() {
            window(JUNE_3, "09:00", "13:00");
            existingBooking(bob.getId(), JUNE_3, "09:00", 60, InterviewBooking.Status.CONFIRMED);

            assertThat(find(alice, JUNE_3, JUNE_3).orElseThrow().startTime()).isEqualTo(LocalTime.of(10, 0));
        }

        @Test
        @DisplayName("cancelled and no-show bookings do not occupy their slot")
        void nonLiveBookingsFreeTheSlot() {
            window(JUNE_3, "09:00", "13:00");
            existingBooking(bob.getId(), JUNE_3, "09:00", 30, InterviewBooking.Status.CANCELLED);
            existingBooking(bob.getId(), JUNE_3, "09:00", 30, InterviewBooking.Status.NO_SHOW);

            assertThat(find(alice, JUNE_3, JUNE_3).orElseThrow().startTime()).isEqualTo(LocalTime.of(9, 0));
        }

        @Test
        @DisplayName("buffer is applied between bookings when enforced")
        void enforcedBuffer() {
            properties.getCapacity().setEnforceBuffer(true);
            window(JUNE_3, "09:00", "13:00");
            existingBooking(bob.getId(), JUNE_3, "09:00", 30, InterviewBooking.Status.SCHEDULED);

            assertThat(find(alice, JUNE_3, JUNE_3).orElseThrow().startTime()).isEqualTo(LocalTime.of(10, 0));
        }

        @Test
        @DisplayName("isSlotFree honours overlap, window coverage and exclusion")
        void isSlotFree() {
            window(JUNE_3, "09:00", "13:00");
            InterviewBooking b = existingBooking(bob.getId(), JUNE_3, "10:00", 30, InterviewBooking.Status.SCHEDULED);

            assertThat(slotAllocator.isSlotFree(RESOURCE, JUNE_3, LocalTime.of(9, 0), 1)).isTrue();
            assertThat(slotAllocator.isSlotFree(RESOURCE, JUNE_3, LocalTime.of(9, 30), 2)).isFalse();
            assertThat(slotAllocator.isSlotFree(RESOURCE, JUNE_3, LocalTime.of(10, 0), 1)).isFalse();
            assertThat(slotAllocator.isSlotFree(RESOURCE, JUNE_3, LocalTime.of(12, 30), 2)).isFalse();
            assertThat(slotAllocator.isSlotFree(RESOURCE, JUNE_3, LocalTime.of(10, 0), 1, b.getId(),
                    properties.capacitySnapshot())).isTrue();
        }
    }

    @Nested
    @DisplayName("capacity ceilings")
    class Capacity {

        @Test
        @DisplayName("weekly ceiling pushes the search into the next ISO week")
        void weeklyCeiling() {
            properties.getCapacity().setMaxWeeklyBookings(2);
            window(JUNE_3, "09:00", "13:00");
            window(LocalDate.of(2024, 6, 10), "09:00", "13:00");
            existingBooking(bob.getId(), LocalDate.of(2024, 6, 4), "09:00", 30, InterviewBooking.Status.SCHEDULED);
            existingBooking(bob.getId(), LocalDate.of(2024, 6, 9), "09:00", 30, InterviewBooking.Status.CONFIRMED);

            SlotProposal slot = find(alice, JUNE_3, LocalDate.of(2024, 6, 10)).orElseThrow();

            assertThat(slot.date()).isEqualTo(LocalDate.of(2024, 6, 10));
        }

        @Test
        @DisplayName("window capacity predicate is open while any date has room")
        void windowPredicate() {
            properties.getCapacity().setMaxDailyBookings(1);
            existingBooking(bob.getId(), JUNE_3, "09:00", 30, InterviewBooking.Status.SCHEDULED);

            CapacityCheck oneDay = slotAllocator.checkCapacity(new SearchWindow(RESOURCE, JUNE_3, JUNE_3),
                    properties.capacitySnapshot());
            CapacityCheck twoDays = slotAllocator.checkCapacity(new SearchWindow(RESOURCE, JUNE_3, JUNE_3.plusDays(1)),
                    properties.capacitySnapshot());

            assertThat(oneDay.canSchedule()).isFalse();
            assertThat(twoDays.canSchedule()).isTrue();
            assertThat(twoDays.dailyRemaining()).isEqualTo(1);
        }

        @Test
        @DisplayName("capacity is counted per resource")
        void perResource() {
            properties.getCapacity().setMaxDailyBookings(1);
            bookingRepository.save(InterviewBooking.builder()
                    .candidateId(bob.getId()).resourceId("secondary").bookingDate(JUNE_3)
                    .startTime(LocalTime.of(9, 0)).durationMinutes(30).createdAt(clock.instant()).build());

            assertThat(slotAllocator.checkCapacity(RESOURCE, JUNE_3, properties.capacitySnapshot()).canSchedule())
                    .isTrue();
        }
    }

    @Nested
    @DisplayName("window filtering")
    class Windows {

        @Test
        @DisplayName("break, blocked and unavailable windows are never offered")
        void onlyOpenInterviewWindows() {
            window(JUNE_3, "09:00", "10:00", AvailabilityWindow.Kind.BREAK, true);
            window(JUNE_3, "10:00", "11:00", AvailabilityWindow.Kind.BLOCKED, true);
            window(JUNE_3, "11:00", "12:00", AvailabilityWindow.Kind.INTERVIEW, false);

            assertThat(find(alice, JUNE_3, JUNE_3)).isEmpty();
        }

        @Test
        @DisplayName("a malformed window is skipped and search continues")
        void malformedWindowSkipped() {
            window(JUNE_3, "08:00", "07:00");
            window(JUNE_3, "14:00", "15:00");

            assertThat(find(alice, JUNE_3, JUNE_3).orElseThrow().startTime()).isEqualTo(LocalTime.of(14, 0));
        }

        @Test
        @DisplayName("search never writes")
        void noSideEffects() {
            window(JUNE_3, "09:00", "13:00");

            find(alice, JUNE_3, JUNE_3);
            find(alice, JUNE_3, JUNE_3);

            assertThat(bookingRepository.count()).isZero();
        }

        @Test
        @DisplayName("booking commit and search agree on the same slot")
        void bookedSlotIsReported() {
            window(JUNE_3, "09:00", "13:00");
            SlotProposal slot = find(alice, JUNE_3, JUNE_3).orElseThrow();

            SchedulingResult result = stateMachine.book(BookingRequest.fromProposal(alice.getId(), slot, "first"));

            assertThat(result.booking().getStartTime()).isEqualTo(slot.startTime());
            assertThat(result.booking().getDurationMinutes()).isEqualTo(slot.durationMinutes());
        }
    }
}
