package com.ai.scheduling.controller;

import com.ai.scheduling.config.SchedulingProperties;
import com.ai.scheduling.dto.BookingRequest;
import com.ai.scheduling.dto.CandidateProfile;
import com.ai.scheduling.dto.ControlState;
import com.ai.scheduling.dto.CycleResult;
import com.ai.scheduling.dto.RiskProfile;
import com.ai.scheduling.dto.SchedulingAnalytics;
import com.ai.scheduling.dto.SchedulingResult;
import com.ai.scheduling.dto.SchedulingStatus;
import com.ai.scheduling.dto.SearchWindow;
import com.ai.scheduling.entity.ConversionEvent;
import com.ai.scheduling.entity.InterviewBooking;
import com.ai.scheduling.entity.InterviewPerformance;
import com.ai.scheduling.entity.QueueEntry;
import com.ai.scheduling.exception.SchedulingIntegrityException;
import com.ai.scheduling.service.BookingStateMachine;
import com.ai.scheduling.service.ControlSwitch;
import com.ai.scheduling.service.ConversionTracker;
import com.ai.scheduling.service.InterviewQueueService;
import com.ai.scheduling.service.QueueProcessor;
import com.ai.scheduling.service.RiskOptimizer;
import com.ai.scheduling.service.SchedulingAnalyticsService;
import com.ai.scheduling.service.SlotAllocator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.LocalDate;
import java.time.LocalTime;
import java.util.List;
import java.util.Map;

/**
 * REST surface over the scheduling engine. Holds no logic of its own beyond
 * mapping outcomes to HTTP status codes.
 */
@RestController
@RequestMapping("/api/v1/scheduling")
public class SchedulingController {

    private static final Logger log = LoggerFactory.getLogger(SchedulingController.class);

    private final QueueProcessor queueProcessor;
    private final SlotAllocator slotAllocator;
    private final BookingStateMachine stateMachine;
    private final InterviewQueueService queueService;
    private final ControlSwitch controlSwitch;
    private final RiskOptimizer riskOptimizer;
    private final ConversionTracker conversionTracker;
    private final SchedulingAnalyticsService analyticsService;
    private final SchedulingProperties properties;

    public SchedulingController(QueueProcessor queueProcessor,
                                SlotAllocator slotAllocator,
                                BookingStateMachine stateMachine,
                                InterviewQueueService queueService,
                                ControlSwitch controlSwitch,
                                RiskOptimizer riskOptimizer,
                                ConversionTracker conversionTracker,
                                SchedulingAnalyticsService analyticsService,
                                SchedulingProperties properties) {
        this.queueProcessor = queueProcessor;
        this.slotAllocator = slotAllocator;
        this.stateMachine = stateMachine;
        this.queueService = queueService;
        this.controlSwitch = controlSwitch;
        this.riskOptimizer = riskOptimizer;
        this.conversionTracker = conversionTracker;
        this.analyticsService = analyticsService;
        this.properties = properties;
    }

    public record EnqueueRequest(Long candidateId, Double priority, List<String> preferredTimes) {}

    public record StatusRequest(InterviewBooking.Status status, String notes) {}

    public record RescheduleRequest(LocalDate date, LocalTime time, String reason) {}

    @PostMapping("/cycle")
    public ResponseEntity<CycleResult> runCycle() {
        CycleResult result = queueProcessor.runCycle();
        return ResponseEntity.status(result.rejected() ? HttpStatus.CONFLICT : HttpStatus.OK).body(result);
    }

    @GetMapping("/slots")
    public ResponseEntity<?> findSlot(@RequestParam Long candidateId,
                                      @RequestParam(required = false) String resourceId,
                                      @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate from,
                                      @RequestParam(required = false) Integer days) {
        String resource = resourceId != null ? resourceId : properties.getDefaultResourceId();
        SearchWindow window = SearchWindow.days(resource, from, days != null ? days : properties.getSearchDays());
        return slotAllocator.findSlot(CandidateProfile.of(candidateId), window)
                .<ResponseEntity<?>>map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.status(HttpStatus.NOT_FOUND)
                        .body(Map.of("message", "No slot available in the requested window.")));
    }

    @PostMapping("/queue")
    public QueueEntry enqueue(@RequestBody EnqueueRequest request) {
        return queueService.enqueue(request.candidateId(), request.priority(), request.preferredTimes());
    }

    @GetMapping("/queue")
    public Map<QueueEntry.Status, Long> queueCounts() {
        return queueService.statusCounts();
    }

    @PostMapping("/bookings")
    public ResponseEntity<SchedulingResult> book(@RequestBody BookingRequest request) {
        return toResponse(stateMachine.book(request));
    }

    @GetMapping("/bookings/{id}")
    public ResponseEntity<InterviewBooking> booking(@PathVariable Long id) {
        return stateMachine.findBooking(id)
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    @PatchMapping("/bookings/{id}/status")
    public ResponseEntity<SchedulingResult> transition(@PathVariable Long id, @RequestBody StatusRequest request) {
        return toResponse(stateMachine.transition(id, request.status(), request.notes()));
    }

    @PatchMapping("/bookings/{id}/reschedule")
    public ResponseEntity<SchedulingResult> reschedule(@PathVariable Long id, @RequestBody RescheduleRequest request) {
        return toResponse(stateMachine.reschedule(id, request.date(), request.time(), request.reason()));
    }

    @PostMapping("/emergency-stop")
    public ControlState emergencyStop() {
        return controlSwitch.emergencyStop();
    }

    @PostMapping("/resume")
    public ControlState resume() {
        return controlSwitch.resume();
    }

    @GetMapping("/status")
    public SchedulingStatus status() {
        return analyticsService.currentStatus();
    }

    @GetMapping("/analytics")
    public SchedulingAnalytics analytics(@RequestParam(defaultValue = "7") int days) {
        return analyticsService.analytics(days);
    }

    @PostMapping("/metrics/daily")
    public InterviewPerformance recordDailyPerformance(
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date) {
        return date != null ? analyticsService.recordDailyPerformance(date) : analyticsService.recordDailyPerformance();
    }

    @GetMapping("/metrics/daily")
    public List<InterviewPerformance> performanceHistory(@RequestParam(defaultValue = "30") int days) {
        return analyticsService.performanceHistory(days);
    }

    @PostMapping("/risk/recompute")
    public List<RiskProfile> recomputeRisk(@RequestParam(required = false) Integer windowDays) {
        return windowDays != null ? riskOptimizer.recompute(windowDays) : riskOptimizer.recompute();
    }

    @GetMapping("/risk/high")
    public List<RiskProfile> highRisk() {
        return riskOptimizer.highRiskProfiles();
    }

    @GetMapping("/candidates/{candidateId}/conversions")
    public List<ConversionEvent> conversions(@PathVariable Long candidateId) {
        return conversionTracker.history(candidateId);
    }

    @GetMapping("/candidates/{candidateId}/bookings")
    public List<InterviewBooking> candidateBookings(@PathVariable Long candidateId) {
        return stateMachine.bookingsForCandidate(candidateId);
    }

    @GetMapping("/conversions/stages")
    public Map<ConversionEvent.Stage, Long> stageCounts(@RequestParam(defaultValue = "30") int days) {
        return conversionTracker.stageCounts(days);
    }

    @ExceptionHandler(SchedulingIntegrityException.class)
    public ResponseEntity<Map<String, String>> onIntegrity(SchedulingIntegrityException e) {
        log.error("Data integrity violation: {}", e.getMessage());
        return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY).body(Map.of("error", e.getMessage()));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, String>> onInvalid(IllegalArgumentException e) {
        return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
    }

    static HttpStatus statusFor(SchedulingResult.Outcome outcome) {
        switch (outcome) {
            case SUCCESS: return HttpStatus.OK;
            case NOT_FOUND: return HttpStatus.NOT_FOUND;
            case POLICY_VIOLATION: return HttpStatus.FORBIDDEN;
            case CONFLICT: return HttpStatus.CONFLICT;
            default: throw new IllegalStateException("Unmapped outcome " + outcome);
        }
    }

    private static ResponseEntity<SchedulingResult> toResponse(SchedulingResult result) {
        return ResponseEntity.status(statusFor(result.outcome())).body(result);
    }
}
