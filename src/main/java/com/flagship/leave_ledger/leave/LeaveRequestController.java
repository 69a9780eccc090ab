package com.flagship.leave_ledger.leave;

import com.flagship.leave_ledger.calendar.HalfDay;
import com.flagship.leave_ledger.leave.dto.CreateLeaveRequestRequest;
import com.flagship.leave_ledger.leave.dto.DecisionRequest;
import com.flagship.leave_ledger.leave.dto.LeaveRequestResponse;
import com.flagship.leave_ledger.leave.dto.ReviseLeaveRequestRequest;
import com.flagship.leave_ledger.leave.dto.TransitionResponse;
import com.flagship.leave_ledger.leave.dto.WorkingDaysResponse;
import com.flagship.leave_ledger.observability.LeaveMetrics;
import com.flagship.leave_ledger.workflow.ApprovalWorkflowEngine;
import com.flagship.leave_ledger.workflow.TransitionResult;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * REST endpoints of the leave request lifecycle.
 *
 * The acting user comes from the X-Actor-Id header. Creation accepts an
 * optional Idempotency-Key: a repeated key returns the original request with
 * 200 instead of creating a second one.
 */
@RestController
@RequestMapping("/api/leave-requests")
@RequiredArgsConstructor
@Slf4j
public class LeaveRequestController {

    private static final String ACTOR_HEADER = "X-Actor-Id";
    private static final String IDEMPOTENCY_KEY_HEADER = "Idempotency-Key";

    private final LeaveRequestService leaveRequestService;
    private final ApprovalWorkflowEngine workflowEngine;
    private final IdempotencyService idempotencyService;
    private final LeaveMetrics leaveMetrics;

    @PostMapping
    public ResponseEntity<LeaveRequestResponse> create(
            @Valid @RequestBody CreateLeaveRequestRequest request,
            @RequestHeader(ACTOR_HEADER) UUID actorId,
            @RequestHeader(value = IDEMPOTENCY_KEY_HEADER, required = false) String idempotencyKey) {

        log.info("Received leave request: employee={}, type={}, {}..{}, draft={}, idempotencyKey={}",
                request.getEmployeeId(), request.getLeaveTypeId(),
                request.getStartDate(), request.getEndDate(), request.getAsDraft(), idempotencyKey);

        boolean keyed = idempotencyKey != null && !idempotencyKey.isBlank();
        if (keyed) {
            Optional<ResponseEntity<LeaveRequestResponse>> replay = replay(idempotencyKey);
            if (replay.isPresent()) {
                return replay.get();
            }
            leaveMetrics.recordIdempotencyMiss();
        }

        LeaveRequestCommand command = LeaveRequestCommand.builder()
            .employeeId(request.getEmployeeId())
            .leaveTypeId(request.getLeaveTypeId())
            .startDate(request.getStartDate())
            .endDate(request.getEndDate())
            .startHalfDay(request.getStartHalfDay())
            .endHalfDay(request.getEndHalfDay())
            .reason(request.getReason())
            .exceptionalReason(request.getExceptionalReason())
            .attachmentUrls(request.getAttachmentUrls())
            .asDraft(Boolean.TRUE.equals(request.getAsDraft()))
            .build();

        IntakeResult result;
        try {
            result = leaveRequestService.create(command, actorId, keyed ? idempotencyKey : null);
        } catch (DataIntegrityViolationException e) {
            // Lost a race with a concurrent call carrying the same key
            if (keyed) {
                Optional<ResponseEntity<LeaveRequestResponse>> replay = replay(idempotencyKey);
                if (replay.isPresent()) {
                    return replay.get();
                }
            }
            throw e;
        }

        LeaveRequest created = result.getRequest();
        if (keyed) {
            idempotencyService.remember(idempotencyKey, created.getId());
        }
        if (result.isReplayed()) {
            leaveMetrics.recordIdempotencyHit();
            return ResponseEntity.ok(LeaveRequestResponse.summary(created));
        }
        return ResponseEntity.status(HttpStatus.CREATED).body(LeaveRequestResponse.summary(created));
    }

    @GetMapping("/{id}")
    public ResponseEntity<LeaveRequestResponse> get(@PathVariable("id") UUID id) {
        LeaveRequest request = leaveRequestService.get(id);
        return ResponseEntity.ok(LeaveRequestResponse.from(request, workflowEngine.history(id)));
    }

    @GetMapping
    public ResponseEntity<List<LeaveRequestResponse>> listForEmployee(@RequestParam("employeeId") UUID employeeId) {
        List<LeaveRequestResponse> body = leaveRequestService.listForEmployee(employeeId).stream()
            .map(LeaveRequestResponse::summary)
            .toList();
        return ResponseEntity.ok(body);
    }

    @PutMapping("/{id}")
    public ResponseEntity<LeaveRequestResponse> revise(
            @PathVariable("id") UUID id,
            @Valid @RequestBody ReviseLeaveRequestRequest request,
            @RequestHeader(ACTOR_HEADER) UUID actorId) {
        LeaveRequestCommand command = LeaveRequestCommand.builder()
            .startDate(request.getStartDate())
            .endDate(request.getEndDate())
            .startHalfDay(request.getStartHalfDay())
            .endHalfDay(request.getEndHalfDay())
            .reason(request.getReason())
            .attachmentUrls(request.getAttachmentUrls())
            .build();
        LeaveRequest revised = leaveRequestService.revise(id, actorId, command);
        return ResponseEntity.ok(LeaveRequestResponse.from(revised, workflowEngine.history(id)));
    }

    @PostMapping("/{id}/submit")
    public ResponseEntity<TransitionResponse> submit(
            @PathVariable("id") UUID id,
            @RequestHeader(ACTOR_HEADER) UUID actorId) {
        TransitionResult result = leaveRequestService.submit(id, actorId);
        return ResponseEntity.ok(TransitionResponse.from(result));
    }

    @PostMapping("/{id}/cancel")
    public ResponseEntity<TransitionResponse> cancel(
            @PathVariable("id") UUID id,
            @RequestHeader(ACTOR_HEADER) UUID actorId) {
        TransitionResult result = workflowEngine.cancel(id, actorId);
        return ResponseEntity.ok(TransitionResponse.from(result));
    }

    @PostMapping("/{id}/steps/{stepId}/decision")
    public ResponseEntity<TransitionResponse> decide(
            @PathVariable("id") UUID id,
            @PathVariable("stepId") UUID stepId,
            @Valid @RequestBody DecisionRequest request,
            @RequestHeader(ACTOR_HEADER) UUID actorId) {
        TransitionResult result = workflowEngine.decideStep(id, stepId, actorId,
                request.getAction(), request.getComment());
        return ResponseEntity.ok(TransitionResponse.from(result));
    }

    @GetMapping("/working-days")
    public ResponseEntity<WorkingDaysResponse> previewWorkingDays(
            @RequestParam("employeeId") UUID employeeId,
            @RequestParam("start") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate start,
            @RequestParam("end") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate end,
            @RequestParam(value = "startHalfDay", required = false) HalfDay startHalfDay,
            @RequestParam(value = "endHalfDay", required = false) HalfDay endHalfDay) {
        WorkingDaysPreview preview = leaveRequestService.preview(employeeId, start, end, startHalfDay, endHalfDay);
        return ResponseEntity.ok(WorkingDaysResponse.from(preview));
    }

    private Optional<ResponseEntity<LeaveRequestResponse>> replay(String idempotencyKey) {
        return idempotencyService.findRequestId(idempotencyKey).map(existingId -> {
            leaveMetrics.recordIdempotencyHit();
            log.info("Idempotency key {} already used, returning leave request {}", idempotencyKey, existingId);
            return ResponseEntity.ok(LeaveRequestResponse.summary(leaveRequestService.get(existingId)));
        });
    }
}
