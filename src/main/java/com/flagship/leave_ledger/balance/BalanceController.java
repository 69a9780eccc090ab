package com.flagship.leave_ledger.balance;

import com.flagship.leave_ledger.balance.dto.BalanceAdjustmentRequest;
import com.flagship.leave_ledger.balance.dto.BalanceAdjustmentResponse;
import com.flagship.leave_ledger.balance.dto.BalanceResponse;
import com.flagship.leave_ledger.balance.dto.CarryOverRequest;
import com.flagship.leave_ledger.balance.dto.OpenBalanceRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/api/balances")
@RequiredArgsConstructor
@Slf4j
public class BalanceController {

    private static final String ACTOR_HEADER = "X-Actor-Id";

    private final BalanceAdministrationService balanceService;

    @GetMapping("/{employeeId}")
    public ResponseEntity<List<BalanceResponse>> balances(
            @PathVariable("employeeId") UUID employeeId,
            @RequestParam(value = "year", required = false) Integer year,
            @RequestHeader(ACTOR_HEADER) UUID actorId) {
        int effectiveYear = year != null ? year : LocalDate.now().getYear();
        List<BalanceResponse> body = balanceService.balances(employeeId, effectiveYear, actorId).stream()
            .map(BalanceResponse::from)
            .toList();
        return ResponseEntity.ok(body);
    }

    @PostMapping("/adjustments")
    public ResponseEntity<BalanceAdjustmentResponse> adjust(
            @Valid @RequestBody BalanceAdjustmentRequest request,
            @RequestHeader(ACTOR_HEADER) UUID actorId) {
        int year = request.getYear() != null ? request.getYear() : LocalDate.now().getYear();
        log.info("Received balance adjustment: employee={}, {} {}, adjustment={}, actor={}",
                request.getEmployeeId(), request.getBalanceType(), year, request.getAdjustment(), actorId);

        LeaveBalance adjusted = balanceService.adjust(request.getEmployeeId(), year, request.getBalanceType(),
                request.getAdjustment(), request.getReason(), actorId);
        return ResponseEntity.ok(BalanceAdjustmentResponse.from(adjusted));
    }

    @PostMapping("/open")
    public ResponseEntity<BalanceResponse> open(
            @Valid @RequestBody OpenBalanceRequest request,
            @RequestHeader(ACTOR_HEADER) UUID actorId) {
        LeaveBalance opened = balanceService.open(request.getEmployeeId(), request.getYear(),
                request.getBalanceType(), request.getTotalDays(), actorId);
        return ResponseEntity.status(HttpStatus.CREATED).body(BalanceResponse.from(opened));
    }

    @PostMapping("/carry-over")
    public ResponseEntity<BalanceResponse> carryOver(
            @Valid @RequestBody CarryOverRequest request,
            @RequestHeader(ACTOR_HEADER) UUID actorId) {
        LeaveBalance target = balanceService.carryOver(request.getEmployeeId(), request.getFromYear(),
                request.getBalanceType(), actorId);
        return ResponseEntity.ok(BalanceResponse.from(target));
    }
}
