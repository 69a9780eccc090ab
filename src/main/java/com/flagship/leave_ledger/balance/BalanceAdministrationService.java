package com.flagship.leave_ledger.balance;

import com.flagship.leave_ledger.directory.EmployeeProfile;
import com.flagship.leave_ledger.directory.OfficePolicy;
import com.flagship.leave_ledger.directory.OrganizationDirectory;
import com.flagship.leave_ledger.exception.ApprovalAuthorizationException;
import com.flagship.leave_ledger.exception.BalanceNotFoundException;
import com.flagship.leave_ledger.exception.LeaveValidationException;
import com.flagship.leave_ledger.observability.LeaveMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.retry.annotation.Backoff;
import org.springframework.retry.annotation.Retryable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * HR-facing operations on balance accounts: opening a year, manual
 * adjustments, carry-over into the next year and inquiry.
 *
 * All arithmetic goes through {@link LeaveBalanceLedger}, so the
 * non-negative remaining invariant holds for these paths too. Mutations are
 * reserved to active HR employees; an employee may read their own balances.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class BalanceAdministrationService {

    private final LeaveBalanceLedger ledger;
    private final OrganizationDirectory organizationDirectory;
    private final EntitlementPolicy entitlementPolicy;
    private final LeaveMetrics leaveMetrics;

    /**
     * Opens the yearly account. Without an explicit total the office default
     * for the balance type applies, prorated for employees hired that year.
     */
    @Transactional
    public LeaveBalance open(UUID employeeId, int year, BalanceType balanceType, BigDecimal totalDays,
                             UUID actorId) {
        requireHr(actorId, "OPEN_BALANCE");
        BigDecimal entitlement = totalDays;
        if (entitlement == null) {
            EmployeeProfile employee = requireEmployee(employeeId);
            OfficePolicy policy = requireOffice(employee.getOfficeId());
            entitlement = entitlementPolicy.prorate(defaultEntitlement(policy, balanceType), employee.getHireDate(), year);
        } else {
            requireEmployee(employeeId);
        }
        return ledger.open(BalanceKey.of(employeeId, year, balanceType), entitlement, BigDecimal.ZERO,
                actorId, "Yearly entitlement");
    }

    @Retryable(
        retryFor = ConcurrencyFailureException.class,
        maxAttemptsExpression = "${leave.retry.max-attempts:3}",
        backoff = @Backoff(delayExpression = "${leave.retry.initial-backoff-ms:50}", multiplier = 2)
    )
    @Transactional
    public LeaveBalance adjust(UUID employeeId, int year, BalanceType balanceType, BigDecimal delta,
                               String reason, UUID actorId) {
        requireHr(actorId, "ADJUST_BALANCE");
        long startTime = System.currentTimeMillis();
        LeaveBalance adjusted = ledger.adjust(BalanceKey.of(employeeId, year, balanceType), delta, reason, actorId);
        leaveMetrics.recordLatency("adjust_balance", System.currentTimeMillis() - startTime);
        return adjusted;
    }

    /**
     * Moves min(remaining, office cap) of fromYear into the next year's
     * carried-over days, opening next year's account at the office default
     * when it does not exist yet. Runs at most once per pair of years.
     *
     * @return the next year's account
     */
    @Retryable(
        retryFor = ConcurrencyFailureException.class,
        maxAttemptsExpression = "${leave.retry.max-attempts:3}",
        backoff = @Backoff(delayExpression = "${leave.retry.initial-backoff-ms:50}", multiplier = 2)
    )
    @Transactional
    public LeaveBalance carryOver(UUID employeeId, int fromYear, BalanceType balanceType, UUID actorId) {
        requireHr(actorId, "CARRY_OVER");
        EmployeeProfile employee = requireEmployee(employeeId);
        OfficePolicy policy = requireOffice(employee.getOfficeId());

        // Concurrent carry-overs of the same account queue on the source row.
        BalanceKey fromKey = BalanceKey.of(employeeId, fromYear, balanceType);
        LeaveBalance source = ledger.lock(fromKey).orElseThrow(() -> new BalanceNotFoundException(fromKey));

        BigDecimal days = source.remaining().min(policy.getMaxCarryOverDays());
        BalanceKey toKey = BalanceKey.of(employeeId, fromYear + 1, balanceType);

        Optional<LeaveBalance> existing = ledger.find(toKey);
        if (existing.isPresent() && existing.get().getCarriedOverDays().signum() > 0) {
            throw new LeaveValidationException(String.format(
                "%s balance of %d was already carried over into %d", balanceType, fromYear, fromYear + 1));
        }
        if (days.signum() <= 0) {
            log.info("Nothing to carry over from {} (remaining={}, cap={})",
                    fromKey, source.remaining(), policy.getMaxCarryOverDays());
            return existing.orElseGet(() -> ledger.open(toKey,
                entitlementPolicy.prorate(defaultEntitlement(policy, balanceType), employee.getHireDate(), fromYear + 1),
                BigDecimal.ZERO, actorId, "Yearly entitlement"));
        }

        String reason = String.format("Carried over from %d", fromYear);
        LeaveBalance target;
        if (existing.isPresent()) {
            target = ledger.addCarryOver(toKey, days, actorId, reason);
        } else {
            BigDecimal entitlement = entitlementPolicy.prorate(
                defaultEntitlement(policy, balanceType), employee.getHireDate(), fromYear + 1);
            target = ledger.open(toKey, entitlement, days, actorId, reason);
        }

        log.info("Carried {} days of {} into {}: cap={}", days, fromKey, toKey, policy.getMaxCarryOverDays());
        return target;
    }

    @Transactional(readOnly = true)
    public List<LeaveBalance> balances(UUID employeeId, int year, UUID actorId) {
        if (!employeeId.equals(actorId)) {
            requireHr(actorId, "READ_BALANCE");
        }
        return ledger.findForEmployee(employeeId, year);
    }

    private void requireHr(UUID actorId, String operation) {
        boolean hr = organizationDirectory.findEmployee(actorId)
            .map(actor -> actor.isActive() && actor.isHr())
            .orElse(false);
        if (!hr) {
            leaveMetrics.recordAuthorizationDenied(operation);
            log.warn("SECURITY: actor {} denied {} (not an active HR employee)", actorId, operation);
            throw new ApprovalAuthorizationException(actorId, null, "Only HR may perform " + operation);
        }
    }

    private EmployeeProfile requireEmployee(UUID employeeId) {
        return organizationDirectory.findEmployee(employeeId)
            .orElseThrow(() -> new LeaveValidationException("Unknown employee: " + employeeId));
    }

    private OfficePolicy requireOffice(UUID officeId) {
        return organizationDirectory.findOfficePolicy(officeId)
            .orElseThrow(() -> new LeaveValidationException("Unknown office: " + officeId));
    }

    private static BigDecimal defaultEntitlement(OfficePolicy policy, BalanceType balanceType) {
        return balanceType == BalanceType.ANNUAL ? policy.getDefaultAnnualLeave() : policy.getDefaultOfferedDays();
    }
}
