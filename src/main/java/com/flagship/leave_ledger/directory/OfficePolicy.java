package com.flagship.leave_ledger.directory;

import com.flagship.leave_ledger.calendar.WorkingWeek;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.UUID;

/**
 * Office-level leave settings.
 */
@Value
public class OfficePolicy {
    UUID id;
    WorkingWeek workingWeek;
    BigDecimal defaultAnnualLeave;
    BigDecimal defaultOfferedDays;
    BigDecimal maxCarryOverDays;
    int probationMonths;

    /**
     * Whether an employee hired on hireDate is still on probation on the given date.
     */
    public boolean isOnProbation(LocalDate hireDate, LocalDate on) {
        if (hireDate == null || probationMonths <= 0) {
            return false;
        }
        return on.isBefore(hireDate.plusMonths(probationMonths));
    }
}
