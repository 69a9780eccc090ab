package com.flagship.leave_ledger.balance;

import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;

/**
 * Yearly entitlement of an employee hired part-way through a year.
 *
 * Hired before the year: full allocation. Hired after it: nothing. Hired
 * during it: allocation / 12 for every month left, hire month included,
 * rounded half-up to one decimal (25 days, hired in April: 18.8).
 */
@Component
public class EntitlementPolicy {

    private static final BigDecimal MONTHS_PER_YEAR = BigDecimal.valueOf(12);

    public BigDecimal prorate(BigDecimal annualDays, LocalDate hireDate, int year) {
        if (annualDays == null || annualDays.signum() <= 0) {
            return BigDecimal.ZERO.setScale(1);
        }
        if (hireDate == null || hireDate.getYear() < year) {
            return annualDays.setScale(1, RoundingMode.HALF_UP);
        }
        if (hireDate.getYear() > year) {
            return BigDecimal.ZERO.setScale(1);
        }

        int remainingMonths = 13 - hireDate.getMonthValue();
        return annualDays.multiply(BigDecimal.valueOf(remainingMonths))
            .divide(MONTHS_PER_YEAR, 1, RoundingMode.HALF_UP);
    }
}
