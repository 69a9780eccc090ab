package com.flagship.leave_ledger.leave;

import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Set;

@Value
public class WorkingDaysPreview {
    BigDecimal totalDays;
    Set<LocalDate> holidays;
}
