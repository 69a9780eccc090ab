package com.flagship.leave_ledger.leave;

import com.flagship.leave_ledger.calendar.HalfDay;
import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

/**
 * Input of leave intake, shared by creation and revision. Revision ignores
 * employeeId, leaveTypeId and asDraft.
 */
@Value
@Builder
public class LeaveRequestCommand {
    UUID employeeId;
    UUID leaveTypeId;
    LocalDate startDate;
    LocalDate endDate;
    HalfDay startHalfDay;
    HalfDay endHalfDay;
    String reason;
    String exceptionalReason;
    List<String> attachmentUrls;
    boolean asDraft;

    public HalfDay startHalfDayOrDefault() {
        return startHalfDay != null ? startHalfDay : HalfDay.FULL_DAY;
    }

    public HalfDay endHalfDayOrDefault() {
        return endHalfDay != null ? endHalfDay : HalfDay.FULL_DAY;
    }
}
