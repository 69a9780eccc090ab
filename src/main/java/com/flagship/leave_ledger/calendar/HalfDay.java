package com.flagship.leave_ledger.calendar;

/**
 * Boundary marker of a leave range.
 * A MORNING start consumes the whole first day; an AFTERNOON start only its second half.
 * A MORNING end consumes only the first half of the last day.
 */
public enum HalfDay {
    FULL_DAY,
    MORNING,
    AFTERNOON;

    public boolean isHalf() {
        return this != FULL_DAY;
    }
}
