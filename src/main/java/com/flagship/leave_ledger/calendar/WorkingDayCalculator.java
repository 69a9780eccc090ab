package com.flagship.leave_ledger.calendar;

import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Set;

/**
 * Turns a leave range into a number of working days.
 *
 * A date counts only if it falls on a working weekday and is not a holiday.
 * Boundary dates count half when the half-day markers say so:
 * <ul>
 *   <li>single day: 0.5 if either marker is a half day, otherwise 1</li>
 *   <li>first day of a longer range: 0.5 for an AFTERNOON start</li>
 *   <li>last day of a longer range: 0.5 for a MORNING end</li>
 * </ul>
 * Works on calendar dates only, so results never depend on a time zone.
 * Stateless and safe to share.
 */
@Component
public class WorkingDayCalculator {

    private static final BigDecimal HALF = new BigDecimal("0.5");

    public BigDecimal compute(LocalDate start, LocalDate end,
                              HalfDay startHalfDay, HalfDay endHalfDay,
                              WorkingWeek workingWeek, Set<LocalDate> holidays) {
        if (start == null || end == null) {
            throw new InvalidRangeException("Start and end dates are required");
        }
        if (end.isBefore(start)) {
            throw new InvalidRangeException(
                String.format("End date %s is before start date %s", end, start));
        }
        HalfDay startMarker = startHalfDay != null ? startHalfDay : HalfDay.FULL_DAY;
        HalfDay endMarker = endHalfDay != null ? endHalfDay : HalfDay.FULL_DAY;
        Set<LocalDate> closed = holidays != null ? holidays : Set.of();

        BigDecimal total = BigDecimal.ZERO.setScale(1);
        for (LocalDate date = start; !date.isAfter(end); date = date.plusDays(1)) {
            if (!workingWeek.isWorkingDay(date.getDayOfWeek()) || closed.contains(date)) {
                continue;
            }
            total = total.add(contribution(date, start, end, startMarker, endMarker));
        }
        return total;
    }

    private BigDecimal contribution(LocalDate date, LocalDate start, LocalDate end,
                                    HalfDay startHalfDay, HalfDay endHalfDay) {
        boolean isStart = date.equals(start);
        boolean isEnd = date.equals(end);

        if (isStart && isEnd) {
            return startHalfDay.isHalf() || endHalfDay.isHalf() ? HALF : BigDecimal.ONE;
        }
        if (isStart) {
            return startHalfDay == HalfDay.AFTERNOON ? HALF : BigDecimal.ONE;
        }
        if (isEnd) {
            return endHalfDay == HalfDay.MORNING ? HALF : BigDecimal.ONE;
        }
        return BigDecimal.ONE;
    }
}
