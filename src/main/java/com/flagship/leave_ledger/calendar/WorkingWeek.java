package com.flagship.leave_ledger.calendar;

import lombok.Value;

import java.time.DayOfWeek;
import java.util.Arrays;
import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * The weekdays an office works on, e.g. MON-FRI or SUN-THU.
 */
@Value
public class WorkingWeek {

    public static final WorkingWeek MONDAY_TO_FRIDAY = of(
        DayOfWeek.MONDAY, DayOfWeek.TUESDAY, DayOfWeek.WEDNESDAY, DayOfWeek.THURSDAY, DayOfWeek.FRIDAY);

    Set<DayOfWeek> days;

    public static WorkingWeek of(DayOfWeek first, DayOfWeek... rest) {
        return new WorkingWeek(Set.copyOf(EnumSet.of(first, rest)));
    }

    /**
     * Parses a comma separated list of three-letter weekday codes ("MON,TUE,WED").
     */
    public static WorkingWeek parse(String codes) {
        if (codes == null || codes.isBlank()) {
            throw new IllegalArgumentException("Working week must contain at least one day");
        }
        Set<DayOfWeek> parsed = Arrays.stream(codes.split(","))
            .map(String::trim)
            .filter(code -> !code.isEmpty())
            .map(WorkingWeek::fromCode)
            .collect(Collectors.toCollection(() -> EnumSet.noneOf(DayOfWeek.class)));
        if (parsed.isEmpty()) {
            throw new IllegalArgumentException("Working week must contain at least one day");
        }
        return new WorkingWeek(Set.copyOf(parsed));
    }

    public boolean isWorkingDay(DayOfWeek day) {
        return days.contains(day);
    }

    private static DayOfWeek fromCode(String code) {
        String upper = code.toUpperCase(Locale.ROOT);
        return Arrays.stream(DayOfWeek.values())
            .filter(day -> day.name().startsWith(upper) && upper.length() >= 3)
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException("Unknown weekday code: " + code));
    }
}
