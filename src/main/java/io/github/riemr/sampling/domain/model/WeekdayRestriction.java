package io.github.riemr.sampling.domain.model;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.util.EnumSet;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * 「月火のみ」のように、指定曜日しか作業できないルール。
 */
public record WeekdayRestriction(Set<DayOfWeek> days) implements AvailabilityRule {

    public WeekdayRestriction {
        if (days == null || days.isEmpty()) {
            throw new IllegalArgumentException("days must not be empty");
        }
        days = Set.copyOf(EnumSet.copyOf(days));
    }

    public static WeekdayRestriction only(DayOfWeek first, DayOfWeek... rest) {
        return new WeekdayRestriction(EnumSet.of(first, rest));
    }

    @Override
    public boolean permits(LocalDate date) {
        return days.contains(date.getDayOfWeek());
    }

    @Override
    public String describe() {
        return "only " + EnumSet.copyOf(days).stream()
                .map(DayOfWeek::name)
                .collect(Collectors.joining(","));
    }
}
