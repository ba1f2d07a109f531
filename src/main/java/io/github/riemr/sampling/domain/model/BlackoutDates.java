package io.github.riemr.sampling.domain.model;

import java.time.LocalDate;
import java.util.Set;
import java.util.TreeSet;

/**
 * 休み希望日など、特定日に作業できないルール。
 */
public record BlackoutDates(Set<LocalDate> dates) implements AvailabilityRule {

    public BlackoutDates {
        dates = dates == null ? Set.of() : Set.copyOf(dates);
    }

    @Override
    public boolean permits(LocalDate date) {
        return !dates.contains(date);
    }

    @Override
    public String describe() {
        return "off " + new TreeSet<>(dates);
    }
}
