package io.github.riemr.sampling.optimization.availability;

import io.github.riemr.sampling.domain.model.BlackoutDates;
import io.github.riemr.sampling.domain.model.WeekdayRestriction;
import io.github.riemr.sampling.domain.model.Worker;
import org.junit.jupiter.api.Test;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.util.List;
import java.util.Set;

import static io.github.riemr.sampling.support.Fixtures.worker;
import static org.assertj.core.api.Assertions.assertThat;

class AvailabilityFilterTest {

    private static final LocalDate MONDAY = LocalDate.of(2025, 4, 7);
    private static final LocalDate WEDNESDAY = LocalDate.of(2025, 4, 9);

    private final AvailabilityFilter filter = new AvailabilityFilter();

    @Test
    void isAvailable_alwaysTrue_whenNoRules() {
        assertThat(filter.isAvailable(worker("a", 3, 3).build(), WEDNESDAY)).isTrue();
    }

    @Test
    void isAvailable_respectsWeekdayRestriction() {
        Worker monTue = worker("a", 3, 3)
                .availabilityRule(WeekdayRestriction.only(DayOfWeek.MONDAY, DayOfWeek.TUESDAY))
                .build();

        assertThat(filter.isAvailable(monTue, MONDAY)).isTrue();
        assertThat(filter.isAvailable(monTue, WEDNESDAY)).isFalse();
    }

    @Test
    void isAvailable_requiresEveryRuleToPermit() {
        Worker w = worker("a", 3, 3)
                .availabilityRule(WeekdayRestriction.only(DayOfWeek.MONDAY))
                .availabilityRule(new BlackoutDates(Set.of(MONDAY)))
                .build();

        assertThat(filter.isAvailable(w, MONDAY)).isFalse();
        assertThat(filter.isAvailable(w, MONDAY.plusWeeks(1))).isTrue();
    }

    @Test
    void eligibleOn_keepsRegistryOrder() {
        Worker a = worker("a", 3, 3).build();
        Worker b = worker("b", 3, 3).availabilityRule(WeekdayRestriction.only(DayOfWeek.MONDAY)).build();
        Worker c = worker("c", 3, 3).build();

        assertThat(filter.eligibleOn(List.of(a, b, c), WEDNESDAY)).extracting(Worker::getName)
                .containsExactly("a", "c");
        assertThat(filter.eligibleOn(List.of(a, b, c), MONDAY)).extracting(Worker::getName)
                .containsExactly("a", "b", "c");
    }
}
