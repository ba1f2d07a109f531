package io.github.riemr.sampling.optimization.service;

import io.github.riemr.sampling.domain.exception.InvalidInputException;
import io.github.riemr.sampling.domain.model.MasterData;
import io.github.riemr.sampling.domain.model.ScheduleEntry;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;

import static io.github.riemr.sampling.support.Fixtures.task;
import static io.github.riemr.sampling.support.Fixtures.worker;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class MasterDataValidatorTest {

    private static final LocalDate DAY = LocalDate.of(2025, 4, 1);

    private final MasterDataValidator validator = new MasterDataValidator();

    @Test
    void validate_acceptsWellFormedData() {
        MasterData data = MasterData.builder()
                .worker(worker("a", 3, 3).build())
                .task(task(1, "T", "A", 1).build())
                .entry(new ScheduleEntry(DAY, "T"))
                .build();

        assertThatCode(() -> validator.validate(data)).doesNotThrowAnyException();
    }

    @Test
    void validate_reportsEveryProblemAtOnce() {
        MasterData data = MasterData.builder()
                .worker(worker("dup", 3, 3).build())
                .worker(worker("dup", -1, 3).build())
                .task(task(1, " ", "A", 0).build())
                .entry(new ScheduleEntry(null, "T"))
                .build();

        assertThatThrownBy(() -> validator.validate(data))
                .isInstanceOf(InvalidInputException.class)
                .hasMessageContaining("duplicate name")
                .hasMessageContaining("negative rating")
                .hasMessageContaining("blank name")
                .hasMessageContaining("requiredWorkers must be positive")
                .hasMessageContaining("missing date");
    }

    @Test
    void validate_rejectsEmptyTaskRegistry() {
        MasterData data = MasterData.builder().worker(worker("a", 3, 3).build()).build();

        assertThatThrownBy(() -> validator.validate(data))
                .isInstanceOf(InvalidInputException.class)
                .hasMessageContaining("task registry is empty");
    }
}
