package io.github.riemr.sampling.domain.exception;

import java.time.LocalDate;

public class ScheduleDateNotFoundException extends RuntimeException {

    public ScheduleDateNotFoundException(LocalDate date) {
        super("Date " + date + " not found in schedule");
    }
}
