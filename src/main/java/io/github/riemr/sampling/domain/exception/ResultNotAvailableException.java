package io.github.riemr.sampling.domain.exception;

public class ResultNotAvailableException extends RuntimeException {

    public ResultNotAvailableException(String message) {
        super(message);
    }
}
