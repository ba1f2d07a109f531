package io.github.riemr.sampling.domain.exception;

/**
 * 入力マスタ・スケジュールの不備。実行全体を中断し、部分結果は返さない。
 */
public class InvalidInputException extends RuntimeException {

    public InvalidInputException(String message) {
        super(message);
    }

    public InvalidInputException(String message, Throwable cause) {
        super(message, cause);
    }
}
