package io.github.riemr.sampling.domain.model;

import java.time.LocalDate;

/**
 * 作業者の出勤可否ルール。全ルールが許可した日だけ作業可能。
 */
public interface AvailabilityRule {

    boolean permits(LocalDate date);

    /** 画面・ログ表示用の短い説明 */
    String describe();
}
