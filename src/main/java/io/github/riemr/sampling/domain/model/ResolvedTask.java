package io.github.riemr.sampling.domain.model;

import lombok.Value;

import java.time.LocalDate;

/**
 * スケジュール上の 1 枠を業務マスタに紐付けたもの。
 * 同じ業務名が 1 日に 2 回出てきた場合も枠ごとに別インスタンスになる。
 */
@Value
public class ResolvedTask {
    TaskDefinition definition;
    LocalDate date;
    /** スケジュールに書かれていた業務名（結果のキー） */
    String displayName;
    /** その日のスケジュール内での位置 */
    int slot;
    /** マスタ未登録のため既定値で補った業務 */
    boolean unregistered;

    public String getArea() {
        return definition.getArea();
    }

    public int getRequiredWorkers() {
        return definition.getRequiredWorkers();
    }
}
