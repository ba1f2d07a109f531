package io.github.riemr.sampling.optimization.availability;

import io.github.riemr.sampling.domain.model.Worker;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.List;

/**
 * 出勤可否ルールによる候補者の絞り込み。減点ではなく当日の候補から除外する。
 */
@Component
public class AvailabilityFilter {

    public boolean isAvailable(Worker worker, LocalDate date) {
        return worker.isAvailableOn(date);
    }

    /** 作業者マスタの並び順を保ったまま当日作業可能な作業者を返す */
    public List<Worker> eligibleOn(List<Worker> workers, LocalDate date) {
        return workers.stream()
                .filter(w -> isAvailable(w, date))
                .toList();
    }
}
