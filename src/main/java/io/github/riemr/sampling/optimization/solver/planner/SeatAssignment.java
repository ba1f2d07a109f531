package io.github.riemr.sampling.optimization.solver.planner;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;
import org.optaplanner.core.api.domain.entity.PlanningEntity;
import org.optaplanner.core.api.domain.lookup.PlanningId;
import org.optaplanner.core.api.domain.valuerange.ValueRangeProvider;
import org.optaplanner.core.api.domain.variable.PlanningVariable;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.List;

/**
 * 業務枠の 1 席。必要人数ぶんの席を用意し、各席に作業者を 1 人まで座らせる。
 * 空席（worker == null）は人数不足として許容する。
 */
@PlanningEntity
@Getter
@Setter
@ToString(onlyExplicitlyIncluded = true)
@NoArgsConstructor
public class SeatAssignment {

    @PlanningId
    @ToString.Include
    private Integer id;

    /** 割当モデル上の業務枠の添字 */
    private int taskIndex;
    @ToString.Include
    private String taskName;
    private int seatNo;
    private int areaIndex;

    // スコアが正の作業者のみ（負・0 の作業者は座らせても目的値が下がるだけ）
    private List<CandidateWorker> candidates = Collections.emptyList();

    // 作業者添字 → この業務でのスコア
    private double[] scoreByWorker;

    @PlanningVariable(valueRangeProviderRefs = {"seatCandidates"}, nullable = true)
    @ToString.Include
    private CandidateWorker worker; // null = 空席

    public SeatAssignment(Integer id, int taskIndex, String taskName, int seatNo, int areaIndex,
                          List<CandidateWorker> candidates, double[] scoreByWorker) {
        this.id = id;
        this.taskIndex = taskIndex;
        this.taskName = taskName;
        this.seatNo = seatNo;
        this.areaIndex = areaIndex;
        this.candidates = candidates;
        this.scoreByWorker = scoreByWorker;
    }

    @ValueRangeProvider(id = "seatCandidates")
    public List<CandidateWorker> getSeatCandidates() {
        return candidates == null ? List.of() : candidates;
    }

    public boolean isSeated() {
        return worker != null;
    }

    public double scoreOf(CandidateWorker candidate) {
        return scoreByWorker[candidate.index()];
    }

    public BigDecimal seatedScore() {
        return worker == null ? BigDecimal.ZERO : BigDecimal.valueOf(scoreOf(worker));
    }
}
