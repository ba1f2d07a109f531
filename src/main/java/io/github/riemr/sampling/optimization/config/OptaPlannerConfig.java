package io.github.riemr.sampling.optimization.config;

import io.github.riemr.sampling.application.util.DurationUtils;
import io.github.riemr.sampling.optimization.solver.planner.GreedySeatInitializer;
import io.github.riemr.sampling.optimization.solver.planner.ProblemKey;
import io.github.riemr.sampling.optimization.solver.planner.SeatAssignment;
import io.github.riemr.sampling.optimization.solver.planner.SeatAssignmentConstraintProvider;
import io.github.riemr.sampling.optimization.solver.planner.SeatAssignmentSolution;
import org.optaplanner.core.api.solver.SolverFactory;
import org.optaplanner.core.api.solver.SolverManager;
import org.optaplanner.core.config.heuristic.selector.common.SelectionOrder;
import org.optaplanner.core.config.heuristic.selector.entity.EntitySelectorConfig;
import org.optaplanner.core.config.heuristic.selector.move.composite.UnionMoveSelectorConfig;
import org.optaplanner.core.config.heuristic.selector.move.generic.ChangeMoveSelectorConfig;
import org.optaplanner.core.config.heuristic.selector.move.generic.SwapMoveSelectorConfig;
import org.optaplanner.core.config.heuristic.selector.value.ValueSelectorConfig;
import org.optaplanner.core.config.localsearch.LocalSearchPhaseConfig;
import org.optaplanner.core.config.localsearch.LocalSearchType;
import org.optaplanner.core.config.phase.PhaseConfig;
import org.optaplanner.core.config.phase.custom.CustomPhaseConfig;
import org.optaplanner.core.config.score.director.ScoreDirectorFactoryConfig;
import org.optaplanner.core.config.solver.EnvironmentMode;
import org.optaplanner.core.config.solver.SolverConfig;
import org.optaplanner.core.config.solver.termination.TerminationConfig;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.Arrays;
import java.util.List;

/**
 * 局所探索バックエンド用のソルバー定義。
 * 1 日の問題は {@link SeatAssignmentSolution}（業務枠の席に作業者を座らせる）として投入される。
 */
@Configuration
public class OptaPlannerConfig {

    // 全体の安全上限。通常は下の未改善ステップ数で先に終わる
    @Value("${assignment.solver.time-limit:PT30S}")
    private String timeLimit;
    // LATE_ACCEPTANCE の未改善ステップ上限。TABU_SEARCH はその 1/10
    @Value("${assignment.solver.optaplanner.unimproved-step-limit:2000}")
    private int unimprovedStepLimit;

    @Bean
    public SolverFactory<SeatAssignmentSolution> seatAssignmentSolverFactory() {
        SolverConfig solverConfig = new SolverConfig()
                .withSolutionClass(SeatAssignmentSolution.class)
                .withEntityClasses(SeatAssignment.class)
                // 乱数シード固定 + ステップ数での終了: 同じ入力なら同じ解
                .withEnvironmentMode(EnvironmentMode.REPRODUCIBLE)
                .withRandomSeed(0L)
                .withTerminationConfig(new TerminationConfig()
                        .withSpentLimit(DurationUtils.parseTolerant(timeLimit, Duration.ofSeconds(30))));

        ScoreDirectorFactoryConfig sdf = new ScoreDirectorFactoryConfig()
                .withConstraintProviderClass(SeatAssignmentConstraintProvider.class);
        solverConfig.setScoreDirectorFactoryConfig(sdf);

        // 貪欲な初期解 → LS(diversify) → LS(converge)
        CustomPhaseConfig initial = new CustomPhaseConfig();
        initial.setCustomPhaseCommandClassList(List.of(GreedySeatInitializer.class));

        int steps = Math.max(100, unimprovedStepLimit);
        solverConfig.setPhaseConfigList(List.<PhaseConfig>of(
                initial,
                localSearchPhase(LocalSearchType.LATE_ACCEPTANCE, steps),
                localSearchPhase(LocalSearchType.TABU_SEARCH, Math.max(50, steps / 10))
        ));
        return SolverFactory.create(solverConfig);
    }

    @Bean
    public SolverManager<SeatAssignmentSolution, ProblemKey> seatAssignmentSolverManager(
            SolverFactory<SeatAssignmentSolution> solverFactory) {
        return SolverManager.create(solverFactory);
    }

    private LocalSearchPhaseConfig localSearchPhase(LocalSearchType type, int unimprovedSteps) {
        LocalSearchPhaseConfig ls = new LocalSearchPhaseConfig();
        ls.setLocalSearchType(type);

        // 着席・離席・入替（Change）と席同士の交換（Swap）。地区をまたぐ移動は離席と着席の 2 手で届く
        ChangeMoveSelectorConfig change = new ChangeMoveSelectorConfig();
        change.setEntitySelectorConfig(new EntitySelectorConfig()
                .withEntityClass(SeatAssignment.class)
                .withSelectionOrder(SelectionOrder.RANDOM));
        change.setValueSelectorConfig(new ValueSelectorConfig()
                .withVariableName("worker")
                .withSelectionOrder(SelectionOrder.RANDOM));
        SwapMoveSelectorConfig swap = new SwapMoveSelectorConfig();
        swap.setEntitySelectorConfig(new EntitySelectorConfig()
                .withEntityClass(SeatAssignment.class)
                .withSelectionOrder(SelectionOrder.RANDOM));
        UnionMoveSelectorConfig union = new UnionMoveSelectorConfig();
        union.setMoveSelectorList(Arrays.asList(change, swap));
        ls.setMoveSelectorConfig(union);

        ls.setTerminationConfig(new TerminationConfig().withUnimprovedStepCountLimit(unimprovedSteps));
        return ls;
    }
}
