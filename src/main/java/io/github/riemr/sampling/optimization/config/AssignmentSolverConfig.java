package io.github.riemr.sampling.optimization.config;

import io.github.riemr.sampling.application.util.DurationUtils;
import io.github.riemr.sampling.optimization.scoring.ScoringWeights;
import io.github.riemr.sampling.optimization.solver.OrToolsSolverAdapter;
import io.github.riemr.sampling.optimization.solver.SolverAdapter;
import io.github.riemr.sampling.optimization.solver.planner.OptaPlannerSolverAdapter;
import io.github.riemr.sampling.optimization.solver.planner.ProblemKey;
import io.github.riemr.sampling.optimization.solver.planner.SeatAssignmentSolution;
import lombok.extern.slf4j.Slf4j;
import org.optaplanner.core.api.solver.SolverManager;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

@Configuration
@Slf4j
public class AssignmentSolverConfig {

    // ortools | optaplanner
    @Value("${assignment.solver.engine:ortools}")
    private String engine;
    // SCIP | CBC
    @Value("${assignment.solver.ortools.backend:SCIP}")
    private String backend;
    @Value("${assignment.solver.time-limit:PT30S}")
    private String timeLimit;
    @Value("${assignment.solver.grace:PT10S}")
    private String grace;
    @Value("${assignment.solver.parallelism:2}")
    private int parallelism;

    @Bean
    public SolverSettings solverSettings() {
        SolverSettings settings = new SolverSettings(
                DurationUtils.parseTolerant(timeLimit, Duration.ofSeconds(30)),
                Math.max(1, parallelism),
                DurationUtils.parseTolerant(grace, Duration.ofSeconds(10)));
        log.info("Solver settings: engine={}, timeLimit={}, parallelism={}",
                engine, settings.timeLimit(), settings.parallelism());
        return settings;
    }

    @Bean
    public SolverAdapter solverAdapter(
            ObjectProvider<SolverManager<SeatAssignmentSolution, ProblemKey>> solverManager) {
        String e = engine == null ? "" : engine.trim().toLowerCase();
        return switch (e) {
            case "optaplanner" -> new OptaPlannerSolverAdapter(solverManager.getObject());
            case "ortools", "" -> new OrToolsSolverAdapter(backend == null || backend.isBlank() ? "SCIP" : backend.trim().toUpperCase());
            default -> throw new IllegalStateException("Unknown assignment.solver.engine: " + engine);
        };
    }

    @Bean
    public ScoringWeights scoringWeights(
            @Value("${assignment.scoring.skill-base:30}") double skillBase,
            @Value("${assignment.scoring.skill-surplus:5}") double skillSurplus,
            @Value("${assignment.scoring.skill-deficit:20}") double skillDeficit,
            @Value("${assignment.scoring.strength-base:20}") double strengthBase,
            @Value("${assignment.scoring.strength-surplus:3}") double strengthSurplus,
            @Value("${assignment.scoring.strength-deficit:15}") double strengthDeficit,
            @Value("${assignment.scoring.vessel-base:15}") double vesselBase,
            @Value("${assignment.scoring.vessel-surplus:2}") double vesselSurplus,
            @Value("${assignment.scoring.vessel-deficit:10}") double vesselDeficit,
            @Value("${assignment.scoring.navigation-base:10}") double navigationBase,
            @Value("${assignment.scoring.navigation-per-level:2}") double navigationPerLevel,
            @Value("${assignment.scoring.navigation-missing:-30}") double navigationMissing,
            @Value("${assignment.scoring.analysis-priority-penalty:-20}") double analysisPriorityPenalty) {
        return new ScoringWeights(skillBase, skillSurplus, skillDeficit,
                strengthBase, strengthSurplus, strengthDeficit,
                vesselBase, vesselSurplus, vesselDeficit,
                navigationBase, navigationPerLevel, navigationMissing,
                analysisPriorityPenalty);
    }
}
