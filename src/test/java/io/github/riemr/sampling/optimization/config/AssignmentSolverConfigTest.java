package io.github.riemr.sampling.optimization.config;

import io.github.riemr.sampling.optimization.scoring.ScoringWeights;
import io.github.riemr.sampling.optimization.solver.OrToolsSolverAdapter;
import io.github.riemr.sampling.optimization.solver.SolverAdapter;
import io.github.riemr.sampling.optimization.solver.planner.OptaPlannerSolverAdapter;
import io.github.riemr.sampling.optimization.solver.planner.ProblemKey;
import io.github.riemr.sampling.optimization.solver.planner.SeatAssignmentSolution;
import org.junit.jupiter.api.Test;
import org.optaplanner.core.api.solver.SolverManager;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.test.util.ReflectionTestUtils;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class AssignmentSolverConfigTest {

    @SuppressWarnings("unchecked")
    private final ObjectProvider<SolverManager<SeatAssignmentSolution, ProblemKey>> provider = mock(ObjectProvider.class);

    private AssignmentSolverConfig config(String engine) {
        AssignmentSolverConfig config = new AssignmentSolverConfig();
        ReflectionTestUtils.setField(config, "engine", engine);
        ReflectionTestUtils.setField(config, "backend", "cbc");
        ReflectionTestUtils.setField(config, "timeLimit", "45s");
        ReflectionTestUtils.setField(config, "grace", "oops");
        ReflectionTestUtils.setField(config, "parallelism", 0);
        return config;
    }

    @Test
    void solverAdapter_defaultsToOrTools() {
        SolverAdapter adapter = config("ortools").solverAdapter(provider);

        assertThat(adapter).isInstanceOf(OrToolsSolverAdapter.class);
        assertThat(adapter.name()).isEqualTo("ortools-CBC");
    }

    @Test
    @SuppressWarnings("unchecked")
    void solverAdapter_selectsOptaPlanner() {
        when(provider.getObject()).thenReturn(mock(SolverManager.class));

        assertThat(config("OptaPlanner").solverAdapter(provider)).isInstanceOf(OptaPlannerSolverAdapter.class);
    }

    @Test
    void solverAdapter_rejectsUnknownEngine() {
        assertThatThrownBy(() -> config("gurobi").solverAdapter(provider))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("gurobi");
    }

    @Test
    void solverSettings_parsesTolerantlyAndClampsParallelism() {
        SolverSettings settings = config("ortools").solverSettings();

        assertThat(settings.timeLimit()).isEqualTo(Duration.ofSeconds(45));
        assertThat(settings.grace()).isEqualTo(Duration.ofSeconds(10));
        assertThat(settings.parallelism()).isEqualTo(1);
        assertThat(settings.guardTimeout()).isEqualTo(Duration.ofSeconds(55));
    }

    @Test
    void scoringWeights_bindsConfiguredValues() {
        ScoringWeights w = config("ortools").scoringWeights(30, 5, 20, 20, 3, 15, 15, 2, 10, 10, 2, -30, -25);

        assertThat(w.analysisPriorityPenalty()).isEqualTo(-25);
        assertThat(w.skillBase()).isEqualTo(30);
    }
}
