package io.github.riemr.sampling.optimization.model;

import io.github.riemr.sampling.domain.model.ResolvedTask;
import io.github.riemr.sampling.domain.model.TaskAssignment;
import io.github.riemr.sampling.domain.model.TaskDefinition;
import io.github.riemr.sampling.domain.model.Worker;
import io.github.riemr.sampling.optimization.scoring.ScoringWeights;
import io.github.riemr.sampling.optimization.scoring.SuitabilityScorer;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;

import static io.github.riemr.sampling.support.Fixtures.task;
import static io.github.riemr.sampling.support.Fixtures.worker;
import static org.assertj.core.api.Assertions.assertThat;

class AssignmentModelBuilderTest {

    private static final LocalDate DAY = LocalDate.of(2025, 4, 2);

    private final SuitabilityScorer scorer = new SuitabilityScorer(ScoringWeights.defaults());
    private final AssignmentModelBuilder builder = new AssignmentModelBuilder(scorer);

    private final List<Worker> workers = List.of(
            worker("A", 5, 5).build(),
            worker("B", 3, 3).analysisPriority(true).build());

    private final List<ResolvedTask> tasks = List.of(
            resolved(task(1, "east-1", "東地区", 2).build(), 0),
            resolved(task(2, "west", "西地区", 1).build(), 1),
            resolved(task(3, "east-2", "東地区", 1).build(), 2));

    @Test
    void build_createsAssignmentAndAreaVariables() {
        AssignmentModel model = builder.build(DAY, workers, tasks);

        assertThat(model.getAreas()).containsExactly("東地区", "西地区");
        // x: 2x3, y: 2x2
        assertThat(model.getProgram().variableCount()).isEqualTo(10);
        assertThat(model.getProgram().getName()).isEqualTo("Sampling_Assignment_2025-04-02");
    }

    @Test
    void build_addsOneAreaLinkAndCapacityRows() {
        AssignmentModel model = builder.build(DAY, workers, tasks);

        List<LinearConstraint> rows = model.getProgram().getConstraints();
        assertThat(rows).filteredOn(c -> c.name().startsWith("one_area")).hasSize(2);
        assertThat(rows).filteredOn(c -> c.name().startsWith("link")).hasSize(6);
        assertThat(rows).filteredOn(c -> c.name().startsWith("capacity"))
                .extracting(LinearConstraint::rhs)
                .containsExactly(2, 1, 1);
    }

    @Test
    void build_objectiveIncludesPriorityAdjustment() {
        AssignmentModel model = builder.build(DAY, workers, tasks);
        BinaryProgram p = model.getProgram();

        assertThat(p.objectiveCoefficient(model.assignmentVariable(0, 0))).isEqualTo(40 + 26);
        assertThat(p.objectiveCoefficient(model.assignmentVariable(1, 0))).isEqualTo(30 + 20 - 20);
        assertThat(p.objectiveCoefficient(model.areaVariable(0, 0))).isZero();
    }

    @Test
    void build_allZeroAssignmentIsFeasible() {
        AssignmentModel model = builder.build(DAY, workers, tasks);

        assertThat(model.getProgram().isSatisfiedBy(new boolean[model.getProgram().variableCount()])).isTrue();
    }

    @Test
    void build_rejectsWorkerInTwoAreas() {
        AssignmentModel model = builder.build(DAY, workers, tasks);
        boolean[] values = new boolean[model.getProgram().variableCount()];
        values[model.assignmentVariable(0, 0)] = true;
        values[model.assignmentVariable(0, 1)] = true;
        values[model.areaVariable(0, 0)] = true;
        values[model.areaVariable(0, 1)] = true;

        assertThat(model.getProgram().isSatisfiedBy(values)).isFalse();
    }

    @Test
    void extract_listsWorkersInRegistryOrderPerSlot() {
        AssignmentModel model = builder.build(DAY, workers, tasks);
        boolean[] values = new boolean[model.getProgram().variableCount()];
        values[model.assignmentVariable(1, 0)] = true;
        values[model.assignmentVariable(0, 0)] = true;
        values[model.assignmentVariable(0, 2)] = true;

        List<TaskAssignment> result = model.extract(values);

        assertThat(result).extracting(TaskAssignment::taskName).containsExactly("east-1", "west", "east-2");
        assertThat(result.get(0).workers()).containsExactly("A", "B");
        assertThat(result.get(1).isEmpty()).isTrue();
        assertThat(result.get(2).workers()).containsExactly("A");
    }

    private static ResolvedTask resolved(TaskDefinition def, int slot) {
        return new ResolvedTask(def, DAY, def.getName(), slot, false);
    }
}
