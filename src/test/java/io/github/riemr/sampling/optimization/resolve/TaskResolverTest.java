package io.github.riemr.sampling.optimization.resolve;

import io.github.riemr.sampling.domain.model.ResolvedTask;
import io.github.riemr.sampling.domain.model.TaskDefinition;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;

import static io.github.riemr.sampling.support.Fixtures.task;
import static org.assertj.core.api.Assertions.assertThat;

class TaskResolverTest {

    private static final LocalDate DAY = LocalDate.of(2025, 4, 1);

    private final TaskResolver resolver = new TaskResolver();

    private final List<TaskDefinition> registry = List.of(
            task(1, "水質調査", "東地区", 2).build(),
            task(2, "東地区 水質調査A", "東地区", 3).build(),
            task(3, "土壌サンプリング", "西地区", 1).build());

    @Test
    void resolve_prefersExactMatch_overEarlierSubstringMatch() {
        ResolvedTask r = resolver.resolve("  東地区 水質調査A ", DAY, 0, registry);

        assertThat(r.getDefinition().getId()).isEqualTo(2);
        assertThat(r.isUnregistered()).isFalse();
        assertThat(r.getDisplayName()).isEqualTo("  東地区 水質調査A ");
    }

    @Test
    void resolve_takesFirstSubstringMatchInRegistryOrder() {
        ResolvedTask r = resolver.resolve("北地区 水質調査B", DAY, 1, registry);

        assertThat(r.getDefinition().getId()).isEqualTo(1);
        assertThat(r.getSlot()).isEqualTo(1);
    }

    @Test
    void resolve_matches_whenRegistryNameContainsDisplayName() {
        ResolvedTask r = resolver.resolve("サンプリング", DAY, 0, registry);

        assertThat(r.getDefinition().getId()).isEqualTo(3);
    }

    @Test
    void resolve_returnsUnregisteredDefault_whenNothingMatches() {
        ResolvedTask r = resolver.resolve("臨時 苦情対応調査", DAY, 0, registry);

        assertThat(r.isUnregistered()).isTrue();
        assertThat(r.getRequiredWorkers()).isEqualTo(1);
        assertThat(r.getArea()).isEqualTo(TaskResolver.UNKNOWN_AREA);
        TaskDefinition def = r.getDefinition();
        assertThat(def.getName()).isEqualTo("臨時 苦情対応調査");
        assertThat(def.getRequiredSkill()).isEqualTo(3);
        assertThat(def.getRequiredStrength()).isEqualTo(3);
        assertThat(def.getDuration()).isEqualTo(1.0);
        assertThat(def.vesselWorkRequired()).isFalse();
        assertThat(def.navigationRequired()).isFalse();
    }

    @Test
    void resolve_returnsUnregistered_whenRegistryEmpty() {
        assertThat(resolver.resolve("水質調査", DAY, 0, List.of()).isUnregistered()).isTrue();
    }
}
