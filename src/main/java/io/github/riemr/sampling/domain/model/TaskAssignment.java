package io.github.riemr.sampling.domain.model;

import java.util.List;

/**
 * 1 枠分の割当結果。workers は作業者マスタの並び順。
 */
public record TaskAssignment(int slot,
                             String taskName,
                             String area,
                             boolean unregistered,
                             List<String> workers) {

    public TaskAssignment {
        workers = List.copyOf(workers);
    }

    public static TaskAssignment unassigned(ResolvedTask task) {
        return new TaskAssignment(task.getSlot(), task.getDisplayName(), task.getArea(), task.isUnregistered(), List.of());
    }

    public boolean isEmpty() {
        return workers.isEmpty();
    }
}
