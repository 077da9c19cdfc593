package com.guitar.registry.api;

import com.guitar.registry.core.model.EntityKind;
import com.guitar.registry.decision.ResolutionAction;
import com.guitar.registry.writer.WriteOutcome;

import java.util.List;

/**
 * Insert and update counts per entity kind, over the successful submissions of a batch.
 */
public record ActionCounts(
        int manufacturersInserted,
        int manufacturersUpdated,
        int modelsInserted,
        int modelsUpdated,
        int guitarsInserted,
        int guitarsUpdated
) {
    public static ActionCounts from(List<SubmissionResult> results) {
        int[] counts = new int[6];
        for (SubmissionResult result : results) {
            if (!result.success()) {
                continue;
            }
            for (WriteOutcome write : result.writes()) {
                counts[slot(write.kind(), write.action())]++;
            }
        }
        return new ActionCounts(counts[0], counts[1], counts[2], counts[3], counts[4], counts[5]);
    }

    private static int slot(EntityKind kind, ResolutionAction action) {
        int base = kind.ordinal() * 2;
        return action == ResolutionAction.INSERT ? base : base + 1;
    }
}
