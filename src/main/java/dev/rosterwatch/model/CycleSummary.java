package dev.rosterwatch.model;

import java.util.List;

public record CycleSummary(List<CategoryOutcome> outcomes, boolean persisted) {

    public boolean allSucceeded() {
        return outcomes.stream().allMatch(CategoryOutcome::success);
    }

    public int notificationCount() {
        return outcomes.stream().mapToInt(o -> o.notified().size()).sum();
    }
}
