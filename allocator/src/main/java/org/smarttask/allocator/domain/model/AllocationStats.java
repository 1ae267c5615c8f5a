package org.smarttask.allocator.domain.model;

import java.util.Objects;

/**
 * Summary statistics over one allocation run.
 */
public final class AllocationStats {

    private final int totalTasks;
    private final int assignedTasks;
    private final int unassignedTasks;
    private final long avgMatchScore;
    private final long efficiency;

    public AllocationStats(int totalTasks, int assignedTasks, long avgMatchScore, long efficiency) {
        if (assignedTasks < 0 || assignedTasks > totalTasks) {
            throw new IllegalArgumentException("assignedTasks must be between 0 and totalTasks");
        }
        this.totalTasks = totalTasks;
        this.assignedTasks = assignedTasks;
        this.unassignedTasks = totalTasks - assignedTasks;
        this.avgMatchScore = avgMatchScore;
        this.efficiency = efficiency;
    }

    public int getTotalTasks() {
        return totalTasks;
    }

    public int getAssignedTasks() {
        return assignedTasks;
    }

    public int getUnassignedTasks() {
        return unassignedTasks;
    }

    public long getAvgMatchScore() {
        return avgMatchScore;
    }

    /**
     * Percentage of tasks that were assigned.
     */
    public long getEfficiency() {
        return efficiency;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof AllocationStats)) {
            return false;
        }
        AllocationStats other = (AllocationStats) o;
        return totalTasks == other.totalTasks
                && assignedTasks == other.assignedTasks
                && avgMatchScore == other.avgMatchScore
                && efficiency == other.efficiency;
    }

    @Override
    public int hashCode() {
        return Objects.hash(totalTasks, assignedTasks, avgMatchScore, efficiency);
    }

    @Override
    public String toString() {
        return String.format("AllocationStats{assigned=%d/%d, avgMatchScore=%d, efficiency=%d%%}",
                assignedTasks, totalTasks, avgMatchScore, efficiency);
    }
}
