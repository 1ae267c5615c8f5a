package org.smarttask.allocator.domain.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Caller-facing report of an allocation run.
 */
public final class AllocationReport {

    private final List<AssignmentRecord> assignments;
    private final AllocationStats stats;
    private final List<MemberSummary> memberSummaries;

    public AllocationReport(List<AssignmentRecord> assignments, AllocationStats stats,
                            List<MemberSummary> memberSummaries) {
        this.assignments = Collections.unmodifiableList(
                new ArrayList<>(Objects.requireNonNull(assignments, "assignments must not be null")));
        this.stats = Objects.requireNonNull(stats, "stats must not be null");
        this.memberSummaries = Collections.unmodifiableList(
                new ArrayList<>(Objects.requireNonNull(memberSummaries, "memberSummaries must not be null")));
    }

    public List<AssignmentRecord> getAssignments() {
        return assignments;
    }

    public AllocationStats getStats() {
        return stats;
    }

    public List<MemberSummary> getMemberSummaries() {
        return memberSummaries;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof AllocationReport)) {
            return false;
        }
        AllocationReport other = (AllocationReport) o;
        return assignments.equals(other.assignments)
                && stats.equals(other.stats)
                && memberSummaries.equals(other.memberSummaries);
    }

    @Override
    public int hashCode() {
        return Objects.hash(assignments, stats, memberSummaries);
    }
}
