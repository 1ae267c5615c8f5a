package org.smarttask.allocator.domain.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Result of one greedy allocation pass: the team state after the pass
 * and the assignment records in processing order.
 */
public final class AllocationResult {

    private final TeamState state;
    private final List<AssignmentRecord> assignments;

    public AllocationResult(TeamState state, List<AssignmentRecord> assignments) {
        this.state = Objects.requireNonNull(state, "state must not be null");
        this.assignments = Collections.unmodifiableList(
                new ArrayList<>(Objects.requireNonNull(assignments, "assignments must not be null")));
    }

    public TeamState getState() {
        return state;
    }

    public List<AssignmentRecord> getAssignments() {
        return assignments;
    }
}
