package org.smarttask.allocator.domain.service;

import org.smarttask.allocator.domain.model.AllocationOutcome;
import org.smarttask.allocator.domain.model.Member;
import org.smarttask.allocator.domain.model.Task;
import org.smarttask.allocator.domain.model.TeamState;

/**
 * Service for running allocations against the team store.
 * Calls are serialized: allocations, resets and creates never interleave,
 * so a create is never overwritten by a concurrent commit.
 */
public interface AllocationService {

    /**
     * Allocate all stored tasks, commit the resulting workloads and assignments,
     * and report on the run.
     *
     * @return a successful outcome with the report, or a failed outcome if
     *         the run could not complete; nothing is committed on failure
     */
    AllocationOutcome allocate();

    /**
     * Clear every workload and task assignment in the store.
     *
     * @return the committed state
     */
    TeamState reset();

    /**
     * Add a member to the store.
     *
     * @throws IllegalArgumentException if a member with the same id exists
     */
    Member addMember(Member member);

    /**
     * Add a task to the store.
     *
     * @throws IllegalArgumentException if a task with the same id exists
     */
    Task addTask(Task task);
}
