package org.smarttask.allocator.domain.service;

import org.smarttask.allocator.domain.model.AllocationResult;
import org.smarttask.allocator.domain.model.TeamState;

/**
 * Assigns tasks to members. Implementations never modify their input.
 */
public interface TaskAllocator {

    /**
     * Allocate every task in the given state, starting from zero workload.
     *
     * @param state members and tasks in their stored order
     * @return the state after allocation plus one record per task, in processing order
     */
    AllocationResult allocate(TeamState state);

    /**
     * Clear all workloads and task assignments.
     *
     * @param state current state
     * @return a state with every workload at 0 and every task unassigned
     */
    TeamState resetWorkloads(TeamState state);
}
