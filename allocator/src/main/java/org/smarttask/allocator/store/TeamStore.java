package org.smarttask.allocator.store;

import org.smarttask.allocator.domain.model.Member;
import org.smarttask.allocator.domain.model.Task;
import org.smarttask.allocator.domain.model.TeamState;

/**
 * Source of truth for members and tasks.
 * Implementations throw {@link TeamStoreException} when the backing data cannot be read or written.
 */
public interface TeamStore {

    /**
     * Snapshot of all members and tasks, in insertion order.
     */
    TeamState getState();

    /**
     * Add a new member.
     *
     * @return the member as stored
     * @throws IllegalArgumentException if a member with the same id exists
     */
    Member addMember(Member member);

    /**
     * Add a new task.
     *
     * @return the task as stored
     * @throws IllegalArgumentException if a task with the same id exists
     */
    Task addTask(Task task);

    /**
     * Commit workloads and assignments for the members and tasks in the given state.
     * The in-memory store keeps entities that were added after the state was read.
     */
    void saveState(TeamState state);

    /**
     * Check if the store can serve requests.
     */
    boolean isInitialized();
}
