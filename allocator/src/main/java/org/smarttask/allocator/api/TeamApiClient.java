package org.smarttask.allocator.api;

import org.smarttask.allocator.api.dto.MemberDto;
import org.smarttask.allocator.api.dto.TaskDto;
import org.smarttask.allocator.api.dto.TeamStateDto;

import java.util.List;

/**
 * Client interface for the external team API that owns members and tasks.
 */
public interface TeamApiClient {

    /**
     * Get all members.
     * GET /v1/members
     *
     * @return members, or null on failure
     */
    List<MemberDto> getMembers();

    /**
     * Get all tasks.
     * GET /v1/tasks
     *
     * @return tasks, or null on failure
     */
    List<TaskDto> getTasks();

    /**
     * Create a member.
     * POST /v1/members
     *
     * @return the stored member, or null on failure
     */
    MemberDto createMember(MemberDto member);

    /**
     * Create a task.
     * POST /v1/tasks
     *
     * @return the stored task, or null on failure
     */
    TaskDto createTask(TaskDto task);

    /**
     * Replace workloads and assignments with a committed state.
     * PUT /v1/team/state
     *
     * @return true if the API accepted the state
     */
    boolean saveState(TeamStateDto state);
}
