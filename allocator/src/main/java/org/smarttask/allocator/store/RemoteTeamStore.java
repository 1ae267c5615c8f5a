package org.smarttask.allocator.store;

import org.smarttask.allocator.api.DtoMapper;
import org.smarttask.allocator.api.TeamApiClient;
import org.smarttask.allocator.api.dto.MemberDto;
import org.smarttask.allocator.api.dto.TaskDto;
import org.smarttask.allocator.domain.model.Member;
import org.smarttask.allocator.domain.model.Task;
import org.smarttask.allocator.domain.model.TeamState;

import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;
import java.util.stream.Collectors;

/**
 * TeamStore backed by the external team API.
 * Every read goes to the API; nothing is cached locally.
 */
public final class RemoteTeamStore implements TeamStore {

    private static final Logger LOG = Logger.getLogger(RemoteTeamStore.class.getName());

    private final TeamApiClient apiClient;
    private volatile boolean initialized = false;

    public RemoteTeamStore(TeamApiClient apiClient) {
        this.apiClient = Objects.requireNonNull(apiClient, "apiClient must not be null");
    }

    @Override
    public TeamState getState() {
        List<MemberDto> members = apiClient.getMembers();
        if (members == null) {
            throw new TeamStoreException("Failed to fetch members from team API");
        }
        List<TaskDto> tasks = apiClient.getTasks();
        if (tasks == null) {
            throw new TeamStoreException("Failed to fetch tasks from team API");
        }

        try {
            TeamState state = new TeamState(
                    members.stream().map(DtoMapper::toMember).collect(Collectors.toList()),
                    tasks.stream().map(DtoMapper::toTask).collect(Collectors.toList()));
            initialized = true;
            return state;
        } catch (IllegalArgumentException e) {
            throw new TeamStoreException("Team API returned invalid data: " + e.getMessage(), e);
        }
    }

    @Override
    public Member addMember(Member member) {
        MemberDto created = apiClient.createMember(DtoMapper.toDto(member));
        if (created == null) {
            throw new TeamStoreException("Failed to create member " + member.getId());
        }
        LOG.info(() -> "Created member " + member.getId() + " via team API");
        return DtoMapper.toMember(created);
    }

    @Override
    public Task addTask(Task task) {
        TaskDto created = apiClient.createTask(DtoMapper.toDto(task));
        if (created == null) {
            throw new TeamStoreException("Failed to create task " + task.getId());
        }
        LOG.info(() -> "Created task " + task.getId() + " via team API");
        return DtoMapper.toTask(created);
    }

    @Override
    public void saveState(TeamState state) {
        if (!apiClient.saveState(DtoMapper.toDto(state))) {
            throw new TeamStoreException("Failed to persist team state");
        }
    }

    /**
     * True once the API has served a complete, valid snapshot.
     */
    @Override
    public boolean isInitialized() {
        return initialized;
    }
}
