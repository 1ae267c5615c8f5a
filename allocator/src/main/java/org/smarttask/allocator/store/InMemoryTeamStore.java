package org.smarttask.allocator.store;

import org.smarttask.allocator.domain.model.Member;
import org.smarttask.allocator.domain.model.Task;
import org.smarttask.allocator.domain.model.TeamState;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.logging.Logger;
import java.util.stream.Collectors;

/**
 * Thread-safe in-memory implementation of TeamStore.
 * Uses read-write lock for concurrent access with exclusive writes.
 */
public final class InMemoryTeamStore implements TeamStore {

    private static final Logger LOG = Logger.getLogger(InMemoryTeamStore.class.getName());

    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    private TeamState state;

    public InMemoryTeamStore() {
        this(TeamState.empty());
    }

    public InMemoryTeamStore(TeamState initialState) {
        this.state = Objects.requireNonNull(initialState, "initialState must not be null");
        LOG.info(() -> String.format("In-memory store initialized with %d members and %d tasks",
                initialState.getMembers().size(), initialState.getTasks().size()));
    }

    @Override
    public TeamState getState() {
        lock.readLock().lock();
        try {
            return state;
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public Member addMember(Member member) {
        Objects.requireNonNull(member, "member must not be null");
        lock.writeLock().lock();
        try {
            for (Member existing : state.getMembers()) {
                if (existing.getId().equals(member.getId())) {
                    throw new IllegalArgumentException("Member already exists: " + member.getId());
                }
            }
            List<Member> members = new ArrayList<>(state.getMembers());
            members.add(member);
            state = new TeamState(members, state.getTasks());
            LOG.info(() -> "Added member " + member.getId());
            return member;
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public Task addTask(Task task) {
        Objects.requireNonNull(task, "task must not be null");
        lock.writeLock().lock();
        try {
            for (Task existing : state.getTasks()) {
                if (existing.getId().equals(task.getId())) {
                    throw new IllegalArgumentException("Task already exists: " + task.getId());
                }
            }
            List<Task> tasks = new ArrayList<>(state.getTasks());
            tasks.add(task);
            state = new TeamState(state.getMembers(), tasks);
            LOG.info(() -> "Added task " + task.getId());
            return task;
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public void saveState(TeamState newState) {
        Objects.requireNonNull(newState, "newState must not be null");
        lock.writeLock().lock();
        try {
            this.state = keepAdded(newState, state);
        } finally {
            lock.writeLock().unlock();
        }
        LOG.fine(() -> "Saved state: " + newState);
    }

    /**
     * Members and tasks created after the saved state was read are appended after it, unchanged.
     */
    private static TeamState keepAdded(TeamState saved, TeamState current) {
        Set<String> memberIds = saved.getMembers().stream().map(Member::getId).collect(Collectors.toSet());
        List<Member> members = new ArrayList<>(saved.getMembers());
        for (Member member : current.getMembers()) {
            if (!memberIds.contains(member.getId())) {
                members.add(member);
            }
        }

        Set<String> taskIds = saved.getTasks().stream().map(Task::getId).collect(Collectors.toSet());
        List<Task> tasks = new ArrayList<>(saved.getTasks());
        for (Task task : current.getTasks()) {
            if (!taskIds.contains(task.getId())) {
                tasks.add(task);
            }
        }
        return new TeamState(members, tasks);
    }

    @Override
    public boolean isInitialized() {
        return true;
    }
}
