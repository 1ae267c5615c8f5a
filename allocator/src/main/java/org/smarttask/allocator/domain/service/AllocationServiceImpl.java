package org.smarttask.allocator.domain.service;

import org.smarttask.allocator.domain.model.AllocationOutcome;
import org.smarttask.allocator.domain.model.AllocationReport;
import org.smarttask.allocator.domain.model.AllocationResult;
import org.smarttask.allocator.domain.model.Member;
import org.smarttask.allocator.domain.model.Task;
import org.smarttask.allocator.domain.model.TeamState;
import org.smarttask.allocator.store.TeamStore;

import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Implementation of AllocationService.
 * Fetches a snapshot from the store, allocates it, commits the new state and builds the report.
 * Store writes made through this service share the run lock, so none of them
 * can land between a snapshot and its commit.
 */
public final class AllocationServiceImpl implements AllocationService {

    private static final Logger LOG = Logger.getLogger(AllocationServiceImpl.class.getName());

    private final TeamStore store;
    private final TaskAllocator allocator;
    private final AllocationReporter reporter;
    private final ReentrantLock runLock = new ReentrantLock();

    public AllocationServiceImpl(TeamStore store, TaskAllocator allocator, AllocationReporter reporter) {
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.allocator = Objects.requireNonNull(allocator, "allocator must not be null");
        this.reporter = Objects.requireNonNull(reporter, "reporter must not be null");
    }

    @Override
    public AllocationOutcome allocate() {
        runLock.lock();
        try {
            TeamState snapshot = store.getState();
            LOG.info(() -> String.format("Allocating %d tasks across %d members",
                    snapshot.getTasks().size(), snapshot.getMembers().size()));

            AllocationResult result = allocator.allocate(snapshot);
            AllocationReport report = reporter.report(result);
            store.saveState(result.getState());

            LOG.info(() -> "Allocation completed: " + report.getStats());
            return AllocationOutcome.succeeded(report);

        } catch (Exception e) {
            LOG.log(Level.SEVERE, e, () -> "Allocation failed");
            return AllocationOutcome.failed(describe(e));
        } finally {
            runLock.unlock();
        }
    }

    @Override
    public TeamState reset() {
        runLock.lock();
        try {
            TeamState cleared = allocator.resetWorkloads(store.getState());
            store.saveState(cleared);
            LOG.info(() -> "Reset workloads for " + cleared.getMembers().size()
                    + " members and assignments for " + cleared.getTasks().size() + " tasks");
            return cleared;
        } finally {
            runLock.unlock();
        }
    }

    @Override
    public Member addMember(Member member) {
        Objects.requireNonNull(member, "member must not be null");
        runLock.lock();
        try {
            return store.addMember(member);
        } finally {
            runLock.unlock();
        }
    }

    @Override
    public Task addTask(Task task) {
        Objects.requireNonNull(task, "task must not be null");
        runLock.lock();
        try {
            return store.addTask(task);
        } finally {
            runLock.unlock();
        }
    }

    private String describe(Exception e) {
        String message = e.getMessage();
        if (message == null || message.isEmpty()) {
            return "Allocation failed: " + e.getClass().getSimpleName();
        }
        return "Allocation failed: " + message;
    }
}
