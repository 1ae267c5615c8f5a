package org.smarttask.allocator.domain.service;

import org.smarttask.allocator.domain.model.AllocationResult;
import org.smarttask.allocator.domain.model.AssignmentRecord;
import org.smarttask.allocator.domain.model.Member;
import org.smarttask.allocator.domain.model.Task;
import org.smarttask.allocator.domain.model.TeamState;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

/**
 * Greedy implementation of TaskAllocator.
 *
 * Tasks are visited most urgent first. Each one goes to the member with the
 * highest score among those who still have room for it; ties keep the member
 * that appears first. Decisions are never revisited, so the workload
 * committed by earlier tasks lowers the scores seen by later ones.
 */
public final class GreedyTaskAllocator implements TaskAllocator {

    private static final Logger LOG = Logger.getLogger(GreedyTaskAllocator.class.getName());

    /**
     * Higher priority first, then earlier deadline. Sorting is stable, so equal keys keep input order.
     */
    static final Comparator<Task> URGENCY_ORDER = Comparator
            .comparingInt((Task t) -> t.getPriority().getWeight()).reversed()
            .thenComparing(Task::getDeadline);

    private final ScoringService scoringService;

    public GreedyTaskAllocator(ScoringService scoringService) {
        this.scoringService = Objects.requireNonNull(scoringService, "scoringService must not be null");
    }

    @Override
    public AllocationResult allocate(TeamState state) {
        Objects.requireNonNull(state, "state must not be null");

        // Working copy; index matches the stored member order
        List<Member> members = state.getMembers().stream()
                .map(m -> m.withWorkload(0))
                .collect(Collectors.toCollection(ArrayList::new));

        List<Task> tasks = state.getTasks();
        List<Integer> processingOrder = IntStream.range(0, tasks.size()).boxed()
                .sorted(Comparator.comparing(tasks::get, URGENCY_ORDER))
                .collect(Collectors.toList());

        List<AssignmentRecord> assignments = new ArrayList<>(tasks.size());
        Task[] allocated = new Task[tasks.size()];

        for (int taskIndex : processingOrder) {
            Task task = tasks.get(taskIndex);
            int bestIndex = -1;
            double bestScore = -1;

            for (int i = 0; i < members.size(); i++) {
                Member member = members.get(i);
                if (member.wouldExceedCapacity(task.getEstimatedHours())) {
                    continue;
                }
                double score = scoringService.score(member, task);
                if (score > bestScore) {
                    bestIndex = i;
                    bestScore = score;
                }
            }

            if (bestIndex >= 0 && bestScore > 0) {
                Member winner = members.get(bestIndex);
                assignments.add(AssignmentRecord.assigned(task, winner, bestScore));
                members.set(bestIndex, winner.withWorkload(winner.getCurrentWorkload() + task.getEstimatedHours()));
                allocated[taskIndex] = task.assignedTo(winner.getId());

                final double score = bestScore;
                LOG.fine(() -> String.format("Assigned %s to %s (score=%.2f)", task.getId(), winner.getId(), score));
            } else {
                assignments.add(AssignmentRecord.unassigned(task));
                allocated[taskIndex] = task.unassigned();
                LOG.fine(() -> "No eligible member for task " + task.getId());
            }
        }

        // Stored task order is kept; only the records follow processing order
        return new AllocationResult(new TeamState(members, Arrays.asList(allocated)), assignments);
    }

    @Override
    public TeamState resetWorkloads(TeamState state) {
        Objects.requireNonNull(state, "state must not be null");
        List<Member> members = state.getMembers().stream()
                .map(m -> m.withWorkload(0))
                .collect(Collectors.toList());
        List<Task> tasks = state.getTasks().stream()
                .map(Task::unassigned)
                .collect(Collectors.toList());
        return new TeamState(members, tasks);
    }
}
