package org.smarttask.allocator.domain.service;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.smarttask.allocator.domain.model.AllocationResult;
import org.smarttask.allocator.domain.model.AssignmentRecord;
import org.smarttask.allocator.domain.model.Member;
import org.smarttask.allocator.domain.model.Priority;
import org.smarttask.allocator.domain.model.Task;
import org.smarttask.allocator.domain.model.TeamState;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class GreedyTaskAllocatorTest {

    private TaskAllocator allocator;

    @BeforeEach
    void setUp() {
        allocator = new GreedyTaskAllocator(new ScoringServiceImpl());
    }

    private static Member member(String id, double capacity, Object... skillsAndLevels) {
        Member.Builder builder = new Member.Builder().id(id).name("Member " + id).maxCapacity(capacity);
        for (int i = 0; i < skillsAndLevels.length; i += 2) {
            builder.skillLevel((String) skillsAndLevels[i], ((Number) skillsAndLevels[i + 1]).doubleValue());
        }
        return builder.build();
    }

    private static Task task(String id, Priority priority, String deadline, double hours, String... skills) {
        return new Task.Builder()
                .id(id)
                .title("Task " + id)
                .requiredSkills(List.of(skills))
                .estimatedHours(hours)
                .priority(priority)
                .deadline(LocalDate.parse(deadline))
                .build();
    }

    private static List<String> taskIds(List<AssignmentRecord> records) {
        return records.stream().map(AssignmentRecord::getTaskId).collect(Collectors.toList());
    }

    private static Member findMember(TeamState state, String id) {
        return state.getMembers().stream().filter(m -> m.getId().equals(id)).findFirst().orElseThrow();
    }

    @Nested
    class Ordering {

        @Test
        @DisplayName("Higher priority is processed before an earlier deadline")
        void priorityBeforeDeadline() {
            TeamState state = new TeamState(
                    List.of(member("m1", 40, "Java", 5)),
                    List.of(task("low", Priority.LOW, "2025-01-01", 2, "Java"),
                            task("high", Priority.HIGH, "2025-12-31", 2, "Java")));

            AllocationResult result = allocator.allocate(state);

            assertEquals(List.of("high", "low"), taskIds(result.getAssignments()));
        }

        @Test
        @DisplayName("Earlier deadline wins within the same priority")
        void deadlineBreaksTies() {
            TeamState state = new TeamState(
                    List.of(member("m1", 40, "Java", 5)),
                    List.of(task("late", Priority.MEDIUM, "2025-03-01", 2, "Java"),
                            task("early", Priority.MEDIUM, "2025-02-01", 2, "Java"),
                            task("urgent", Priority.HIGH, "2025-04-01", 2, "Java")));

            AllocationResult result = allocator.allocate(state);

            assertEquals(List.of("urgent", "early", "late"), taskIds(result.getAssignments()));
        }

        @Test
        @DisplayName("Equal priority and deadline keep input order")
        void stableForEqualKeys() {
            TeamState state = new TeamState(
                    List.of(member("m1", 40, "Java", 5)),
                    List.of(task("b", Priority.HIGH, "2025-02-01", 2, "Java"),
                            task("a", Priority.HIGH, "2025-02-01", 2, "Java"),
                            task("c", Priority.HIGH, "2025-02-01", 2, "Java")));

            AllocationResult result = allocator.allocate(state);

            assertEquals(List.of("b", "a", "c"), taskIds(result.getAssignments()));
        }

        @Test
        @DisplayName("New state keeps the stored task order")
        void stateKeepsInputOrder() {
            TeamState state = new TeamState(
                    List.of(member("m1", 40, "Java", 5)),
                    List.of(task("low", Priority.LOW, "2025-01-01", 2, "Java"),
                            task("high", Priority.HIGH, "2025-12-31", 2, "Java")));

            AllocationResult result = allocator.allocate(state);

            List<String> stored = result.getState().getTasks().stream().map(Task::getId).collect(Collectors.toList());
            assertEquals(List.of("low", "high"), stored);
            assertTrue(result.getState().getTasks().stream().allMatch(t -> "m1".equals(t.getAssignedTo())));
        }
    }

    @Nested
    class MemberSelection {

        @Test
        @DisplayName("Login component goes to Alice with score 85")
        void exampleScenario() {
            TeamState state = new TeamState(
                    List.of(member("alice", 40, "React", 8, "JavaScript", 9, "CSS", 7),
                            member("bob", 35, "Node.js", 9, "Python", 8)),
                    List.of(task("t1", Priority.HIGH, "2025-02-15", 8, "React", "JavaScript")));

            AllocationResult result = allocator.allocate(state);

            AssignmentRecord record = result.getAssignments().get(0);
            assertEquals("alice", record.getMemberId());
            assertEquals("Member alice", record.getMemberName());
            assertEquals(85, record.getMatchScore());
            assertEquals(8, findMember(result.getState(), "alice").getCurrentWorkload());
            assertEquals(0, findMember(result.getState(), "bob").getCurrentWorkload());
        }

        @Test
        @DisplayName("Member whose capacity would be exceeded is skipped")
        void capacityExclusion() {
            TeamState state = new TeamState(
                    List.of(member("expert", 5, "Java", 10),
                            member("junior", 40, "Java", 3)),
                    List.of(task("t1", Priority.HIGH, "2025-02-15", 8, "Java")));

            AllocationResult result = allocator.allocate(state);

            assertEquals("junior", result.getAssignments().get(0).getMemberId());
            assertEquals(30, result.getAssignments().get(0).getMatchScore());
        }

        @Test
        @DisplayName("Task that exactly fills capacity is accepted")
        void exactFitAllowed() {
            TeamState state = new TeamState(
                    List.of(member("m1", 8, "Java", 5)),
                    List.of(task("t1", Priority.HIGH, "2025-02-15", 8, "Java")));

            AllocationResult result = allocator.allocate(state);

            assertTrue(result.getAssignments().get(0).isAssigned());
            assertEquals(8, findMember(result.getState(), "m1").getCurrentWorkload());
        }

        @Test
        @DisplayName("Equal scores go to the member listed first")
        void tieKeepsFirstMember() {
            TeamState state = new TeamState(
                    List.of(member("first", 40, "Java", 6),
                            member("second", 40, "Java", 6)),
                    List.of(task("t1", Priority.HIGH, "2025-02-15", 4, "Java")));

            AllocationResult result = allocator.allocate(state);

            assertEquals("first", result.getAssignments().get(0).getMemberId());
        }

        @Test
        @DisplayName("Committed workload lowers scores for later tasks")
        void workloadCarriesForward() {
            TeamState state = new TeamState(
                    List.of(member("first", 40, "Java", 6),
                            member("second", 40, "Java", 6)),
                    List.of(task("t1", Priority.HIGH, "2025-02-15", 10, "Java"),
                            task("t2", Priority.HIGH, "2025-02-16", 10, "Java")));

            AllocationResult result = allocator.allocate(state);

            assertEquals("first", result.getAssignments().get(0).getMemberId());
            assertEquals(60, result.getAssignments().get(0).getMatchScore());
            assertEquals("second", result.getAssignments().get(1).getMemberId());
            assertEquals(60, result.getAssignments().get(1).getMatchScore());
        }

        @Test
        @DisplayName("Task with no matching member is recorded as unassigned")
        void zeroScoreUnassigned() {
            TeamState state = new TeamState(
                    List.of(member("m1", 40, "Java", 9)),
                    List.of(task("t1", Priority.HIGH, "2025-02-15", 4, "Rust")));

            AllocationResult result = allocator.allocate(state);

            AssignmentRecord record = result.getAssignments().get(0);
            assertFalse(record.isAssigned());
            assertNull(record.getMemberId());
            assertEquals(AssignmentRecord.UNASSIGNED_NAME, record.getMemberName());
            assertEquals(0, record.getMatchScore());
            assertEquals(AssignmentRecord.NO_MEMBER_REASON, record.getReason());
            assertNull(result.getState().getTasks().get(0).getAssignedTo());
            assertEquals(0, findMember(result.getState(), "m1").getCurrentWorkload());
        }

        @Test
        @DisplayName("Penalty that drives the only candidate to zero leaves the task unassigned")
        void penalizedToZero() {
            TeamState state = new TeamState(
                    // after t1 the penalty is 10/20*20 = 10, cancelling the skill score
                    List.of(member("m1", 20, "Java", 1)),
                    List.of(task("t1", Priority.HIGH, "2025-02-15", 10, "Java"),
                            task("t2", Priority.LOW, "2025-02-15", 0.5, "Java")));

            AllocationResult result = allocator.allocate(state);

            assertTrue(result.getAssignments().get(0).isAssigned());
            assertFalse(result.getAssignments().get(1).isAssigned());
        }

        @Test
        @DisplayName("Tasks are unassigned when there are no members")
        void noMembers() {
            TeamState state = new TeamState(List.of(),
                    List.of(task("t1", Priority.HIGH, "2025-02-15", 4, "Java")));

            AllocationResult result = allocator.allocate(state);

            assertEquals(1, result.getAssignments().size());
            assertFalse(result.getAssignments().get(0).isAssigned());
        }

        @Test
        @DisplayName("Empty task list produces no records")
        void noTasks() {
            TeamState state = new TeamState(List.of(member("m1", 40, "Java", 5)), List.of());

            AllocationResult result = allocator.allocate(state);

            assertTrue(result.getAssignments().isEmpty());
            assertEquals(1, result.getState().getMembers().size());
        }
    }

    @Nested
    class StateHandling {

        @Test
        @DisplayName("Existing workload is ignored and starts from zero")
        void workloadStartsAtZero() {
            Member busy = member("m1", 40, "Java", 5).withWorkload(35);
            TeamState state = new TeamState(List.of(busy),
                    List.of(task("t1", Priority.HIGH, "2025-02-15", 20, "Java")));

            AllocationResult result = allocator.allocate(state);

            assertEquals(50, result.getAssignments().get(0).getMatchScore());
            assertEquals(20, result.getState().getMembers().get(0).getCurrentWorkload());
        }

        @Test
        @DisplayName("Previous assignments are cleared when a task can no longer be placed")
        void staleAssignmentCleared() {
            Task stale = task("t1", Priority.HIGH, "2025-02-15", 4, "Rust").assignedTo("gone");
            TeamState state = new TeamState(List.of(member("m1", 40, "Java", 5)), List.of(stale));

            AllocationResult result = allocator.allocate(state);

            assertNull(result.getState().getTasks().get(0).getAssignedTo());
        }

        @Test
        @DisplayName("Input state is left untouched")
        void inputNotMutated() {
            Member busy = member("m1", 40, "Java", 5).withWorkload(12);
            Task task = task("t1", Priority.HIGH, "2025-02-15", 4, "Java");
            TeamState state = new TeamState(List.of(busy), List.of(task));

            allocator.allocate(state);

            assertEquals(12, state.getMembers().get(0).getCurrentWorkload());
            assertNull(state.getTasks().get(0).getAssignedTo());
        }

        @Test
        @DisplayName("Same input yields the same result")
        void deterministic() {
            TeamState state = mixedTeam();

            AllocationResult first = allocator.allocate(state);
            AllocationResult second = allocator.allocate(state);

            assertEquals(first.getAssignments(), second.getAssignments());
            assertEquals(first.getState(), second.getState());
        }

        @Test
        @DisplayName("No member ends above capacity and workload equals assigned hours")
        void capacityInvariant() {
            AllocationResult result = allocator.allocate(mixedTeam());

            Map<String, Double> hoursByMember = new HashMap<>();
            for (AssignmentRecord record : result.getAssignments()) {
                if (record.isAssigned()) {
                    hoursByMember.merge(record.getMemberId(), record.getEstimatedHours(), Double::sum);
                }
            }
            for (Member member : result.getState().getMembers()) {
                assertTrue(member.getCurrentWorkload() <= member.getMaxCapacity(), member.getId());
                assertEquals(hoursByMember.getOrDefault(member.getId(), 0.0), member.getCurrentWorkload(), 1e-9);
            }
        }

        @Test
        @DisplayName("Reset clears workloads and assignments")
        void resetClearsEverything() {
            AllocationResult result = allocator.allocate(mixedTeam());

            TeamState cleared = allocator.resetWorkloads(result.getState());

            assertTrue(cleared.getMembers().stream().allMatch(m -> m.getCurrentWorkload() == 0));
            assertTrue(cleared.getTasks().stream().noneMatch(Task::isAssigned));
            assertEquals(result.getState().getTasks().size(), cleared.getTasks().size());
        }

        @Test
        @DisplayName("Allocating after a reset reproduces the first run")
        void resetThenAllocateIsRepeatable() {
            AllocationResult first = allocator.allocate(mixedTeam());

            AllocationResult again = allocator.allocate(allocator.resetWorkloads(first.getState()));

            assertEquals(first.getAssignments(), again.getAssignments());
        }
    }

    private static TeamState mixedTeam() {
        List<Member> members = new ArrayList<>();
        members.add(member("alice", 20, "Java", 8, "SQL", 6));
        members.add(member("bob", 15, "Java", 6, "Docker", 9));
        members.add(member("carol", 10, "SQL", 9, "Docker", 4));

        List<Task> tasks = new ArrayList<>();
        tasks.add(task("t1", Priority.HIGH, "2025-02-10", 8, "Java"));
        tasks.add(task("t2", Priority.MEDIUM, "2025-02-12", 6, "SQL"));
        tasks.add(task("t3", Priority.HIGH, "2025-02-11", 7, "Docker"));
        tasks.add(task("t4", Priority.LOW, "2025-02-20", 9, "Java", "SQL"));
        tasks.add(task("t5", Priority.MEDIUM, "2025-02-12", 5, "Docker", "SQL"));
        tasks.add(task("t6", Priority.HIGH, "2025-02-10", 12, "Java"));
        tasks.add(task("t7", Priority.LOW, "2025-03-01", 4, "Kotlin"));
        return new TeamState(members, tasks);
    }
}
