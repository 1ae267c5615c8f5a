package org.smarttask.allocator.store;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.smarttask.allocator.domain.model.Member;
import org.smarttask.allocator.domain.model.Priority;
import org.smarttask.allocator.domain.model.Task;
import org.smarttask.allocator.domain.model.TeamState;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryTeamStoreTest {

    private InMemoryTeamStore store;

    @BeforeEach
    void setUp() {
        store = new InMemoryTeamStore();
    }

    private static Member member(String id) {
        return new Member.Builder().id(id).name("Member " + id).skillLevel("Java", 5).maxCapacity(40).build();
    }

    private static Task task(String id) {
        return new Task.Builder()
                .id(id)
                .title("Task " + id)
                .requiredSkills(List.of("Java"))
                .estimatedHours(4)
                .priority(Priority.HIGH)
                .deadline(LocalDate.of(2025, 2, 1))
                .build();
    }

    @Test
    @DisplayName("New store is empty and ready")
    void startsEmpty() {
        assertTrue(store.isInitialized());
        assertEquals(TeamState.empty(), store.getState());
    }

    @Test
    @DisplayName("Members and tasks are kept in insertion order")
    void insertionOrder() {
        store.addMember(member("b"));
        store.addMember(member("a"));
        store.addTask(task("t2"));
        store.addTask(task("t1"));

        TeamState state = store.getState();
        assertEquals("b", state.getMembers().get(0).getId());
        assertEquals("a", state.getMembers().get(1).getId());
        assertEquals("t2", state.getTasks().get(0).getId());
        assertEquals("t1", state.getTasks().get(1).getId());
    }

    @Test
    @DisplayName("Duplicate ids are rejected")
    void duplicatesRejected() {
        store.addMember(member("m1"));
        store.addTask(task("t1"));

        IllegalArgumentException memberError = assertThrows(IllegalArgumentException.class,
                () -> store.addMember(member("m1")));
        assertEquals("Member already exists: m1", memberError.getMessage());
        assertThrows(IllegalArgumentException.class, () -> store.addTask(task("t1")));
        assertEquals(1, store.getState().getMembers().size());
    }

    @Test
    @DisplayName("Snapshots are not affected by later writes")
    void snapshotIsolation() {
        store.addMember(member("m1"));
        TeamState before = store.getState();

        store.saveState(new TeamState(List.of(member("m1").withWorkload(10)), List.of()));

        assertEquals(0, before.getMembers().get(0).getCurrentWorkload());
        assertEquals(10, store.getState().getMembers().get(0).getCurrentWorkload());
    }

    @Test
    @DisplayName("Saving a state read before later adds keeps those adds")
    void saveKeepsLaterAdds() {
        store.addMember(member("m1"));
        store.addTask(task("t1"));
        TeamState snapshot = store.getState();

        store.addMember(member("m2"));
        store.addTask(task("t2"));
        store.saveState(new TeamState(
                List.of(snapshot.getMembers().get(0).withWorkload(4)),
                List.of(snapshot.getTasks().get(0).assignedTo("m1"))));

        TeamState state = store.getState();
        assertEquals(2, state.getMembers().size());
        assertEquals(4, state.getMembers().get(0).getCurrentWorkload());
        assertEquals("m2", state.getMembers().get(1).getId());
        assertEquals("m1", state.getTasks().get(0).getAssignedTo());
        assertEquals(task("t2"), state.getTasks().get(1));
    }

    @Test
    @DisplayName("Seeded store exposes the initial state")
    void seeded() {
        TeamState seed = new TeamState(List.of(member("m1")), List.of(task("t1")));

        assertEquals(seed, new InMemoryTeamStore(seed).getState());
    }

    @Test
    @DisplayName("Concurrent adds are all recorded")
    void concurrentAdds() throws InterruptedException {
        ExecutorService pool = Executors.newFixedThreadPool(4);
        CountDownLatch done = new CountDownLatch(50);
        List<String> ids = new ArrayList<>();
        for (int i = 0; i < 50; i++) {
            ids.add("t" + i);
        }
        for (String id : ids) {
            pool.submit(() -> {
                try {
                    store.addTask(task(id));
                } finally {
                    done.countDown();
                }
            });
        }

        assertTrue(done.await(5, TimeUnit.SECONDS));
        pool.shutdown();
        assertEquals(50, store.getState().getTasks().size());
    }
}
