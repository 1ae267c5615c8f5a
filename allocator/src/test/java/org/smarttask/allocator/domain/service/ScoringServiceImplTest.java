package org.smarttask.allocator.domain.service;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.smarttask.allocator.domain.model.Member;
import org.smarttask.allocator.domain.model.Priority;
import org.smarttask.allocator.domain.model.ScoringConfig;
import org.smarttask.allocator.domain.model.Task;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ScoringServiceImplTest {

    private ScoringService scoring;

    @BeforeEach
    void setUp() {
        scoring = new ScoringServiceImpl();
    }

    private Member alice(double workload) {
        return new Member.Builder()
                .id("alice")
                .name("Alice")
                .skillLevel("React", 8)
                .skillLevel("JavaScript", 9)
                .skillLevel("CSS", 7)
                .currentWorkload(workload)
                .maxCapacity(40)
                .build();
    }

    private Task task(String... skills) {
        return new Task.Builder()
                .id("t")
                .title("Task")
                .requiredSkills(List.of(skills))
                .estimatedHours(8)
                .priority(Priority.HIGH)
                .deadline(LocalDate.of(2025, 1, 1))
                .build();
    }

    @Test
    @DisplayName("Login component example scores 85 for an idle member")
    void exampleScenario() {
        assertEquals(85.0, scoring.score(alice(0), task("React", "JavaScript")), 1e-9);
    }

    @Test
    @DisplayName("No matching skill scores exactly zero")
    void noMatch() {
        assertEquals(0.0, scoring.score(alice(0), task("Python", "Docker")));
    }

    @Test
    @DisplayName("Task without required skills scores zero")
    void noRequiredSkills() {
        assertEquals(0.0, scoring.score(alice(0), task()));
    }

    @Test
    @DisplayName("Only held skills count towards the average")
    void partialMatchAveragesHeldSkillsOnly() {
        // CSS=7 held, Python not held: average is 7, not 3.5
        assertEquals(70.0, scoring.score(alice(0), task("CSS", "Python")), 1e-9);
    }

    @Test
    @DisplayName("Required skill order does not change the score")
    void orderIndependent() {
        assertEquals(scoring.score(alice(0), task("React", "CSS")),
                scoring.score(alice(0), task("CSS", "React")), 1e-9);
    }

    @Test
    @DisplayName("Workload penalty is ratio times 20")
    void workloadPenalty() {
        // 10/40 = 0.25 -> penalty 5
        assertEquals(80.0, scoring.score(alice(10), task("React", "JavaScript")), 1e-9);
        // full capacity -> penalty 20
        assertEquals(65.0, scoring.score(alice(40), task("React", "JavaScript")), 1e-9);
    }

    @Test
    @DisplayName("Score is floored at zero")
    void flooredAtZero() {
        Member novice = new Member.Builder()
                .id("n").name("Novice")
                .skillLevel("React", 1)
                .currentWorkload(10)
                .maxCapacity(10)
                .build();
        // 1*10 - 20 = -10 -> 0
        assertEquals(0.0, scoring.score(novice, task("React")));
    }

    @Test
    @DisplayName("Score is not capped at 100")
    void notCappedAt100() {
        Member expert = new Member.Builder()
                .id("e").name("Expert")
                .skillLevel("React", 15)
                .maxCapacity(40)
                .build();
        assertEquals(150.0, scoring.score(expert, task("React")), 1e-9);
    }

    @Test
    @DisplayName("Custom weights change multiplier and penalty")
    void customWeights() {
        ScoringService custom = new ScoringServiceImpl(ScoringConfig.fromMap(Map.of(
                ScoringConfig.SKILL_LEVEL_MULTIPLIER, 5.0,
                ScoringConfig.WORKLOAD_PENALTY_WEIGHT, 40.0)));
        // 8.5*5 - 0.25*40 = 42.5 - 10
        assertEquals(32.5, custom.score(alice(10), task("React", "JavaScript")), 1e-9);
    }
}
