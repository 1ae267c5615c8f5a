package org.smarttask.allocator.domain.service;

import org.smarttask.allocator.domain.model.Member;
import org.smarttask.allocator.domain.model.ScoringConfig;
import org.smarttask.allocator.domain.model.Task;

import java.util.Objects;
import java.util.logging.Logger;

/**
 * Implementation of ScoringService using skill overlap and a workload penalty.
 *
 * Score formula (higher = better):
 *   score = max(0, avg_matched_level * skill_level_multiplier
 *                  - (current_workload / max_capacity) * workload_penalty_weight)
 *
 * Only the required skills the member holds count towards the average.
 * The result is not capped at the top.
 */
public final class ScoringServiceImpl implements ScoringService {

    private static final Logger LOG = Logger.getLogger(ScoringServiceImpl.class.getName());

    private final ScoringConfig config;

    public ScoringServiceImpl() {
        this(ScoringConfig.defaults());
    }

    public ScoringServiceImpl(ScoringConfig config) {
        this.config = Objects.requireNonNull(config, "config must not be null");
    }

    @Override
    public double score(Member member, Task task) {
        double levelSum = 0;
        int matched = 0;
        for (String skill : task.getRequiredSkills()) {
            Double level = member.getSkillLevel(skill);
            if (level != null) {
                levelSum += level;
                matched++;
            }
        }

        if (matched == 0) {
            return 0;
        }

        double skillScore = calculateSkillScore(levelSum / matched);
        double penalty = calculateWorkloadPenalty(member);
        double score = Math.max(0, skillScore - penalty);

        final int matchedSkills = matched;
        LOG.fine(() -> String.format(
                "Scored %s for %s: matched=%d/%d, skill=%.1f, penalty=%.1f, total=%.2f",
                member.getId(), task.getId(), matchedSkills, task.getRequiredSkills().size(),
                skillScore, penalty, score));

        return score;
    }

    private double calculateSkillScore(double averageLevel) {
        return averageLevel * config.getSkillLevelMultiplier();
    }

    /**
     * Penalizes members proportionally to how much of their capacity is already committed.
     */
    private double calculateWorkloadPenalty(Member member) {
        double workloadRatio = member.getCurrentWorkload() / member.getMaxCapacity();
        return workloadRatio * config.getWorkloadPenaltyWeight();
    }
}
