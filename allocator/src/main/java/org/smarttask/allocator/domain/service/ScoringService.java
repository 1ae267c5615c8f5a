package org.smarttask.allocator.domain.service;

import org.smarttask.allocator.domain.model.Member;
import org.smarttask.allocator.domain.model.Task;

/**
 * Service for calculating how well a member suits a task.
 */
public interface ScoringService {

    /**
     * Calculate the match score for a member/task pair.
     * Higher score = better candidate; 0 means the member holds none of the required skills.
     *
     * @param member the member, with workload as committed so far in the current run
     * @param task the task to be placed
     * @return score, never negative
     */
    double score(Member member, Task task);
}
