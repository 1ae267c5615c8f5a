package org.smarttask.allocator.domain.model;

import java.util.Objects;

/**
 * Outcome of allocating a single task.
 * Unassigned records carry no member id and a reason.
 */
public final class AssignmentRecord {

    public static final String UNASSIGNED_NAME = "Unassigned";
    public static final String NO_MEMBER_REASON = "No available member with required skills";

    private final String taskId;
    private final String taskTitle;
    private final String memberId;
    private final String memberName;
    private final long matchScore;
    private final double estimatedHours;
    private final String reason;

    private AssignmentRecord(String taskId, String taskTitle, String memberId, String memberName,
                             long matchScore, double estimatedHours, String reason) {
        this.taskId = Objects.requireNonNull(taskId, "taskId must not be null");
        this.taskTitle = Objects.requireNonNull(taskTitle, "taskTitle must not be null");
        this.memberId = memberId;
        this.memberName = Objects.requireNonNull(memberName, "memberName must not be null");
        this.matchScore = matchScore;
        this.estimatedHours = estimatedHours;
        this.reason = reason;
    }

    /**
     * Record for a task given to a member. The raw score is rounded half-up.
     */
    public static AssignmentRecord assigned(Task task, Member member, double score) {
        return new AssignmentRecord(task.getId(), task.getTitle(), member.getId(), member.getName(),
                Math.round(score), task.getEstimatedHours(), null);
    }

    public static AssignmentRecord unassigned(Task task) {
        return new AssignmentRecord(task.getId(), task.getTitle(), null, UNASSIGNED_NAME,
                0, task.getEstimatedHours(), NO_MEMBER_REASON);
    }

    public String getTaskId() {
        return taskId;
    }

    public String getTaskTitle() {
        return taskTitle;
    }

    public String getMemberId() {
        return memberId;
    }

    public String getMemberName() {
        return memberName;
    }

    public long getMatchScore() {
        return matchScore;
    }

    public double getEstimatedHours() {
        return estimatedHours;
    }

    public String getReason() {
        return reason;
    }

    public boolean isAssigned() {
        return memberId != null;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof AssignmentRecord)) {
            return false;
        }
        AssignmentRecord other = (AssignmentRecord) o;
        return matchScore == other.matchScore
                && Double.compare(estimatedHours, other.estimatedHours) == 0
                && taskId.equals(other.taskId)
                && taskTitle.equals(other.taskTitle)
                && Objects.equals(memberId, other.memberId)
                && memberName.equals(other.memberName)
                && Objects.equals(reason, other.reason);
    }

    @Override
    public int hashCode() {
        return Objects.hash(taskId, taskTitle, memberId, memberName, matchScore, estimatedHours, reason);
    }

    @Override
    public String toString() {
        return String.format("AssignmentRecord{task='%s', member='%s', score=%d}", taskId, memberName, matchScore);
    }
}
