package org.smarttask.allocator.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Response DTO for POST /api/allocate.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class AllocationResponseDto {

    @JsonProperty("success")
    private boolean success;

    @JsonProperty("assignments")
    private List<AssignmentDto> assignments;

    @JsonProperty("stats")
    private StatsDto stats;

    @JsonProperty("memberSummaries")
    private List<MemberSummaryDto> memberSummaries;

    @JsonProperty("error")
    private String error;

    public boolean isSuccess() {
        return success;
    }

    public void setSuccess(boolean success) {
        this.success = success;
    }

    public List<AssignmentDto> getAssignments() {
        return assignments;
    }

    public void setAssignments(List<AssignmentDto> assignments) {
        this.assignments = assignments;
    }

    public StatsDto getStats() {
        return stats;
    }

    public void setStats(StatsDto stats) {
        this.stats = stats;
    }

    public List<MemberSummaryDto> getMemberSummaries() {
        return memberSummaries;
    }

    public void setMemberSummaries(List<MemberSummaryDto> memberSummaries) {
        this.memberSummaries = memberSummaries;
    }

    public String getError() {
        return error;
    }

    public void setError(String error) {
        this.error = error;
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static final class AssignmentDto {
        @JsonProperty("taskId")
        private String taskId;

        @JsonProperty("taskTitle")
        private String taskTitle;

        @JsonProperty("memberId")
        private String memberId;

        @JsonProperty("memberName")
        private String memberName;

        @JsonProperty("matchScore")
        private long matchScore;

        @JsonProperty("estimatedHours")
        private double estimatedHours;

        @JsonProperty("reason")
        private String reason;

        public String getTaskId() {
            return taskId;
        }

        public void setTaskId(String taskId) {
            this.taskId = taskId;
        }

        public String getTaskTitle() {
            return taskTitle;
        }

        public void setTaskTitle(String taskTitle) {
            this.taskTitle = taskTitle;
        }

        public String getMemberId() {
            return memberId;
        }

        public void setMemberId(String memberId) {
            this.memberId = memberId;
        }

        public String getMemberName() {
            return memberName;
        }

        public void setMemberName(String memberName) {
            this.memberName = memberName;
        }

        public long getMatchScore() {
            return matchScore;
        }

        public void setMatchScore(long matchScore) {
            this.matchScore = matchScore;
        }

        public double getEstimatedHours() {
            return estimatedHours;
        }

        public void setEstimatedHours(double estimatedHours) {
            this.estimatedHours = estimatedHours;
        }

        public String getReason() {
            return reason;
        }

        public void setReason(String reason) {
            this.reason = reason;
        }
    }

    public static final class StatsDto {
        @JsonProperty("totalTasks")
        private int totalTasks;

        @JsonProperty("assignedTasks")
        private int assignedTasks;

        @JsonProperty("unassignedTasks")
        private int unassignedTasks;

        @JsonProperty("avgMatchScore")
        private long avgMatchScore;

        @JsonProperty("efficiency")
        private long efficiency;

        public int getTotalTasks() {
            return totalTasks;
        }

        public void setTotalTasks(int totalTasks) {
            this.totalTasks = totalTasks;
        }

        public int getAssignedTasks() {
            return assignedTasks;
        }

        public void setAssignedTasks(int assignedTasks) {
            this.assignedTasks = assignedTasks;
        }

        public int getUnassignedTasks() {
            return unassignedTasks;
        }

        public void setUnassignedTasks(int unassignedTasks) {
            this.unassignedTasks = unassignedTasks;
        }

        public long getAvgMatchScore() {
            return avgMatchScore;
        }

        public void setAvgMatchScore(long avgMatchScore) {
            this.avgMatchScore = avgMatchScore;
        }

        public long getEfficiency() {
            return efficiency;
        }

        public void setEfficiency(long efficiency) {
            this.efficiency = efficiency;
        }
    }

    public static final class MemberSummaryDto {
        @JsonProperty("id")
        private String id;

        @JsonProperty("name")
        private String name;

        @JsonProperty("currentWorkload")
        private double currentWorkload;

        @JsonProperty("maxCapacity")
        private double maxCapacity;

        @JsonProperty("utilization")
        private long utilization;

        public String getId() {
            return id;
        }

        public void setId(String id) {
            this.id = id;
        }

        public String getName() {
            return name;
        }

        public void setName(String name) {
            this.name = name;
        }

        public double getCurrentWorkload() {
            return currentWorkload;
        }

        public void setCurrentWorkload(double currentWorkload) {
            this.currentWorkload = currentWorkload;
        }

        public double getMaxCapacity() {
            return maxCapacity;
        }

        public void setMaxCapacity(double maxCapacity) {
            this.maxCapacity = maxCapacity;
        }

        public long getUtilization() {
            return utilization;
        }

        public void setUtilization(long utilization) {
            this.utilization = utilization;
        }
    }
}
