package org.smarttask.allocator.api;

import org.smarttask.allocator.api.dto.AllocationResponseDto;
import org.smarttask.allocator.api.dto.MemberDto;
import org.smarttask.allocator.api.dto.TaskDto;
import org.smarttask.allocator.api.dto.TeamStateDto;
import org.smarttask.allocator.domain.model.AllocationReport;
import org.smarttask.allocator.domain.model.AllocationStats;
import org.smarttask.allocator.domain.model.AssignmentRecord;
import org.smarttask.allocator.domain.model.Member;
import org.smarttask.allocator.domain.model.MemberSummary;
import org.smarttask.allocator.domain.model.Priority;
import org.smarttask.allocator.domain.model.Task;
import org.smarttask.allocator.domain.model.TeamState;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Converts between wire DTOs and domain objects.
 * Conversion to the domain validates the entity and throws IllegalArgumentException on bad input.
 */
public final class DtoMapper {

    private DtoMapper() {
    }

    public static Member toMember(MemberDto dto) {
        if (dto == null) {
            throw new IllegalArgumentException("member must not be null");
        }
        if (dto.getMaxCapacity() == null) {
            throw new IllegalArgumentException("maxCapacity is required");
        }
        Member.Builder builder = new Member.Builder()
                .id(dto.getId() != null ? dto.getId() : newId())
                .name(dto.getName())
                .skillLevels(dto.getSkillLevels() != null ? dto.getSkillLevels() : Collections.emptyMap())
                .currentWorkload(dto.getCurrentWorkload() != null ? dto.getCurrentWorkload() : 0)
                .maxCapacity(dto.getMaxCapacity());
        if (dto.getSkills() != null) {
            builder.skills(new LinkedHashSet<>(dto.getSkills()));
        }
        return builder.build();
    }

    public static Task toTask(TaskDto dto) {
        if (dto == null) {
            throw new IllegalArgumentException("task must not be null");
        }
        if (dto.getEstimatedHours() == null) {
            throw new IllegalArgumentException("estimatedHours is required");
        }
        return new Task.Builder()
                .id(dto.getId() != null ? dto.getId() : newId())
                .title(dto.getTitle())
                .description(dto.getDescription())
                .requiredSkills(dto.getRequiredSkills() != null ? dto.getRequiredSkills() : Collections.emptyList())
                .estimatedHours(dto.getEstimatedHours())
                .priority(Priority.fromCode(dto.getPriority()))
                .deadline(dto.getDeadline())
                .assignedTo(dto.getAssignedTo())
                .build();
    }

    public static TeamState toTeamState(TeamStateDto dto) {
        if (dto == null) {
            return TeamState.empty();
        }
        List<Member> members = dto.getMembers() == null ? Collections.emptyList()
                : dto.getMembers().stream().map(DtoMapper::toMember).collect(Collectors.toList());
        List<Task> tasks = dto.getTasks() == null ? Collections.emptyList()
                : dto.getTasks().stream().map(DtoMapper::toTask).collect(Collectors.toList());
        return new TeamState(members, tasks);
    }

    public static MemberDto toDto(Member member) {
        MemberDto dto = new MemberDto();
        dto.setId(member.getId());
        dto.setName(member.getName());
        dto.setSkills(new ArrayList<>(member.getSkills()));
        dto.setSkillLevels(member.getSkillLevels());
        dto.setCurrentWorkload(member.getCurrentWorkload());
        dto.setMaxCapacity(member.getMaxCapacity());
        return dto;
    }

    public static TaskDto toDto(Task task) {
        TaskDto dto = new TaskDto();
        dto.setId(task.getId());
        dto.setTitle(task.getTitle());
        dto.setDescription(task.getDescription());
        dto.setRequiredSkills(task.getRequiredSkills());
        dto.setEstimatedHours(task.getEstimatedHours());
        dto.setPriority(task.getPriority().getCode());
        dto.setDeadline(task.getDeadline());
        dto.setAssignedTo(task.getAssignedTo());
        return dto;
    }

    public static TeamStateDto toDto(TeamState state) {
        TeamStateDto dto = new TeamStateDto();
        dto.setMembers(state.getMembers().stream().map(DtoMapper::toDto).collect(Collectors.toList()));
        dto.setTasks(state.getTasks().stream().map(DtoMapper::toDto).collect(Collectors.toList()));
        return dto;
    }

    public static AllocationResponseDto toResponse(AllocationReport report) {
        AllocationResponseDto dto = new AllocationResponseDto();
        dto.setSuccess(true);
        dto.setAssignments(report.getAssignments().stream().map(DtoMapper::toDto).collect(Collectors.toList()));
        dto.setStats(toDto(report.getStats()));
        dto.setMemberSummaries(report.getMemberSummaries().stream().map(DtoMapper::toDto).collect(Collectors.toList()));
        return dto;
    }

    public static AllocationResponseDto failure(String error) {
        AllocationResponseDto dto = new AllocationResponseDto();
        dto.setSuccess(false);
        dto.setError(error);
        return dto;
    }

    private static AllocationResponseDto.AssignmentDto toDto(AssignmentRecord record) {
        AllocationResponseDto.AssignmentDto dto = new AllocationResponseDto.AssignmentDto();
        dto.setTaskId(record.getTaskId());
        dto.setTaskTitle(record.getTaskTitle());
        dto.setMemberId(record.getMemberId());
        dto.setMemberName(record.getMemberName());
        dto.setMatchScore(record.getMatchScore());
        dto.setEstimatedHours(record.getEstimatedHours());
        dto.setReason(record.getReason());
        return dto;
    }

    private static AllocationResponseDto.StatsDto toDto(AllocationStats stats) {
        AllocationResponseDto.StatsDto dto = new AllocationResponseDto.StatsDto();
        dto.setTotalTasks(stats.getTotalTasks());
        dto.setAssignedTasks(stats.getAssignedTasks());
        dto.setUnassignedTasks(stats.getUnassignedTasks());
        dto.setAvgMatchScore(stats.getAvgMatchScore());
        dto.setEfficiency(stats.getEfficiency());
        return dto;
    }

    private static AllocationResponseDto.MemberSummaryDto toDto(MemberSummary summary) {
        AllocationResponseDto.MemberSummaryDto dto = new AllocationResponseDto.MemberSummaryDto();
        dto.setId(summary.getId());
        dto.setName(summary.getName());
        dto.setCurrentWorkload(summary.getCurrentWorkload());
        dto.setMaxCapacity(summary.getMaxCapacity());
        dto.setUtilization(summary.getUtilization());
        return dto;
    }

    private static String newId() {
        return UUID.randomUUID().toString();
    }
}
