package org.smarttask.allocator.domain.service;

import org.smarttask.allocator.domain.model.AllocationReport;
import org.smarttask.allocator.domain.model.AllocationResult;
import org.smarttask.allocator.domain.model.AllocationStats;
import org.smarttask.allocator.domain.model.AssignmentRecord;
import org.smarttask.allocator.domain.model.Member;
import org.smarttask.allocator.domain.model.MemberSummary;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Derives summary statistics and per-member utilization from an allocation result.
 * All percentages and averages are rounded half-up.
 */
public final class AllocationReporter {

    public AllocationReport report(AllocationResult result) {
        return new AllocationReport(
                result.getAssignments(),
                summarize(result.getAssignments()),
                summarizeMembers(result.getState().getMembers()));
    }

    public AllocationStats summarize(List<AssignmentRecord> assignments) {
        int total = assignments.size();
        int assigned = 0;
        long scoreSum = 0;
        for (AssignmentRecord record : assignments) {
            if (record.isAssigned()) {
                assigned++;
                scoreSum += record.getMatchScore();
            }
        }

        long avgMatchScore = assigned > 0 ? Math.round((double) scoreSum / assigned) : 0;
        long efficiency = total > 0 ? Math.round((double) assigned / total * 100) : 0;
        return new AllocationStats(total, assigned, avgMatchScore, efficiency);
    }

    public List<MemberSummary> summarizeMembers(List<Member> members) {
        return members.stream()
                .map(this::summarizeMember)
                .collect(Collectors.toList());
    }

    private MemberSummary summarizeMember(Member member) {
        long utilization = Math.round(member.getCurrentWorkload() / member.getMaxCapacity() * 100);
        return new MemberSummary(member.getId(), member.getName(),
                member.getCurrentWorkload(), member.getMaxCapacity(), utilization);
    }
}
