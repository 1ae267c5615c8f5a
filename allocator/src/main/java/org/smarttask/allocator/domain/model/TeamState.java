package org.smarttask.allocator.domain.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Immutable snapshot of all members and tasks, in their stored order.
 */
public final class TeamState {

    private final List<Member> members;
    private final List<Task> tasks;

    public TeamState(List<Member> members, List<Task> tasks) {
        this.members = Collections.unmodifiableList(new ArrayList<>(Objects.requireNonNull(members, "members must not be null")));
        this.tasks = Collections.unmodifiableList(new ArrayList<>(Objects.requireNonNull(tasks, "tasks must not be null")));
    }

    public static TeamState empty() {
        return new TeamState(Collections.emptyList(), Collections.emptyList());
    }

    public List<Member> getMembers() {
        return members;
    }

    public List<Task> getTasks() {
        return tasks;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof TeamState)) {
            return false;
        }
        TeamState other = (TeamState) o;
        return members.equals(other.members) && tasks.equals(other.tasks);
    }

    @Override
    public int hashCode() {
        return Objects.hash(members, tasks);
    }

    @Override
    public String toString() {
        return "TeamState{members=" + members.size() + ", tasks=" + tasks.size() + "}";
    }
}
