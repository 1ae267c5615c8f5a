package org.smarttask.allocator.api.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Full team state as exchanged with the team API and read from seed files.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class TeamStateDto {

    @JsonProperty("members")
    private List<MemberDto> members;

    @JsonProperty("tasks")
    private List<TaskDto> tasks;

    public List<MemberDto> getMembers() {
        return members;
    }

    public void setMembers(List<MemberDto> members) {
        this.members = members;
    }

    public List<TaskDto> getTasks() {
        return tasks;
    }

    public void setTasks(List<TaskDto> tasks) {
        this.tasks = tasks;
    }
}
