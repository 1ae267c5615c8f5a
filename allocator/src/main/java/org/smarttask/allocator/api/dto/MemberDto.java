package org.smarttask.allocator.api.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

/**
 * DTO for a team member.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class MemberDto {

    @JsonProperty("id")
    private String id;

    @JsonProperty("name")
    private String name;

    @JsonProperty("skills")
    private List<String> skills;

    @JsonProperty("skillLevels")
    private Map<String, Double> skillLevels;

    @JsonProperty("currentWorkload")
    private Double currentWorkload;

    @JsonProperty("maxCapacity")
    private Double maxCapacity;

    // Getters and Setters
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

    public List<String> getSkills() {
        return skills;
    }

    public void setSkills(List<String> skills) {
        this.skills = skills;
    }

    public Map<String, Double> getSkillLevels() {
        return skillLevels;
    }

    public void setSkillLevels(Map<String, Double> skillLevels) {
        this.skillLevels = skillLevels;
    }

    public Double getCurrentWorkload() {
        return currentWorkload;
    }

    public void setCurrentWorkload(Double currentWorkload) {
        this.currentWorkload = currentWorkload;
    }

    public Double getMaxCapacity() {
        return maxCapacity;
    }

    public void setMaxCapacity(Double maxCapacity) {
        this.maxCapacity = maxCapacity;
    }
}
