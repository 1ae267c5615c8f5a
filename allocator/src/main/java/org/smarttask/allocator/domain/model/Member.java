package org.smarttask.allocator.domain.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Immutable team member with rated skills and a bounded weekly capacity.
 * Workload changes produce a new instance via {@link #withWorkload(double)}.
 */
public final class Member {

    private final String id;
    private final String name;
    private final Set<String> skills;
    private final Map<String, Double> skillLevels;
    private final double currentWorkload;
    private final double maxCapacity;

    private Member(Builder builder) {
        this.id = requireText(builder.id, "id");
        this.name = requireText(builder.name, "name");
        this.skillLevels = Collections.unmodifiableMap(new LinkedHashMap<>(builder.skillLevels));
        Set<String> declared = builder.skills != null ? builder.skills : builder.skillLevels.keySet();
        this.skills = Collections.unmodifiableSet(new LinkedHashSet<>(declared));
        this.currentWorkload = builder.currentWorkload;
        this.maxCapacity = builder.maxCapacity;

        if (!Double.isFinite(maxCapacity) || maxCapacity <= 0) {
            throw new IllegalArgumentException("maxCapacity must be greater than 0 for member " + id);
        }
        if (!Double.isFinite(currentWorkload) || currentWorkload < 0) {
            throw new IllegalArgumentException("currentWorkload must not be negative for member " + id);
        }
        for (Map.Entry<String, Double> level : skillLevels.entrySet()) {
            if (level.getValue() == null || !Double.isFinite(level.getValue())) {
                throw new IllegalArgumentException(
                        "skill level for " + level.getKey() + " must be a number for member " + id);
            }
        }
    }

    public String getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public Set<String> getSkills() {
        return skills;
    }

    public Map<String, Double> getSkillLevels() {
        return skillLevels;
    }

    public double getCurrentWorkload() {
        return currentWorkload;
    }

    public double getMaxCapacity() {
        return maxCapacity;
    }

    /**
     * Proficiency for a skill, or null when the member does not hold it.
     */
    public Double getSkillLevel(String skill) {
        return skillLevels.get(skill);
    }

    /**
     * Check whether taking on the given hours would exceed capacity.
     */
    public boolean wouldExceedCapacity(double additionalHours) {
        return currentWorkload + additionalHours > maxCapacity;
    }

    public Member withWorkload(double workload) {
        return toBuilder().currentWorkload(workload).build();
    }

    public Builder toBuilder() {
        return new Builder()
                .id(id)
                .name(name)
                .skills(skills)
                .skillLevels(skillLevels)
                .currentWorkload(currentWorkload)
                .maxCapacity(maxCapacity);
    }

    private static String requireText(String value, String field) {
        if (value == null || value.trim().isEmpty()) {
            throw new IllegalArgumentException(field + " must not be empty");
        }
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Member)) {
            return false;
        }
        Member other = (Member) o;
        return Double.compare(currentWorkload, other.currentWorkload) == 0
                && Double.compare(maxCapacity, other.maxCapacity) == 0
                && id.equals(other.id)
                && name.equals(other.name)
                && skills.equals(other.skills)
                && skillLevels.equals(other.skillLevels);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, name, skills, skillLevels, currentWorkload, maxCapacity);
    }

    @Override
    public String toString() {
        return String.format("Member{id='%s', name='%s', workload=%.1f/%.1f}",
                id, name, currentWorkload, maxCapacity);
    }

    /**
     * Builder for Member.
     */
    public static final class Builder {
        private String id;
        private String name;
        private Set<String> skills;
        private Map<String, Double> skillLevels = new LinkedHashMap<>();
        private double currentWorkload;
        private double maxCapacity;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder skills(Set<String> skills) {
            this.skills = skills;
            return this;
        }

        public Builder skillLevels(Map<String, Double> skillLevels) {
            this.skillLevels = new LinkedHashMap<>(Objects.requireNonNull(skillLevels, "skillLevels must not be null"));
            return this;
        }

        public Builder skillLevel(String skill, double level) {
            this.skillLevels.put(skill, level);
            return this;
        }

        public Builder currentWorkload(double currentWorkload) {
            this.currentWorkload = currentWorkload;
            return this;
        }

        public Builder maxCapacity(double maxCapacity) {
            this.maxCapacity = maxCapacity;
            return this;
        }

        public Member build() {
            return new Member(this);
        }
    }
}
