package org.smarttask.allocator.domain.model;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Immutable unit of work requiring a set of skills.
 * {@code assignedTo} holds the id of the member the task went to, or null.
 */
public final class Task {

    private final String id;
    private final String title;
    private final String description;
    private final List<String> requiredSkills;
    private final double estimatedHours;
    private final Priority priority;
    private final LocalDate deadline;
    private final String assignedTo;

    private Task(Builder builder) {
        if (builder.id == null || builder.id.trim().isEmpty()) {
            throw new IllegalArgumentException("id must not be empty");
        }
        if (builder.title == null || builder.title.trim().isEmpty()) {
            throw new IllegalArgumentException("title must not be empty for task " + builder.id);
        }
        if (!Double.isFinite(builder.estimatedHours) || builder.estimatedHours <= 0) {
            throw new IllegalArgumentException("estimatedHours must be greater than 0 for task " + builder.id);
        }
        if (builder.priority == null) {
            throw new IllegalArgumentException("priority must not be null for task " + builder.id);
        }
        if (builder.deadline == null) {
            throw new IllegalArgumentException("deadline must not be null for task " + builder.id);
        }
        this.id = builder.id;
        this.title = builder.title;
        this.description = builder.description;
        this.requiredSkills = Collections.unmodifiableList(new ArrayList<>(builder.requiredSkills));
        this.estimatedHours = builder.estimatedHours;
        this.priority = builder.priority;
        this.deadline = builder.deadline;
        this.assignedTo = builder.assignedTo;
    }

    public String getId() {
        return id;
    }

    public String getTitle() {
        return title;
    }

    public String getDescription() {
        return description;
    }

    public List<String> getRequiredSkills() {
        return requiredSkills;
    }

    public double getEstimatedHours() {
        return estimatedHours;
    }

    public Priority getPriority() {
        return priority;
    }

    public LocalDate getDeadline() {
        return deadline;
    }

    public String getAssignedTo() {
        return assignedTo;
    }

    public boolean isAssigned() {
        return assignedTo != null;
    }

    public Task assignedTo(String memberId) {
        return toBuilder().assignedTo(Objects.requireNonNull(memberId, "memberId must not be null")).build();
    }

    public Task unassigned() {
        return toBuilder().assignedTo(null).build();
    }

    public Builder toBuilder() {
        return new Builder()
                .id(id)
                .title(title)
                .description(description)
                .requiredSkills(requiredSkills)
                .estimatedHours(estimatedHours)
                .priority(priority)
                .deadline(deadline)
                .assignedTo(assignedTo);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Task)) {
            return false;
        }
        Task other = (Task) o;
        return Double.compare(estimatedHours, other.estimatedHours) == 0
                && id.equals(other.id)
                && title.equals(other.title)
                && Objects.equals(description, other.description)
                && requiredSkills.equals(other.requiredSkills)
                && priority == other.priority
                && deadline.equals(other.deadline)
                && Objects.equals(assignedTo, other.assignedTo);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, title, description, requiredSkills, estimatedHours, priority, deadline, assignedTo);
    }

    @Override
    public String toString() {
        return String.format("Task{id='%s', title='%s', priority=%s, deadline=%s, assignedTo=%s}",
                id, title, priority.getCode(), deadline, assignedTo);
    }

    /**
     * Builder for Task.
     */
    public static final class Builder {
        private String id;
        private String title;
        private String description;
        private List<String> requiredSkills = new ArrayList<>();
        private double estimatedHours;
        private Priority priority;
        private LocalDate deadline;
        private String assignedTo;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder title(String title) {
            this.title = title;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder requiredSkills(List<String> requiredSkills) {
            this.requiredSkills = new ArrayList<>(Objects.requireNonNull(requiredSkills, "requiredSkills must not be null"));
            return this;
        }

        public Builder estimatedHours(double estimatedHours) {
            this.estimatedHours = estimatedHours;
            return this;
        }

        public Builder priority(Priority priority) {
            this.priority = priority;
            return this;
        }

        public Builder deadline(LocalDate deadline) {
            this.deadline = deadline;
            return this;
        }

        public Builder assignedTo(String assignedTo) {
            this.assignedTo = assignedTo;
            return this;
        }

        public Task build() {
            return new Task(this);
        }
    }
}
