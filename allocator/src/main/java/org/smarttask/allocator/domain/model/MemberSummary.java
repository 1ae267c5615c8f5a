package org.smarttask.allocator.domain.model;

import java.util.Objects;

/**
 * Per-member workload after an allocation run.
 */
public final class MemberSummary {

    private final String id;
    private final String name;
    private final double currentWorkload;
    private final double maxCapacity;
    private final long utilization;

    public MemberSummary(String id, String name, double currentWorkload, double maxCapacity, long utilization) {
        this.id = Objects.requireNonNull(id, "id must not be null");
        this.name = Objects.requireNonNull(name, "name must not be null");
        this.currentWorkload = currentWorkload;
        this.maxCapacity = maxCapacity;
        this.utilization = utilization;
    }

    public String getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public double getCurrentWorkload() {
        return currentWorkload;
    }

    public double getMaxCapacity() {
        return maxCapacity;
    }

    public long getUtilization() {
        return utilization;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof MemberSummary)) {
            return false;
        }
        MemberSummary other = (MemberSummary) o;
        return Double.compare(currentWorkload, other.currentWorkload) == 0
                && Double.compare(maxCapacity, other.maxCapacity) == 0
                && utilization == other.utilization
                && id.equals(other.id)
                && name.equals(other.name);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, name, currentWorkload, maxCapacity, utilization);
    }

    @Override
    public String toString() {
        return String.format("MemberSummary{id='%s', utilization=%d%%}", id, utilization);
    }
}
