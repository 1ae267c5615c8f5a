package org.smarttask.allocator.domain.model;

import java.util.Objects;

/**
 * Either a report from a completed allocation run or the error that
 * aborted it. A failed outcome never carries partial results.
 */
public final class AllocationOutcome {

    private final AllocationReport report;
    private final String error;

    private AllocationOutcome(AllocationReport report, String error) {
        this.report = report;
        this.error = error;
    }

    public static AllocationOutcome succeeded(AllocationReport report) {
        return new AllocationOutcome(Objects.requireNonNull(report, "report must not be null"), null);
    }

    public static AllocationOutcome failed(String error) {
        return new AllocationOutcome(null, Objects.requireNonNull(error, "error must not be null"));
    }

    public boolean isSuccess() {
        return report != null;
    }

    /**
     * @throws IllegalStateException if the run failed
     */
    public AllocationReport getReport() {
        if (report == null) {
            throw new IllegalStateException("Allocation failed: " + error);
        }
        return report;
    }

    public String getError() {
        return error;
    }

    @Override
    public String toString() {
        return isSuccess() ? "AllocationOutcome{success, " + report.getStats() + "}" : "AllocationOutcome{failed: " + error + "}";
    }
}
