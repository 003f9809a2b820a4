package me.christianrobert.orapgroutines.core.job.model;

import java.time.LocalDateTime;

public class JobProgress {
    private int percentage;
    private String currentTask;
    private String details;
    private LocalDateTime lastUpdated;

    public JobProgress() {
        this.percentage = 0;
        this.currentTask = "";
        this.details = "";
        this.lastUpdated = LocalDateTime.now();
    }

    public JobProgress(int percentage, String currentTask) {
        this();
        this.percentage = clamp(percentage);
        this.currentTask = currentTask != null ? currentTask : "";
    }

    public JobProgress(int percentage, String currentTask, String details) {
        this(percentage, currentTask);
        this.details = details != null ? details : "";
    }

    /**
     * Percentage for step {@code done} of {@code total} within the range [from, to].
     */
    public static int scaled(int done, int total, int from, int to) {
        if (total <= 0) {
            return to;
        }
        return from + (int) ((long) (to - from) * done / total);
    }

    private static int clamp(int percentage) {
        return Math.max(0, Math.min(100, percentage));
    }

    public int getPercentage() {
        return percentage;
    }

    public String getCurrentTask() {
        return currentTask;
    }

    public String getDetails() {
        return details;
    }

    public LocalDateTime getLastUpdated() {
        return lastUpdated;
    }

    @Override
    public String toString() {
        return "JobProgress{" +
                "percentage=" + percentage +
                ", currentTask='" + currentTask + '\'' +
                ", details='" + details + '\'' +
                ", lastUpdated=" + lastUpdated +
                '}';
    }
}
