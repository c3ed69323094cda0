package com.coursesync.scrape.model;

public enum ScrapePriority {
    LOW(0),
    NORMAL(1),
    HIGH(2),
    URGENT(3);

    private final int rank;

    ScrapePriority(int rank) {
        this.rank = rank;
    }

    public int rank() {
        return rank;
    }

    public static ScrapePriority fromRank(int rank) {
        for (ScrapePriority priority : values()) {
            if (priority.rank == rank) {
                return priority;
            }
        }
        throw new IllegalArgumentException("Unknown priority rank " + rank);
    }
}
