package com.scanq.queue;

public enum JobPriority {
    HIGH(0),
    NORMAL(1),
    LOW(2);

    private final int rank;

    JobPriority(int rank) {
        this.rank = rank;
    }

    /**
     * Lower rank is dequeued first.
     */
    public int rank() {
        return rank;
    }
}
