package com.kmg.nexar.model;

public enum DownloadPriority {
    HIGH(4),
    NORMAL(2),
    LOW(1);

    private final int weight;

    DownloadPriority(int weight) {
        this.weight = weight;
    }

    public int weight() {
        return weight;
    }
}
