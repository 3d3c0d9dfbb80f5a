package com.kmg.nexar.service;

import com.kmg.nexar.model.DownloadPriority;

public enum FairnessPolicy {
    /**
     * Bandwidth shares follow {@link DownloadPriority#weight()}.
     */
    WEIGHTED,
    /**
     * Every active transfer gets an equal share regardless of priority.
     */
    ROUND_ROBIN;

    public int weightOf(DownloadPriority priority) {
        return this == WEIGHTED ? priority.weight() : 1;
    }
}
