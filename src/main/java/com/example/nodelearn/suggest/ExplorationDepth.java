package com.example.nodelearn.suggest;

/**
 * How many related concepts one expansion asks for.
 */
public enum ExplorationDepth {
    BRIEF(3),
    STANDARD(5),
    DETAILED(7);

    private final int maxResults;

    ExplorationDepth(int maxResults) {
        this.maxResults = maxResults;
    }

    public int getMaxResults() {
        return maxResults;
    }
}
