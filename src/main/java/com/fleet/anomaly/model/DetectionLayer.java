package com.fleet.anomaly.model;

/**
 * The three detection layers, in tag-merge order, with their weight in the fused score.
 */
public enum DetectionLayer {
    RULE(3),
    STATISTICAL(2),
    ML(1);

    private final int weight;

    DetectionLayer(int weight) {
        this.weight = weight;
    }

    public int getWeight() {
        return weight;
    }
}
