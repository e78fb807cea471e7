package com.fleet.anomaly.engine.isolationforest;

import org.apache.commons.math3.stat.descriptive.rank.Percentile;
import org.apache.commons.math3.stat.descriptive.rank.Percentile.EstimationType;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Random;

/**
 * Ensemble of randomized isolation trees. Fitted on one unit's data, used to score that
 * same data and then discarded.
 */
public class IsolationForest {

    private List<IsolationTree> trees = Collections.emptyList();
    private int sampleSize;

    /**
     * Train the isolation forest on the given data.
     *
     * @param data       training samples, each row is a feature vector
     * @param numTrees   number of trees in the forest (typically 100)
     * @param maxSamples sub-sampling size per tree (typically 256), capped at the row count
     * @param seed       random seed for reproducibility
     */
    public void train(double[][] data, int numTrees, int maxSamples, long seed) {
        if (data.length == 0) {
            throw new IllegalArgumentException("Cannot train an isolation forest on zero samples");
        }
        if (numTrees <= 0) {
            throw new IllegalArgumentException("numTrees must be > 0, got " + numTrees);
        }
        this.sampleSize = Math.min(maxSamples, data.length);
        int maxDepth = (int) Math.ceil(Math.log(Math.max(this.sampleSize, 2)) / Math.log(2));
        List<IsolationTree> built = new ArrayList<>(numTrees);

        Random random = new Random(seed);

        for (int i = 0; i < numTrees; i++) {
            double[][] sample = subsample(data, this.sampleSize, random);
            built.add(IsolationTree.build(sample, maxDepth, random));
        }
        this.trees = built;
    }

    /**
     * Compute anomaly score for a single point.
     *
     * @return score between 0.0 (normal) and 1.0 (anomalous)
     *         Score > 0.5 indicates anomaly; score ≈ 0.5 is uncertain; score < 0.5 is normal
     */
    public double anomalyScore(double[] point) {
        if (trees.isEmpty()) {
            throw new IllegalStateException("Isolation forest has not been trained");
        }

        double avgPathLength = 0.0;
        for (IsolationTree tree : trees) {
            avgPathLength += tree.pathLength(point);
        }
        avgPathLength /= trees.size();

        double c = IsolationNode.averagePathLength(sampleSize);
        if (c <= 0) return 0.0;

        // IF scoring formula: s(x, n) = 2^(-E(h(x)) / c(n))
        return Math.pow(2.0, -avgPathLength / c);
    }

    public double[] anomalyScores(double[][] points) {
        double[] scores = new double[points.length];
        for (int i = 0; i < points.length; i++) {
            scores[i] = anomalyScore(points[i]);
        }
        return scores;
    }

    /**
     * Score above which a point counts as an outlier, chosen so that about a
     * {@code contamination} share of the given (training) scores lies above it.
     * Uses the linearly interpolated (1 - contamination) quantile.
     */
    public static double scoreCutoff(double[] trainingScores, double contamination) {
        if (contamination <= 0.0 || contamination > 0.5) {
            throw new IllegalArgumentException("contamination must be in (0, 0.5], got " + contamination);
        }
        Percentile quantile = new Percentile().withEstimationType(EstimationType.R_7);
        return quantile.evaluate(trainingScores, 100.0 * (1.0 - contamination));
    }

    private double[][] subsample(double[][] data, int size, Random random) {
        if (data.length <= size) {
            return Arrays.copyOf(data, data.length);
        }
        double[][] sample = new double[size][];
        // Fisher-Yates shuffle on indices
        int[] indices = new int[data.length];
        for (int i = 0; i < data.length; i++) indices[i] = i;
        for (int i = 0; i < size; i++) {
            int j = i + random.nextInt(data.length - i);
            int tmp = indices[i];
            indices[i] = indices[j];
            indices[j] = tmp;
            sample[i] = data[indices[i]];
        }
        return sample;
    }

    public List<IsolationTree> getTrees() { return trees; }
    public int getSampleSize() { return sampleSize; }
}
