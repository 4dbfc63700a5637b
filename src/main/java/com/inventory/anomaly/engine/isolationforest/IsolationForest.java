package com.inventory.anomaly.engine.isolationforest;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;

/**
 * Ensemble of {@link IsolationTree}s. Points that are isolated in few splits get
 * short average paths and scores close to 1; dense points score around or below 0.5.
 * Training is fully determined by the seed.
 */
public class IsolationForest {

    private final List<IsolationTree> trees;
    private final int sampleSize;

    @JsonCreator
    public IsolationForest(@JsonProperty("trees") List<IsolationTree> trees,
                           @JsonProperty("sampleSize") int sampleSize) {
        this.trees = List.copyOf(trees);
        this.sampleSize = sampleSize;
    }

    /**
     * @param rows       feature vectors, all of the same length
     * @param numTrees   ensemble size
     * @param sampleSize rows drawn without replacement per tree, capped at the row count
     * @param seed       random seed
     */
    public static IsolationForest fit(double[][] rows, int numTrees, int sampleSize, long seed) {
        if (rows.length == 0) {
            throw new IllegalArgumentException("Cannot fit an isolation forest on zero rows");
        }
        if (numTrees < 1) {
            throw new IllegalArgumentException("numTrees must be >= 1");
        }

        int psi = Math.min(sampleSize, rows.length);
        int heightLimit = (int) Math.ceil(Math.log(Math.max(psi, 2)) / Math.log(2));
        Random random = new Random(seed);

        List<IsolationTree> trees = new ArrayList<>(numTrees);
        for (int t = 0; t < numTrees; t++) {
            trees.add(IsolationTree.grow(drawSample(rows, psi, random), heightLimit, random));
        }
        return new IsolationForest(trees, psi);
    }

    /**
     * @return anomaly score in (0, 1]
     */
    public double score(double[] point) {
        double c = IsolationTree.expectedDepth(sampleSize);
        if (c <= 0.0) return 0.5;

        double total = 0.0;
        for (IsolationTree tree : trees) {
            total += tree.pathLength(point);
        }
        return Math.pow(2.0, -(total / trees.size()) / c);
    }

    public double[] scoreAll(double[][] rows) {
        double[] scores = new double[rows.length];
        for (int i = 0; i < rows.length; i++) {
            scores[i] = score(rows[i]);
        }
        return scores;
    }

    public List<IsolationTree> getTrees() {
        return Collections.unmodifiableList(trees);
    }

    public int getSampleSize() {
        return sampleSize;
    }

    private static double[][] drawSample(double[][] rows, int size, Random random) {
        int[] index = new int[rows.length];
        for (int i = 0; i < index.length; i++) index[i] = i;

        double[][] sample = new double[size][];
        for (int i = 0; i < size; i++) {
            int j = i + random.nextInt(index.length - i);
            int swap = index[i];
            index[i] = index[j];
            index[j] = swap;
            sample[i] = rows[index[i]];
        }
        return sample;
    }
}
