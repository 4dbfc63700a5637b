package com.inventory.anomaly.engine.isolationforest;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Arrays;
import java.util.Random;

/**
 * One random partitioning tree. Internal nodes split a random feature at a uniform
 * random value between that feature's min and max; leaves keep the number of
 * training rows that reached them so path lengths can be corrected for
 * unexpanded subtrees.
 */
public class IsolationTree {

    private final Node root;

    @JsonCreator
    public IsolationTree(@JsonProperty("root") Node root) {
        this.root = root;
    }

    public static IsolationTree grow(double[][] rows, int heightLimit, Random random) {
        return new IsolationTree(split(rows, 0, heightLimit, random));
    }

    private static Node split(double[][] rows, int depth, int heightLimit, Random random) {
        if (depth >= heightLimit || rows.length <= 1) {
            return Node.leaf(rows.length);
        }

        int feature = random.nextInt(rows[0].length);
        double lo = Double.POSITIVE_INFINITY;
        double hi = Double.NEGATIVE_INFINITY;
        for (double[] row : rows) {
            lo = Math.min(lo, row[feature]);
            hi = Math.max(hi, row[feature]);
        }
        if (!(lo < hi)) {
            return Node.leaf(rows.length);
        }

        double threshold = lo + random.nextDouble() * (hi - lo);

        // Partition in place: [0, boundary) goes left
        double[][] work = Arrays.copyOf(rows, rows.length);
        int boundary = 0;
        for (int i = 0; i < work.length; i++) {
            if (work[i][feature] < threshold) {
                double[] tmp = work[boundary];
                work[boundary++] = work[i];
                work[i] = tmp;
            }
        }

        return Node.branch(feature, threshold,
                split(Arrays.copyOfRange(work, 0, boundary), depth + 1, heightLimit, random),
                split(Arrays.copyOfRange(work, boundary, work.length), depth + 1, heightLimit, random));
    }

    /**
     * Depth at which {@code point} lands in a leaf, plus the expected remaining
     * depth of the leaf's unexpanded subtree.
     */
    public double pathLength(double[] point) {
        Node node = root;
        int depth = 0;
        while (!node.isLeaf()) {
            node = point[node.feature] < node.threshold ? node.left : node.right;
            depth++;
        }
        return depth + expectedDepth(node.size);
    }

    public Node getRoot() {
        return root;
    }

    /**
     * Average path length of an unsuccessful search in a binary search tree of
     * {@code n} keys, used to normalize path lengths.
     */
    public static double expectedDepth(int n) {
        if (n <= 1) return 0.0;
        if (n == 2) return 1.0;
        double harmonic = Math.log(n - 1.0) + 0.5772156649015329;
        return 2.0 * harmonic - 2.0 * (n - 1.0) / n;
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static final class Node {

        @JsonProperty("f")
        private final int feature;

        @JsonProperty("t")
        private final double threshold;

        @JsonProperty("n")
        private final int size;

        @JsonProperty("l")
        private final Node left;

        @JsonProperty("r")
        private final Node right;

        @JsonCreator
        Node(@JsonProperty("f") int feature,
             @JsonProperty("t") double threshold,
             @JsonProperty("n") int size,
             @JsonProperty("l") Node left,
             @JsonProperty("r") Node right) {
            this.feature = feature;
            this.threshold = threshold;
            this.size = size;
            this.left = left;
            this.right = right;
        }

        static Node leaf(int size) {
            return new Node(-1, 0.0, size, null, null);
        }

        static Node branch(int feature, double threshold, Node left, Node right) {
            return new Node(feature, threshold, left.size + right.size, left, right);
        }

        @JsonIgnore
        public boolean isLeaf() {
            return left == null;
        }

        public int getSize() {
            return size;
        }
    }
}
