package com.triage.service.anomaly;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * One randomized partitioning tree. Each internal node splits a randomly chosen
 * non-constant attribute at a uniform point between the subset's min and max.
 */
final class IsolationTree {

    private final Node root;

    private IsolationTree(Node root) {
        this.root = root;
    }

    static IsolationTree build(double[][] sample, int heightLimit, Random random) {
        int[] indices = new int[sample.length];
        for (int i = 0; i < indices.length; i++) {
            indices[i] = i;
        }
        return new IsolationTree(grow(sample, indices, 0, heightLimit, random));
    }

    /**
     * Path length to isolate {@code point}, with the expected remaining depth added at
     * leaves that still hold more than one training point.
     */
    double pathLength(double[] point) {
        Node node = root;
        int depth = 0;
        while (node.attribute >= 0) {
            node = point[node.attribute] < node.split ? node.left : node.right;
            depth++;
        }
        return depth + IsolationForest.averagePathLength(node.size);
    }

    private static Node grow(double[][] data, int[] indices, int depth, int heightLimit, Random random) {
        if (depth >= heightLimit || indices.length <= 1) {
            return Node.leaf(indices.length);
        }

        int dimension = data[indices[0]].length;
        List<Integer> candidates = new ArrayList<>();
        double[] min = new double[dimension];
        double[] max = new double[dimension];
        for (int j = 0; j < dimension; j++) {
            double lo = Double.POSITIVE_INFINITY;
            double hi = Double.NEGATIVE_INFINITY;
            for (int index : indices) {
                double v = data[index][j];
                if (v < lo) lo = v;
                if (v > hi) hi = v;
            }
            min[j] = lo;
            max[j] = hi;
            if (hi > lo) {
                candidates.add(j);
            }
        }
        if (candidates.isEmpty()) {
            return Node.leaf(indices.length);
        }

        int attribute = candidates.get(random.nextInt(candidates.size()));
        double split = min[attribute] + random.nextDouble() * (max[attribute] - min[attribute]);

        int leftCount = 0;
        for (int index : indices) {
            if (data[index][attribute] < split) {
                leftCount++;
            }
        }
        int[] left = new int[leftCount];
        int[] right = new int[indices.length - leftCount];
        int l = 0;
        int r = 0;
        for (int index : indices) {
            if (data[index][attribute] < split) {
                left[l++] = index;
            } else {
                right[r++] = index;
            }
        }

        return Node.split(attribute, split,
                grow(data, left, depth + 1, heightLimit, random),
                grow(data, right, depth + 1, heightLimit, random));
    }

    private static final class Node {
        final int attribute;
        final double split;
        final Node left;
        final Node right;
        final int size;

        private Node(int attribute, double split, Node left, Node right, int size) {
            this.attribute = attribute;
            this.split = split;
            this.left = left;
            this.right = right;
            this.size = size;
        }

        static Node leaf(int size) {
            return new Node(-1, 0.0, null, null, size);
        }

        static Node split(int attribute, double split, Node left, Node right) {
            return new Node(attribute, split, left, right, 0);
        }
    }
}
