package com.bank.fraudshield.engine.scoring;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Node of a fitted regression tree, in the compact JSON form exported by the
 * training pipeline. Every node carries its expected output {@code value}
 * (the mean over training samples reaching it), which path attribution needs.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class TreeNode {

    @JsonProperty("f")
    private int splitFeature;

    @JsonProperty("t")
    private double threshold;

    @JsonProperty("l")
    private TreeNode left;

    @JsonProperty("r")
    private TreeNode right;

    @JsonProperty("v")
    private double value;

    public TreeNode() {}

    public static TreeNode split(int splitFeature, double threshold, double value, TreeNode left, TreeNode right) {
        TreeNode node = new TreeNode();
        node.splitFeature = splitFeature;
        node.threshold = threshold;
        node.value = value;
        node.left = left;
        node.right = right;
        return node;
    }

    public static TreeNode leaf(double value) {
        TreeNode node = new TreeNode();
        node.value = value;
        return node;
    }

    public boolean isLeaf() {
        return left == null || right == null;
    }

    /** Samples with x[f] < t go left. */
    public TreeNode next(double[] point) {
        return point[splitFeature] < threshold ? left : right;
    }

    public double predict(double[] point) {
        TreeNode node = this;
        while (!node.isLeaf()) {
            node = node.next(point);
        }
        return node.value;
    }

    /**
     * Adds to {@code contributions} the change in node value at each split on
     * the decision path, credited to the split feature. The contributions sum
     * to leaf value minus root value.
     */
    public void accumulatePathContributions(double[] point, double[] contributions, double weight) {
        TreeNode node = this;
        while (!node.isLeaf()) {
            TreeNode child = node.next(point);
            contributions[node.splitFeature] += weight * (child.value - node.value);
            node = child;
        }
    }

    /** Largest feature index referenced by this subtree, or -1 for a leaf. */
    public int maxFeatureIndex() {
        if (isLeaf()) return -1;
        return Math.max(splitFeature, Math.max(left.maxFeatureIndex(), right.maxFeatureIndex()));
    }

    public int getSplitFeature() { return splitFeature; }
    public double getThreshold() { return threshold; }
    public TreeNode getLeft() { return left; }
    public TreeNode getRight() { return right; }
    public double getValue() { return value; }
}
