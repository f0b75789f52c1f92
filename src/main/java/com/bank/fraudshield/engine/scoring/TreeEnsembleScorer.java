package com.bank.fraudshield.engine.scoring;

import java.util.List;

/**
 * Tree ensemble covering both bagged and boosted models.
 * <ul>
 *   <li>{@link Aggregation#AVERAGE}: leaves hold class probabilities, the
 *       score is their mean (random forest).</li>
 *   <li>{@link Aggregation#SUM_LOGIT}: leaves hold margins, the score is
 *       sigmoid(baseMargin + sum of leaves) (XGBoost, LightGBM, CatBoost).</li>
 * </ul>
 */
public class TreeEnsembleScorer implements Scorer {

    public enum Aggregation {
        AVERAGE,
        SUM_LOGIT
    }

    private final List<TreeNode> trees;
    private final Aggregation aggregation;
    private final double baseMargin;
    private final int featureCount;

    public TreeEnsembleScorer(List<TreeNode> trees, Aggregation aggregation, double baseMargin, int featureCount) {
        if (trees == null || trees.isEmpty()) {
            throw new IllegalArgumentException("Tree ensemble needs at least one tree");
        }
        for (TreeNode tree : trees) {
            if (tree.maxFeatureIndex() >= featureCount) {
                throw new IllegalArgumentException("Tree references feature " + tree.maxFeatureIndex()
                        + " but the model has " + featureCount + " features");
            }
        }
        this.trees = List.copyOf(trees);
        this.aggregation = aggregation;
        this.baseMargin = baseMargin;
        this.featureCount = featureCount;
    }

    @Override
    public double score(double[] input) {
        checkDimension(input);
        double sum = 0.0;
        for (TreeNode tree : trees) {
            sum += tree.predict(input);
        }
        if (aggregation == Aggregation.AVERAGE) {
            return Math.max(0.0, Math.min(1.0, sum / trees.size()));
        }
        return Sigmoid.apply(baseMargin + sum);
    }

    @Override
    public boolean supportsNativeAttribution() {
        return true;
    }

    @Override
    public double[] attribute(double[] input) {
        checkDimension(input);
        double[] contributions = new double[featureCount];
        double weight = aggregation == Aggregation.AVERAGE ? 1.0 / trees.size() : 1.0;
        for (TreeNode tree : trees) {
            tree.accumulatePathContributions(input, contributions, weight);
        }
        return contributions;
    }

    public int getTreeCount() {
        return trees.size();
    }

    private void checkDimension(double[] input) {
        if (input.length != featureCount) {
            throw new IllegalArgumentException(
                    "Tree ensemble expects " + featureCount + " features, got " + input.length);
        }
    }
}
