package com.bank.fraudshield.engine.scoring;

import com.bank.fraudshield.engine.scoring.TreeEnsembleScorer.Aggregation;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.bank.fraudshield.engine.scoring.TreeNode.leaf;
import static com.bank.fraudshield.engine.scoring.TreeNode.split;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class TreeEnsembleScorerTest {

    private static final List<TreeNode> FOREST = List.of(
            split(0, 1.5, 0.2, leaf(0.05), split(2, 0.5, 0.6, leaf(0.4), leaf(0.95))),
            split(1, 5.0, 0.25, leaf(0.1), leaf(0.8)));

    private static final List<TreeNode> BOOSTED = List.of(
            split(2, 0.4, -0.3, leaf(-0.8), leaf(1.6)),
            split(0, 2.0, -0.2, leaf(-0.5), leaf(1.2)));

    @Test
    void average_meanOfLeafProbabilities() {
        TreeEnsembleScorer scorer = new TreeEnsembleScorer(FOREST, Aggregation.AVERAGE, 0.0, 3);

        assertThat(scorer.score(new double[]{2.0, 6.0, 0.7})).isCloseTo(0.875, within(1e-12));
        assertThat(scorer.score(new double[]{0.0, 2.0, 0.1})).isCloseTo(0.075, within(1e-12));
    }

    @Test
    void sumLogit_addsBaseMarginAndAppliesSigmoid() {
        TreeEnsembleScorer scorer = new TreeEnsembleScorer(BOOSTED, Aggregation.SUM_LOGIT, -1.0, 3);

        assertThat(scorer.score(new double[]{0.0, 2.0, 0.1})).isCloseTo(Sigmoid.apply(-2.3), within(1e-12));
    }

    @Test
    void splitThreshold_equalValueGoesRight() {
        TreeNode stump = split(0, 1.0, 0.5, leaf(0.0), leaf(1.0));

        assertThat(stump.predict(new double[]{1.0})).isEqualTo(1.0);
        assertThat(stump.predict(new double[]{0.999})).isEqualTo(0.0);
    }

    @Test
    void attribute_averagePathContributionsSumToPredictionMinusRootMean() {
        TreeEnsembleScorer scorer = new TreeEnsembleScorer(FOREST, Aggregation.AVERAGE, 0.0, 3);
        double[] x = {2.0, 6.0, 0.7};

        double[] contributions = scorer.attribute(x);

        assertThat(contributions[0]).isCloseTo(0.2, within(1e-12));
        assertThat(contributions[1]).isCloseTo(0.275, within(1e-12));
        assertThat(contributions[2]).isCloseTo(0.175, within(1e-12));
        double rootMean = (0.2 + 0.25) / 2;
        assertThat(contributions[0] + contributions[1] + contributions[2])
                .isCloseTo(scorer.score(x) - rootMean, within(1e-12));
    }

    @Test
    void attribute_boostedContributionsAreSignedMargins() {
        TreeEnsembleScorer scorer = new TreeEnsembleScorer(BOOSTED, Aggregation.SUM_LOGIT, -1.0, 3);

        double[] contributions = scorer.attribute(new double[]{0.0, 2.0, 0.1});

        assertThat(contributions[0]).isCloseTo(-0.3, within(1e-12));
        assertThat(contributions[1]).isZero();
        assertThat(contributions[2]).isCloseTo(-0.5, within(1e-12));
    }

    @Test
    void treeReferencingUnknownFeature_isRejected() {
        assertThatThrownBy(() -> new TreeEnsembleScorer(
                List.of(split(5, 0.0, 0.5, leaf(0.0), leaf(1.0))), Aggregation.AVERAGE, 0.0, 3))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("feature 5");
    }

    @Test
    void emptyEnsemble_isRejected() {
        assertThatThrownBy(() -> new TreeEnsembleScorer(List.of(), Aggregation.AVERAGE, 0.0, 3))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void treeNode_deserializesCompactJson() throws Exception {
        String json = "{\"f\":1,\"t\":2.5,\"v\":0.3,\"l\":{\"v\":0.1},\"r\":{\"v\":0.9}}";

        TreeNode node = new ObjectMapper().readValue(json, TreeNode.class);

        assertThat(node.isLeaf()).isFalse();
        assertThat(node.getSplitFeature()).isEqualTo(1);
        assertThat(node.predict(new double[]{0.0, 3.0})).isEqualTo(0.9);
        assertThat(node.maxFeatureIndex()).isEqualTo(1);
    }
}
