package com.bank.fraudshield.engine.registry;

import com.bank.fraudshield.config.EngineConfig;
import com.bank.fraudshield.engine.bundle.ModelBundle;
import com.bank.fraudshield.engine.scaling.ScaledViews;
import com.bank.fraudshield.engine.schema.ExtraFeaturePolicy;
import com.bank.fraudshield.exception.DownstreamTimeoutException;
import com.bank.fraudshield.model.Algorithm;
import com.bank.fraudshield.model.BaseScore;
import com.bank.fraudshield.model.ModelFamily;
import com.bank.fraudshield.model.ScalingVariant;
import com.bank.fraudshield.testutil.TestBundles;
import com.bank.fraudshield.testutil.TestEngine;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.bank.fraudshield.testutil.TestBundles.constant;
import static com.bank.fraudshield.testutil.TestBundles.failing;
import static com.bank.fraudshield.testutil.TestBundles.scorer;
import static com.bank.fraudshield.testutil.TestBundles.sleeping;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BaseModelRegistryTest {

    private static ScaledViews views(ModelBundle bundle) {
        return bundle.getScalingPolicy().apply(
                bundle.getValidator().validate(TestBundles.memFeatures(1.0, 2.0, 3.0), ExtraFeaturePolicy.REJECT));
    }

    @Test
    void scoreAll_returnsScoresInSlotOrder() {
        ModelBundle bundle = TestBundles.inMemory(
                sleeping(80, 0.1), constant(0.2), sleeping(40, 0.3), constant(0.4));

        try (TestEngine engine = TestEngine.of(bundle, new EngineConfig())) {
            List<BaseScore> scores = engine.registry.scoreAll(views(bundle), 2000);

            assertThat(scores).extracting(BaseScore::getSlot).containsExactly(0, 1, 2, 3);
            assertThat(scores).extracting(BaseScore::getScore).containsExactly(0.1, 0.2, 0.3, 0.4);
            assertThat(scores).allMatch(BaseScore::isAvailable);
        }
    }

    @Test
    void scoreAll_failingModel_isIsolated() {
        ModelBundle bundle = TestBundles.inMemory(
                constant(0.7), failing("weights corrupted"), scorer(x -> Double.NaN), scorer(x -> 1.5), constant(0.6));

        try (TestEngine engine = TestEngine.of(bundle, new EngineConfig())) {
            List<BaseScore> scores = engine.registry.scoreAll(views(bundle), 2000);

            assertThat(scores.get(0).isAvailable()).isTrue();
            assertThat(scores.get(1).isAvailable()).isFalse();
            assertThat(scores.get(1).getFailureReason()).contains("weights corrupted");
            assertThat(scores.get(1).getScore()).isNull();
            assertThat(scores.get(2).isAvailable()).isFalse();
            assertThat(scores.get(3).isAvailable()).isFalse();
            assertThat(scores.get(3).getFailureReason()).contains("not a probability");
            assertThat(scores.get(4).getScore()).isEqualTo(0.6);
            assertThat(engine.counter("base_model.unavailable.count")).isEqualTo(3.0);
        }
    }

    @Test
    void scoreAll_modelPassesItsOwnScaledView() {
        ModelBundle bundle = TestBundles.inMemory(scorer(x -> x[2] / 10.0));

        try (TestEngine engine = TestEngine.of(bundle, new EngineConfig())) {
            assertThat(engine.registry.scoreAll(views(bundle), 2000).get(0).getScore()).isEqualTo(0.3);
        }
    }

    @Test
    void scoreAll_modelExceedingBudget_timesOutWholeRequest() {
        ModelBundle bundle = TestBundles.inMemory(constant(0.5), sleeping(3000, 0.5));

        try (TestEngine engine = TestEngine.of(bundle, new EngineConfig())) {
            assertThatThrownBy(() -> engine.registry.scoreAll(views(bundle), 100))
                    .isInstanceOf(DownstreamTimeoutException.class)
                    .hasMessageContaining("100 ms");
        }
    }

    @Test
    void descriptor_displayNameFallsBackToName() {
        ModelDescriptor descriptor = ModelDescriptor.builder()
                .name("catboost")
                .family(ModelFamily.ML)
                .algorithm(Algorithm.TREE_ENSEMBLE)
                .scaling(ScalingVariant.NONE)
                .slot(0)
                .scorer(constant(0.1))
                .build();

        assertThat(descriptor.getDisplayName()).isEqualTo("catboost");
    }
}
