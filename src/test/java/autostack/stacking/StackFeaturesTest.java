package autostack.stacking;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import com.google.common.collect.ImmutableMap;

import autostack.data.Dataset;
import autostack.data.Predictions;

class StackFeaturesTest {

	private static final Dataset ORIGINAL = Dataset.builder().numericColumn("x", 1, 2).build();

	@Test
	@DisplayName("binary models contribute the positive-class probability only")
	void binary() {
		Predictions p = Predictions.ofProbabilities(new double[][] { { 0.3, 0.7 }, { 0.9, 0.1 } });

		Dataset augmented = StackFeatures.augment(ORIGINAL, Arrays.asList("rf_L1"), ImmutableMap.of("rf_L1", p), Arrays.asList("neg", "pos"));

		assertThat(augmented.getColumnNames()).containsExactly("x", "rf_L1");
		assertThat(augmented.getColumn("rf_L1")).containsExactly(0.7, 0.1);
	}

	@Test
	@DisplayName("multiclass models contribute one column per class")
	void multiclass() {
		Predictions p = Predictions.ofProbabilities(new double[][] { { 0.2, 0.3, 0.5 }, { 0.6, 0.3, 0.1 } });

		List<String> names = StackFeatures.getColumnNames("knn_L1", p, Arrays.asList("a", "b", "c"));

		assertThat(names).containsExactly("knn_L1_a", "knn_L1_b", "knn_L1_c");
	}

	@Test
	@DisplayName("quantile models contribute one column per level")
	void quantile() {
		Predictions p = Predictions.ofQuantiles(new double[] { 0.1, 0.5 }, new double[][] { { 1, 2 }, { 3, 4 } });

		Dataset augmented = StackFeatures.augment(ORIGINAL, Arrays.asList("gbm_L1"), ImmutableMap.of("gbm_L1", p), Collections.emptyList());

		assertThat(augmented.getColumnNames()).containsExactly("x", "gbm_L1_q0.1", "gbm_L1_q0.5");
		assertThat(augmented.getColumn("gbm_L1_q0.5")).containsExactly(2, 4);
	}

	@Test
	@DisplayName("columns follow the order of the given model ids")
	void order() {
		Map<String, Predictions> predictions = ImmutableMap.of("a", Predictions.ofValues(new double[] { 1, 1 }), "b", Predictions.ofValues(new double[] { 2, 2 }));

		assertThat(StackFeatures.augment(ORIGINAL, Arrays.asList("b", "a"), predictions, null).getColumnNames()).containsExactly("x", "b", "a");
	}

	@Test
	void rejectsMissingPredictions() {
		assertThatThrownBy(() -> StackFeatures.augment(ORIGINAL, Arrays.asList("a"), Collections.emptyMap(), null)).isInstanceOf(IllegalArgumentException.class).hasMessageContaining("a");
	}

	@Test
	void rejectsRowMismatch() {
		Map<String, Predictions> predictions = ImmutableMap.of("a", Predictions.ofValues(new double[] { 1 }));

		assertThatThrownBy(() -> StackFeatures.augment(ORIGINAL, Arrays.asList("a"), predictions, null)).isInstanceOf(IllegalArgumentException.class);
	}
}
