package autostack.ensemble;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.offset;

import java.util.LinkedHashMap;
import java.util.Map;

import org.junit.jupiter.api.Test;

import com.google.common.collect.ImmutableMap;

import autostack.data.Predictions;

class EnsembleWeightsTest {

	@Test
	void fromCountsNormalizesAndDropsZeros() {
		Map<String, Integer> counts = new LinkedHashMap<>();
		counts.put("a", 3);
		counts.put("b", 0);
		counts.put("c", 1);

		EnsembleWeights weights = EnsembleWeights.fromCounts(counts);

		assertThat(weights.getWeight("a")).isEqualTo(0.75);
		assertThat(weights.getWeight("c")).isEqualTo(0.25);
		assertThat(weights.getSupport()).containsExactly("a", "c");
		assertThat(weights.getWeight("unknown")).isZero();
	}

	@Test
	void rejectsWeightsNotSummingToOne() {
		assertThatThrownBy(() -> new EnsembleWeights(ImmutableMap.of("a", 0.5, "b", 0.4))).isInstanceOf(IllegalArgumentException.class).hasMessageContaining("sum to 1");
	}

	@Test
	void rejectsNegativeWeights() {
		assertThatThrownBy(() -> new EnsembleWeights(ImmutableMap.of("a", 1.5, "b", -0.5))).isInstanceOf(IllegalArgumentException.class);
	}

	@Test
	void combineIsWeightedAverage() {
		EnsembleWeights weights = new EnsembleWeights(ImmutableMap.of("a", 0.25, "b", 0.75));
		Map<String, Predictions> predictions = ImmutableMap.of("a", Predictions.ofValues(new double[] { 4, 0 }), "b", Predictions.ofValues(new double[] { 0, 4 }), "other", Predictions.ofValues(new double[] { 100, 100 }));

		Predictions combined = weights.combine(predictions);

		assertThat(combined.get(0, 0)).isCloseTo(1.0, offset(1e-12));
		assertThat(combined.get(1, 0)).isCloseTo(3.0, offset(1e-12));
	}

	@Test
	void combineFailsForMissingMember() {
		EnsembleWeights weights = EnsembleWeights.single("a");

		assertThatThrownBy(() -> weights.combine(ImmutableMap.of("b", Predictions.ofValues(new double[] { 1 })))).isInstanceOf(IllegalArgumentException.class).hasMessageContaining("a");
	}
}
