package autostack.portfolio;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.offset;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import com.google.common.collect.ImmutableMap;

class CandidateConfigTest {

	@Test
	@DisplayName("engine arguments are not handed to the model family")
	void engineArgumentsAreSeparated() {
		CandidateConfig config = new CandidateConfig("KNN", "KNN", ImmutableMap.of("K", 5, CandidateConfig.ENGINE_ARGS, ImmutableMap.of(CandidateConfig.ARG_VALID_STACKER, false, CandidateConfig.ARG_MAX_ROWS, 100)),
				ResourceEstimate.cpuOnly(1), 1);
		assertThat(config.getModelHyperparameters()).containsOnlyKeys("K");
		assertThat(config.getHyperparameters()).containsKeys("K", CandidateConfig.ENGINE_ARGS);
		assertThat(config.isValidBase()).isTrue();
		assertThat(config.isValidStacker()).isFalse();
		assertThat(config.isAdmissibleInLayer(0)).isTrue();
		assertThat(config.isAdmissibleInLayer(1)).isFalse();
		assertThat(config.getMaxRows()).isEqualTo(100);
	}

	@Test
	@DisplayName("without engine arguments a candidate may be used everywhere")
	void defaults() {
		CandidateConfig config = new CandidateConfig("RF", "RF", ImmutableMap.of("I", 10), ResourceEstimate.cpuOnly(1), 1);
		assertThat(config.isAdmissibleInLayer(0)).isTrue();
		assertThat(config.isAdmissibleInLayer(2)).isTrue();
		assertThat(config.getMaxRows()).isEqualTo(Integer.MAX_VALUE);
		assertThat(config.requiresExternalWeights()).isFalse();
	}

	@Test
	@DisplayName("engine arguments must be a map")
	void invalidEngineArguments() {
		assertThatThrownBy(() -> new CandidateConfig("X", "RF", ImmutableMap.of(CandidateConfig.ENGINE_ARGS, "fast"), ResourceEstimate.cpuOnly(1), 1)).isInstanceOf(IllegalArgumentException.class);
	}

	@Test
	@DisplayName("bagged cost accounts for fold size, repetitions and refit")
	void baggedCost() {
		ResourceEstimate estimate = ResourceEstimate.cpuOnly(10);
		assertThat(estimate.getBaggedFitSeconds(5, 1, false)).isEqualTo(40.0, offset(1e-9));
		assertThat(estimate.getBaggedFitSeconds(5, 2, true)).isEqualTo(90.0, offset(1e-9));
	}

	@Test
	@DisplayName("GPU-only estimates need a GPU")
	void gpuOnlyNeedsGpu() {
		assertThatThrownBy(() -> new ResourceEstimate(1, 0, 0, 1, true, false)).isInstanceOf(IllegalArgumentException.class);
	}

	@Test
	@DisplayName("per-cell estimates grow with the table while fixed estimates stay put")
	void rescaling() {
		ResourceEstimate narrow = ResourceEstimate.perCell(2, 0, 1.0, 1e-6, 8, 1_000_000, false, false);
		ResourceEstimate wide = narrow.forCells(4_000_000);

		assertThat(narrow.getFitSeconds()).isCloseTo(2.0, offset(1e-9));
		assertThat(narrow.getMemoryBytes()).isEqualTo(8_000_000);
		assertThat(wide.getFitSeconds()).isCloseTo(5.0, offset(1e-9));
		assertThat(wide.getMemoryBytes()).isEqualTo(32_000_000);
		assertThat(wide.getCpus()).isEqualTo(2);
		assertThat(wide.forCells(1_000_000)).isEqualTo(narrow);

		ResourceEstimate fixed = ResourceEstimate.cpuOnly(3);
		assertThat(fixed.forCells(1_000_000_000)).isSameAs(fixed);
	}
}
