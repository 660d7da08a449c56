package autostack.leaderboard;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import com.google.common.collect.ImmutableMap;

import autostack.data.Predictions;
import autostack.ensemble.EnsembleWeights;
import autostack.stacking.FittedModel;
import autostack.storage.ArtifactReference;
import autostack.testing.TestData;

class ModelRegistryTest {

	private ModelRegistry registry;

	private static FittedModel model(final String name, final int layer, final List<String> inputs) {
		return new FittedModel(name, TestData.fakeCandidate(name, 0, null), layer, Arrays.asList(new ArtifactReference(name + "/fold0")), null, Predictions.ofValues(new double[] { 0 }), 0.5, "mse", 1.0, 0.1, 0,
				inputs, Collections.singletonList("x"));
	}

	@BeforeEach
	void setUp() {
		this.registry = new ModelRegistry();
		this.registry.register(model("a", 0, Collections.emptyList()));
		this.registry.register(model("b", 0, Collections.emptyList()));
		this.registry.register(model("unused", 0, Collections.emptyList()));
		this.registry.register(model("s", 1, Arrays.asList("a", "b")));
		this.registry.register(model("t", 2, Arrays.asList("s")));
	}

	@Test
	@DisplayName("resolving collects the inputs of the members transitively")
	void resolveTransitively() {
		InferencePlan plan = this.registry.resolve(EnsembleWeights.single("t"));

		assertThat(plan.getModels(0)).containsExactly("a", "b");
		assertThat(plan.getModels(1)).containsExactly("s");
		assertThat(plan.getModels(2)).containsExactly("t");
		assertThat(plan.contains("unused")).isFalse();
		assertThat(plan.size()).isEqualTo(4);
		assertThat(plan.getModelsPerLayer().keySet()).containsExactly(0, 1, 2);
	}

	@Test
	@DisplayName("a base-layer ensemble needs only its members")
	void resolveBaseLayer() {
		InferencePlan plan = this.registry.resolve(new EnsembleWeights(ImmutableMap.of("a", 0.5, "unused", 0.5)));

		assertThat(plan.getModelIds()).containsExactlyInAnyOrder("a", "unused");
	}

	@Test
	void rejectsUnregisteredInputs() {
		assertThatThrownBy(() -> this.registry.register(model("x", 1, Arrays.asList("missing")))).isInstanceOf(IllegalArgumentException.class).hasMessageContaining("missing");
	}

	@Test
	void rejectsInputsOnTheSameLayer() {
		assertThatThrownBy(() -> this.registry.register(model("x", 0, Arrays.asList("a")))).isInstanceOf(IllegalArgumentException.class).hasMessageContaining("lower layer");
	}

	@Test
	void rejectsDuplicates() {
		assertThatThrownBy(() -> this.registry.register(model("a", 0, Collections.emptyList()))).isInstanceOf(IllegalArgumentException.class);
	}

	@Test
	@DisplayName("layers are removed top-down")
	void removeLayer() {
		assertThatThrownBy(() -> this.registry.removeLayer(1)).isInstanceOf(IllegalStateException.class);

		List<FittedModel> removed = this.registry.removeLayer(2);

		assertThat(removed).extracting(FittedModel::getId).containsExactly("t");
		assertThat(this.registry.get("t")).isEmpty();
		assertThat(this.registry.getLayerIndexes()).containsExactly(0, 1);
		assertThat(this.registry.size()).isEqualTo(4);
	}
}
