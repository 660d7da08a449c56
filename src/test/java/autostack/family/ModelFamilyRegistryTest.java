package autostack.family;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

import autostack.data.ProblemType;
import autostack.testing.FakeModelFamily;

class ModelFamilyRegistryTest {

	@Test
	void defaultsCoverThePortfolioFamilies() {
		ModelFamilyRegistry registry = ModelFamilyRegistry.withDefaults();

		assertThat(registry.getIds()).contains(ModelFamilyRegistry.RANDOM_FOREST, ModelFamilyRegistry.GRADIENT_BOOSTING, ModelFamilyRegistry.LINEAR, ModelFamilyRegistry.NEAREST_NEIGHBORS,
				ModelFamilyRegistry.DECISION_TREE, ModelFamilyRegistry.NEURAL_NETWORK, ModelFamilyRegistry.NEURAL_NETWORK_GPU, ModelFamilyRegistry.DUMMY, ModelFamilyRegistry.PRETRAINED);
		for (String id : registry.getIds()) {
			ModelFamily family = registry.find(id).get();
			for (ProblemType type : ProblemType.values()) {
				assertThat(family.supports(type)).as("%s supports %s", id, type).isTrue();
			}
		}
		assertThat(registry.find(ModelFamilyRegistry.PRETRAINED).get().requiresExternalWeights()).isTrue();
	}

	@Test
	void customFamiliesCanBeAdded() {
		ModelFamilyRegistry registry = new ModelFamilyRegistry().register(new FakeModelFamily());

		assertThat(registry.find(FakeModelFamily.ID)).isPresent();
		assertThat(registry.find("missing")).isEmpty();
		assertThatThrownBy(() -> registry.register(new FakeModelFamily())).isInstanceOf(IllegalArgumentException.class);
	}
}
