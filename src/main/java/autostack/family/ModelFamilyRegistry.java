package autostack.family;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import com.google.common.collect.ImmutableSet;

import weka.classifiers.functions.LinearRegression;
import weka.classifiers.functions.Logistic;
import weka.classifiers.functions.MultilayerPerceptron;
import weka.classifiers.lazy.IBk;
import weka.classifiers.meta.AdditiveRegression;
import weka.classifiers.meta.LogitBoost;
import weka.classifiers.rules.ZeroR;
import weka.classifiers.trees.J48;
import weka.classifiers.trees.REPTree;
import weka.classifiers.trees.RandomForest;

/**
 * Lookup of model families by the identifier that portfolio entries refer to.
 */
public class ModelFamilyRegistry {

	public static final String RANDOM_FOREST = "RF";
	public static final String GRADIENT_BOOSTING = "GBM";
	public static final String LINEAR = "LR";
	public static final String NEAREST_NEIGHBORS = "KNN";
	public static final String DECISION_TREE = "DT";
	public static final String NEURAL_NETWORK = "NN";
	public static final String NEURAL_NETWORK_GPU = "NN_GPU";
	public static final String DUMMY = "DUMMY";
	public static final String PRETRAINED = "PRETRAINED";

	private final Map<String, ModelFamily> families = new LinkedHashMap<>();

	/**
	 * @return a registry with the Weka-backed default families
	 */
	public static ModelFamilyRegistry withDefaults() {
		ModelFamilyRegistry registry = new ModelFamilyRegistry();
		registry.register(new WekaModelFamily(RANDOM_FOREST, RandomForest.class.getName(), RandomForest.class.getName(), ImmutableSet.of("I", "K", "M", "depth", "num-slots")));
		registry.register(new WekaModelFamily(GRADIENT_BOOSTING, LogitBoost.class.getName(), AdditiveRegression.class.getName(), ImmutableSet.of("I")));
		registry.register(new WekaModelFamily(LINEAR, Logistic.class.getName(), LinearRegression.class.getName(), ImmutableSet.of("R")));
		registry.register(new WekaModelFamily(NEAREST_NEIGHBORS, IBk.class.getName(), IBk.class.getName(), ImmutableSet.of("K", "I", "F")));
		registry.register(new WekaModelFamily(DECISION_TREE, J48.class.getName(), REPTree.class.getName(), ImmutableSet.of("M")));
		Set<String> mlpParams = ImmutableSet.of("H", "N", "L", "M");
		registry.register(new WekaModelFamily(NEURAL_NETWORK, MultilayerPerceptron.class.getName(), MultilayerPerceptron.class.getName(), mlpParams));
		registry.register(new WekaModelFamily(NEURAL_NETWORK_GPU, MultilayerPerceptron.class.getName(), MultilayerPerceptron.class.getName(), mlpParams));
		registry.register(new WekaModelFamily(DUMMY, ZeroR.class.getName(), ZeroR.class.getName(), ImmutableSet.of()));
		registry.register(new PretrainedModelFamily(PRETRAINED, ImmutableSet.of()));
		return registry;
	}

	public synchronized ModelFamilyRegistry register(final ModelFamily family) {
		if (this.families.putIfAbsent(family.getId(), family) != null) {
			throw new IllegalArgumentException("A family with id " + family.getId() + " is already registered.");
		}
		return this;
	}

	public synchronized Optional<ModelFamily> find(final String id) {
		return Optional.ofNullable(this.families.get(id));
	}

	public synchronized Set<String> getIds() {
		return ImmutableSet.copyOf(this.families.keySet());
	}
}
