package autostack.leaderboard;

import java.util.List;
import java.util.Map;
import java.util.Map.Entry;
import java.util.SortedMap;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSortedMap;

import autostack.ensemble.EnsembleWeights;

/**
 * The models needed to reproduce an ensemble at inference time, grouped by stack layer. Layers must be evaluated in ascending order since models of
 * layer L+1 consume predictions of layer L.
 */
public class InferencePlan {

	private final ImmutableSortedMap<Integer, ImmutableList<String>> modelsPerLayer;
	private final EnsembleWeights weights;

	public InferencePlan(final SortedMap<Integer, List<String>> modelsPerLayer, final EnsembleWeights weights) {
		super();
		ImmutableSortedMap.Builder<Integer, ImmutableList<String>> builder = ImmutableSortedMap.naturalOrder();
		for (Entry<Integer, List<String>> e : modelsPerLayer.entrySet()) {
			builder.put(e.getKey(), ImmutableList.copyOf(e.getValue()));
		}
		this.modelsPerLayer = builder.build();
		this.weights = weights;
	}

	public ImmutableSortedMap<Integer, ImmutableList<String>> getModelsPerLayer() {
		return this.modelsPerLayer;
	}

	public ImmutableList<String> getModels(final int layer) {
		return this.modelsPerLayer.getOrDefault(layer, ImmutableList.of());
	}

	public List<String> getModelIds() {
		return this.modelsPerLayer.values().stream().flatMap(List::stream).collect(ImmutableList.toImmutableList());
	}

	public boolean contains(final String modelId) {
		return this.modelsPerLayer.values().stream().anyMatch(l -> l.contains(modelId));
	}

	public int size() {
		return this.modelsPerLayer.values().stream().mapToInt(List::size).sum();
	}

	public EnsembleWeights getWeights() {
		return this.weights;
	}

	public Map<String, Double> getWeightMap() {
		return this.weights.asMap();
	}

	@Override
	public String toString() {
		return "InferencePlan [modelsPerLayer=" + this.modelsPerLayer + ", weights=" + this.weights + "]";
	}
}
