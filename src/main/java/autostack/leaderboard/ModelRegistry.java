package autostack.leaderboard;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;

import com.google.common.collect.ImmutableList;

import autostack.ensemble.EnsembleWeights;
import autostack.stacking.FittedModel;

/**
 * Fitted models indexed by stack layer. Dependencies between models are kept as ids, so that the layer graph can be resolved without following
 * object references.
 */
public class ModelRegistry {

	private final Map<String, FittedModel> models = new HashMap<>();
	private final SortedMap<Integer, List<String>> layers = new TreeMap<>();

	/**
	 * Registers a model. All models it consumes must already be registered on lower layers.
	 */
	public synchronized void register(final FittedModel model) {
		if (this.models.containsKey(model.getId())) {
			throw new IllegalArgumentException("Model " + model.getId() + " is already registered.");
		}
		for (String input : model.getInputModelIds()) {
			FittedModel inputModel = this.models.get(input);
			if (inputModel == null) {
				throw new IllegalArgumentException("Input model " + input + " of " + model.getId() + " is not registered.");
			}
			if (inputModel.getLayer() >= model.getLayer()) {
				throw new IllegalArgumentException("Input model " + input + " of " + model.getId() + " is not on a lower layer.");
			}
		}
		this.models.put(model.getId(), model);
		this.layers.computeIfAbsent(model.getLayer(), l -> new ArrayList<>()).add(model.getId());
	}

	public synchronized Optional<FittedModel> get(final String id) {
		return Optional.ofNullable(this.models.get(id));
	}

	public synchronized FittedModel getOrFail(final String id) {
		FittedModel model = this.models.get(id);
		if (model == null) {
			throw new IllegalArgumentException("No model with id " + id + " is registered.");
		}
		return model;
	}

	public synchronized List<FittedModel> getLayer(final int layer) {
		List<FittedModel> result = new ArrayList<>();
		for (String id : this.layers.getOrDefault(layer, ImmutableList.of())) {
			result.add(this.models.get(id));
		}
		return result;
	}

	public synchronized List<Integer> getLayerIndexes() {
		return new ArrayList<>(this.layers.keySet());
	}

	public synchronized int size() {
		return this.models.size();
	}

	/**
	 * Removes all models of a layer. Models of higher layers must have been removed before.
	 *
	 * @return the removed models
	 */
	public synchronized List<FittedModel> removeLayer(final int layer) {
		if (!this.layers.tailMap(layer + 1).isEmpty()) {
			throw new IllegalStateException("Cannot remove layer " + layer + " while higher layers exist.");
		}
		List<FittedModel> removed = this.getLayer(layer);
		removed.forEach(m -> this.models.remove(m.getId()));
		this.layers.remove(layer);
		return removed;
	}

	/**
	 * Computes the models needed to evaluate the given ensemble: its members plus, transitively, every model whose predictions they consume.
	 */
	public synchronized InferencePlan resolve(final EnsembleWeights weights) {
		Set<String> required = new HashSet<>();
		Deque<String> open = new ArrayDeque<>(weights.getSupport());
		while (!open.isEmpty()) {
			String id = open.poll();
			if (!required.add(id)) {
				continue;
			}
			FittedModel model = this.getOrFail(id);
			open.addAll(model.getInputModelIds());
		}
		SortedMap<Integer, List<String>> plan = new TreeMap<>();
		for (Map.Entry<Integer, List<String>> layer : this.layers.entrySet()) {
			for (String id : layer.getValue()) {
				if (required.contains(id)) {
					plan.computeIfAbsent(layer.getKey(), l -> new ArrayList<>()).add(id);
				}
			}
		}
		return new InferencePlan(plan, weights);
	}
}
