package autostack.ensemble;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Map.Entry;
import java.util.stream.Collectors;

import com.google.common.collect.ImmutableMap;

import autostack.data.Predictions;

/**
 * Non-negative weights of fitted models that sum to one.
 */
public class EnsembleWeights {

	public static final double TOLERANCE = 1e-9;

	private final ImmutableMap<String, Double> weights;

	public EnsembleWeights(final Map<String, Double> weights) {
		super();
		if (weights.isEmpty()) {
			throw new IllegalArgumentException("An ensemble needs at least one member.");
		}
		double sum = 0;
		for (Entry<String, Double> e : weights.entrySet()) {
			if (e.getValue() == null || e.getValue() < 0 || Double.isNaN(e.getValue())) {
				throw new IllegalArgumentException("Weight of " + e.getKey() + " must be non-negative but is " + e.getValue());
			}
			sum += e.getValue();
		}
		if (Math.abs(sum - 1) > TOLERANCE) {
			throw new IllegalArgumentException("Weights must sum to 1 but sum to " + sum);
		}
		this.weights = ImmutableMap.copyOf(weights);
	}

	/**
	 * Normalizes selection counts into weights. Members with count zero are dropped.
	 */
	public static EnsembleWeights fromCounts(final Map<String, Integer> counts) {
		int total = counts.values().stream().mapToInt(Integer::intValue).sum();
		if (total <= 0) {
			throw new IllegalArgumentException("At least one selection is required, got " + counts);
		}
		Map<String, Double> weights = new LinkedHashMap<>();
		counts.forEach((id, count) -> {
			if (count > 0) {
				weights.put(id, count / (double) total);
			}
		});
		return new EnsembleWeights(weights);
	}

	public static EnsembleWeights single(final String modelId) {
		return new EnsembleWeights(ImmutableMap.of(modelId, 1.0));
	}

	public ImmutableMap<String, Double> asMap() {
		return this.weights;
	}

	public double getWeight(final String modelId) {
		return this.weights.getOrDefault(modelId, 0.0);
	}

	/**
	 * @return ids of the models with positive weight
	 */
	public List<String> getSupport() {
		return this.weights.entrySet().stream().filter(e -> e.getValue() > 0).map(Entry::getKey).collect(Collectors.toList());
	}

	/**
	 * Computes the weighted average of the predictions of the members.
	 *
	 * @param predictions
	 *            predictions for at least every member of the support
	 */
	public Predictions combine(final Map<String, Predictions> predictions) {
		Predictions template = null;
		double[][] combined = null;
		for (Entry<String, Double> e : this.weights.entrySet()) {
			if (e.getValue() == 0) {
				continue;
			}
			Predictions member = predictions.get(e.getKey());
			if (member == null) {
				throw new IllegalArgumentException("No predictions of ensemble member " + e.getKey());
			}
			if (template == null) {
				template = member;
				combined = new double[member.getNumRows()][member.getNumColumns()];
			}
			if (member.getNumRows() != combined.length || member.getNumColumns() != template.getNumColumns()) {
				throw new IllegalArgumentException("Predictions of " + e.getKey() + " do not have the shape of the other members.");
			}
			for (int r = 0; r < combined.length; r++) {
				for (int c = 0; c < combined[r].length; c++) {
					combined[r][c] += e.getValue() * member.get(r, c);
				}
			}
		}
		return Predictions.like(template, combined);
	}

	@Override
	public int hashCode() {
		return this.weights.hashCode();
	}

	@Override
	public boolean equals(final Object obj) {
		if (this == obj) {
			return true;
		}
		if (obj == null || this.getClass() != obj.getClass()) {
			return false;
		}
		return this.weights.equals(((EnsembleWeights) obj).weights);
	}

	@Override
	public String toString() {
		return "EnsembleWeights " + this.weights;
	}
}
