package autostack.stacking;

import java.util.List;
import java.util.Optional;

import org.apache.commons.math3.stat.descriptive.DescriptiveStatistics;

import com.google.common.collect.ImmutableList;

import autostack.metrics.ScoringFunction;

/**
 * What building one layer produced: the fitted models, the failed candidates, and the candidates that were never started.
 */
public class LayerResult {

	private final LayerOutput output;
	private final ImmutableList<CandidateFailure> failures;
	private final ImmutableList<String> notAdmitted;
	private final double runtimeSeconds;

	public LayerResult(final LayerOutput output, final List<CandidateFailure> failures, final List<String> notAdmitted, final double runtimeSeconds) {
		super();
		this.output = output;
		this.failures = ImmutableList.copyOf(failures);
		this.notAdmitted = ImmutableList.copyOf(notAdmitted);
		this.runtimeSeconds = runtimeSeconds;
	}

	public int getLayer() {
		return this.output.getLayer();
	}

	public LayerOutput getOutput() {
		return this.output;
	}

	public ImmutableList<CandidateFailure> getFailures() {
		return this.failures;
	}

	/**
	 * @return names of candidates that were not started because of the budget or because they are not admissible in the layer
	 */
	public ImmutableList<String> getNotAdmitted() {
		return this.notAdmitted;
	}

	public double getRuntimeSeconds() {
		return this.runtimeSeconds;
	}

	public boolean isEmpty() {
		return this.output.isEmpty();
	}

	public Optional<FittedModel> getBestModel(final ScoringFunction metric) {
		FittedModel best = null;
		for (FittedModel model : this.output.getModels()) {
			if (best == null || metric.isBetter(model.getScore(), best.getScore())) {
				best = model;
			}
		}
		return Optional.ofNullable(best);
	}

	/**
	 * @return summary of the validation scores of the fitted models
	 */
	public DescriptiveStatistics getScoreStatistics() {
		DescriptiveStatistics stats = new DescriptiveStatistics();
		this.output.getModels().forEach(m -> stats.addValue(m.getScore()));
		return stats;
	}

	@Override
	public String toString() {
		return "LayerResult [layer=" + this.getLayer() + ", models=" + this.output.getModelIds() + ", failures=" + this.failures.size() + ", notAdmitted=" + this.notAdmitted + "]";
	}
}
