package autostack.ensemble;

import java.util.List;

import com.google.common.collect.ImmutableList;

import autostack.data.Predictions;

/**
 * Outcome of greedy ensemble selection.
 */
public class EnsembleSelection {

	private final EnsembleWeights weights;
	private final ImmutableList<String> selectionOrder;
	private final ImmutableList<Double> lossTrajectory;
	private final Predictions outOfFoldPredictions;
	private final double score;

	public EnsembleSelection(final EnsembleWeights weights, final List<String> selectionOrder, final List<Double> lossTrajectory, final Predictions outOfFoldPredictions, final double score) {
		super();
		this.weights = weights;
		this.selectionOrder = ImmutableList.copyOf(selectionOrder);
		this.lossTrajectory = ImmutableList.copyOf(lossTrajectory);
		this.outOfFoldPredictions = outOfFoldPredictions;
		this.score = score;
	}

	public EnsembleWeights getWeights() {
		return this.weights;
	}

	/**
	 * @return the model picked in each round
	 */
	public ImmutableList<String> getSelectionOrder() {
		return this.selectionOrder;
	}

	/**
	 * @return validation loss of the ensemble after each round
	 */
	public ImmutableList<Double> getLossTrajectory() {
		return this.lossTrajectory;
	}

	public Predictions getOutOfFoldPredictions() {
		return this.outOfFoldPredictions;
	}

	/**
	 * @return validation score of the ensemble in the unit of the metric
	 */
	public double getScore() {
		return this.score;
	}

	public int getNumRounds() {
		return this.selectionOrder.size();
	}

	@Override
	public String toString() {
		return "EnsembleSelection [weights=" + this.weights + ", score=" + this.score + ", rounds=" + this.selectionOrder.size() + "]";
	}
}
