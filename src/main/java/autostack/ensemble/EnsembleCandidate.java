package autostack.ensemble;

import java.util.Objects;

import autostack.data.Predictions;

/**
 * A fitted model as seen by the ensemble selector: its out-of-fold predictions plus the attributes used to break ties.
 */
public class EnsembleCandidate {

	private final String modelId;
	private final Predictions outOfFoldPredictions;
	private final double fitSeconds;
	private final int insertionOrder;

	public EnsembleCandidate(final String modelId, final Predictions outOfFoldPredictions, final double fitSeconds, final int insertionOrder) {
		super();
		this.modelId = Objects.requireNonNull(modelId);
		this.outOfFoldPredictions = Objects.requireNonNull(outOfFoldPredictions);
		this.fitSeconds = fitSeconds;
		this.insertionOrder = insertionOrder;
	}

	public String getModelId() {
		return this.modelId;
	}

	public Predictions getOutOfFoldPredictions() {
		return this.outOfFoldPredictions;
	}

	public double getFitSeconds() {
		return this.fitSeconds;
	}

	/**
	 * @return position of the model's entry on the leaderboard
	 */
	public int getInsertionOrder() {
		return this.insertionOrder;
	}

	@Override
	public String toString() {
		return "EnsembleCandidate [modelId=" + this.modelId + ", fitSeconds=" + this.fitSeconds + ", insertionOrder=" + this.insertionOrder + "]";
	}
}
