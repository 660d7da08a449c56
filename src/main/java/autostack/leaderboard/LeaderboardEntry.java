package autostack.leaderboard;

import java.util.Objects;

/**
 * Record of one scored model. Entries are created once and never changed.
 */
public class LeaderboardEntry {

	public static final String ENSEMBLE_FAMILY = "ENSEMBLE";

	private final String modelId;
	private final String familyId;
	private final int layer;
	private final double score;
	private final double fitSeconds;
	private final double predictSeconds;
	private final long memoryBytes;
	private final int insertionIndex;

	public LeaderboardEntry(final String modelId, final String familyId, final int layer, final double score, final double fitSeconds, final double predictSeconds, final long memoryBytes) {
		this(modelId, familyId, layer, score, fitSeconds, predictSeconds, memoryBytes, -1);
	}

	private LeaderboardEntry(final String modelId, final String familyId, final int layer, final double score, final double fitSeconds, final double predictSeconds, final long memoryBytes, final int insertionIndex) {
		super();
		this.modelId = Objects.requireNonNull(modelId);
		this.familyId = Objects.requireNonNull(familyId);
		this.layer = layer;
		this.score = score;
		this.fitSeconds = fitSeconds;
		this.predictSeconds = predictSeconds;
		this.memoryBytes = memoryBytes;
		this.insertionIndex = insertionIndex;
	}

	LeaderboardEntry withInsertionIndex(final int index) {
		return new LeaderboardEntry(this.modelId, this.familyId, this.layer, this.score, this.fitSeconds, this.predictSeconds, this.memoryBytes, index);
	}

	public String getModelId() {
		return this.modelId;
	}

	public String getFamilyId() {
		return this.familyId;
	}

	public boolean isEnsemble() {
		return ENSEMBLE_FAMILY.equals(this.familyId);
	}

	/**
	 * @return the stack layer of the model; for ensembles the layer whose models they combine
	 */
	public int getLayer() {
		return this.layer;
	}

	public double getScore() {
		return this.score;
	}

	public double getFitSeconds() {
		return this.fitSeconds;
	}

	public double getPredictSeconds() {
		return this.predictSeconds;
	}

	public long getMemoryBytes() {
		return this.memoryBytes;
	}

	/**
	 * @return position on the leaderboard at which the entry was appended, or -1 if it has not been appended yet
	 */
	public int getInsertionIndex() {
		return this.insertionIndex;
	}

	@Override
	public String toString() {
		return String.format("%-36s layer=%d score=%.6f fit=%.2fs predict=%.2fs memory=%dB", this.modelId, this.layer, this.score, this.fitSeconds, this.predictSeconds, this.memoryBytes);
	}
}
