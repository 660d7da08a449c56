package autostack.stacking;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import com.google.common.collect.ImmutableList;

import autostack.data.Predictions;
import autostack.portfolio.CandidateConfig;
import autostack.storage.ArtifactReference;

/**
 * A candidate trained on one stack layer: references to its fold artifacts (and optionally a refit artifact), and its out-of-fold predictions for
 * every training row. Never mutated; retraining produces a new instance.
 */
public class FittedModel {

	private final String id;
	private final CandidateConfig config;
	private final int layer;
	private final ImmutableList<ArtifactReference> foldArtifacts;
	private final ArtifactReference refitArtifact;
	private final Predictions outOfFoldPredictions;
	private final double score;
	private final String metricName;
	private final double fitSeconds;
	private final double predictSeconds;
	private final long memoryBytes;
	private final ImmutableList<String> inputModelIds;
	private final ImmutableList<String> featureNames;

	public FittedModel(final String id, final CandidateConfig config, final int layer, final List<ArtifactReference> foldArtifacts, final ArtifactReference refitArtifact, final Predictions outOfFoldPredictions,
			final double score, final String metricName, final double fitSeconds, final double predictSeconds, final long memoryBytes, final List<String> inputModelIds, final List<String> featureNames) {
		super();
		if (foldArtifacts.isEmpty() && refitArtifact == null) {
			throw new IllegalArgumentException("Model " + id + " has no artifact.");
		}
		this.id = Objects.requireNonNull(id);
		this.config = Objects.requireNonNull(config);
		this.layer = layer;
		this.foldArtifacts = ImmutableList.copyOf(foldArtifacts);
		this.refitArtifact = refitArtifact;
		this.outOfFoldPredictions = Objects.requireNonNull(outOfFoldPredictions);
		this.score = score;
		this.metricName = metricName;
		this.fitSeconds = fitSeconds;
		this.predictSeconds = predictSeconds;
		this.memoryBytes = memoryBytes;
		this.inputModelIds = ImmutableList.copyOf(inputModelIds);
		this.featureNames = ImmutableList.copyOf(featureNames);
	}

	public static String getModelId(final CandidateConfig config, final int layer) {
		return config.getName() + "_L" + (layer + 1);
	}

	public String getId() {
		return this.id;
	}

	public CandidateConfig getConfig() {
		return this.config;
	}

	public String getFamilyId() {
		return this.config.getFamilyId();
	}

	public int getLayer() {
		return this.layer;
	}

	public ImmutableList<ArtifactReference> getFoldArtifacts() {
		return this.foldArtifacts;
	}

	public boolean hasRefitArtifact() {
		return this.refitArtifact != null;
	}

	public ArtifactReference getRefitArtifact() {
		return this.refitArtifact;
	}

	public Predictions getOutOfFoldPredictions() {
		return this.outOfFoldPredictions;
	}

	public double getScore() {
		return this.score;
	}

	public String getMetricName() {
		return this.metricName;
	}

	/**
	 * @return the time spent on all fold fits and the refit
	 */
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
	 * @return ids of the previous-layer models whose predictions are features of this model
	 */
	public ImmutableList<String> getInputModelIds() {
		return this.inputModelIds;
	}

	/**
	 * @return the columns the model expects, in order
	 */
	public ImmutableList<String> getFeatureNames() {
		return this.featureNames;
	}

	public Map<String, Object> getInfo() {
		Map<String, Object> info = new LinkedHashMap<>();
		info.put("name", this.id);
		info.put("family", this.config.getFamilyId());
		info.put("layer", this.layer);
		info.put("score", this.score);
		info.put("metric", this.metricName);
		info.put("fitSeconds", this.fitSeconds);
		info.put("predictSeconds", this.predictSeconds);
		info.put("memoryBytes", this.memoryBytes);
		info.put("hyperparameters", this.config.getHyperparameters());
		info.put("numFoldArtifacts", this.foldArtifacts.size());
		info.put("refitFull", this.refitArtifact != null);
		info.put("inputModels", this.inputModelIds);
		return info;
	}

	@Override
	public String toString() {
		return "FittedModel [id=" + this.id + ", layer=" + this.layer + ", score=" + this.score + ", fitSeconds=" + this.fitSeconds + "]";
	}
}
