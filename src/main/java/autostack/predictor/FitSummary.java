package autostack.predictor;

import java.util.List;
import java.util.Map;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import autostack.data.ProblemType;
import autostack.portfolio.Preset;
import autostack.stacking.CandidateFailure;

/**
 * Facts about a finished fit.
 */
public class FitSummary {

	private final Preset requestedPreset;
	private final Preset candidatePreset;
	private final ProblemType problemType;
	private final String metricName;
	private final int numLayersBuilt;
	private final int ensembleLayer;
	private final double ensembleScore;
	private final ImmutableList<CandidateFailure> failures;
	private final ImmutableList<String> notes;
	private final ImmutableMap<String, Integer> runtimesPerStage;

	public FitSummary(final Preset requestedPreset, final Preset candidatePreset, final ProblemType problemType, final String metricName, final int numLayersBuilt, final int ensembleLayer, final double ensembleScore,
			final List<CandidateFailure> failures, final List<String> notes, final Map<String, Integer> runtimesPerStage) {
		super();
		this.requestedPreset = requestedPreset;
		this.candidatePreset = candidatePreset;
		this.problemType = problemType;
		this.metricName = metricName;
		this.numLayersBuilt = numLayersBuilt;
		this.ensembleLayer = ensembleLayer;
		this.ensembleScore = ensembleScore;
		this.failures = ImmutableList.copyOf(failures);
		this.notes = ImmutableList.copyOf(notes);
		this.runtimesPerStage = ImmutableMap.copyOf(runtimesPerStage);
	}

	public Preset getRequestedPreset() {
		return this.requestedPreset;
	}

	/**
	 * @return the preset whose candidates were trained, which differs from the requested one if it was gated off
	 */
	public Preset getCandidatePreset() {
		return this.candidatePreset;
	}

	public ProblemType getProblemType() {
		return this.problemType;
	}

	public String getMetricName() {
		return this.metricName;
	}

	/**
	 * @return number of layers with at least one fitted model
	 */
	public int getNumLayersBuilt() {
		return this.numLayersBuilt;
	}

	/**
	 * @return index of the layer whose models the final ensemble combines
	 */
	public int getEnsembleLayer() {
		return this.ensembleLayer;
	}

	public double getEnsembleScore() {
		return this.ensembleScore;
	}

	public ImmutableList<CandidateFailure> getFailures() {
		return this.failures;
	}

	public ImmutableList<String> getNotes() {
		return this.notes;
	}

	/**
	 * @return runtime in milliseconds of each stage, in execution order
	 */
	public ImmutableMap<String, Integer> getRuntimesPerStage() {
		return this.runtimesPerStage;
	}

	@Override
	public String toString() {
		return "FitSummary [requestedPreset=" + this.requestedPreset + ", candidatePreset=" + this.candidatePreset + ", problemType=" + this.problemType + ", metric=" + this.metricName + ", numLayersBuilt="
				+ this.numLayersBuilt + ", ensembleLayer=" + this.ensembleLayer + ", ensembleScore=" + this.ensembleScore + ", failures=" + this.failures.size() + ", runtimesPerStage=" + this.runtimesPerStage + "]";
	}
}
