package autostack.testing;

import java.util.Arrays;

import autostack.data.ProblemType;
import autostack.family.ModelArtifact;

public class FakeArtifact implements ModelArtifact {

	private static final long serialVersionUID = 2291407743551170123L;

	private final ProblemType problemType;
	private final String feature;
	private final double quality;
	private final int numClasses;
	private final double[] quantileLevels;

	public FakeArtifact(final ProblemType problemType, final String feature, final double quality, final int numClasses, final double[] quantileLevels) {
		this.problemType = problemType;
		this.feature = feature;
		this.quality = quality;
		this.numClasses = numClasses;
		this.quantileLevels = quantileLevels != null ? Arrays.copyOf(quantileLevels, quantileLevels.length) : null;
	}

	@Override
	public ProblemType getProblemType() {
		return this.problemType;
	}

	public String getFeature() {
		return this.feature;
	}

	public double getQuality() {
		return this.quality;
	}

	public int getNumClasses() {
		return this.numClasses;
	}

	public double[] getQuantileLevels() {
		return this.quantileLevels;
	}
}
