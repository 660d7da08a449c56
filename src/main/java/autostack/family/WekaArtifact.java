package autostack.family;

import java.util.Arrays;
import java.util.List;

import com.google.common.collect.ImmutableList;

import autostack.data.ProblemType;
import weka.classifiers.Classifier;
import weka.core.Instances;

/**
 * A trained Weka classifier together with the empty header of its training data. Quantile models additionally carry one offset per quantile level
 * that is added to the point prediction.
 */
public class WekaArtifact implements ModelArtifact {

	private static final long serialVersionUID = 3356270434761548231L;

	private final Classifier classifier;
	private final Instances header;
	private final ProblemType problemType;
	private final ImmutableList<String> featureNames;
	private final double[] quantileLevels;
	private final double[] quantileOffsets;

	public WekaArtifact(final Classifier classifier, final Instances header, final ProblemType problemType, final List<String> featureNames) {
		this(classifier, header, problemType, featureNames, null, null);
	}

	public WekaArtifact(final Classifier classifier, final Instances header, final ProblemType problemType, final List<String> featureNames, final double[] quantileLevels, final double[] quantileOffsets) {
		super();
		if (problemType == ProblemType.QUANTILE && (quantileLevels == null || quantileOffsets == null || quantileLevels.length != quantileOffsets.length)) {
			throw new IllegalArgumentException("Quantile artifacts need one offset per quantile level.");
		}
		this.classifier = classifier;
		this.header = new Instances(header, 0);
		this.problemType = problemType;
		this.featureNames = ImmutableList.copyOf(featureNames);
		this.quantileLevels = quantileLevels != null ? Arrays.copyOf(quantileLevels, quantileLevels.length) : null;
		this.quantileOffsets = quantileOffsets != null ? Arrays.copyOf(quantileOffsets, quantileOffsets.length) : null;
	}

	public Classifier getClassifier() {
		return this.classifier;
	}

	public Instances getHeader() {
		return this.header;
	}

	@Override
	public ProblemType getProblemType() {
		return this.problemType;
	}

	public ImmutableList<String> getFeatureNames() {
		return this.featureNames;
	}

	public double[] getQuantileLevels() {
		return this.quantileLevels != null ? Arrays.copyOf(this.quantileLevels, this.quantileLevels.length) : null;
	}

	public double[] getQuantileOffsets() {
		return this.quantileOffsets != null ? Arrays.copyOf(this.quantileOffsets, this.quantileOffsets.length) : null;
	}
}
