package autostack.data;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

import com.google.common.collect.ImmutableList;

/**
 * Features together with encoded labels. For classification problems, a label is the index of its class in {@link #getClassLabels()}.
 */
public class LabeledDataset {

	private final Dataset features;
	private final double[] labels;
	private final ProblemType problemType;
	private final ImmutableList<String> classLabels;

	public LabeledDataset(final Dataset features, final double[] labels, final ProblemType problemType, final List<String> classLabels) {
		super();
		Objects.requireNonNull(features);
		Objects.requireNonNull(labels);
		Objects.requireNonNull(problemType);
		if (features.getNumRows() != labels.length) {
			throw new IllegalArgumentException("Got " + labels.length + " labels for " + features.getNumRows() + " rows.");
		}
		this.features = features;
		this.labels = Arrays.copyOf(labels, labels.length);
		this.problemType = problemType;
		this.classLabels = classLabels != null ? ImmutableList.copyOf(classLabels) : ImmutableList.of();
		if (problemType.isClassification()) {
			if (this.classLabels.size() < 2) {
				throw new IllegalArgumentException("Classification requires at least two classes but got " + this.classLabels);
			}
			for (double label : this.labels) {
				if (label < 0 || label >= this.classLabels.size() || label != Math.rint(label)) {
					throw new IllegalArgumentException("Label " + label + " is not a class index in [0, " + this.classLabels.size() + ").");
				}
			}
		} else {
			for (double label : this.labels) {
				if (!Double.isFinite(label)) {
					throw new IllegalArgumentException("Numeric targets must be finite but found " + label);
				}
			}
		}
	}

	public int size() {
		return this.labels.length;
	}

	public Dataset getFeatures() {
		return this.features;
	}

	public double getLabel(final int row) {
		return this.labels[row];
	}

	public double[] getLabels() {
		return Arrays.copyOf(this.labels, this.labels.length);
	}

	public double getWeight(final int row) {
		return this.features.getSampleWeight(row);
	}

	public boolean isWeighted() {
		return this.features.hasSampleWeights();
	}

	public ProblemType getProblemType() {
		return this.problemType;
	}

	public List<String> getClassLabels() {
		return this.classLabels;
	}

	public int getNumClasses() {
		return this.classLabels.size();
	}

	public LabeledDataset selectRows(final int[] rows) {
		double[] selectedLabels = new double[rows.length];
		for (int i = 0; i < rows.length; i++) {
			selectedLabels[i] = this.labels[rows[i]];
		}
		return new LabeledDataset(this.features.selectRows(rows), selectedLabels, this.problemType, this.classLabels);
	}

	/**
	 * Same rows and labels with a different feature table, e.g. the original features extended by stacking features.
	 */
	public LabeledDataset withFeatures(final Dataset newFeatures) {
		return new LabeledDataset(newFeatures, this.labels, this.problemType, this.classLabels);
	}

	@Override
	public String toString() {
		return "LabeledDataset [problemType=" + this.problemType + ", size=" + this.labels.length + ", classes=" + this.classLabels + ", features=" + this.features + "]";
	}
}
