package autostack.portfolio;

import autostack.data.LabeledDataset;
import autostack.data.ProblemType;

public class DatasetCharacteristics {

	private final int numRows;
	private final int numFeatures;
	private final int numClasses;
	private final ProblemType problemType;

	public DatasetCharacteristics(final int numRows, final int numFeatures, final int numClasses, final ProblemType problemType) {
		super();
		this.numRows = numRows;
		this.numFeatures = numFeatures;
		this.numClasses = numClasses;
		this.problemType = problemType;
	}

	public static DatasetCharacteristics of(final LabeledDataset data) {
		return new DatasetCharacteristics(data.size(), data.getFeatures().getNumColumns(), data.getNumClasses(), data.getProblemType());
	}

	public int getNumRows() {
		return this.numRows;
	}

	public int getNumFeatures() {
		return this.numFeatures;
	}

	public int getNumClasses() {
		return this.numClasses;
	}

	public ProblemType getProblemType() {
		return this.problemType;
	}

	public long getNumCells() {
		return (long) this.numRows * this.numFeatures;
	}

	@Override
	public String toString() {
		return "DatasetCharacteristics [numRows=" + this.numRows + ", numFeatures=" + this.numFeatures + ", numClasses=" + this.numClasses + ", problemType=" + this.problemType + "]";
	}
}
