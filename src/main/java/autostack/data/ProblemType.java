package autostack.data;

public enum ProblemType {

	BINARY, MULTICLASS, REGRESSION, QUANTILE;

	public boolean isClassification() {
		return this == BINARY || this == MULTICLASS;
	}

	public boolean isNumericTarget() {
		return this == REGRESSION || this == QUANTILE;
	}
}
