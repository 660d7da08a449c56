package autostack.stacking;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import autostack.data.Dataset;
import autostack.data.Predictions;
import autostack.data.ProblemType;

/**
 * Turns model predictions into feature columns of the next stack layer. Binary problems contribute the probability of the positive class only,
 * multiclass problems one column per class, regression one column and quantile problems one column per level.
 */
public class StackFeatures {

	private StackFeatures() {
		/* avoid instantiation */
	}

	public static List<String> getColumnNames(final String modelId, final Predictions predictions, final List<String> classLabels) {
		List<String> names = new ArrayList<>();
		switch (predictions.getProblemType()) {
		case BINARY:
		case REGRESSION:
			names.add(modelId);
			break;
		case MULTICLASS:
			for (int c = 0; c < predictions.getNumColumns(); c++) {
				names.add(modelId + "_" + (classLabels != null && c < classLabels.size() ? classLabels.get(c) : String.valueOf(c)));
			}
			break;
		case QUANTILE:
			for (double level : predictions.getQuantileLevels()) {
				names.add(modelId + "_q" + level);
			}
			break;
		default:
			throw new IllegalArgumentException("Unsupported problem type " + predictions.getProblemType());
		}
		return names;
	}

	public static double[] getFeatureValues(final Predictions predictions, final int row) {
		if (predictions.getProblemType() == ProblemType.BINARY) {
			return new double[] { predictions.get(row, 1) };
		}
		return predictions.getRow(row);
	}

	/**
	 * Appends the predictions of the given models, in the given order, to the original features.
	 */
	public static Dataset augment(final Dataset original, final List<String> modelIds, final Map<String, Predictions> predictions, final List<String> classLabels) {
		List<String> names = new ArrayList<>();
		List<Predictions> ordered = new ArrayList<>();
		for (String id : modelIds) {
			Predictions p = predictions.get(id);
			if (p == null) {
				throw new IllegalArgumentException("No predictions of model " + id);
			}
			if (p.getNumRows() != original.getNumRows()) {
				throw new IllegalArgumentException("Predictions of " + id + " have " + p.getNumRows() + " rows, features have " + original.getNumRows());
			}
			names.addAll(getColumnNames(id, p, classLabels));
			ordered.add(p);
		}
		double[][] block = new double[original.getNumRows()][names.size()];
		for (int r = 0; r < block.length; r++) {
			int offset = 0;
			for (Predictions p : ordered) {
				double[] values = getFeatureValues(p, r);
				System.arraycopy(values, 0, block[r], offset, values.length);
				offset += values.length;
			}
		}
		return original.appendColumns(names, block);
	}
}
