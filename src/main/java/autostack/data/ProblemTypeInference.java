package autostack.data;

import java.util.ArrayList;
import java.util.List;
import java.util.SortedSet;
import java.util.TreeSet;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import autostack.FitConfigurationException;

/**
 * Separates the label column from a table, decides the problem type and encodes the labels.
 */
public class ProblemTypeInference {

	private static final Logger LOGGER = LoggerFactory.getLogger(ProblemTypeInference.class);

	public static final int MAX_CLASSES_OF_NUMERIC_LABEL = 20;
	public static final double MAX_DISTINCT_RATIO_OF_NUMERIC_LABEL = 0.05;

	private ProblemTypeInference() {
		/* static helper */
	}

	public static ProblemType infer(final Dataset data, final String labelColumn) {
		if (data.isNominal(labelColumn)) {
			return distinctNominalValues(data, labelColumn).size() > 2 ? ProblemType.MULTICLASS : ProblemType.BINARY;
		}
		SortedSet<Double> distinct = distinctNumericValues(data, labelColumn);
		if (distinct.size() == 2) {
			return ProblemType.BINARY;
		}
		boolean integral = distinct.stream().allMatch(v -> v == Math.rint(v));
		int rows = countLabeledRows(data, labelColumn);
		if (integral && distinct.size() > 2 && distinct.size() <= MAX_CLASSES_OF_NUMERIC_LABEL && distinct.size() <= MAX_DISTINCT_RATIO_OF_NUMERIC_LABEL * rows) {
			return ProblemType.MULTICLASS;
		}
		return ProblemType.REGRESSION;
	}

	/**
	 * Builds the labeled training data. Rows without a label are dropped.
	 *
	 * @param hint problem type requested by the caller, or null to infer it
	 */
	public static LabeledDataset toLabeledDataset(final Dataset data, final String labelColumn, final ProblemType hint) throws FitConfigurationException {
		if (data == null || data.isEmpty()) {
			throw new FitConfigurationException("The training data is empty.");
		}
		if (labelColumn == null || !data.hasColumn(labelColumn)) {
			throw new FitConfigurationException("Label column " + labelColumn + " does not exist. Columns are " + (data != null ? data.getColumnNames() : null));
		}
		if (data.getNumColumns() < 2) {
			throw new FitConfigurationException("The training data has no feature columns besides the label " + labelColumn);
		}

		/* drop rows with missing labels */
		double[] rawLabels = data.getColumn(labelColumn);
		List<Integer> labeledRows = new ArrayList<>();
		for (int r = 0; r < rawLabels.length; r++) {
			if (!Double.isNaN(rawLabels[r])) {
				labeledRows.add(r);
			}
		}
		if (labeledRows.isEmpty()) {
			throw new FitConfigurationException("No row of the training data has a label in column " + labelColumn);
		}
		Dataset labeled = data;
		if (labeledRows.size() < rawLabels.length) {
			LOGGER.info("Dropping {} of {} rows with missing label.", rawLabels.length - labeledRows.size(), rawLabels.length);
			labeled = data.selectRows(labeledRows.stream().mapToInt(Integer::intValue).toArray());
		}

		ProblemType inferred = infer(labeled, labelColumn);
		ProblemType problemType = hint != null ? hint : inferred;
		LOGGER.info("Problem type is {} (inferred {}, hint {}).", problemType, inferred, hint);
		Dataset features = labeled.dropColumn(labelColumn);
		double[] labelValues = labeled.getColumn(labelColumn);

		if (problemType.isNumericTarget()) {
			if (labeled.isNominal(labelColumn)) {
				throw new FitConfigurationException("Problem type " + problemType + " requires a numeric label, but column " + labelColumn + " is nominal.");
			}
			for (double v : labelValues) {
				if (!Double.isFinite(v)) {
					throw new FitConfigurationException("Label column " + labelColumn + " contains the non-finite target " + v);
				}
			}
			return new LabeledDataset(features, labelValues, problemType, null);
		}

		/* classification: encode classes as indexes of the observed values */
		List<String> classes = new ArrayList<>();
		double[] encoded = new double[labelValues.length];
		if (labeled.isNominal(labelColumn)) {
			List<String> declared = labeled.getNominalValues(labelColumn);
			List<Integer> observed = new ArrayList<>(distinctNominalValues(labeled, labelColumn));
			observed.forEach(i -> classes.add(declared.get(i)));
			for (int r = 0; r < labelValues.length; r++) {
				encoded[r] = observed.indexOf((int) labelValues[r]);
			}
		} else {
			List<Double> observed = new ArrayList<>(distinctNumericValues(labeled, labelColumn));
			observed.forEach(v -> classes.add(v == Math.rint(v) ? Long.toString(v.longValue()) : Double.toString(v)));
			for (int r = 0; r < labelValues.length; r++) {
				encoded[r] = observed.indexOf(labelValues[r]);
			}
		}
		if (classes.size() < 2) {
			throw new FitConfigurationException("Classification requires at least two classes but label column " + labelColumn + " only contains " + classes);
		}
		if (problemType == ProblemType.BINARY && classes.size() != 2) {
			throw new FitConfigurationException("Problem type BINARY requires exactly two classes but found " + classes.size());
		}
		if (problemType == ProblemType.MULTICLASS && classes.size() == 2) {
			throw new FitConfigurationException("Label column " + labelColumn + " has only two classes; use BINARY instead of MULTICLASS.");
		}
		return new LabeledDataset(features, encoded, problemType, classes);
	}

	private static SortedSet<Integer> distinctNominalValues(final Dataset data, final String column) {
		SortedSet<Integer> values = new TreeSet<>();
		for (double v : data.getColumn(column)) {
			if (!Double.isNaN(v)) {
				values.add((int) v);
			}
		}
		return values;
	}

	private static SortedSet<Double> distinctNumericValues(final Dataset data, final String column) {
		SortedSet<Double> values = new TreeSet<>();
		for (double v : data.getColumn(column)) {
			if (!Double.isNaN(v)) {
				values.add(v);
			}
		}
		return values;
	}

	private static int countLabeledRows(final Dataset data, final String column) {
		int count = 0;
		for (double v : data.getColumn(column)) {
			if (!Double.isNaN(v)) {
				count++;
			}
		}
		return count;
	}
}
