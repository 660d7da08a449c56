package autostack.family;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import autostack.data.Dataset;
import autostack.data.LabeledDataset;
import autostack.data.ProblemType;
import weka.core.Attribute;
import weka.core.DenseInstance;
import weka.core.Instances;
import weka.core.Utils;

/**
 * Translates datasets into Weka {@link Instances}. The label becomes the last attribute.
 */
public class WekaConversion {

	public static final String LABEL_ATTRIBUTE = "__label__";

	private WekaConversion() {
		/* avoid instantiation */
	}

	public static Instances toInstances(final LabeledDataset data, final String relationName) {
		Dataset features = data.getFeatures();
		if (features.hasColumn(LABEL_ATTRIBUTE)) {
			throw new IllegalArgumentException("Feature name " + LABEL_ATTRIBUTE + " is reserved.");
		}
		ArrayList<Attribute> attributes = getFeatureAttributes(features);
		if (data.getProblemType().isClassification()) {
			attributes.add(new Attribute(LABEL_ATTRIBUTE, new ArrayList<>(data.getClassLabels())));
		} else {
			attributes.add(new Attribute(LABEL_ATTRIBUTE));
		}
		Instances instances = new Instances(relationName, attributes, data.size());
		instances.setClassIndex(attributes.size() - 1);
		for (int i = 0; i < data.size(); i++) {
			double[] values = Arrays.copyOf(features.getRow(i), attributes.size());
			values[attributes.size() - 1] = data.getLabel(i);
			instances.add(new DenseInstance(data.getWeight(i), toWekaValues(values)));
		}
		return instances;
	}

	/**
	 * Creates instances with missing labels that share the attributes of the given header. The data must contain every feature of the header.
	 */
	public static Instances toUnlabeledInstances(final Dataset data, final Instances header) {
		Instances instances = new Instances(header, data.getNumRows());
		int[] columns = new int[header.numAttributes()];
		for (int a = 0; a < header.numAttributes(); a++) {
			columns[a] = a == header.classIndex() ? -1 : data.getColumnIndex(header.attribute(a).name());
		}
		for (int i = 0; i < data.getNumRows(); i++) {
			double[] values = new double[header.numAttributes()];
			for (int a = 0; a < values.length; a++) {
				values[a] = columns[a] < 0 ? Utils.missingValue() : data.getValue(i, columns[a]);
			}
			instances.add(new DenseInstance(1.0, toWekaValues(values)));
		}
		return instances;
	}

	public static ProblemType getProblemType(final Instances header, final boolean quantile) {
		if (header.classAttribute().isNominal()) {
			return header.classAttribute().numValues() == 2 ? ProblemType.BINARY : ProblemType.MULTICLASS;
		}
		return quantile ? ProblemType.QUANTILE : ProblemType.REGRESSION;
	}

	/**
	 * Converts Weka instances with a class attribute back into a dataset; the class attribute becomes a column with the given name.
	 */
	public static Dataset fromInstances(final Instances instances, final String labelColumn) {
		Dataset.Builder builder = Dataset.builder();
		for (int a = 0; a < instances.numAttributes(); a++) {
			Attribute attribute = instances.attribute(a);
			String name = a == instances.classIndex() ? labelColumn : attribute.name();
			double[] values = instances.attributeToDoubleArray(a);
			if (attribute.isNominal() || attribute.isString()) {
				List<String> declared = new ArrayList<>();
				for (int v = 0; v < attribute.numValues(); v++) {
					declared.add(attribute.value(v));
				}
				String[] entries = new String[values.length];
				for (int i = 0; i < values.length; i++) {
					entries[i] = Utils.isMissingValue(values[i]) ? null : attribute.value((int) values[i]);
				}
				builder.nominalColumn(name, declared, entries);
			} else {
				builder.numericColumn(name, values);
			}
		}
		boolean weighted = false;
		double[] weights = new double[instances.numInstances()];
		for (int i = 0; i < weights.length; i++) {
			weights[i] = instances.instance(i).weight();
			weighted |= weights[i] != 1.0;
		}
		if (weighted) {
			builder.sampleWeights(weights);
		}
		return builder.build();
	}

	private static ArrayList<Attribute> getFeatureAttributes(final Dataset features) {
		ArrayList<Attribute> attributes = new ArrayList<>();
		for (String column : features.getColumnNames()) {
			if (features.isNominal(column)) {
				attributes.add(new Attribute(column, new ArrayList<>(features.getNominalValues(column))));
			} else {
				attributes.add(new Attribute(column));
			}
		}
		return attributes;
	}

	private static double[] toWekaValues(final double[] values) {
		for (int i = 0; i < values.length; i++) {
			if (Double.isNaN(values[i])) {
				values[i] = Utils.missingValue();
			}
		}
		return values;
	}
}
