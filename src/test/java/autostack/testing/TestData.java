package autostack.testing;

import java.util.Arrays;
import java.util.Map;
import java.util.Random;

import autostack.data.Dataset;
import autostack.data.LabeledDataset;
import autostack.data.ProblemType;
import autostack.portfolio.CandidateConfig;
import autostack.portfolio.ResourceEstimate;

public class TestData {

	public static final String LABEL = "y";

	private TestData() {
		/* avoid instantiation */
	}

	/**
	 * Column x is positive exactly for rows labeled "pos"; column z is noise.
	 */
	public static Dataset binary(final int numRows, final long seed) {
		Random random = new Random(seed);
		double[] x = new double[numRows];
		double[] z = new double[numRows];
		String[] y = new String[numRows];
		for (int i = 0; i < numRows; i++) {
			x[i] = (i % 2 == 0 ? 1 : -1) * (1 + random.nextDouble());
			z[i] = random.nextGaussian();
			y[i] = x[i] > 0 ? "pos" : "neg";
		}
		return Dataset.builder().numericColumn("x", x).numericColumn("z", z).nominalColumn(LABEL, Arrays.asList("neg", "pos"), y).build();
	}

	/**
	 * Column x rounded is the class index of the row.
	 */
	public static Dataset multiclass(final int numRows, final long seed) {
		Random random = new Random(seed);
		double[] x = new double[numRows];
		double[] z = new double[numRows];
		String[] y = new String[numRows];
		String[] classes = { "a", "b", "c" };
		for (int i = 0; i < numRows; i++) {
			int c = i % 3;
			x[i] = c + (random.nextDouble() - 0.5) * 0.5;
			z[i] = random.nextGaussian();
			y[i] = classes[c];
		}
		return Dataset.builder().numericColumn("x", x).numericColumn("z", z).nominalColumn(LABEL, Arrays.asList(classes), y).build();
	}

	/**
	 * The target equals column x.
	 */
	public static Dataset regression(final int numRows, final long seed) {
		Random random = new Random(seed);
		double[] x = new double[numRows];
		double[] z = new double[numRows];
		for (int i = 0; i < numRows; i++) {
			x[i] = random.nextDouble() * 10;
			z[i] = random.nextGaussian();
		}
		return Dataset.builder().numericColumn("x", x).numericColumn("z", z).numericColumn(LABEL, Arrays.copyOf(x, numRows)).build();
	}

	public static LabeledDataset labeledBinary(final int numRows, final long seed) {
		Dataset data = binary(numRows, seed);
		double[] labels = new double[numRows];
		double[] x = data.getColumn("x");
		for (int i = 0; i < numRows; i++) {
			labels[i] = x[i] > 0 ? 1 : 0;
		}
		return new LabeledDataset(data.dropColumn(LABEL), labels, ProblemType.BINARY, Arrays.asList("neg", "pos"));
	}

	public static CandidateConfig fakeCandidate(final String name, final int rank, final Map<String, ?> hyperparameters) {
		return new CandidateConfig(name, FakeModelFamily.ID, hyperparameters, ResourceEstimate.cpuOnly(0.01), rank);
	}

	public static CandidateConfig fakeCandidate(final String name, final String familyId, final int rank, final Map<String, ?> hyperparameters, final ResourceEstimate estimate) {
		return new CandidateConfig(name, familyId, hyperparameters, estimate, rank);
	}
}
