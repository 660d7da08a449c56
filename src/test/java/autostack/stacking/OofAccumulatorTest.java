package autostack.stacking;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

import autostack.data.Predictions;

class OofAccumulatorTest {

	@Test
	void averagesOverRepetitions() {
		OofAccumulator accumulator = new OofAccumulator(3, 2);
		accumulator.add(0, new int[] { 0, 2 }, Predictions.ofValues(new double[] { 1, 3 }));
		accumulator.add(0, new int[] { 1 }, Predictions.ofValues(new double[] { 2 }));
		assertThat(accumulator.isComplete()).isFalse();
		accumulator.add(1, new int[] { 1, 2 }, Predictions.ofValues(new double[] { 4, 5 }));
		accumulator.add(1, new int[] { 0 }, Predictions.ofValues(new double[] { 3 }));

		Predictions oof = accumulator.build();

		assertThat(oof.toArray()).isDeepEqualTo(new double[][] { { 2 }, { 3 }, { 4 } });
	}

	@Test
	void rejectsRowsPredictedTwice() {
		OofAccumulator accumulator = new OofAccumulator(2, 1);
		accumulator.add(0, new int[] { 0 }, Predictions.ofValues(new double[] { 1 }));

		assertThatThrownBy(() -> accumulator.add(0, new int[] { 0, 1 }, Predictions.ofValues(new double[] { 1, 2 }))).isInstanceOf(IllegalStateException.class).hasMessageContaining("Row 0");
	}

	@Test
	void refusesIncompleteCoverage() {
		OofAccumulator accumulator = new OofAccumulator(2, 1);
		accumulator.add(0, new int[] { 1 }, Predictions.ofValues(new double[] { 1 }));

		assertThatThrownBy(accumulator::build).isInstanceOf(IllegalStateException.class);
	}

	@Test
	void rejectsShapeChanges() {
		OofAccumulator accumulator = new OofAccumulator(2, 1);
		accumulator.add(0, new int[] { 0 }, Predictions.ofProbabilities(new double[][] { { 0.5, 0.5 } }));

		assertThatThrownBy(() -> accumulator.add(0, new int[] { 1 }, Predictions.ofProbabilities(new double[][] { { 0.2, 0.3, 0.5 } }))).isInstanceOf(IllegalArgumentException.class);
	}
}
