package autostack.data;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.Arrays;

import org.junit.jupiter.api.Test;

class DatasetTest {

	private static Dataset colors(final String... values) {
		return Dataset.builder().numericColumn("x", new double[values.length]).nominalColumn("color", Arrays.asList("red", "blue", "green"), values).build();
	}

	@Test
	void recodeNominalMatchesValuesByName() {
		Dataset recoded = colors("red", "blue", null, "green").recodeNominal("color", Arrays.asList("blue", "green", "red"));

		double[] color = recoded.getColumn("color");
		assertThat(color[0]).isEqualTo(2);
		assertThat(color[1]).isZero();
		assertThat(color[2]).isNaN();
		assertThat(color[3]).isEqualTo(1);
		assertThat(recoded.getNominalValues("color")).containsExactly("blue", "green", "red");
		assertThat(recoded.getColumn("x")).containsExactly(0, 0, 0, 0);
	}

	@Test
	void recodeNominalTurnsUnknownValuesIntoMissingOnes() {
		Dataset recoded = colors("green", "red").recodeNominal("color", Arrays.asList("red", "blue"));

		assertThat(recoded.getColumn("color")[0]).isNaN();
		assertThat(recoded.getColumn("color")[1]).isZero();
	}

	@Test
	void recodeNominalWithSameValuesKeepsTheTable() {
		Dataset data = colors("red");

		assertThat(data.recodeNominal("color", Arrays.asList("red", "blue", "green"))).isSameAs(data);
	}

	@Test
	void recodeNominalRejectsNumericColumns() {
		assertThatThrownBy(() -> colors("red").recodeNominal("x", Arrays.asList("a"))).isInstanceOf(IllegalArgumentException.class).hasMessageContaining("not nominal");
	}

	@Test
	void nominalEntriesMustBeDeclared() {
		assertThatThrownBy(() -> colors("purple")).isInstanceOf(IllegalArgumentException.class).hasMessageContaining("purple");
	}
}
