package autostack.leaderboard;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import autostack.metrics.EPerformanceMeasure;

class LeaderboardTest {

	private static LeaderboardEntry entry(final String id, final int layer, final double score) {
		return new LeaderboardEntry(id, "FAKE", layer, score, 1.0, 0.1, 1024);
	}

	@Test
	@DisplayName("entries get consecutive insertion indexes")
	void insertionIndexes() {
		Leaderboard leaderboard = new Leaderboard(EPerformanceMeasure.ACCURACY);

		assertThat(leaderboard.append(entry("a", 0, 0.7)).getInsertionIndex()).isZero();
		assertThat(leaderboard.append(entry("b", 0, 0.8)).getInsertionIndex()).isEqualTo(1);
		assertThat(leaderboard.size()).isEqualTo(2);
		assertThat(leaderboard.get("b")).hasValueSatisfying(e -> assertThat(e.getScore()).isEqualTo(0.8));
	}

	@Test
	void rejectsDuplicateIds() {
		Leaderboard leaderboard = new Leaderboard(EPerformanceMeasure.ACCURACY);
		leaderboard.append(entry("a", 0, 0.7));

		assertThatThrownBy(() -> leaderboard.append(entry("a", 1, 0.9))).isInstanceOf(IllegalArgumentException.class);
	}

	@Test
	@DisplayName("ranking follows the direction of the metric")
	void rankingDirection() {
		Leaderboard accuracy = new Leaderboard(EPerformanceMeasure.ACCURACY);
		Leaderboard logLoss = new Leaderboard(EPerformanceMeasure.LOG_LOSS);
		for (Leaderboard leaderboard : new Leaderboard[] { accuracy, logLoss }) {
			leaderboard.append(entry("low", 0, 0.2));
			leaderboard.append(entry("high", 0, 0.9));
		}

		assertThat(accuracy.getRanking()).extracting(LeaderboardEntry::getModelId).containsExactly("high", "low");
		assertThat(logLoss.getRanking()).extracting(LeaderboardEntry::getModelId).containsExactly("low", "high");
	}

	@Test
	@DisplayName("equal scores keep insertion order and undefined scores come last")
	void ties() {
		Leaderboard leaderboard = new Leaderboard(EPerformanceMeasure.ROC_AUC);
		leaderboard.append(entry("undefined", 0, Double.NaN));
		leaderboard.append(entry("first", 0, 0.8));
		leaderboard.append(entry("second", 0, 0.8));

		assertThat(leaderboard.getRanking()).extracting(LeaderboardEntry::getModelId).containsExactly("first", "second", "undefined");
	}

	@Test
	@DisplayName("the best model of a layer ignores ensembles and other layers")
	void bestOfLayer() {
		Leaderboard leaderboard = new Leaderboard(EPerformanceMeasure.ACCURACY);
		leaderboard.append(entry("base", 0, 0.7));
		leaderboard.append(entry("stacker", 1, 0.8));
		leaderboard.append(new LeaderboardEntry("WeightedEnsemble_L2", LeaderboardEntry.ENSEMBLE_FAMILY, 0, 0.95, 0.0, 0.0, 0));

		assertThat(leaderboard.getBest(0)).hasValueSatisfying(e -> assertThat(e.getModelId()).isEqualTo("base"));
		assertThat(leaderboard.getBest(2)).isEmpty();
	}
}
