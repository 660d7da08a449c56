package autostack;

import static org.assertj.core.api.Assertions.assertThat;

import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.TimeUnit;

import org.api4.java.algorithm.Timeout;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import autostack.data.Dataset;
import autostack.data.ProblemType;
import autostack.leaderboard.LeaderboardEntry;
import autostack.portfolio.Preset;
import autostack.predictor.StackedEnsemblePredictor;
import autostack.resources.Parallelism;
import autostack.testing.TestData;

/**
 * Runs the Weka-backed default portfolio end to end on small synthetic data.
 */
class AutoStackIntegrationTest {

	@TempDir
	Path artifacts;

	@Test
	@DisplayName("the default portfolio fits and predicts a separable binary problem")
	void binary() throws Exception {
		AutoStackConfig config = AutoStackConfig.loadDefault().setMinModelSeconds(0.0).setPersistArtifacts(true).setArtifactDirectory(this.artifacts.toString());
		AutoStack autoStack = new AutoStackBuilder().withConfig(config).withResourceProbe(() -> new Parallelism(2, 0, 0)).build();
		Dataset train = TestData.binary(80, 11);

		StackedEnsemblePredictor predictor = autoStack.fit(train, TestData.LABEL, null, new Timeout(60, TimeUnit.SECONDS), Preset.MEDIUM_QUALITY);

		assertThat(predictor.getProblemType()).isEqualTo(ProblemType.BINARY);
		assertThat(predictor.getLeaderboard().getEntries()).extracting(LeaderboardEntry::getModelId).contains("WeightedEnsemble_L2");
		Dataset test = TestData.binary(20, 12);
		List<String> labels = predictor.predictLabels(test.dropColumn(TestData.LABEL));
		int correct = 0;
		for (int i = 0; i < labels.size(); i++) {
			String truth = test.getColumn("x")[i] > 0 ? "pos" : "neg";
			if (truth.equals(labels.get(i))) {
				correct++;
			}
		}
		assertThat(correct).isGreaterThanOrEqualTo(18);
	}

	@Test
	@DisplayName("the default portfolio fits a regression problem")
	void regression() throws Exception {
		AutoStack autoStack = new AutoStackBuilder().withConfig(AutoStackConfig.loadDefault().setMinModelSeconds(0.0)).withResourceProbe(() -> new Parallelism(2, 0, 0)).build();

		StackedEnsemblePredictor predictor = autoStack.fit(TestData.regression(60, 5), TestData.LABEL, ProblemType.REGRESSION, new Timeout(60, TimeUnit.SECONDS), Preset.MEDIUM_QUALITY);

		double[][] predictions = predictor.predict(Dataset.builder().numericColumn("x", 5.0).numericColumn("z", 0.0).build());
		assertThat(predictions[0][0]).isBetween(3.0, 7.0);
		assertThat(predictor.getFitSummary().getEnsembleScore()).isLessThan(2.0);
	}
}
