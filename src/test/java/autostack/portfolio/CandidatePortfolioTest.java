package autostack.portfolio;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import autostack.data.ProblemType;
import autostack.resources.Parallelism;

class CandidatePortfolioTest {

	private static final Parallelism CPU_ONLY = new Parallelism(4, 0, 0);
	private static final Parallelism WITH_GPU = new Parallelism(4, 1, 16L << 30);

	private static CandidatePortfolio portfolio;

	@BeforeAll
	static void load() throws IOException {
		portfolio = CandidatePortfolio.loadDefault(CandidatePortfolio.DEFAULT_EXTREME_MAX_ROWS);
	}

	private static List<String> names(final PortfolioSelection selection) {
		return selection.getCandidates().stream().map(CandidateConfig::getName).collect(Collectors.toList());
	}

	private static DatasetCharacteristics binary(final int rows) {
		return new DatasetCharacteristics(rows, 10, 2, ProblemType.BINARY);
	}

	@Test
	@DisplayName("candidates come in rank order")
	void rankOrder() {
		PortfolioSelection selection = portfolio.getCandidates(binary(1000), Preset.MEDIUM_QUALITY, CPU_ONLY);
		assertThat(names(selection)).containsExactly("RandomForest", "GradientBoosting", "LinearModel", "DecisionTree", "Baseline");
		assertThat(selection.getNotes()).isEmpty();
	}

	@Test
	@DisplayName("stricter presets admit a superset of candidates")
	void presetsAreMonotone() {
		List<String> previous = names(portfolio.getCandidates(binary(1000), Preset.MEDIUM_QUALITY, WITH_GPU));
		for (Preset preset : Arrays.asList(Preset.GOOD_QUALITY, Preset.HIGH_QUALITY, Preset.BEST_QUALITY, Preset.EXTREME_QUALITY)) {
			List<String> current = names(portfolio.getCandidates(binary(1000), preset, WITH_GPU));
			assertThat(current).containsAll(previous);
			previous = current;
		}
		assertThat(previous).contains("RandomForestLarge", "GradientBoostingLarge");
	}

	@Nested
	@DisplayName("without GPU")
	class WithoutGpu {

		@Test
		@DisplayName("GPU-only candidates are excluded with a single note")
		void gpuOnlyExcluded() {
			PortfolioSelection selection = portfolio.getCandidates(binary(1000), Preset.HIGH_QUALITY, CPU_ONLY);
			assertThat(names(selection)).doesNotContain("NeuralNetworkLarge");
			assertThat(selection.getNotes()).hasSize(1);
			assertThat(selection.getNotes().get(0)).contains("No GPU", "NeuralNetworkLarge");
		}

		@Test
		@DisplayName("candidates that can use a GPU fall back to CPU")
		void gpuCapableRunsOnCpu() {
			PortfolioSelection selection = portfolio.getCandidates(binary(1000), Preset.HIGH_QUALITY, CPU_ONLY);
			CandidateConfig foundation = selection.getCandidates().stream().filter(c -> c.getName().equals("TabularFoundationModel")).findFirst().get();
			assertThat(foundation.getEstimate().getGpus()).isZero();
			assertThat(foundation.requiresExternalWeights()).isTrue();
			assertThat(foundation.getWeightsId()).isEqualTo("tabular-foundation-v1");
		}

		@Test
		@DisplayName("with a GPU the GPU-only candidate is kept")
		void gpuOnlyKeptWithGpu() {
			PortfolioSelection selection = portfolio.getCandidates(binary(1000), Preset.HIGH_QUALITY, WITH_GPU);
			assertThat(names(selection)).contains("NeuralNetworkLarge");
			assertThat(selection.getNotes()).isEmpty();
		}
	}

	@Nested
	@DisplayName("extreme preset gating")
	class Gating {

		@Test
		@DisplayName("extreme candidates are admitted up to the row threshold")
		void belowThreshold() {
			PortfolioSelection selection = portfolio.getCandidates(binary(30000), Preset.EXTREME_QUALITY, CPU_ONLY);
			assertThat(selection.getCandidatePreset()).isEqualTo(Preset.EXTREME_QUALITY);
			assertThat(names(selection)).contains("RandomForestLarge");
		}

		@Test
		@DisplayName("above the threshold the best preset candidates are used and the fallback is noted")
		void aboveThreshold() {
			PortfolioSelection selection = portfolio.getCandidates(binary(30001), Preset.EXTREME_QUALITY, CPU_ONLY);
			assertThat(selection.getRequestedPreset()).isEqualTo(Preset.EXTREME_QUALITY);
			assertThat(selection.getCandidatePreset()).isEqualTo(Preset.BEST_QUALITY);
			assertThat(names(selection)).doesNotContain("RandomForestLarge", "GradientBoostingLarge");
			assertThat(selection.getNotes()).anyMatch(n -> n.contains("30000"));
		}

		@Test
		@DisplayName("the threshold is configurable")
		void customThreshold() {
			CandidatePortfolio small = new CandidatePortfolio(portfolio.getEntries(), 100);
			assertThat(small.getCandidatePreset(Preset.EXTREME_QUALITY, 101)).isEqualTo(Preset.BEST_QUALITY);
			assertThat(small.getCandidatePreset(Preset.HIGH_QUALITY, 1000000)).isEqualTo(Preset.HIGH_QUALITY);
		}
	}

	@Nested
	@DisplayName("dataset characteristics")
	class Characteristics {

		@Test
		@DisplayName("row limits of engine arguments exclude candidates")
		void maxRows() {
			PortfolioSelection selection = portfolio.getCandidates(binary(200000), Preset.HIGH_QUALITY, CPU_ONLY);
			assertThat(names(selection)).doesNotContain("KNeighbors", "TabularFoundationModel").contains("RandomForest");
			assertThat(selection.getNotes()).anyMatch(n -> n.contains("KNeighbors"));
		}

		@Test
		@DisplayName("feature and class limits exclude candidates")
		void featureAndClassLimits() {
			PortfolioSelection wide = portfolio.getCandidates(new DatasetCharacteristics(100, 600, 2, ProblemType.BINARY), Preset.HIGH_QUALITY, CPU_ONLY);
			assertThat(names(wide)).doesNotContain("TabularFoundationModel").contains("KNeighbors");
			PortfolioSelection manyClasses = portfolio.getCandidates(new DatasetCharacteristics(100, 5, 12, ProblemType.MULTICLASS), Preset.HIGH_QUALITY, CPU_ONLY);
			assertThat(names(manyClasses)).doesNotContain("TabularFoundationModel");
		}

		@Test
		@DisplayName("resource estimates grow with the data size")
		void estimatesScale() {
			CandidateConfig small = portfolio.getCandidates(binary(1000), Preset.MEDIUM_QUALITY, CPU_ONLY).getCandidates().get(0);
			CandidateConfig large = portfolio.getCandidates(binary(100000), Preset.MEDIUM_QUALITY, CPU_ONLY).getCandidates().get(0);
			assertThat(large.getEstimate().getFitSeconds()).isGreaterThan(small.getEstimate().getFitSeconds());
			assertThat(large.getEstimate().getMemoryBytes()).isGreaterThan(small.getEstimate().getMemoryBytes());
		}
	}

	@Test
	@DisplayName("portfolios can be read from a file and must have unique names")
	void fromFile(@TempDir final Path dir) throws IOException {
		Path file = dir.resolve("portfolio.json");
		Files.writeString(file, "[{\"name\": \"A\", \"family\": \"RF\", \"rank\": 2}, {\"name\": \"B\", \"family\": \"DT\", \"rank\": 1, \"problemTypes\": [\"REGRESSION\"]}]", StandardCharsets.UTF_8);
		CandidatePortfolio custom = CandidatePortfolio.load(file, 10);
		assertThat(names(custom.getCandidates(binary(50), Preset.MEDIUM_QUALITY, CPU_ONLY))).containsExactly("A");
		assertThat(names(custom.getCandidates(new DatasetCharacteristics(50, 3, 0, ProblemType.REGRESSION), Preset.MEDIUM_QUALITY, CPU_ONLY))).containsExactly("B", "A");

		PortfolioEntry a = custom.getEntries().get(0);
		assertThatThrownBy(() -> new CandidatePortfolio(Arrays.asList(a, a), 10)).isInstanceOf(IllegalArgumentException.class);
	}
}
