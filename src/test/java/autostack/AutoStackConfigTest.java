package autostack;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.fasterxml.jackson.databind.exc.UnrecognizedPropertyException;

import autostack.ensemble.EnsembleSelector;

class AutoStackConfigTest {

	@TempDir
	Path directory;

	@Test
	void defaults() throws IOException {
		AutoStackConfig config = AutoStackConfig.loadDefault();

		assertThat(config.getMaxStackLayers()).isEqualTo(3);
		assertThat(config.getEnsembleRounds()).isEqualTo(25);
		assertThat(config.getEnsembleTolerance()).isZero();
		assertThat(config.getEnsembleTieBreak()).isEqualTo(EnsembleSelector.TieBreak.FIT_TIME_THEN_ORDER);
		assertThat(config.getGracePeriodSeconds()).isEqualTo(5.0);
		assertThat(config.getExtremeMaxRows()).isEqualTo(30000);
		assertThat(config.getMaxHeapFraction()).isEqualTo(0.8);
		assertThat(config.getRefitFull()).isNull();
		assertThat(config.getArtifactDirectory()).isNull();
		assertThat(config.getQuantileLevels()).containsExactly(0.1, 0.5, 0.9);
	}

	@Test
	void fileOverridesOnlyTheKeysItNames() throws IOException {
		Path file = Files.write(this.directory.resolve("config.json"), "{ \"ensembleRounds\": 7, \"refitFull\": false, \"artifactDirectory\": \"/tmp/models\" }".getBytes(StandardCharsets.UTF_8));

		AutoStackConfig config = AutoStackConfig.load(file);

		assertThat(config.getEnsembleRounds()).isEqualTo(7);
		assertThat(config.getRefitFull()).isFalse();
		assertThat(config.getArtifactDirectory()).hasToString("/tmp/models");
		assertThat(config.getMaxStackLayers()).isEqualTo(3);
	}

	@Test
	void unknownKeysAreRejected() throws IOException {
		Path file = Files.write(this.directory.resolve("config.json"), "{ \"ensembleRuns\": 7 }".getBytes(StandardCharsets.UTF_8));

		assertThatThrownBy(() -> AutoStackConfig.load(file)).isInstanceOf(UnrecognizedPropertyException.class).hasMessageContaining("ensembleRuns");
	}

	@Test
	void builderRejectsUnusableEnsembleSettings() throws IOException {
		AutoStackConfig config = AutoStackConfig.loadDefault().setEnsembleRounds(0);

		assertThatThrownBy(() -> new AutoStackBuilder().withConfig(config).build()).isInstanceOf(IllegalStateException.class);
	}

	@Test
	void builderRejectsHeapFractionsOutsideTheUnitInterval() throws IOException {
		AutoStackConfig config = AutoStackConfig.loadDefault().setMaxHeapFraction(1.5);

		assertThatThrownBy(() -> new AutoStackBuilder().withConfig(config).build()).isInstanceOf(IllegalStateException.class).hasMessageContaining("heap fraction");
	}
}
