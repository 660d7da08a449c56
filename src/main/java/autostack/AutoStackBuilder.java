package autostack;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;

import com.google.common.base.Ticker;

import autostack.family.ModelFamily;
import autostack.family.ModelFamilyRegistry;
import autostack.metrics.ScoringFunction;
import autostack.portfolio.CandidatePortfolio;
import autostack.resources.ResourceProbe;
import autostack.resources.SystemResourceProbe;
import autostack.storage.ArtifactStore;
import autostack.weights.LocalCacheWeightsProvider;
import autostack.weights.WeightsProvider;

public class AutoStackBuilder {

	private AutoStackConfig config;
	private ModelFamilyRegistry families;
	private CandidatePortfolio portfolio;
	private WeightsProvider weightsProvider;
	private ArtifactStore artifactStore;
	private ResourceProbe probe;
	private ScoringFunction metric;
	private Ticker ticker = Ticker.systemTicker();
	private String loggerName;

	public AutoStackBuilder withConfig(final AutoStackConfig config) {
		this.config = config;
		return this;
	}

	public AutoStackBuilder withConfig(final Path configFile) throws IOException {
		this.config = AutoStackConfig.load(configFile);
		return this;
	}

	public AutoStackBuilder withModelFamilies(final ModelFamilyRegistry families) {
		this.families = families;
		return this;
	}

	/**
	 * Adds a family to the registry, starting from the built-in families if no registry has been set.
	 */
	public AutoStackBuilder withModelFamily(final ModelFamily family) {
		if (this.families == null) {
			this.families = ModelFamilyRegistry.withDefaults();
		}
		this.families.register(family);
		return this;
	}

	public AutoStackBuilder withPortfolio(final CandidatePortfolio portfolio) {
		this.portfolio = portfolio;
		return this;
	}

	public AutoStackBuilder withPortfolio(final Path portfolioFile) throws IOException {
		this.portfolio = CandidatePortfolio.load(portfolioFile, this.getConfig().getExtremeMaxRows());
		return this;
	}

	public AutoStackBuilder withWeightsProvider(final WeightsProvider weightsProvider) {
		this.weightsProvider = weightsProvider;
		return this;
	}

	public AutoStackBuilder withArtifactStore(final ArtifactStore artifactStore) {
		this.artifactStore = artifactStore;
		return this;
	}

	public AutoStackBuilder withResourceProbe(final ResourceProbe probe) {
		this.probe = probe;
		return this;
	}

	public AutoStackBuilder withMetric(final ScoringFunction metric) {
		this.metric = metric;
		return this;
	}

	public AutoStackBuilder withTicker(final Ticker ticker) {
		this.ticker = ticker;
		return this;
	}

	public AutoStackBuilder withLoggerName(final String loggerName) {
		this.loggerName = loggerName;
		return this;
	}

	private AutoStackConfig getConfig() {
		if (this.config == null) {
			try {
				this.config = AutoStackConfig.loadDefault();
			} catch (IOException e) {
				throw new UncheckedIOException("Could not read the default configuration.", e);
			}
		}
		return this.config;
	}

	public AutoStack build() {
		AutoStackConfig effectiveConfig = this.getConfig();
		if (effectiveConfig.getEnsembleRounds() < 1 || effectiveConfig.getEnsembleTieBreak() == null) {
			throw new IllegalStateException("Ensemble selection needs at least one round and a tie-break rule: " + effectiveConfig);
		}
		if (!(effectiveConfig.getMaxHeapFraction() > 0 && effectiveConfig.getMaxHeapFraction() <= 1)) {
			throw new IllegalStateException("The heap fraction must lie in (0, 1]: " + effectiveConfig);
		}
		CandidatePortfolio effectivePortfolio = this.portfolio;
		if (effectivePortfolio == null) {
			try {
				effectivePortfolio = CandidatePortfolio.loadDefault(effectiveConfig.getExtremeMaxRows());
			} catch (IOException e) {
				throw new UncheckedIOException("Could not read the default portfolio.", e);
			}
		}
		WeightsProvider effectiveWeightsProvider = this.weightsProvider;
		if (effectiveWeightsProvider == null && effectiveConfig.getWeightsCacheDirectory() != null) {
			effectiveWeightsProvider = new LocalCacheWeightsProvider(effectiveConfig.getWeightsCacheDirectory());
		}
		AutoStack autoStack = new AutoStack(effectiveConfig, this.families != null ? this.families : ModelFamilyRegistry.withDefaults(), effectivePortfolio, effectiveWeightsProvider, this.artifactStore,
				this.probe != null ? this.probe : new SystemResourceProbe(), this.metric, this.ticker);
		if (this.loggerName != null) {
			autoStack.setLoggerName(this.loggerName);
		}
		return autoStack;
	}
}
